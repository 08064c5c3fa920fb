package com.finsight.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    SAVINGS,
    INCOME,
    TARGETS,
    BUDGET,
    INVESTMENT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
