package com.finsight.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BudgetStatus {
    UNDER_BUDGET,
    OVER_BUDGET;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
