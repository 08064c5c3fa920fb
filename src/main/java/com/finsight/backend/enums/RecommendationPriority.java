package com.finsight.backend.enums;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared from most to least urgent, so {@link #compareTo} orders by urgency.
 */
public enum RecommendationPriority {
    CRITICAL,
    HIGH,
    MEDIUM;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
