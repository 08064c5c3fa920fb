package com.finsight.backend.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
    EXCELLENT("Excellent", 80),
    GOOD("Good", 60),
    FAIR("Fair", 40),
    POOR("Poor", 0);

    private final String label;
    private final int minScore;

    HealthStatus(String label, int minScore) {
        this.label = label;
        this.minScore = minScore;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public int getMinScore() {
        return minScore;
    }

    public static HealthStatus fromScore(int score) {
        for (HealthStatus status : values()) {
            if (score >= status.minScore) {
                return status;
            }
        }
        return POOR;
    }
}
