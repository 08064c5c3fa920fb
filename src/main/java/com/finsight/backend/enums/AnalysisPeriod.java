package com.finsight.backend.enums;

import java.time.LocalDate;

/**
 * Rolling window ending today that the analysis endpoint applies to transactions.
 */
public enum AnalysisPeriod {
    WEEK,
    MONTH,
    QUARTER,
    YEAR,
    ALL;

    /**
     * First day included in the window, or {@code null} for {@link #ALL}.
     */
    public LocalDate startFrom(LocalDate today) {
        return switch (this) {
            case WEEK -> today.minusWeeks(1);
            case MONTH -> today.minusMonths(1);
            case QUARTER -> today.minusMonths(3);
            case YEAR -> today.minusYears(1);
            case ALL -> null;
        };
    }
}
