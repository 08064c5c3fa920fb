package com.finsight.backend.services.analysis.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Savings target state at analysis time. {@code targetDate} is optional.
 */
public record TargetSnapshot(
        BigDecimal targetAmount,
        BigDecimal currentAmount,
        LocalDate targetDate,
        LocalDate createdAt
) {
}
