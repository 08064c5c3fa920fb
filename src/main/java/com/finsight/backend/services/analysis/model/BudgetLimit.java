package com.finsight.backend.services.analysis.model;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Spending ceiling of one category for one (month, year).
 */
public record BudgetLimit(
        String categoryName,
        UUID categoryId,
        BigDecimal amount,
        int month,
        int year
) {
}
