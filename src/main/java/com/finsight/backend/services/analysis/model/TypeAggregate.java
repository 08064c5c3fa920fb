package com.finsight.backend.services.analysis.model;

import java.math.BigDecimal;
import java.util.Map;

import com.finsight.backend.enums.TransactionType;

/**
 * Unrounded totals of one transaction type. {@code categories} iterates largest amount first.
 */
public record TypeAggregate(
        TransactionType type,
        BigDecimal total,
        int count,
        BigDecimal monthlyAverage,
        Map<String, BigDecimal> categories
) {
}
