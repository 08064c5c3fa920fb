package com.finsight.backend.services.analysis.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.SortedMap;

/**
 * @param monthlyIncome   income totals keyed by {@code YYYY-MM}
 * @param monthlyExpenses expense totals keyed by {@code YYYY-MM}
 */
public record AggregationResult(
        TypeAggregate income,
        TypeAggregate expenses,
        TypeAggregate investments,
        SortedMap<String, BigDecimal> monthlyIncome,
        SortedMap<String, BigDecimal> monthlyExpenses,
        LocalDate firstDate,
        LocalDate lastDate,
        int totalTransactions
) {
}
