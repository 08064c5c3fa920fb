package com.finsight.backend.services.analysis.model;

import java.math.BigDecimal;

import com.finsight.backend.dto.analysis.BudgetAnalysisDTO;
import com.finsight.backend.dto.analysis.TargetAnalysisDTO;
import com.finsight.backend.dto.analysis.TrendAnalysisDTO;

/**
 * Values the scoring and recommendation stages read. {@code savingsRate} is rounded to 2 decimals for display;
 * {@code exactSavingsRate} keeps working precision for the score bands.
 */
public record AnalysisMetrics(
        BigDecimal savingsRate,
        BigDecimal exactSavingsRate,
        BigDecimal monthlyIncome,
        BigDecimal monthlyExpenses,
        BigDecimal monthlyNetIncome,
        BigDecimal totalInvestments,
        TargetAnalysisDTO targets,
        BudgetAnalysisDTO budgets,
        TrendAnalysisDTO trends,
        String currencySymbol
) {
}
