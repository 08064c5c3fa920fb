package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Consolidated analysis of one person's transactions, targets and budgets. Built fresh on every call.
 */
@Value
@Builder
public class AnalysisReportDTO {

    TransactionTypeSummaryDTO income;
    TransactionTypeSummaryDTO expenses;
    TransactionTypeSummaryDTO investments;
    NetIncomeDTO netIncome;
    BigDecimal savingsRate;
    TargetAnalysisDTO targets;
    BudgetAnalysisDTO budgets;
    TrendAnalysisDTO trends;
    int healthScore;
    HealthScoreBreakdownDTO healthScoreBreakdown;
    @Singular
    List<RecommendationDTO> recommendations;
    AnalysisSummaryDTO summary;
    NeedsVsWantsDTO needsVsWants;
    PeriodDTO period;
}
