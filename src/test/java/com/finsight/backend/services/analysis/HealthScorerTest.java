package com.finsight.backend.services.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.BudgetAnalysisDTO;
import com.finsight.backend.dto.analysis.HealthScoreBreakdownDTO;
import com.finsight.backend.dto.analysis.TargetAnalysisDTO;
import com.finsight.backend.dto.analysis.TrendAnalysisDTO;
import com.finsight.backend.enums.TrendDirection;
import com.finsight.backend.services.analysis.model.AnalysisMetrics;

class HealthScorerTest {

    private final HealthScorer scorer = new HealthScorer(AnalysisProperties.defaults());

    @Test
    void score_bestCase_isOneHundred() {
        HealthScoreBreakdownDTO result = scorer.score(metrics("25", "500", "85", 4, 0, TrendDirection.DECREASING));

        assertEquals(30, result.getSavingsRatePoints());
        assertEquals(25, result.getNetIncomePoints());
        assertEquals(20, result.getTargetProgressPoints());
        assertEquals(15, result.getBudgetAdherencePoints());
        assertEquals(10, result.getTrendPoints());
        assertEquals(100, result.getScore());
    }

    @Test
    void score_worstCase_isZero() {
        HealthScoreBreakdownDTO result = scorer.score(metrics("-40", "-1500", "10", 4, 3, TrendDirection.INCREASING));

        assertEquals(0, result.getAchievedPoints());
        assertEquals(100, result.getMaxPoints());
        assertEquals(0, result.getScore());
    }

    @Test
    void score_middleBands() {
        HealthScoreBreakdownDTO result = scorer.score(metrics("12", "-1000", "55", 4, 1, TrendDirection.STABLE));

        assertEquals(20, result.getSavingsRatePoints());
        assertEquals(15, result.getNetIncomePoints());
        assertEquals(15, result.getTargetProgressPoints());
        assertEquals(10, result.getBudgetAdherencePoints());
        assertEquals(5, result.getTrendPoints());
        assertEquals(65, result.getScore());
    }

    @Test
    void score_lowerBands() {
        HealthScoreBreakdownDTO result = scorer.score(metrics("5", "0", "25", 10, 3, TrendDirection.STABLE));

        assertEquals(10, result.getSavingsRatePoints());
        assertEquals(15, result.getNetIncomePoints());
        assertEquals(10, result.getTargetProgressPoints());
        assertEquals(10, result.getBudgetAdherencePoints());
        assertEquals(50, result.getScore());
    }

    @Test
    void score_customWeights_scaleToHundred() {
        AnalysisProperties props = new AnalysisProperties(null, null, null,
                new AnalysisProperties.HealthWeights(60, 20, 10, 5, 5), null, null, null, null);
        HealthScorer weighted = new HealthScorer(props);

        HealthScoreBreakdownDTO result = weighted.score(metrics("25", "-5000", "0", 0, 0, TrendDirection.INCREASING));

        assertEquals(60, result.getSavingsRatePoints());
        assertEquals(5, result.getBudgetAdherencePoints());
        assertEquals(65, result.getAchievedPoints());
        assertEquals(65, result.getScore());
    }

    @Test
    void score_savingsBandsReadExactRate() {
        AnalysisMetrics metrics = new AnalysisMetrics(
                new BigDecimal("10.00"),
                new BigDecimal("9.996"),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                new BigDecimal("100"),
                BigDecimal.ZERO,
                TargetAnalysisDTO.builder().overallProgress(BigDecimal.ZERO).build(),
                budgets(0, 0),
                TrendAnalysisDTO.builder().trendDirection(TrendDirection.STABLE).build(),
                "₹");

        assertEquals(10, scorer.score(metrics).getSavingsRatePoints());
    }

    @Test
    void budgetAdherenceFraction_allowsUpToThirtyPercentOver() {
        assertEquals(2.0 / 3.0, scorer.budgetAdherenceFraction(budgets(10, 3)));
        assertEquals(0.0, scorer.budgetAdherenceFraction(budgets(10, 4)));
        assertEquals(1.0, scorer.budgetAdherenceFraction(null));
    }

    private static AnalysisMetrics metrics(String savingsRate, String monthlyNet, String targetProgress,
                                           int totalBudgets, int overBudget, TrendDirection direction) {
        return new AnalysisMetrics(
                new BigDecimal(savingsRate),
                new BigDecimal(savingsRate),
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                new BigDecimal(monthlyNet),
                BigDecimal.ZERO,
                TargetAnalysisDTO.builder().overallProgress(new BigDecimal(targetProgress)).build(),
                budgets(totalBudgets, overBudget),
                TrendAnalysisDTO.builder().trendDirection(direction).build(),
                "₹");
    }

    private static BudgetAnalysisDTO budgets(int total, int over) {
        return BudgetAnalysisDTO.builder().totalBudgets(total).overBudget(over).underBudget(total - over).build();
    }
}
