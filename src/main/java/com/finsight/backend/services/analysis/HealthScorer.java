package com.finsight.backend.services.analysis;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.config.AnalysisProperties.HealthWeights;
import com.finsight.backend.dto.analysis.BudgetAnalysisDTO;
import com.finsight.backend.dto.analysis.HealthScoreBreakdownDTO;
import com.finsight.backend.dto.analysis.TargetAnalysisDTO;
import com.finsight.backend.enums.TrendDirection;
import com.finsight.backend.services.analysis.model.AnalysisMetrics;

import lombok.RequiredArgsConstructor;

/**
 * Weighted composite of five factors. Each factor earns a fraction of its configured maximum and the score is
 * the achieved share of the maximum total, rounded to an integer in [0, 100].
 */
@Component
@RequiredArgsConstructor
public class HealthScorer {

    private static final BigDecimal TWENTY = new BigDecimal("20");
    private static final BigDecimal TEN = BigDecimal.TEN;
    private static final BigDecimal FIVE = new BigDecimal("5");
    private static final BigDecimal EIGHTY = new BigDecimal("80");
    private static final BigDecimal FIFTY = new BigDecimal("50");
    private static final BigDecimal TWENTY_FIVE = new BigDecimal("25");
    private static final BigDecimal OVER_BUDGET_SHARE = new BigDecimal("0.3");

    private final AnalysisProperties properties;

    public HealthScoreBreakdownDTO score(AnalysisMetrics metrics) {
        HealthWeights weights = properties.healthWeights();

        BigDecimal rate = metrics.exactSavingsRate() != null ? metrics.exactSavingsRate() : metrics.savingsRate();
        int savings = points(weights.savingsRate(), savingsRateFraction(rate));
        int net = points(weights.netIncome(), netIncomeFraction(metrics.monthlyNetIncome()));
        int targets = points(weights.targetProgress(), targetProgressFraction(metrics.targets()));
        int budgets = points(weights.budgetAdherence(), budgetAdherenceFraction(metrics.budgets()));
        int trend = points(weights.trend(), trendFraction(metrics.trends() != null
                ? metrics.trends().getTrendDirection()
                : null));

        int achieved = savings + net + targets + budgets + trend;
        int max = weights.total();

        return HealthScoreBreakdownDTO.builder()
                .savingsRatePoints(savings)
                .netIncomePoints(net)
                .targetProgressPoints(targets)
                .budgetAdherencePoints(budgets)
                .trendPoints(trend)
                .achievedPoints(achieved)
                .maxPoints(max)
                .score(clampScore(max <= 0 ? 0 : (int) Math.round(achieved * 100.0 / max)))
                .build();
    }

    double savingsRateFraction(BigDecimal savingsRate) {
        BigDecimal rate = AnalysisMath.safeAmount(savingsRate);
        if (rate.compareTo(TWENTY) >= 0) return 1.0;
        if (rate.compareTo(TEN) >= 0) return 2.0 / 3.0;
        if (rate.compareTo(FIVE) >= 0) return 1.0 / 3.0;
        return 0.0;
    }

    double netIncomeFraction(BigDecimal monthlyNetIncome) {
        BigDecimal net = AnalysisMath.safeAmount(monthlyNetIncome);
        if (net.signum() > 0) return 1.0;
        if (net.compareTo(properties.negativeCashFlowFloor()) >= 0) return 0.6;
        return 0.0;
    }

    double targetProgressFraction(TargetAnalysisDTO targets) {
        BigDecimal progress = targets != null ? AnalysisMath.safeAmount(targets.getOverallProgress()) : BigDecimal.ZERO;
        if (progress.compareTo(EIGHTY) >= 0) return 1.0;
        if (progress.compareTo(FIFTY) >= 0) return 0.75;
        if (progress.compareTo(TWENTY_FIVE) >= 0) return 0.5;
        return 0.0;
    }

    double budgetAdherenceFraction(BudgetAnalysisDTO budgets) {
        if (budgets == null || budgets.getOverBudget() == 0) return 1.0;
        BigDecimal allowed = OVER_BUDGET_SHARE.multiply(BigDecimal.valueOf(budgets.getTotalBudgets()));
        if (BigDecimal.valueOf(budgets.getOverBudget()).compareTo(allowed) <= 0) return 2.0 / 3.0;
        return 0.0;
    }

    double trendFraction(TrendDirection direction) {
        if (direction == TrendDirection.DECREASING) return 1.0;
        if (direction == TrendDirection.STABLE || direction == null) return 0.5;
        return 0.0;
    }

    private static int points(int max, double fraction) {
        return (int) Math.round(max * fraction);
    }

    private static int clampScore(int value) {
        if (value < 0) return 0;
        if (value > 100) return 100;
        return value;
    }
}
