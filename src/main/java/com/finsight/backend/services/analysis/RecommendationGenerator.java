package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Component;

import com.finsight.backend.dto.analysis.RecommendationDTO;
import com.finsight.backend.enums.RecommendationPriority;
import com.finsight.backend.enums.RecommendationType;
import com.finsight.backend.services.analysis.model.AnalysisMetrics;

/**
 * Rule based advice. Each rule fires at most once and rules are evaluated in display order.
 */
@Component
public class RecommendationGenerator {

    private static final BigDecimal MIN_SAVINGS_RATE = BigDecimal.TEN;

    public List<RecommendationDTO> generate(AnalysisMetrics metrics) {
        List<RecommendationDTO> out = new ArrayList<>();
        lowSavingsRate(metrics).ifPresent(out::add);
        negativeCashFlow(metrics).ifPresent(out::add);
        targetsBehind(metrics).ifPresent(out::add);
        budgetOverspending(metrics).ifPresent(out::add);
        startInvesting(metrics).ifPresent(out::add);
        return List.copyOf(out);
    }

    private Optional<RecommendationDTO> lowSavingsRate(AnalysisMetrics m) {
        BigDecimal rate = AnalysisMath.safeAmount(m.savingsRate());
        if (rate.compareTo(MIN_SAVINGS_RATE) >= 0) {
            return Optional.empty();
        }
        return Optional.of(RecommendationDTO.builder()
                .type(RecommendationType.SAVINGS)
                .priority(RecommendationPriority.HIGH)
                .title("Increase Savings Rate")
                .description(String.format(
                        "Your current savings rate is %s%%. Consider increasing it to at least 10-20%% for better financial security.",
                        AnalysisMath.formatPercent(rate)))
                .action("Review your expenses and identify areas to cut costs or increase income.")
                .build());
    }

    private Optional<RecommendationDTO> negativeCashFlow(AnalysisMetrics m) {
        BigDecimal net = AnalysisMath.safeAmount(m.monthlyNetIncome());
        if (net.signum() >= 0) {
            return Optional.empty();
        }
        return Optional.of(RecommendationDTO.builder()
                .type(RecommendationType.INCOME)
                .priority(RecommendationPriority.CRITICAL)
                .title("Negative Cash Flow")
                .description(String.format(
                        "You are spending %s more than you earn each month. This is unsustainable in the long term.",
                        AnalysisMath.formatCurrency(m.currencySymbol(), net.negate())))
                .action("Immediately reduce expenses or find ways to increase income.")
                .build());
    }

    private Optional<RecommendationDTO> targetsBehind(AnalysisMetrics m) {
        int behind = m.targets() != null ? m.targets().getBehindTargets() : 0;
        if (behind <= 0) {
            return Optional.empty();
        }
        return Optional.of(RecommendationDTO.builder()
                .type(RecommendationType.TARGETS)
                .priority(RecommendationPriority.MEDIUM)
                .title("Target Progress")
                .description(String.format("You have %d %s behind schedule.",
                        behind, behind == 1 ? "target that is" : "targets that are"))
                .action("Review your action plans and consider increasing monthly contributions.")
                .build());
    }

    private Optional<RecommendationDTO> budgetOverspending(AnalysisMetrics m) {
        int over = m.budgets() != null ? m.budgets().getOverBudget() : 0;
        if (over <= 0) {
            return Optional.empty();
        }
        return Optional.of(RecommendationDTO.builder()
                .type(RecommendationType.BUDGET)
                .priority(RecommendationPriority.MEDIUM)
                .title("Budget Overspending")
                .description(String.format("You are over budget in %d %s.",
                        over, over == 1 ? "category" : "categories"))
                .action("Review your spending patterns and adjust your budget or spending habits.")
                .build());
    }

    private Optional<RecommendationDTO> startInvesting(AnalysisMetrics m) {
        BigDecimal invested = AnalysisMath.safeAmount(m.totalInvestments());
        BigDecimal net = AnalysisMath.safeAmount(m.monthlyNetIncome());
        if (invested.signum() != 0 || net.signum() <= 0) {
            return Optional.empty();
        }
        return Optional.of(RecommendationDTO.builder()
                .type(RecommendationType.INVESTMENT)
                .priority(RecommendationPriority.MEDIUM)
                .title("Start Investing")
                .description(String.format(
                        "You have a positive cash flow of %s per month but no investments. Consider starting to invest for long-term growth.",
                        AnalysisMath.formatCurrency(m.currencySymbol(), net)))
                .action("Research investment options like SIPs, mutual funds, or fixed deposits.")
                .build());
    }
}
