package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.AnalysisReportDTO;
import com.finsight.backend.dto.analysis.AnalysisSummaryDTO;
import com.finsight.backend.dto.analysis.BudgetAnalysisDTO;
import com.finsight.backend.dto.analysis.CategoryAmountDTO;
import com.finsight.backend.dto.analysis.HealthScoreBreakdownDTO;
import com.finsight.backend.dto.analysis.KeyMetricsDTO;
import com.finsight.backend.dto.analysis.NetIncomeDTO;
import com.finsight.backend.dto.analysis.PeriodDTO;
import com.finsight.backend.dto.analysis.RecommendationDTO;
import com.finsight.backend.dto.analysis.TargetAnalysisDTO;
import com.finsight.backend.dto.analysis.TransactionTypeSummaryDTO;
import com.finsight.backend.dto.analysis.TrendAnalysisDTO;
import com.finsight.backend.enums.HealthStatus;
import com.finsight.backend.services.analysis.model.AggregationResult;
import com.finsight.backend.services.analysis.model.AnalysisInput;
import com.finsight.backend.services.analysis.model.AnalysisMetrics;
import com.finsight.backend.services.analysis.model.TypeAggregate;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point of the analysis engine. Runs aggregation, target, budget and trend analysis, then scoring and
 * recommendations, and assembles the report. Holds no state between calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FinancialAnalysisFacade {

    private static final BigDecimal STRONG_SAVINGS_RATE = new BigDecimal("15");
    private static final BigDecimal WEAK_SAVINGS_RATE = BigDecimal.TEN;

    private final TransactionAggregator aggregator;
    private final TargetProgressAnalyzer targetAnalyzer;
    private final BudgetComparator budgetComparator;
    private final SpendingTrendAnalyzer trendAnalyzer;
    private final HealthScorer healthScorer;
    private final RecommendationGenerator recommendationGenerator;
    private final NeedsVsWantsClassifier needsVsWantsClassifier;
    private final AnalysisProperties properties;

    public AnalysisReportDTO analyze(AnalysisInput input) {
        String symbol = input.currencySymbol() != null && !input.currencySymbol().isBlank()
                ? input.currencySymbol()
                : properties.defaultCurrencySymbol();

        AggregationResult aggregation = aggregator.aggregate(input.transactions());
        TargetAnalysisDTO targets = targetAnalyzer.analyze(input.targets(), input.now());
        BudgetAnalysisDTO budgets = budgetComparator.compare(
                input.budgets(),
                input.budgetTransactions(),
                input.now().getMonthValue(),
                input.now().getYear());
        TrendAnalysisDTO trends = trendAnalyzer.analyze(aggregation);

        TypeAggregate income = aggregation.income();
        TypeAggregate expenses = aggregation.expenses();

        BigDecimal netIncome = income.total().subtract(expenses.total());
        BigDecimal monthlyNet = income.monthlyAverage().subtract(expenses.monthlyAverage());
        BigDecimal exactSavingsRate = AnalysisMath.ratio(netIncome, income.total()).multiply(AnalysisMath.ONE_HUNDRED);
        BigDecimal savingsRate = AnalysisMath.percentage(netIncome, income.total());

        AnalysisMetrics metrics = new AnalysisMetrics(
                savingsRate,
                exactSavingsRate,
                income.monthlyAverage(),
                expenses.monthlyAverage(),
                monthlyNet,
                aggregation.investments().total(),
                targets,
                budgets,
                trends,
                symbol);

        HealthScoreBreakdownDTO health = healthScorer.score(metrics);
        List<RecommendationDTO> recommendations = recommendationGenerator.generate(metrics);

        log.debug("[Analysis] transactions={}, targets={}, budgets={}, score={}, recommendations={}",
                aggregation.totalTransactions(), targets.getTotalTargets(), budgets.getTotalBudgets(),
                health.getScore(), recommendations.size());

        return AnalysisReportDTO.builder()
                .income(summaryOf(income))
                .expenses(summaryOf(expenses))
                .investments(summaryOf(aggregation.investments()))
                .netIncome(new NetIncomeDTO(AnalysisMath.money(netIncome), AnalysisMath.money(monthlyNet)))
                .savingsRate(savingsRate)
                .targets(targets)
                .budgets(budgets)
                .trends(trends)
                .healthScore(health.getScore())
                .healthScoreBreakdown(health)
                .recommendations(recommendations)
                .summary(summaryOf(metrics, health.getScore()))
                .needsVsWants(needsVsWantsClassifier.classify(expenses.categories()))
                .period(new PeriodDTO(aggregation.firstDate(), aggregation.lastDate(), aggregation.totalTransactions()))
                .build();
    }

    AnalysisSummaryDTO summaryOf(AnalysisMetrics m, int score) {
        AnalysisSummaryDTO.AnalysisSummaryDTOBuilder summary = AnalysisSummaryDTO.builder()
                .healthScore(score)
                .healthStatus(HealthStatus.fromScore(score))
                .keyMetrics(KeyMetricsDTO.builder()
                        .monthlyIncome(AnalysisMath.money(m.monthlyIncome()))
                        .monthlyExpenses(AnalysisMath.money(m.monthlyExpenses()))
                        .monthlySavings(AnalysisMath.money(m.monthlyNetIncome()))
                        .savingsRate(m.savingsRate())
                        .targetProgress(m.targets().getOverallProgress())
                        .build());

        BigDecimal rate = m.savingsRate();
        int netSign = m.monthlyNetIncome().signum();
        int over = m.budgets().getOverBudget();

        if (rate.compareTo(STRONG_SAVINGS_RATE) > 0) summary.strength("Good savings rate");
        if (netSign > 0) summary.strength("Positive cash flow");
        if (m.targets().getCompletedTargets() > 0) summary.strength("Achieving financial goals");
        if (over == 0) summary.strength("Good budget adherence");

        if (rate.compareTo(WEAK_SAVINGS_RATE) < 0) summary.areaForImprovement("Increase savings rate");
        if (netSign < 0) summary.areaForImprovement("Improve cash flow");
        if (m.targets().getBehindTargets() > 0) summary.areaForImprovement("Accelerate target progress");
        if (over > 0) summary.areaForImprovement("Better budget management");

        return summary.build();
    }

    private static TransactionTypeSummaryDTO summaryOf(TypeAggregate aggregate) {
        TransactionTypeSummaryDTO.TransactionTypeSummaryDTOBuilder builder = TransactionTypeSummaryDTO.builder()
                .total(AnalysisMath.money(aggregate.total()))
                .monthly(aggregate.monthlyAverage().setScale(AnalysisMath.MONEY_SCALE, RoundingMode.HALF_UP))
                .transactions(aggregate.count());
        for (Map.Entry<String, BigDecimal> e : aggregate.categories().entrySet()) {
            builder.category(new CategoryAmountDTO(e.getKey(), AnalysisMath.money(e.getValue())));
        }
        return builder.build();
    }
}
