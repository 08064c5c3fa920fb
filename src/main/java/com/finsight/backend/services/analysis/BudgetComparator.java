package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

import org.springframework.stereotype.Component;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.BudgetAnalysisDTO;
import com.finsight.backend.dto.analysis.BudgetCategoryDTO;
import com.finsight.backend.enums.BudgetStatus;
import com.finsight.backend.enums.CategoryMatching;
import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.services.analysis.model.BudgetLimit;
import com.finsight.backend.services.analysis.model.TransactionFact;

import lombok.RequiredArgsConstructor;

/**
 * Compares expense spend of one calendar month against the budgets set for that month.
 */
@Component
@RequiredArgsConstructor
public class BudgetComparator {

    private final AnalysisProperties properties;

    public BudgetAnalysisDTO compare(List<BudgetLimit> budgets, List<TransactionFact> transactions, int month, int year) {
        List<BudgetLimit> ofPeriod = budgets == null
                ? List.of()
                : budgets.stream()
                        .filter(Objects::nonNull)
                        .filter(b -> b.month() == month && b.year() == year)
                        .toList();

        BudgetAnalysisDTO.BudgetAnalysisDTOBuilder result = BudgetAnalysisDTO.builder()
                .month(month)
                .year(year)
                .totalBudgets(ofPeriod.size());

        BigDecimal totalBudget = BigDecimal.ZERO;
        BigDecimal totalSpent = BigDecimal.ZERO;
        int over = 0;

        for (BudgetLimit budget : ofPeriod) {
            BigDecimal limit = AnalysisMath.safeAmount(budget.amount());
            BigDecimal actual = spentAgainst(budget, transactions);

            totalBudget = totalBudget.add(limit);
            totalSpent = totalSpent.add(actual.min(limit));
            if (actual.compareTo(limit) > 0) {
                over++;
            }
            result.category(line(budget, actual));
        }

        return result
                .totalBudgetAmount(AnalysisMath.money(totalBudget))
                .totalSpent(AnalysisMath.money(totalSpent))
                .overBudget(over)
                .underBudget(ofPeriod.size() - over)
                .budgetUtilization(AnalysisMath.percentage(totalSpent, totalBudget))
                .build();
    }

    /**
     * Usage of a single budget within its own month.
     */
    public BudgetCategoryDTO usage(BudgetLimit budget, List<TransactionFact> transactions) {
        return line(budget, spentAgainst(budget, transactions));
    }

    BigDecimal spentAgainst(BudgetLimit budget, List<TransactionFact> transactions) {
        if (transactions == null) {
            return BigDecimal.ZERO;
        }
        return transactions.stream()
                .filter(tx -> AnalysisMath.isType(tx, TransactionType.EXPENSE))
                .filter(tx -> inMonth(tx.date(), budget.month(), budget.year()))
                .filter(tx -> matches(budget, tx))
                .map(AnalysisMath::safeAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    boolean matches(BudgetLimit budget, TransactionFact tx) {
        if (properties.categoryMatching() == CategoryMatching.CATEGORY_ID
                && budget.categoryId() != null && tx.categoryId() != null) {
            return budget.categoryId().equals(tx.categoryId());
        }
        return budget.categoryName() != null && budget.categoryName().equals(tx.category());
    }

    private static boolean inMonth(LocalDate date, int month, int year) {
        return date != null && date.getMonthValue() == month && date.getYear() == year;
    }

    private static BudgetCategoryDTO line(BudgetLimit budget, BigDecimal actual) {
        BigDecimal limit = AnalysisMath.safeAmount(budget.amount());
        return BudgetCategoryDTO.builder()
                .category(AnalysisMath.normalizeCategory(budget.categoryName()))
                .budget(AnalysisMath.money(limit))
                .spent(AnalysisMath.money(actual))
                .remaining(AnalysisMath.money(limit.subtract(actual)))
                .percentageUsed(AnalysisMath.percentage(actual, limit))
                .status(actual.compareTo(limit) > 0 ? BudgetStatus.OVER_BUDGET : BudgetStatus.UNDER_BUDGET)
                .build();
    }
}
