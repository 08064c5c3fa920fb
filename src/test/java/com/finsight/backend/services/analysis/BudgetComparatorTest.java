package com.finsight.backend.services.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.BudgetAnalysisDTO;
import com.finsight.backend.dto.analysis.BudgetCategoryDTO;
import com.finsight.backend.enums.BudgetStatus;
import com.finsight.backend.enums.CategoryMatching;
import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.services.analysis.model.BudgetLimit;
import com.finsight.backend.services.analysis.model.TransactionFact;

class BudgetComparatorTest {

    private final BudgetComparator comparator = new BudgetComparator(AnalysisProperties.defaults());

    @Test
    void compare_noBudgetsForPeriod_returnsZeroResult() {
        List<BudgetLimit> budgets = List.of(new BudgetLimit("Rent", null, new BigDecimal("1000"), 2, 2024));

        BudgetAnalysisDTO result = comparator.compare(budgets, List.of(), 3, 2024);

        assertEquals(0, result.getTotalBudgets());
        assertEquals(new BigDecimal("0.00"), result.getTotalBudgetAmount());
        assertEquals(new BigDecimal("0.00"), result.getTotalSpent());
        assertEquals(new BigDecimal("0.00"), result.getBudgetUtilization());
        assertTrue(result.getCategories().isEmpty());
    }

    @Test
    void compare_capsSpentAtBudgetAndCountsOverBudget() {
        List<BudgetLimit> budgets = List.of(
                new BudgetLimit("Rent", null, new BigDecimal("1000"), 3, 2024),
                new BudgetLimit("Dining", null, new BigDecimal("500"), 3, 2024)
        );
        List<TransactionFact> txs = List.of(
                expense("2024-03-01", "1200", "Rent", null),
                expense("2024-03-10", "200", "Dining", null),
                // outside the month
                expense("2024-02-28", "900", "Dining", null),
                new TransactionFact(LocalDate.parse("2024-03-02"), new BigDecimal("999"), TransactionType.INCOME, "Rent", null, null)
        );

        BudgetAnalysisDTO result = comparator.compare(budgets, txs, 3, 2024);

        assertEquals(2, result.getTotalBudgets());
        assertEquals(1, result.getOverBudget());
        assertEquals(1, result.getUnderBudget());
        assertEquals(new BigDecimal("1500.00"), result.getTotalBudgetAmount());
        assertEquals(new BigDecimal("1200.00"), result.getTotalSpent());
        assertEquals(new BigDecimal("80.00"), result.getBudgetUtilization());

        BudgetCategoryDTO rent = result.getCategories().get(0);
        assertEquals("Rent", rent.getCategory());
        assertEquals(new BigDecimal("1200.00"), rent.getSpent());
        assertEquals(new BigDecimal("-200.00"), rent.getRemaining());
        assertEquals(new BigDecimal("120.00"), rent.getPercentageUsed());
        assertEquals(BudgetStatus.OVER_BUDGET, rent.getStatus());

        assertEquals(BudgetStatus.UNDER_BUDGET, result.getCategories().get(1).getStatus());
    }

    @Test
    void compare_spendingExactlyAtLimit_isNotOverBudget() {
        List<BudgetLimit> budgets = List.of(new BudgetLimit("Rent", null, new BigDecimal("1000"), 3, 2024));

        BudgetAnalysisDTO result = comparator.compare(budgets, List.of(expense("2024-03-01", "1000", "Rent", null)), 3, 2024);

        assertEquals(0, result.getOverBudget());
        assertEquals(new BigDecimal("100.00"), result.getBudgetUtilization());
    }

    @Test
    void matches_categoryIdMode_prefersIdsAndFallsBackToName() {
        UUID food = UUID.randomUUID();
        BudgetLimit budget = new BudgetLimit("Food", food, new BigDecimal("300"), 3, 2024);

        assertTrue(comparator.matches(budget, expense("2024-03-01", "10", "Groceries", food)));
        assertFalse(comparator.matches(budget, expense("2024-03-01", "10", "Food", UUID.randomUUID())));
        assertTrue(comparator.matches(budget, expense("2024-03-01", "10", "Food", null)));
        assertFalse(comparator.matches(budget, expense("2024-03-01", "10", "food", null)));
    }

    @Test
    void matches_exactNameMode_ignoresIds() {
        BudgetComparator legacy = new BudgetComparator(
                AnalysisProperties.defaults().withCategoryMatching(CategoryMatching.EXACT_NAME));
        UUID food = UUID.randomUUID();
        BudgetLimit budget = new BudgetLimit("Food", food, new BigDecimal("300"), 3, 2024);

        assertFalse(legacy.matches(budget, expense("2024-03-01", "10", "Groceries", food)));
        assertTrue(legacy.matches(budget, expense("2024-03-01", "10", "Food", UUID.randomUUID())));
    }

    @Test
    void usage_singleBudget_reportsRemaining() {
        BudgetLimit budget = new BudgetLimit("Travel", null, new BigDecimal("400"), 5, 2024);

        BudgetCategoryDTO usage = comparator.usage(budget, List.of(
                expense("2024-05-02", "150", "Travel", null),
                expense("2024-05-20", "50", "Travel", null)));

        assertEquals(new BigDecimal("200.00"), usage.getSpent());
        assertEquals(new BigDecimal("200.00"), usage.getRemaining());
        assertEquals(new BigDecimal("50.00"), usage.getPercentageUsed());
        assertEquals(BudgetStatus.UNDER_BUDGET, usage.getStatus());
    }

    @Test
    void usage_zeroBudget_hasZeroPercentage() {
        BudgetLimit budget = new BudgetLimit("Gifts", null, BigDecimal.ZERO, 5, 2024);

        BudgetCategoryDTO usage = comparator.usage(budget, List.of(expense("2024-05-02", "10", "Gifts", null)));

        assertEquals(new BigDecimal("0.00"), usage.getPercentageUsed());
        assertEquals(BudgetStatus.OVER_BUDGET, usage.getStatus());
    }

    private static TransactionFact expense(String date, String amount, String category, UUID categoryId) {
        return new TransactionFact(LocalDate.parse(date), new BigDecimal(amount), TransactionType.EXPENSE, category, categoryId, null);
    }
}
