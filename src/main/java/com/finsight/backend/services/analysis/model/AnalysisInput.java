package com.finsight.backend.services.analysis.model;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything one analysis run needs. Collections are copied so later changes by the caller are not observed.
 * {@code budgetTransactions} feeds the budget comparison for {@code now}'s month; when absent the analysed
 * transactions are used.
 */
public record AnalysisInput(
        List<TransactionFact> transactions,
        List<TargetSnapshot> targets,
        List<BudgetLimit> budgets,
        List<TransactionFact> budgetTransactions,
        LocalDate now,
        String currencySymbol
) {

    public AnalysisInput {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
        targets = targets == null ? List.of() : List.copyOf(targets);
        budgets = budgets == null ? List.of() : List.copyOf(budgets);
        budgetTransactions = budgetTransactions == null ? transactions : List.copyOf(budgetTransactions);
        if (now == null) {
            throw new IllegalArgumentException("now is required");
        }
    }

    public AnalysisInput(List<TransactionFact> transactions, List<TargetSnapshot> targets, List<BudgetLimit> budgets,
                         LocalDate now, String currencySymbol) {
        this(transactions, targets, budgets, null, now, currencySymbol);
    }
}
