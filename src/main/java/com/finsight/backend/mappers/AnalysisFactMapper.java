package com.finsight.backend.mappers;

import com.finsight.backend.entities.Budget;
import com.finsight.backend.entities.FinancialTransaction;
import com.finsight.backend.entities.Target;
import com.finsight.backend.services.analysis.model.BudgetLimit;
import com.finsight.backend.services.analysis.model.TargetSnapshot;
import com.finsight.backend.services.analysis.model.TransactionFact;

/**
 * Converts persisted entities into the read-only values the analysis engine consumes.
 */
public class AnalysisFactMapper {

    private AnalysisFactMapper() {}

    public static TransactionFact toFact(FinancialTransaction tx) {
        return new TransactionFact(
                tx.getTransactionDate(),
                tx.getAmount(),
                tx.getType(),
                tx.getCategory(),
                tx.getCategoryRef() != null ? tx.getCategoryRef().getId() : null,
                tx.getTarget() != null ? tx.getTarget().getId() : null
        );
    }

    public static TargetSnapshot toSnapshot(Target target) {
        return new TargetSnapshot(
                target.getTargetAmount(),
                target.getCurrentAmount(),
                target.getTargetDate(),
                target.getCreatedAt()
        );
    }

    public static BudgetLimit toLimit(Budget budget) {
        return new BudgetLimit(
                budget.getCategory() != null ? budget.getCategory().getName() : null,
                budget.getCategory() != null ? budget.getCategory().getId() : null,
                budget.getAmount(),
                budget.getMonth(),
                budget.getYear()
        );
    }
}
