package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;
import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class BudgetAnalysisDTO {

    int month;
    int year;
    int totalBudgets;
    BigDecimal totalBudgetAmount;
    /** Sum of per-category spend, each capped at that category's budget. */
    BigDecimal totalSpent;
    int overBudget;
    int underBudget;
    BigDecimal budgetUtilization;
    @Singular
    List<BudgetCategoryDTO> categories;
}
