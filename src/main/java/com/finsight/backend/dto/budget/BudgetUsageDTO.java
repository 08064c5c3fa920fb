package com.finsight.backend.dto.budget;

import com.finsight.backend.dto.analysis.BudgetCategoryDTO;

import lombok.Value;

/**
 * Spend against one budget within its own month.
 */
@Value
public class BudgetUsageDTO {

    BudgetResponseDTO budget;
    BudgetCategoryDTO usage;
}
