package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;

import com.finsight.backend.enums.BudgetStatus;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BudgetCategoryDTO {

    String category;
    BigDecimal budget;
    BigDecimal spent;
    BigDecimal remaining;
    BigDecimal percentageUsed;
    BudgetStatus status;
}
