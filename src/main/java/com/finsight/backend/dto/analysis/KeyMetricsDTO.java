package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class KeyMetricsDTO {

    BigDecimal monthlyIncome;
    BigDecimal monthlyExpenses;
    BigDecimal monthlySavings;
    BigDecimal savingsRate;
    BigDecimal targetProgress;
}
