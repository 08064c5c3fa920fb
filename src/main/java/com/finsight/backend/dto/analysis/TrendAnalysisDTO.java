package com.finsight.backend.dto.analysis;

import java.math.BigDecimal;
import java.util.Map;

import com.finsight.backend.enums.TrendDirection;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TrendAnalysisDTO {

    /** Expense totals keyed by {@code YYYY-MM}, in key order. */
    Map<String, BigDecimal> monthlySpending;
    Map<String, BigDecimal> monthlyIncome;
    BigDecimal spendingTrend;
    TrendDirection trendDirection;
}
