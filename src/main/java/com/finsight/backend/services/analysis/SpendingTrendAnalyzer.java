package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.finsight.backend.dto.analysis.TrendAnalysisDTO;
import com.finsight.backend.enums.TrendDirection;
import com.finsight.backend.services.analysis.model.AggregationResult;

@Component
public class SpendingTrendAnalyzer {

    public TrendAnalysisDTO analyze(AggregationResult aggregation) {
        SortedMap<String, BigDecimal> spending = aggregation.monthlyExpenses() != null
                ? new TreeMap<>(aggregation.monthlyExpenses())
                : new TreeMap<>();
        SortedMap<String, BigDecimal> income = aggregation.monthlyIncome() != null
                ? new TreeMap<>(aggregation.monthlyIncome())
                : new TreeMap<>();

        BigDecimal trend = trend(spending);

        return TrendAnalysisDTO.builder()
                .monthlySpending(rounded(spending))
                .monthlyIncome(rounded(income))
                .spendingTrend(AnalysisMath.money(trend))
                .trendDirection(direction(trend))
                .build();
    }

    /**
     * Difference between the last and first month's spending, spread over the number of months present.
     * Unrounded; only the reported value is rounded.
     */
    BigDecimal trend(SortedMap<String, BigDecimal> spending) {
        if (spending.size() < 2) {
            return BigDecimal.ZERO;
        }

        BigDecimal first = AnalysisMath.safeAmount(spending.get(spending.firstKey()));
        BigDecimal last = AnalysisMath.safeAmount(spending.get(spending.lastKey()));

        return AnalysisMath.ratio(last.subtract(first), BigDecimal.valueOf(spending.size()));
    }

    static TrendDirection direction(BigDecimal trend) {
        int sign = AnalysisMath.safeAmount(trend).signum();
        if (sign > 0) return TrendDirection.INCREASING;
        if (sign < 0) return TrendDirection.DECREASING;
        return TrendDirection.STABLE;
    }

    private static Map<String, BigDecimal> rounded(SortedMap<String, BigDecimal> buckets) {
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        buckets.forEach((month, amount) -> out.put(month, AnalysisMath.money(amount)));
        return Collections.unmodifiableMap(out);
    }
}
