package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

import org.springframework.stereotype.Component;

import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.services.analysis.model.AggregationResult;
import com.finsight.backend.services.analysis.model.TransactionFact;
import com.finsight.backend.services.analysis.model.TypeAggregate;

/**
 * Groups transactions by type, by category and by calendar month.
 */
@Component
public class TransactionAggregator {

    private static final Comparator<Map.Entry<String, BigDecimal>> LARGEST_FIRST =
            Map.Entry.<String, BigDecimal>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey());

    public AggregationResult aggregate(List<TransactionFact> transactions) {
        List<TransactionFact> txs = transactions == null
                ? List.of()
                : transactions.stream().filter(Objects::nonNull).toList();

        SortedMap<String, BigDecimal> monthlyIncome = new TreeMap<>();
        SortedMap<String, BigDecimal> monthlyExpenses = new TreeMap<>();
        LocalDate first = null;
        LocalDate last = null;

        for (TransactionFact tx : txs) {
            if (tx.date() == null) continue;

            if (first == null || tx.date().isBefore(first)) first = tx.date();
            if (last == null || tx.date().isAfter(last)) last = tx.date();

            if (tx.type() == TransactionType.INCOME) {
                monthlyIncome.merge(AnalysisMath.monthKey(tx.date()), AnalysisMath.safeAmount(tx), BigDecimal::add);
            } else if (tx.type() == TransactionType.EXPENSE) {
                monthlyExpenses.merge(AnalysisMath.monthKey(tx.date()), AnalysisMath.safeAmount(tx), BigDecimal::add);
            }
        }

        return new AggregationResult(
                aggregateType(txs, TransactionType.INCOME),
                aggregateType(txs, TransactionType.EXPENSE),
                aggregateType(txs, TransactionType.INVESTMENT),
                Collections.unmodifiableSortedMap(monthlyIncome),
                Collections.unmodifiableSortedMap(monthlyExpenses),
                first,
                last,
                txs.size()
        );
    }

    TypeAggregate aggregateType(List<TransactionFact> txs, TransactionType type) {
        List<TransactionFact> ofType = txs.stream()
                .filter(tx -> AnalysisMath.isType(tx, type))
                .toList();

        BigDecimal total = ofType.stream()
                .map(AnalysisMath::safeAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new TypeAggregate(
                type,
                total,
                ofType.size(),
                monthlyAverage(ofType, total),
                categoryBreakdown(ofType)
        );
    }

    /**
     * Total divided by the number of calendar months between the earliest and latest transaction, both included.
     */
    BigDecimal monthlyAverage(List<TransactionFact> ofType, BigDecimal total) {
        if (ofType.isEmpty()) {
            return BigDecimal.ZERO;
        }

        YearMonth earliest = null;
        YearMonth latest = null;
        for (TransactionFact tx : ofType) {
            if (tx.date() == null) continue;
            YearMonth ym = YearMonth.from(tx.date());
            if (earliest == null || ym.isBefore(earliest)) earliest = ym;
            if (latest == null || ym.isAfter(latest)) latest = ym;
        }

        long months = earliest == null ? 1 : ChronoUnit.MONTHS.between(earliest, latest) + 1;
        return AnalysisMath.ratio(total, BigDecimal.valueOf(months));
    }

    Map<String, BigDecimal> categoryBreakdown(List<TransactionFact> ofType) {
        Map<String, BigDecimal> sums = new HashMap<>();
        for (TransactionFact tx : ofType) {
            sums.merge(AnalysisMath.normalizeCategory(tx.category()), AnalysisMath.safeAmount(tx), BigDecimal::add);
        }

        Map<String, BigDecimal> sorted = new LinkedHashMap<>();
        sums.entrySet().stream()
                .sorted(LARGEST_FIRST)
                .forEach(e -> sorted.put(e.getKey(), e.getValue()));
        return Collections.unmodifiableMap(sorted);
    }
}
