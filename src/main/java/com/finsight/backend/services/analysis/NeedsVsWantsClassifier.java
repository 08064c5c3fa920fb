package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.finsight.backend.config.AnalysisProperties;
import com.finsight.backend.dto.analysis.NeedsVsWantsDTO;

import lombok.RequiredArgsConstructor;

/**
 * Splits expense spend into essential and discretionary buckets by category keyword.
 * A category matches a keyword when either contains the other, ignoring case; needs are checked first.
 * Spend that matches neither list is apportioned with the configured fallback ratio.
 */
@Component
@RequiredArgsConstructor
public class NeedsVsWantsClassifier {

    public enum Bucket { NEEDS, WANTS, UNCLASSIFIED }

    private final AnalysisProperties properties;

    public NeedsVsWantsDTO classify(Map<String, BigDecimal> expensesByCategory) {
        BigDecimal needs = BigDecimal.ZERO;
        BigDecimal wants = BigDecimal.ZERO;
        BigDecimal unclassified = BigDecimal.ZERO;

        if (expensesByCategory != null) {
            for (Map.Entry<String, BigDecimal> entry : expensesByCategory.entrySet()) {
                BigDecimal amount = AnalysisMath.safeAmount(entry.getValue());
                switch (bucketOf(entry.getKey())) {
                    case NEEDS -> needs = needs.add(amount);
                    case WANTS -> wants = wants.add(amount);
                    default -> unclassified = unclassified.add(amount);
                }
            }
        }

        BigDecimal ratio = properties.needsFallbackRatio();
        BigDecimal finalNeeds = needs.add(unclassified.multiply(ratio));
        BigDecimal finalWants = wants.add(unclassified.multiply(BigDecimal.ONE.subtract(ratio)));
        BigDecimal total = needs.add(wants).add(unclassified);

        int needsPercentage = 0;
        int wantsPercentage = 0;
        if (total.signum() > 0) {
            needsPercentage = AnalysisMath.ratio(finalNeeds, total)
                    .multiply(AnalysisMath.ONE_HUNDRED)
                    .setScale(0, RoundingMode.HALF_UP)
                    .intValue();
            wantsPercentage = 100 - needsPercentage;
        }

        return NeedsVsWantsDTO.builder()
                .needs(AnalysisMath.money(finalNeeds))
                .wants(AnalysisMath.money(finalWants))
                .unclassified(AnalysisMath.money(unclassified))
                .needsPercentage(needsPercentage)
                .wantsPercentage(wantsPercentage)
                .build();
    }

    public Bucket bucketOf(String category) {
        if (category == null || category.isBlank()) {
            return Bucket.UNCLASSIFIED;
        }
        String normalized = category.trim().toLowerCase(Locale.ROOT);
        if (matchesAny(normalized, properties.needsKeywords())) {
            return Bucket.NEEDS;
        }
        if (matchesAny(normalized, properties.wantsKeywords())) {
            return Bucket.WANTS;
        }
        return Bucket.UNCLASSIFIED;
    }

    private static boolean matchesAny(String category, List<String> keywords) {
        for (String keyword : keywords) {
            if (keyword == null || keyword.isBlank()) continue;
            String k = keyword.trim().toLowerCase(Locale.ROOT);
            if (category.contains(k) || k.contains(category)) {
                return true;
            }
        }
        return false;
    }
}
