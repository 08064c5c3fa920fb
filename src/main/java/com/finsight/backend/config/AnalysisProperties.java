package com.finsight.backend.config;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import com.finsight.backend.enums.CategoryMatching;

/**
 * Policy constants of the analysis engine, bound from {@code finsight.analysis.*}.
 * Every field falls back to the value the report has always been computed with.
 */
@ConfigurationProperties(prefix = "finsight.analysis")
public record AnalysisProperties(
        BigDecimal onTrackTolerance,
        BigDecimal negativeCashFlowFloor,
        CategoryMatching categoryMatching,
        HealthWeights healthWeights,
        List<String> needsKeywords,
        List<String> wantsKeywords,
        BigDecimal needsFallbackRatio,
        String defaultCurrencySymbol
) {

    public static final List<String> DEFAULT_NEEDS_KEYWORDS = List.of(
            "Rent", "Utilities", "Groceries", "Healthcare", "Transportation", "Insurance", "Education"
    );

    public static final List<String> DEFAULT_WANTS_KEYWORDS = List.of(
            "Entertainment", "Shopping", "Dining", "Travel", "Hobbies", "Gifts"
    );

    public AnalysisProperties {
        if (onTrackTolerance == null) {
            onTrackTolerance = new BigDecimal("0.8");
        }
        if (negativeCashFlowFloor == null) {
            negativeCashFlowFloor = new BigDecimal("-1000");
        }
        if (categoryMatching == null) {
            categoryMatching = CategoryMatching.CATEGORY_ID;
        }
        if (healthWeights == null) {
            healthWeights = HealthWeights.defaults();
        }
        if (needsKeywords == null) {
            needsKeywords = DEFAULT_NEEDS_KEYWORDS;
        }
        if (wantsKeywords == null) {
            wantsKeywords = DEFAULT_WANTS_KEYWORDS;
        }
        if (needsFallbackRatio == null) {
            needsFallbackRatio = new BigDecimal("0.7");
        }
        if (defaultCurrencySymbol == null || defaultCurrencySymbol.isBlank()) {
            defaultCurrencySymbol = "₹";
        }
    }

    public static AnalysisProperties defaults() {
        return new AnalysisProperties(null, null, null, null, null, null, null, null);
    }

    public AnalysisProperties withCategoryMatching(CategoryMatching matching) {
        return new AnalysisProperties(
                onTrackTolerance,
                negativeCashFlowFloor,
                matching,
                healthWeights,
                needsKeywords,
                wantsKeywords,
                needsFallbackRatio,
                defaultCurrencySymbol
        );
    }

    /**
     * Maximum points of each health-score factor.
     */
    public record HealthWeights(
            Integer savingsRate,
            Integer netIncome,
            Integer targetProgress,
            Integer budgetAdherence,
            Integer trend
    ) {
        public HealthWeights {
            if (savingsRate == null) savingsRate = 30;
            if (netIncome == null) netIncome = 25;
            if (targetProgress == null) targetProgress = 20;
            if (budgetAdherence == null) budgetAdherence = 15;
            if (trend == null) trend = 10;
        }

        public static HealthWeights defaults() {
            return new HealthWeights(null, null, null, null, null);
        }

        public int total() {
            return savingsRate + netIncome + targetProgress + budgetAdherence + trend;
        }
    }
}
