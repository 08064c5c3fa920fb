package com.finsight.backend.services.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.math.BigDecimal;
import java.time.LocalDate;

import org.junit.jupiter.api.Test;

class AnalysisMathTest {

    @Test
    void percentage_zeroDenominator_isZero() {
        assertEquals(new BigDecimal("0.00"), AnalysisMath.percentage(new BigDecimal("10"), BigDecimal.ZERO));
        assertEquals(new BigDecimal("0.00"), AnalysisMath.percentage(new BigDecimal("10"), null));
    }

    @Test
    void percentage_roundsHalfUp() {
        assertEquals(new BigDecimal("33.33"), AnalysisMath.percentage(BigDecimal.ONE, new BigDecimal("3")));
        assertEquals(new BigDecimal("66.67"), AnalysisMath.percentage(new BigDecimal("2"), new BigDecimal("3")));
    }

    @Test
    void formatCurrency_groupsThousandsAndKeepsSign() {
        assertEquals("₹1,234,567.80", AnalysisMath.formatCurrency("₹", new BigDecimal("1234567.8")));
        assertEquals("-$5.00", AnalysisMath.formatCurrency("$", new BigDecimal("-5")));
        assertEquals("0.00", AnalysisMath.formatCurrency(null, null));
    }

    @Test
    void formatPercent_dropsTrailingZeros() {
        assertEquals("7.5", AnalysisMath.formatPercent(new BigDecimal("7.50")));
        assertEquals("100", AnalysisMath.formatPercent(new BigDecimal("100.00")));
        assertEquals("0", AnalysisMath.formatPercent(null));
    }

    @Test
    void normalizeCategory_blankIsUncategorized() {
        assertEquals(AnalysisMath.UNCATEGORIZED, AnalysisMath.normalizeCategory("   "));
        assertEquals("Rent", AnalysisMath.normalizeCategory("Rent"));
    }

    @Test
    void monthKey_isYearDashMonth() {
        assertEquals("2024-03", AnalysisMath.monthKey(LocalDate.of(2024, 3, 31)));
    }
}
