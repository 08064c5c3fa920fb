package com.finsight.backend.services.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Locale;

import com.finsight.backend.enums.TransactionType;
import com.finsight.backend.services.analysis.model.TransactionFact;

public final class AnalysisMath {

    public static final String UNCATEGORIZED = "Uncategorized";

    public static final BigDecimal ONE_HUNDRED = new BigDecimal("100");
    public static final int MONEY_SCALE = 2;
    public static final int PERCENT_SCALE = 2;
    public static final int DIVISION_SCALE = 10;

    private AnalysisMath() {
    }

    public static BigDecimal safeAmount(BigDecimal amount) {
        return amount != null ? amount : BigDecimal.ZERO;
    }

    public static BigDecimal safeAmount(TransactionFact tx) {
        if (tx == null) {
            return BigDecimal.ZERO;
        }
        return safeAmount(tx.amount());
    }

    public static boolean isType(TransactionFact tx, TransactionType type) {
        return tx != null && tx.type() == type;
    }

    public static String normalizeCategory(String category) {
        if (category == null || category.isBlank()) {
            return UNCATEGORIZED;
        }
        return category;
    }

    public static String monthKey(LocalDate date) {
        return YearMonth.from(date).toString();
    }

    /**
     * Rounds a monetary value for the report.
     */
    public static BigDecimal money(BigDecimal value) {
        return safeAmount(value).setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code numerator / denominator} at working precision, or zero when the denominator is zero.
     */
    public static BigDecimal ratio(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return safeAmount(numerator).divide(denominator, DIVISION_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * {@code part / whole × 100} rounded to 2 decimals, or zero when {@code whole} is zero.
     */
    public static BigDecimal percentage(BigDecimal part, BigDecimal whole) {
        return ratio(part, whole)
                .multiply(ONE_HUNDRED)
                .setScale(PERCENT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Formats an amount for report text, e.g. {@code ₹1,234.50}.
     */
    public static String formatCurrency(String symbol, BigDecimal amount) {
        DecimalFormat format = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
        String prefix = symbol != null ? symbol : "";
        BigDecimal safe = money(amount);
        if (safe.signum() < 0) {
            return "-" + prefix + format.format(safe.negate());
        }
        return prefix + format.format(safe);
    }

    /**
     * Formats a percentage without trailing zeros, e.g. {@code 7.5}.
     */
    public static String formatPercent(BigDecimal value) {
        BigDecimal stripped = safeAmount(value).stripTrailingZeros();
        if (stripped.scale() < 0) {
            stripped = stripped.setScale(0);
        }
        return stripped.toPlainString();
    }
}
