package com.titiplex.tracker.core.model;

import com.titiplex.tracker.core.error.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Parsing and display helpers for amounts. Rounding to cents only happens here.
 */
public final class Money {

    public static final int SCALE = 2;
    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private Money() {
    }

    /**
     * Parses amount text that may carry a currency symbol or grouping commas
     * ("₹500.00", "$1,234.50", " 300 ").
     */
    public static BigDecimal parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("Amount is required");
        }
        StringBuilder digits = new StringBuilder();
        for (char ch : text.strip().toCharArray()) {
            if (Character.isDigit(ch) || ch == '.' || ch == '-') {
                digits.append(ch);
            }
        }
        if (digits.isEmpty()) {
            throw new ValidationException("Not a numeric amount: " + text);
        }
        try {
            return new BigDecimal(digits.toString());
        } catch (NumberFormatException e) {
            throw new ValidationException("Not a numeric amount: " + text);
        }
    }

    /**
     * The currency label written in front of the number, or "" when there is none.
     */
    public static String symbolOf(String text) {
        if (text == null) {
            return "";
        }
        String s = text.strip();
        int i = 0;
        while (i < s.length() && !Character.isDigit(s.charAt(i)) && s.charAt(i) != '.' && s.charAt(i) != '-') {
            i++;
        }
        return s.substring(0, i).strip();
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** e.g. {@code ₹1,234.50}, {@code -$20.00}. */
    public static String format(String symbol, BigDecimal amount) {
        BigDecimal value = round(amount == null ? BigDecimal.ZERO : amount);
        DecimalFormat df = new DecimalFormat("#,##0.00", DecimalFormatSymbols.getInstance(Locale.ROOT));
        String sym = symbol == null ? "" : symbol;
        if (value.signum() < 0) {
            return "-" + sym + df.format(value.negate());
        }
        return sym + df.format(value);
    }

    public static String plain(BigDecimal amount) {
        return round(amount).toPlainString();
    }

    /** Share of {@code part} in {@code whole} as a whole percent, rounded half up; 0 when whole is 0. */
    public static int percent(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return 0;
        }
        return part.multiply(ONE_HUNDRED)
                .divide(whole, 0, RoundingMode.HALF_UP)
                .intValueExact();
    }
}
