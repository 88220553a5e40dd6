package com.titiplex.tracker.core.report;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Everything a renderer needs for one monthly report, numbers and display strings alike.
 * {@code noData} is set when the month has no expense records.
 */
public record ReportPayload(
        YearMonth month,
        String title,
        String currencySymbol,
        BigDecimal totalIncome,
        BigDecimal totalExpense,
        BigDecimal balance,
        String formattedIncome,
        String formattedExpense,
        String formattedBalance,
        List<CategoryLine> categories,
        List<ChartSlice> slices,
        boolean noData
) {

    public record CategoryLine(int rank, String category, BigDecimal amount, String formattedAmount, int sharePercent) {
    }
}
