package com.titiplex.tracker.core.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Derived summary of one month. Never persisted.
 */
public record MonthlyAggregate(
        YearMonth month,
        BigDecimal totalIncome,
        BigDecimal totalExpense,
        BigDecimal balance,
        Map<String, BigDecimal> categoryTotals,
        List<CategoryTotal> topCategories,
        int recordCount
) {

    public boolean isEmpty() {
        return recordCount == 0;
    }
}
