package com.titiplex.tracker.core.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;

/**
 * One row of the expense file. Identified by its position in the store, not by a key.
 */
public record ExpenseRecord(
        LocalDate date,
        String category,
        BigDecimal amount,
        String currencySymbol,
        String note
) {

    public ExpenseRecord {
        category = category == null ? null : category.strip();
        currencySymbol = currencySymbol == null ? "" : currencySymbol.strip();
        note = note == null ? "" : note.strip();
    }

    public YearMonth month() {
        return YearMonth.from(date);
    }
}
