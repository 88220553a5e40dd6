package com.titiplex.tracker.core.store;

import com.titiplex.tracker.core.model.ExpenseEntry;
import com.titiplex.tracker.core.model.ExpenseRecord;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

public interface RecordStore {
    // Expenses

    /**
     * Appends a record and returns its id (position in storage order).
     */
    int addExpense(ExpenseRecord record);

    void updateExpense(int id, ExpenseRecord record);

    void deleteExpense(int id);

    ExpenseRecord expense(int id);

    List<ExpenseRecord> listExpenses();

    List<ExpenseRecord> listExpenses(YearMonth month);

    /**
     * Records with their ids for the given month, or all of them when {@code month} is null.
     */
    List<ExpenseEntry> entries(YearMonth month);

    // Income

    void setIncome(YearMonth month, BigDecimal amount);

    void clearIncome(YearMonth month);

    Map<YearMonth, BigDecimal> listIncome();

    BigDecimal incomeFor(YearMonth month);

    /**
     * File backing the expense table; it may not exist until the first record is saved.
     */
    Path expensesPath();

    /**
     * Drops the in-memory copy; the next call reads the files again.
     */
    void reload();
}
