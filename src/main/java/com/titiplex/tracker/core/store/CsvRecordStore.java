package com.titiplex.tracker.core.store;

import com.titiplex.tracker.core.error.NotFoundException;
import com.titiplex.tracker.core.error.ValidationException;
import com.titiplex.tracker.core.model.ExpenseEntry;
import com.titiplex.tracker.core.model.ExpenseRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps both tables in memory and rewrites the whole file on every change. Memory is
 * only updated once the new file is in place, so a failed write changes nothing.
 * Single writer: callers issue mutations from one thread.
 */
@Repository
public class CsvRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(CsvRecordStore.class);

    private final Path expensesPath;
    private final Path incomePath;

    private List<ExpenseRecord> expenses;
    private LinkedHashMap<YearMonth, BigDecimal> income;

    @Autowired
    public CsvRecordStore(@Value("${app.data.dir}") String dataDir) {
        this(Paths.get(dataDir));
    }

    public CsvRecordStore(Path dataDir) {
        this.expensesPath = dataDir.resolve("expenses.csv");
        this.incomePath = dataDir.resolve("income.csv");
    }

    // ---------- Expenses ----------
    @Override
    public int addExpense(ExpenseRecord record) {
        requireValid(record);
        List<ExpenseRecord> next = new ArrayList<>(expenses());
        next.add(record);
        commitExpenses(next);
        return next.size() - 1;
    }

    @Override
    public void updateExpense(int id, ExpenseRecord record) {
        requireId(id);
        requireValid(record);
        List<ExpenseRecord> next = new ArrayList<>(expenses());
        next.set(id, record);
        commitExpenses(next);
    }

    @Override
    public void deleteExpense(int id) {
        requireId(id);
        List<ExpenseRecord> next = new ArrayList<>(expenses());
        next.remove(id);
        commitExpenses(next);
    }

    @Override
    public ExpenseRecord expense(int id) {
        requireId(id);
        return expenses().get(id);
    }

    @Override
    public List<ExpenseRecord> listExpenses() {
        return List.copyOf(expenses());
    }

    @Override
    public List<ExpenseRecord> listExpenses(YearMonth month) {
        return expenses().stream()
                .filter(r -> r.month().equals(month))
                .toList();
    }

    @Override
    public List<ExpenseEntry> entries(YearMonth month) {
        List<ExpenseRecord> all = expenses();
        List<ExpenseEntry> out = new ArrayList<>();
        for (int i = 0; i < all.size(); i++) {
            if (month == null || all.get(i).month().equals(month)) {
                out.add(new ExpenseEntry(i, all.get(i)));
            }
        }
        return Collections.unmodifiableList(out);
    }

    private void commitExpenses(List<ExpenseRecord> next) {
        CsvTables.writeExpenses(expensesPath, next);
        expenses = next;
        log.debug("Wrote {} expenses to {}", next.size(), expensesPath);
    }

    private List<ExpenseRecord> expenses() {
        if (expenses == null) {
            expenses = Files.exists(expensesPath) ? CsvTables.readExpenses(expensesPath) : new ArrayList<>();
            log.info("Loaded {} expenses from {}", expenses.size(), expensesPath);
        }
        return expenses;
    }

    private void requireId(int id) {
        int size = expenses().size();
        if (id < 0 || id >= size) {
            throw new NotFoundException("No expense at position " + id + " (" + size + " stored)");
        }
    }

    static void requireValid(ExpenseRecord r) {
        if (r == null) {
            throw new ValidationException("Expense is required");
        }
        if (r.date() == null) {
            throw new ValidationException("Date is required");
        }
        if (r.category() == null || r.category().isBlank()) {
            throw new ValidationException("Category is required");
        }
        if (r.amount() == null) {
            throw new ValidationException("Amount is required");
        }
        if (r.amount().signum() < 0) {
            throw new ValidationException("Amount must not be negative: " + r.amount().toPlainString());
        }
    }

    // ---------- Income ----------
    @Override
    public void setIncome(YearMonth month, BigDecimal amount) {
        if (month == null) {
            throw new ValidationException("Month is required");
        }
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException("Income must be zero or more");
        }
        LinkedHashMap<YearMonth, BigDecimal> next = new LinkedHashMap<>(income());
        next.put(month, amount);
        commitIncome(next);
    }

    @Override
    public void clearIncome(YearMonth month) {
        if (!income().containsKey(month)) {
            throw new NotFoundException("No income recorded for " + month);
        }
        LinkedHashMap<YearMonth, BigDecimal> next = new LinkedHashMap<>(income());
        next.remove(month);
        commitIncome(next);
    }

    @Override
    public Map<YearMonth, BigDecimal> listIncome() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(income()));
    }

    @Override
    public BigDecimal incomeFor(YearMonth month) {
        return income().getOrDefault(month, BigDecimal.ZERO);
    }

    private void commitIncome(LinkedHashMap<YearMonth, BigDecimal> next) {
        CsvTables.writeIncome(incomePath, next);
        income = next;
        log.debug("Wrote {} income months to {}", next.size(), incomePath);
    }

    private LinkedHashMap<YearMonth, BigDecimal> income() {
        if (income == null) {
            income = Files.exists(incomePath) ? CsvTables.readIncome(incomePath) : new LinkedHashMap<>();
            log.info("Loaded {} income months from {}", income.size(), incomePath);
        }
        return income;
    }

    @Override
    public Path expensesPath() {
        return expensesPath;
    }

    @Override
    public void reload() {
        expenses = null;
        income = null;
    }
}
