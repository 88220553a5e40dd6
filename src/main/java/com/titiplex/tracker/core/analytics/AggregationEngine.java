package com.titiplex.tracker.core.analytics;

import com.titiplex.tracker.core.model.CategoryTotal;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.model.MonthlyAggregate;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Pure rollups over expense records. Sums stay exact ({@link BigDecimal}); nothing is
 * rounded here.
 */
@Service
public class AggregationEngine {

    private final int topN;

    public AggregationEngine(@Value("${app.analytics.top-n:5}") int topN) {
        if (topN <= 0) {
            throw new IllegalArgumentException("app.analytics.top-n must be positive: " + topN);
        }
        this.topN = topN;
    }

    public int topN() {
        return topN;
    }

    /**
     * Summarises the given records (callers pass one month's records) against that month's income.
     */
    public MonthlyAggregate aggregate(List<ExpenseRecord> records, BigDecimal income, YearMonth month) {
        List<ExpenseRecord> rows = records == null ? List.of() : records;
        BigDecimal totalIncome = income == null ? BigDecimal.ZERO : income;

        Map<String, BigDecimal> totals = categoryTotals(rows);
        BigDecimal totalExpense = BigDecimal.ZERO;
        for (ExpenseRecord r : rows) {
            totalExpense = totalExpense.add(r.amount());
        }

        return new MonthlyAggregate(
                month,
                totalIncome,
                totalExpense,
                totalIncome.subtract(totalExpense),
                totals,
                rankCategories(totals, topN),
                rows.size()
        );
    }

    /**
     * One aggregate per month that has expenses or income, oldest first.
     */
    public List<MonthlyAggregate> aggregateAll(List<ExpenseRecord> records, Map<YearMonth, BigDecimal> incomeByMonth) {
        Map<YearMonth, List<ExpenseRecord>> byMonth = new TreeMap<>();
        for (ExpenseRecord r : records == null ? List.<ExpenseRecord>of() : records) {
            byMonth.computeIfAbsent(r.month(), m -> new ArrayList<>()).add(r);
        }
        Map<YearMonth, BigDecimal> income = incomeByMonth == null ? Map.of() : incomeByMonth;

        TreeSet<YearMonth> months = new TreeSet<>(byMonth.keySet());
        months.addAll(income.keySet());

        List<MonthlyAggregate> out = new ArrayList<>(months.size());
        for (YearMonth m : months) {
            out.add(aggregate(byMonth.getOrDefault(m, List.of()), income.get(m), m));
        }
        return out;
    }

    /**
     * Category → summed amount, in order of first appearance.
     */
    public Map<String, BigDecimal> categoryTotals(List<ExpenseRecord> records) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (ExpenseRecord r : records) {
            totals.merge(r.category(), r.amount(), BigDecimal::add);
        }
        return Collections.unmodifiableMap(totals);
    }

    /**
     * Largest first, ties by category name, at most {@code limit} entries.
     */
    public static List<CategoryTotal> rankCategories(Map<String, BigDecimal> totals, int limit) {
        return totals.entrySet().stream()
                .map(e -> new CategoryTotal(e.getKey(), e.getValue()))
                .sorted(CategoryTotal.BY_AMOUNT_DESC)
                .limit(limit)
                .toList();
    }
}
