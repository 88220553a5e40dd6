package com.titiplex.tracker.core.analytics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.titiplex.tracker.core.model.CategoryTotal;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.model.MonthlyAggregate;

class AggregationEngineTest {

    private final AggregationEngine engine = new AggregationEngine(5);

    private static ExpenseRecord expense(String date, String category, String amount) {
        return new ExpenseRecord(LocalDate.parse(date), category, new BigDecimal(amount), "₹", "");
    }

    @Test
    void aggregatesAMonth() {
        List<ExpenseRecord> rows = List.of(
                expense("2024-01-05", "Food", "500"),
                expense("2024-01-10", "Transport", "200"),
                expense("2024-01-15", "Food", "300"));

        MonthlyAggregate agg = engine.aggregate(rows, new BigDecimal("50000"), YearMonth.of(2024, 1));

        assertEquals(0, new BigDecimal("1000").compareTo(agg.totalExpense()));
        assertEquals(0, new BigDecimal("49000").compareTo(agg.balance()));
        assertEquals(0, new BigDecimal("800").compareTo(agg.categoryTotals().get("Food")));
        assertEquals(List.of("Food", "Transport"), agg.topCategories().stream().map(CategoryTotal::category).toList());
        assertEquals(3, agg.recordCount());
    }

    @Test
    void categoryTotalsSumToTotalExpense() {
        List<ExpenseRecord> rows = List.of(
                expense("2024-03-01", "Food", "10.10"),
                expense("2024-03-02", "Bills", "0.20"),
                expense("2024-03-03", "Food", "0.30"),
                expense("2024-03-04", "Health", "99.99"));

        MonthlyAggregate agg = engine.aggregate(rows, null, YearMonth.of(2024, 3));

        BigDecimal sum = agg.categoryTotals().values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        assertEquals(0, sum.compareTo(agg.totalExpense()));
        assertEquals(0, new BigDecimal("110.59").compareTo(agg.totalExpense()));
        assertEquals(0, BigDecimal.ZERO.compareTo(agg.totalIncome()));
    }

    @Test
    void tiesRankByCategoryNameAndAreCapped() {
        AggregationEngine topTwo = new AggregationEngine(2);
        List<ExpenseRecord> rows = List.of(
                expense("2024-01-01", "Shopping", "100"),
                expense("2024-01-02", "Bills", "100"),
                expense("2024-01-03", "Food", "50"));

        MonthlyAggregate agg = topTwo.aggregate(rows, BigDecimal.ZERO, YearMonth.of(2024, 1));

        assertEquals(List.of(new CategoryTotal("Bills", new BigDecimal("100")),
                        new CategoryTotal("Shopping", new BigDecimal("100"))),
                agg.topCategories());
    }

    @Test
    void emptyMonth() {
        MonthlyAggregate agg = engine.aggregate(List.of(), new BigDecimal("1000"), YearMonth.of(2024, 4));

        assertTrue(agg.isEmpty());
        assertTrue(agg.topCategories().isEmpty());
        assertEquals(0, new BigDecimal("1000").compareTo(agg.balance()));
    }

    @Test
    void aggregateAllIsChronologicalAndIncludesIncomeOnlyMonths() {
        List<ExpenseRecord> rows = List.of(
                expense("2024-03-01", "Food", "10"),
                expense("2024-01-01", "Food", "20"));
        Map<YearMonth, BigDecimal> income = Map.of(YearMonth.of(2024, 2), new BigDecimal("500"));

        List<MonthlyAggregate> all = engine.aggregateAll(rows, income);

        assertEquals(List.of(YearMonth.of(2024, 1), YearMonth.of(2024, 2), YearMonth.of(2024, 3)),
                all.stream().map(MonthlyAggregate::month).toList());
        assertTrue(all.get(1).isEmpty());
        assertEquals(0, new BigDecimal("500").compareTo(all.get(1).totalIncome()));
    }

    @Test
    void topNMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new AggregationEngine(0));
    }
}
