package com.titiplex.tracker.core.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.model.CategoryTotal;
import com.titiplex.tracker.core.model.ExpenseRecord;

class ChartDataAssemblerTest {

    private final ChartDataAssembler assembler = new ChartDataAssembler(new AggregationEngine(5));

    private static ExpenseRecord expense(String date, String category, String amount) {
        return new ExpenseRecord(LocalDate.parse(date), category, new BigDecimal(amount), "₹", "");
    }

    @Test
    void seriesPerMonthAndAllTimeCategories() {
        List<ExpenseRecord> rows = List.of(
                expense("2024-02-03", "Food", "100"),
                expense("2024-01-03", "Bills", "400"),
                expense("2024-02-10", "Food", "350"));
        Map<YearMonth, BigDecimal> income = Map.of(YearMonth.of(2024, 1), new BigDecimal("1000"));

        ChartData data = assembler.chartData(rows, income, YearMonth.of(2024, 3));

        assertEquals(List.of(
                new ChartData.MonthPoint(YearMonth.of(2024, 1), new BigDecimal("1000"), new BigDecimal("400")),
                new ChartData.MonthPoint(YearMonth.of(2024, 2), BigDecimal.ZERO, new BigDecimal("450"))),
                data.months());
        assertEquals(List.of("Food", "Bills"), data.topCategories().stream().map(CategoryTotal::category).toList());
        assertEquals(2, data.slices().size());
    }

    @Test
    void noDataShowsCurrentMonthOnly() {
        ChartData data = assembler.chartData(List.of(), Map.of(), YearMonth.of(2024, 3));

        assertEquals(List.of(new ChartData.MonthPoint(YearMonth.of(2024, 3), BigDecimal.ZERO, BigDecimal.ZERO)),
                data.months());
        assertTrue(data.topCategories().isEmpty());
        assertTrue(data.slices().isEmpty());
    }
}
