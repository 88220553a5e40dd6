package com.titiplex.tracker.core.report;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.model.ExpenseRecord;
import com.titiplex.tracker.core.model.MonthlyAggregate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

@Service
public class ChartDataAssembler {

    static final int TOP_CATEGORIES = 10;

    private final AggregationEngine engine;

    public ChartDataAssembler(AggregationEngine engine) {
        this.engine = engine;
    }

    public ChartData chartData(List<ExpenseRecord> records, Map<YearMonth, BigDecimal> income) {
        return chartData(records, income, YearMonth.now());
    }

    /**
     * @param current month shown alone when there is no data at all
     */
    public ChartData chartData(List<ExpenseRecord> records, Map<YearMonth, BigDecimal> income, YearMonth current) {
        List<ChartData.MonthPoint> months = engine.aggregateAll(records, income).stream()
                .map(this::point)
                .toList();
        if (months.isEmpty()) {
            months = List.of(new ChartData.MonthPoint(current, BigDecimal.ZERO, BigDecimal.ZERO));
        }

        Map<String, BigDecimal> allTime = engine.categoryTotals(records);
        return new ChartData(
                months,
                AggregationEngine.rankCategories(allTime, TOP_CATEGORIES),
                ReportAssembler.slices(allTime, ReportAssembler.PIE_SLICES));
    }

    private ChartData.MonthPoint point(MonthlyAggregate agg) {
        return new ChartData.MonthPoint(agg.month(), agg.totalIncome(), agg.totalExpense());
    }
}
