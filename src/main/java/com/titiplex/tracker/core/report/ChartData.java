package com.titiplex.tracker.core.report;

import com.titiplex.tracker.core.model.CategoryTotal;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Series for the charts window: income vs expenditure per month, all-time top categories
 * and the category share pie.
 */
public record ChartData(List<MonthPoint> months, List<CategoryTotal> topCategories, List<ChartSlice> slices) {

    public record MonthPoint(YearMonth month, BigDecimal income, BigDecimal expense) {
    }
}
