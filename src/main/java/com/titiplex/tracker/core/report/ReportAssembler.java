package com.titiplex.tracker.core.report;

import com.titiplex.tracker.core.analytics.AggregationEngine;
import com.titiplex.tracker.core.model.CategoryTotal;
import com.titiplex.tracker.core.model.Money;
import com.titiplex.tracker.core.model.MonthlyAggregate;
import com.titiplex.tracker.core.model.Preferences;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns an aggregate into a {@link ReportPayload}. Does no rendering.
 */
@Service
public class ReportAssembler {

    static final int BREAKDOWN_LIMIT = 10;
    static final int PIE_SLICES = 6;
    static final String OTHERS = "Others";

    public ReportPayload buildReport(MonthlyAggregate agg, Preferences prefs) {
        String sym = prefs.currencySymbol();
        boolean noData = agg.isEmpty();

        List<ReportPayload.CategoryLine> lines = new ArrayList<>();
        if (!noData) {
            int rank = 1;
            for (CategoryTotal c : AggregationEngine.rankCategories(agg.categoryTotals(), BREAKDOWN_LIMIT)) {
                lines.add(new ReportPayload.CategoryLine(
                        rank++,
                        c.category(),
                        c.amount(),
                        Money.format(sym, c.amount()),
                        Money.percent(c.amount(), agg.totalExpense())));
            }
        }

        return new ReportPayload(
                agg.month(),
                "Monthly Expense Report - " + agg.month(),
                sym,
                agg.totalIncome(),
                agg.totalExpense(),
                agg.balance(),
                Money.format(sym, agg.totalIncome()),
                Money.format(sym, agg.totalExpense()),
                Money.format(sym, agg.balance()),
                List.copyOf(lines),
                noData ? List.of() : slices(agg.categoryTotals(), PIE_SLICES),
                noData);
    }

    /**
     * The {@code count} largest categories, the remainder folded into one "Others" slice.
     */
    public static List<ChartSlice> slices(Map<String, BigDecimal> totals, int count) {
        List<CategoryTotal> ranked = AggregationEngine.rankCategories(totals, Integer.MAX_VALUE);
        List<ChartSlice> out = new ArrayList<>();
        BigDecimal others = BigDecimal.ZERO;
        for (int i = 0; i < ranked.size(); i++) {
            CategoryTotal c = ranked.get(i);
            if (i < count) {
                out.add(new ChartSlice(c.category(), c.amount()));
            } else {
                others = others.add(c.amount());
            }
        }
        if (ranked.size() > count) {
            out.add(new ChartSlice(OTHERS, others));
        }
        return List.copyOf(out);
    }
}
