package com.titiplex.tracker.core.suggest;

import com.titiplex.tracker.core.model.CategoryTotal;
import com.titiplex.tracker.core.model.Money;
import com.titiplex.tracker.core.model.MonthlyAggregate;
import com.titiplex.tracker.core.model.Preferences;
import com.titiplex.tracker.core.model.SuggestionReport;
import com.titiplex.tracker.core.model.Tip;
import com.titiplex.tracker.core.model.TipKind;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Rule-based tips for a month. Every rule is checked in {@link TipKind} order and all
 * that apply are kept; the output depends only on the inputs.
 */
@Service
public class SuggestionEngine {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private final BigDecimal lowSavingsThreshold;
    private final BigDecimal highSavingsThreshold;
    private final int topCategoryTips;

    public SuggestionEngine(@Value("${app.suggest.low-savings-threshold:0.10}") BigDecimal lowSavingsThreshold,
                            @Value("${app.suggest.high-savings-threshold:0.30}") BigDecimal highSavingsThreshold,
                            @Value("${app.suggest.top-category-tips:3}") int topCategoryTips) {
        if (lowSavingsThreshold.compareTo(highSavingsThreshold) > 0) {
            throw new IllegalArgumentException("low savings threshold " + lowSavingsThreshold
                    + " is above high savings threshold " + highSavingsThreshold);
        }
        this.lowSavingsThreshold = lowSavingsThreshold;
        this.highSavingsThreshold = highSavingsThreshold;
        this.topCategoryTips = topCategoryTips;
    }

    public SuggestionReport suggest(MonthlyAggregate agg, Preferences prefs) {
        BigDecimal savingsRate = savingsRate(agg);
        String sym = prefs.currencySymbol();

        List<Tip> tips = new ArrayList<>();
        for (TipKind kind : TipKind.values()) {
            switch (kind) {
                case OVERSPENDING -> {
                    if (agg.totalExpense().compareTo(agg.totalIncome()) > 0) {
                        BigDecimal excess = agg.totalExpense().subtract(agg.totalIncome());
                        tips.add(new Tip(kind, "You are overspending this month: expenditure exceeds income by "
                                + Money.format(sym, excess) + ". Review your top categories and cut back where possible."));
                    }
                }
                case BUDGET_OVERRUN -> {
                    if (prefs.hasBudget() && agg.totalExpense().compareTo(prefs.defaultMonthlyBudget()) > 0) {
                        BigDecimal overrun = agg.totalExpense().subtract(prefs.defaultMonthlyBudget());
                        tips.add(new Tip(kind, "Monthly budget of " + Money.format(sym, prefs.defaultMonthlyBudget())
                                + " exceeded by " + Money.format(sym, overrun) + "."));
                    }
                }
                case LOW_SAVINGS -> {
                    if (savingsRate != null && savingsRate.compareTo(lowSavingsThreshold) < 0) {
                        tips.add(new Tip(kind, "You are saving " + percentOf(savingsRate) + "% of your income, below "
                                + percentOf(lowSavingsThreshold) + "%. Try to set aside more each month."));
                    }
                }
                case HIGH_SAVINGS -> {
                    if (savingsRate != null && savingsRate.compareTo(highSavingsThreshold) >= 0) {
                        tips.add(new Tip(kind, "Great! You are saving " + percentOf(savingsRate) + "% of your income ("
                                + Money.format(sym, agg.balance()) + " available). Consider automating it as a SIP."));
                    }
                }
                case TOP_CATEGORY -> {
                    List<CategoryTotal> top = agg.topCategories();
                    for (CategoryTotal c : top.subList(0, Math.min(topCategoryTips, top.size()))) {
                        tips.add(new Tip(kind, c.category() + " takes " + Money.percent(c.amount(), agg.totalExpense())
                                + "% of your spending (" + Money.format(sym, c.amount()) + ")."));
                    }
                }
            }
        }
        return new SuggestionReport(agg, List.copyOf(tips), savingsRate);
    }

    /**
     * The monthly summary block shown in the insights window.
     */
    public String summaryText(SuggestionReport report, Preferences prefs) {
        MonthlyAggregate agg = report.aggregate();
        String sym = prefs.currencySymbol();
        StringBuilder sb = new StringBuilder();
        sb.append("Month: ").append(agg.month()).append('\n');
        sb.append("Income: ").append(Money.format(sym, agg.totalIncome())).append('\n');
        sb.append("Expenditure: ").append(Money.format(sym, agg.totalExpense())).append('\n');
        sb.append("Balance: ").append(Money.format(sym, agg.balance())).append('\n');
        report.savingsRateIfDefined()
                .ifPresent(rate -> sb.append("Savings rate: ").append(percentOf(rate)).append("%\n"));
        if (agg.totalIncome().signum() == 0) {
            sb.append("\nNo income set for this month. Set monthly income to enable better insights.\n");
        }
        if (!report.tips().isEmpty()) {
            sb.append('\n');
            for (Tip tip : report.tips()) {
                sb.append("• ").append(tip.message()).append('\n');
            }
        }
        return sb.toString();
    }

    static BigDecimal savingsRate(MonthlyAggregate agg) {
        if (agg.totalIncome().signum() <= 0) {
            return null;
        }
        return agg.balance().divide(agg.totalIncome(), MathContext.DECIMAL64);
    }

    private static int percentOf(BigDecimal rate) {
        return rate.multiply(ONE_HUNDRED).setScale(0, RoundingMode.HALF_UP).intValue();
    }
}
