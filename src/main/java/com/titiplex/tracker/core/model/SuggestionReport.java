package com.titiplex.tracker.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Tips for one month. {@code savingsRate} is null when the month has no income.
 */
public record SuggestionReport(MonthlyAggregate aggregate, List<Tip> tips, BigDecimal savingsRate) {

    public Optional<BigDecimal> savingsRateIfDefined() {
        return Optional.ofNullable(savingsRate);
    }
}
