package com.titiplex.tracker.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

public record Preferences(
        @JsonProperty("currency_symbol") String currencySymbol,
        @JsonProperty("default_monthly_budget") BigDecimal defaultMonthlyBudget
) {

    public boolean hasBudget() {
        return defaultMonthlyBudget != null && defaultMonthlyBudget.signum() > 0;
    }
}
