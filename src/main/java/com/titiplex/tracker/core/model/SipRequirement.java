package com.titiplex.tracker.core.model;

import java.math.BigDecimal;

public record SipRequirement(
        BigDecimal targetFutureValue,
        BigDecimal annualRatePercent,
        int months,
        BigDecimal requiredMonthlyInvestment
) implements SipResult {
}
