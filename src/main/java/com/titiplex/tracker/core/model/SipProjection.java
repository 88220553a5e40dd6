package com.titiplex.tracker.core.model;

import java.math.BigDecimal;

public record SipProjection(
        BigDecimal monthlyInvestment,
        BigDecimal annualRatePercent,
        int months,
        BigDecimal futureValue,
        BigDecimal totalInvested,
        BigDecimal estimatedGains
) implements SipResult {
}
