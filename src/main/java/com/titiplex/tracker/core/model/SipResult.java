package com.titiplex.tracker.core.model;

import java.math.BigDecimal;

/**
 * Outcome of a SIP computation, forward or inverse. Both carry the inputs used.
 */
public sealed interface SipResult permits SipProjection, SipRequirement {

    BigDecimal annualRatePercent();

    int months();
}
