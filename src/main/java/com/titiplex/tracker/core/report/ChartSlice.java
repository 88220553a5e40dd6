package com.titiplex.tracker.core.report;

import java.math.BigDecimal;

public record ChartSlice(String label, BigDecimal amount) {
}
