package com.titiplex.tracker.core.model;

/**
 * Suggestion rules. Declaration order is evaluation order.
 */
public enum TipKind {
    OVERSPENDING,
    BUDGET_OVERRUN,
    LOW_SAVINGS,
    HIGH_SAVINGS,
    TOP_CATEGORY
}
