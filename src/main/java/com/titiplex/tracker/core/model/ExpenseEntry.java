package com.titiplex.tracker.core.model;

/**
 * An expense together with its current position in the store.
 */
public record ExpenseEntry(int id, ExpenseRecord record) {
}
