package com.titiplex.tracker.core.model;

import java.math.BigDecimal;
import java.util.Comparator;

public record CategoryTotal(String category, BigDecimal amount) {

    /** Largest amount first; equal amounts by category name. */
    public static final Comparator<CategoryTotal> BY_AMOUNT_DESC = Comparator
            .comparing(CategoryTotal::amount, Comparator.reverseOrder())
            .thenComparing(CategoryTotal::category);
}
