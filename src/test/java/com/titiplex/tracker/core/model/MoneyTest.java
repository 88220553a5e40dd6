package com.titiplex.tracker.core.model;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.titiplex.tracker.core.error.ValidationException;

class MoneyTest {

    @Test
    void parsesAmountsWithSymbolsAndGrouping() {
        assertEquals(new BigDecimal("500.00"), Money.parse("₹500.00"));
        assertEquals(new BigDecimal("1234.50"), Money.parse("$1,234.50"));
        assertEquals(new BigDecimal("300"), Money.parse(" 300 "));
    }

    @Test
    void rejectsNonNumericText() {
        assertThrows(ValidationException.class, () -> Money.parse(""));
        assertThrows(ValidationException.class, () -> Money.parse("abc"));
        assertThrows(ValidationException.class, () -> Money.parse("1.2.3"));
    }

    @Test
    void symbolOf() {
        assertEquals("₹", Money.symbolOf("₹500.00"));
        assertEquals("AED", Money.symbolOf("AED 20"));
        assertEquals("", Money.symbolOf("42"));
    }

    @Test
    void formatsWithSymbolAndGrouping() {
        assertEquals("₹1,234.50", Money.format("₹", new BigDecimal("1234.5")));
        assertEquals("-$20.00", Money.format("$", new BigDecimal("-20")));
        assertEquals("0.01", Money.format(null, new BigDecimal("0.005")));
    }

    @Test
    void percentRoundsHalfUp() {
        assertEquals(71, Money.percent(new BigDecimal("500"), new BigDecimal("700")));
        assertEquals(0, Money.percent(BigDecimal.TEN, BigDecimal.ZERO));
    }
}
