package com.evarsity.lifecycle;

import com.evarsity.lifecycle.dropout.RefundPolicy;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class RefundPolicyTest {

    @Test
    void tiersFollowElapsedShareOfCourse() {
        assertTier("90", 0, 180);
        assertTier("90", 30, 180);
        assertTier("90", 45, 180);
        assertTier("50", 46, 180);
        assertTier("50", 90, 180);
        assertTier("25", 91, 180);
        assertTier("25", 100, 180);
        assertTier("25", 135, 180);
        assertTier("0", 136, 180);
        assertTier("0", 170, 180);
        assertTier("0", 180, 180);
    }

    @Test
    void boundariesAreExactForDurationsNotDivisibleByFour() {
        // 30 days: quarter = 7.5, half = 15, three quarters = 22.5
        assertTier("90", 7, 30);
        assertTier("50", 8, 30);
        assertTier("50", 15, 30);
        assertTier("25", 16, 30);
        assertTier("25", 22, 30);
        assertTier("0", 23, 30);
    }

    @Test
    void amountIsPriceTimesPercentageRoundedToCents() {
        assertEquals(new BigDecimal("900.00"), RefundPolicy.refundAmount(new BigDecimal("1000.00"), new BigDecimal("90.00")));
        assertEquals(new BigDecimal("166.67"), RefundPolicy.refundAmount(new BigDecimal("333.33"), new BigDecimal("50.00")));
        assertEquals(new BigDecimal("0.00"), RefundPolicy.refundAmount(new BigDecimal("1000.00"), new BigDecimal("0.00")));
    }

    @Test
    void completedDaysAreClampedToCourseDuration() {
        LocalDate enrolled = LocalDate.of(2026, 1, 5);
        assertEquals(40, RefundPolicy.completedDays(enrolled, enrolled.plusDays(40), 180));
        assertEquals(180, RefundPolicy.completedDays(enrolled, enrolled.plusDays(500), 180));
        assertEquals(0, RefundPolicy.completedDays(enrolled, enrolled.minusDays(3), 180));
    }

    @Test
    void quoteCombinesDurationTierAndAmount() {
        LocalDate enrolled = LocalDate.of(2026, 1, 5);
        var quote = RefundPolicy.quote(enrolled, enrolled.plusDays(40), 180, new BigDecimal("1000.00"));
        assertEquals(40, quote.completedDays());
        assertEquals(180, quote.totalDays());
        assertEquals(0, new BigDecimal("90").compareTo(quote.refundPercentage()));
        assertEquals(0, new BigDecimal("900").compareTo(quote.refundAmount()));
    }

    @Test
    void rejectsNonPositiveDuration() {
        assertThrows(IllegalArgumentException.class, () -> RefundPolicy.refundPercentage(1, 0));
    }

    private void assertTier(String expected, int completedDays, int totalDays) {
        BigDecimal actual = RefundPolicy.refundPercentage(completedDays, totalDays);
        assertEquals(0, new BigDecimal(expected).compareTo(actual),
                "day " + completedDays + " of " + totalDays + " -> " + actual);
    }
}
