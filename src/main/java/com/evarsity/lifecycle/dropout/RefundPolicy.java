package com.evarsity.lifecycle.dropout;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Refund tiers by elapsed share of the course:
 * <pre>
 *   ratio &lt;= 0.25        -> 90%
 *   0.25 &lt; ratio &lt;= 0.50 -> 50%
 *   0.50 &lt; ratio &lt;= 0.75 -> 25%
 *   ratio &gt; 0.75         -> 0%
 * </pre>
 * Ratios are compared in integer arithmetic so tier boundaries are exact.
 */
public final class RefundPolicy {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public record RefundQuote(int completedDays, int totalDays, BigDecimal refundPercentage, BigDecimal refundAmount) {}

    public static RefundQuote quote(LocalDate enrollmentDate, LocalDate dropoutDate, int totalDays, BigDecimal price) {
        int completed = completedDays(enrollmentDate, dropoutDate, totalDays);
        BigDecimal percentage = refundPercentage(completed, totalDays);
        return new RefundQuote(completed, totalDays, percentage, refundAmount(price, percentage));
    }

    public static int completedDays(LocalDate enrollmentDate, LocalDate dropoutDate, int totalDays) {
        long days = ChronoUnit.DAYS.between(enrollmentDate, dropoutDate);
        return (int) Math.max(0, Math.min(totalDays, days));
    }

    public static BigDecimal refundPercentage(int completedDays, int totalDays) {
        if (totalDays <= 0) {
            throw new IllegalArgumentException("Total course duration must be positive: " + totalDays);
        }
        long completed = completedDays;
        long total = totalDays;
        if (completed * 4 <= total) return new BigDecimal("90.00");
        if (completed * 2 <= total) return new BigDecimal("50.00");
        if (completed * 4 <= total * 3) return new BigDecimal("25.00");
        return new BigDecimal("0.00");
    }

    public static BigDecimal refundAmount(BigDecimal price, BigDecimal refundPercentage) {
        return price.multiply(refundPercentage).divide(HUNDRED, 2, RoundingMode.HALF_UP);
    }

    private RefundPolicy() {}
}
