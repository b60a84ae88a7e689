package com.flagship.hour_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal arithmetic helpers for tutoring hours. Hours are always carried with two
 * decimal places.
 */
public final class Hours {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private Hours() {
        // Utility class
    }

    public static BigDecimal normalize(BigDecimal hours) {
        return hours == null ? null : hours.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static boolean isPositive(BigDecimal hours) {
        return hours != null && hours.signum() > 0;
    }

    public static BigDecimal min(BigDecimal a, BigDecimal b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
