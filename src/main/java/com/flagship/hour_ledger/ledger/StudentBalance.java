package com.flagship.hour_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only snapshot of a student's hour balance.
 */
@Value
public class StudentBalance {
    UUID id;
    UUID studentId;
    BigDecimal hoursPurchased;
    BigDecimal hoursConsumed;
    BigDecimal balanceAmount;
    Instant updatedAt;

    public BigDecimal getRemainingHours() {
        return hoursPurchased.subtract(hoursConsumed);
    }

    public static StudentBalance empty(UUID studentId) {
        return new StudentBalance(null, studentId, Hours.ZERO, Hours.ZERO, BigDecimal.ZERO.setScale(2), null);
    }
}
