package com.flagship.hour_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Hours drawn from one package by one student for one session.
 *
 * {@code hoursConsumed} is what is currently billed; {@code hoursOriginallyReserved} is
 * what was billed when the record was created. Refunded records no longer count against
 * the balance.
 */
@Value
public class HourConsumption {
    UUID id;
    UUID balanceId;
    UUID studentId;
    UUID sessionId;
    UUID packageId;
    BigDecimal hoursConsumed;
    BigDecimal hoursOriginallyReserved;
    boolean refunded;
    String reason;
    Instant consumedAt;

    /**
     * Positive when hours were given back after the record was created.
     */
    public BigDecimal getHoursDifference() {
        return hoursOriginallyReserved.subtract(hoursConsumed);
    }
}
