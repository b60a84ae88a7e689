package com.flagship.hour_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class StudentBalanceEntityTest {

    @Test
    @DisplayName("Remaining hours are purchased minus consumed")
    void testRemainingHours() {
        StudentBalanceEntity balance = StudentBalanceEntity.open(UUID.randomUUID());
        assertEquals(0, balance.getRemainingHours().signum());

        balance.credit(new BigDecimal("10"), new BigDecimal("250"));
        balance.consume(new BigDecimal("2.5"));

        assertEquals(new BigDecimal("10.00"), balance.getHoursPurchased());
        assertEquals(new BigDecimal("2.50"), balance.getHoursConsumed());
        assertEquals(new BigDecimal("7.50"), balance.getRemainingHours());
        assertEquals(new BigDecimal("250.00"), balance.getBalanceAmount());
    }

    @Test
    @DisplayName("Restoring more hours than consumed is rejected")
    void testRestore_CannotGoBelowZero() {
        StudentBalanceEntity balance = StudentBalanceEntity.open(UUID.randomUUID());
        balance.credit(new BigDecimal("5"), BigDecimal.ZERO);
        balance.consume(new BigDecimal("1"));

        assertThrows(IllegalStateException.class, () -> balance.restore(new BigDecimal("1.5")));

        balance.restore(new BigDecimal("1"));
        assertEquals(new BigDecimal("0.00"), balance.getHoursConsumed());
    }

    @Test
    @DisplayName("Expiring hours lowers the purchased total")
    void testExpire() {
        StudentBalanceEntity balance = StudentBalanceEntity.open(UUID.randomUUID());
        balance.credit(new BigDecimal("10"), new BigDecimal("100"));

        balance.expire(new BigDecimal("4"));

        assertEquals(new BigDecimal("6.00"), balance.getHoursPurchased());
        assertEquals(new BigDecimal("6.00"), balance.toDomain().getRemainingHours());
    }

    @Test
    @DisplayName("Balance operations reject non-positive hours")
    void testRejectsNonPositiveHours() {
        StudentBalanceEntity balance = StudentBalanceEntity.open(UUID.randomUUID());

        assertThrows(IllegalArgumentException.class, () -> balance.consume(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> balance.credit(new BigDecimal("-1"), BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class, () -> balance.credit(BigDecimal.ONE, new BigDecimal("-1")));
        assertThrows(IllegalArgumentException.class, () -> balance.expire(null));
    }
}
