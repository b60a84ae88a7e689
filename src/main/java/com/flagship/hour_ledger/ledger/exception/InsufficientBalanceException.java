package com.flagship.hour_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Raised when a student's remaining hours do not cover the requested hours, or when the
 * student never purchased a package.
 */
@Getter
public class InsufficientBalanceException extends HourLedgerException {

    private final BigDecimal requiredHours;
    private final BigDecimal availableHours;

    public InsufficientBalanceException(String message, UUID studentId,
                                        BigDecimal requiredHours, BigDecimal availableHours) {
        super(message, studentId);
        this.requiredHours = requiredHours;
        this.availableHours = availableHours;
    }

    public static InsufficientBalanceException shortfall(UUID studentId, BigDecimal required, BigDecimal available) {
        return new InsufficientBalanceException(
            String.format("Insufficient balance for student %s: required %s hours, available %s hours",
                studentId, required, available),
            studentId, required, available);
    }

    public static InsufficientBalanceException noPackages(UUID studentId, BigDecimal required, BigDecimal available) {
        return new InsufficientBalanceException(
            String.format("Insufficient balance for student %s: no packages purchased (required %s hours)",
                studentId, required),
            studentId, required, available);
    }

    public BigDecimal getShortfall() {
        return requiredHours.subtract(availableHours).max(BigDecimal.ZERO);
    }
}
