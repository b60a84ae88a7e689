package com.flagship.hour_ledger.ledger.exception;

import lombok.Getter;

import java.math.BigDecimal;

@Getter
public class InvalidDurationException extends HourLedgerException {

    private final BigDecimal durationHours;

    public InvalidDurationException(BigDecimal durationHours) {
        super(String.format("Session duration must be positive, got %s hours", durationHours), null);
        this.durationHours = durationHours;
    }
}
