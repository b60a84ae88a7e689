package com.flagship.hour_ledger.ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Base class for business-rule rejections raised by the hour ledger.
 * These are not transient faults: callers roll back and report, they do not retry.
 */
@Getter
public abstract class HourLedgerException extends RuntimeException {

    private final UUID studentId;

    protected HourLedgerException(String message, UUID studentId) {
        super(message);
        this.studentId = studentId;
    }
}
