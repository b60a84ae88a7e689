package com.flagship.hour_ledger.ledger.exception;

import java.util.UUID;

/**
 * Raised when a student has completed packages but none of them can still be used.
 */
public class PackageExpiredException extends HourLedgerException {

    public PackageExpiredException(UUID studentId) {
        super(String.format("All hour packages for student %s have expired", studentId), studentId);
    }
}
