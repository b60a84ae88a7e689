package com.flagship.hour_ledger.ledger;

/**
 * Session status as reported by the session registry.
 */
public enum SessionStatus {
    SCHEDULED,
    COMPLETED,
    CANCELLED,
    NO_SHOW
}
