package com.flagship.hour_ledger.purchase;

/**
 * Lifecycle of a purchased hour package, driven by the payment gateway.
 */
public enum PackageStatus {
    /**
     * Payment initiated, not yet confirmed. Hours are not usable.
     */
    PENDING,

    /**
     * Payment confirmed. Hours are credited and the package can be consumed
     * until it expires.
     * Terminal state.
     */
    COMPLETED,

    /**
     * Payment failed. Terminal state.
     */
    FAILED
}
