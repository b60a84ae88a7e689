package com.flagship.hour_ledger.session;

public enum AdjustmentType {
    NONE,
    ADDITIONAL_DEDUCTION,
    PARTIAL_REFUND
}
