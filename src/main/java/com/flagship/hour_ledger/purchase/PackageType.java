package com.flagship.hour_ledger.purchase;

/**
 * Kind of purchase that produced a package. Subscriptions never expire.
 */
public enum PackageType {
    PACKAGE,
    SUBSCRIPTION
}
