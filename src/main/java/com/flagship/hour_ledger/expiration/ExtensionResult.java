package com.flagship.hour_ledger.expiration;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class ExtensionResult {
    UUID packageId;
    Instant originalExpiry;
    Instant newExpiry;
    int extensionDays;
    String reason;
    String auditLog;
}
