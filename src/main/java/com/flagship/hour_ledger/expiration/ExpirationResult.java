package com.flagship.hour_ledger.expiration;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of removing an expired package's unused hours from the student's balance.
 * Failures carry an error message and expire nothing.
 */
@Value
@Builder
public class ExpirationResult {
    boolean success;
    UUID packageId;
    UUID studentId;
    BigDecimal hoursExpired;
    Instant processedAt;
    String auditLog;
    String errorMessage;

    static ExpirationResult failure(UUID packageId, UUID studentId, String errorMessage) {
        return ExpirationResult.builder()
            .success(false)
            .packageId(packageId)
            .studentId(studentId)
            .hoursExpired(BigDecimal.ZERO.setScale(2))
            .processedAt(Instant.now())
            .auditLog("")
            .errorMessage(errorMessage)
            .build();
    }
}
