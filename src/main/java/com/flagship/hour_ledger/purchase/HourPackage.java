package com.flagship.hour_ledger.purchase;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Purchased bundle of tutoring hours.
 *
 * Status transitions are explicit and validated:
 * PENDING → COMPLETED, PENDING → FAILED. Every transition returns a new instance.
 * Only COMPLETED packages that have not expired can be drawn from.
 */
@Value
public class HourPackage {
    UUID id;
    UUID studentId;
    PackageType type;
    BigDecimal hoursIncluded;
    BigDecimal amount;
    PackageStatus status;
    String failureReason;
    Instant expiresAt;
    String paymentReference;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new package in PENDING status.
     */
    public static HourPackage create(UUID id, UUID studentId, PackageType type,
                                     BigDecimal hoursIncluded, BigDecimal amount,
                                     Instant expiresAt, String paymentReference) {
        Instant now = Instant.now();
        return new HourPackage(
            id,
            studentId,
            type,
            hoursIncluded,
            amount,
            PackageStatus.PENDING,
            null,
            expiresAt,
            paymentReference,
            now,
            now
        );
    }

    /**
     * Transitions the package to COMPLETED once the payment is confirmed.
     *
     * @throws IllegalStateException if the package is not PENDING
     */
    public HourPackage complete() {
        if (this.status != PackageStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot complete package %s in %s status. Only PENDING packages can be completed.",
                    this.id, this.status)
            );
        }
        return withStatus(PackageStatus.COMPLETED, this.failureReason);
    }

    /**
     * Transitions the package to FAILED.
     *
     * @throws IllegalStateException if the package is not PENDING
     */
    public HourPackage fail(String reason) {
        if (this.status != PackageStatus.PENDING) {
            throw new IllegalStateException(
                String.format("Cannot fail package %s in %s status. Only PENDING packages can be failed.",
                    this.id, this.status)
            );
        }
        return withStatus(PackageStatus.FAILED, reason);
    }

    public boolean isTerminal() {
        return this.status == PackageStatus.COMPLETED || this.status == PackageStatus.FAILED;
    }

    public boolean canTransitionTo(PackageStatus targetStatus) {
        if (this.status == targetStatus) {
            return true;
        }
        return switch (this.status) {
            case PENDING -> targetStatus == PackageStatus.COMPLETED || targetStatus == PackageStatus.FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    /**
     * A package without an expiry (subscription) never expires.
     */
    public boolean isExpiredAt(Instant instant) {
        return expiresAt != null && !expiresAt.isAfter(instant);
    }

    public boolean isEligibleAt(Instant instant) {
        return status == PackageStatus.COMPLETED && !isExpiredAt(instant);
    }

    private HourPackage withStatus(PackageStatus newStatus, String reason) {
        return new HourPackage(
            this.id,
            this.studentId,
            this.type,
            this.hoursIncluded,
            this.amount,
            newStatus,
            reason,
            this.expiresAt,
            this.paymentReference,
            this.createdAt,
            Instant.now()
        );
    }
}
