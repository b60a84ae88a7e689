package com.flagship.hour_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for hour consumption records.
 *
 * Records are never deleted. A refund either reduces {@code hoursConsumed} (partial) or
 * flags the whole record as refunded. The reason column carries the adjustment note for
 * records created by a duration adjustment and the refund reason once refunded.
 */
@Entity
@Table(
    name = "hour_consumptions",
    indexes = {
        @Index(name = "idx_hour_consumptions_session", columnList = "session_id, refunded"),
        @Index(name = "idx_hour_consumptions_package", columnList = "package_id"),
        @Index(name = "idx_hour_consumptions_balance", columnList = "balance_id, consumed_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HourConsumptionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "balance_id", nullable = false, updatable = false)
    private UUID balanceId;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Column(name = "session_id", nullable = false, updatable = false)
    private UUID sessionId;

    @Column(name = "package_id", nullable = false, updatable = false)
    private UUID packageId;

    @Column(name = "hours_consumed", nullable = false, precision = 7, scale = 2)
    private BigDecimal hoursConsumed;

    @Column(name = "hours_originally_reserved", nullable = false, updatable = false, precision = 7, scale = 2)
    private BigDecimal hoursOriginallyReserved;

    @Column(nullable = false)
    private boolean refunded;

    @Column(name = "reason", columnDefinition = "TEXT")
    private String reason;

    @Column(name = "consumed_at", nullable = false, updatable = false)
    private Instant consumedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static HourConsumptionEntity record(StudentBalanceEntity balance, UUID sessionId,
                                               UUID packageId, BigDecimal hours, String reason) {
        if (!Hours.isPositive(hours)) {
            throw new IllegalArgumentException("Consumed hours must be positive, got " + hours);
        }
        BigDecimal normalized = Hours.normalize(hours);
        return new HourConsumptionEntity(
            UUID.randomUUID(),
            balance.getId(),
            balance.getStudentId(),
            sessionId,
            packageId,
            normalized,
            normalized,
            false,
            reason,
            Instant.now(),
            null
        );
    }

    @PrePersist
    void onCreate() {
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Refunds everything still billed on this record.
     *
     * @return hours to give back to the balance
     * @throws IllegalStateException if the record was already refunded
     */
    public BigDecimal refundAll(String refundReason) {
        requireNotRefunded();
        this.refunded = true;
        this.reason = refundReason;
        return hoursConsumed;
    }

    /**
     * Gives back part of the billed hours. The record becomes refunded once nothing is
     * billed on it any more.
     */
    public void refundPartially(BigDecimal hours, String refundReason) {
        requireNotRefunded();
        if (!Hours.isPositive(hours) || hours.compareTo(hoursConsumed) > 0) {
            throw new IllegalArgumentException(String.format(
                "Cannot refund %s hours from consumption %s billing %s hours", hours, id, hoursConsumed));
        }
        this.hoursConsumed = Hours.normalize(hoursConsumed.subtract(hours));
        this.reason = refundReason;
        if (this.hoursConsumed.signum() == 0) {
            this.refunded = true;
        }
    }

    public HourConsumption toDomain() {
        return new HourConsumption(
            id,
            balanceId,
            studentId,
            sessionId,
            packageId,
            hoursConsumed,
            hoursOriginallyReserved,
            refunded,
            reason,
            consumedAt
        );
    }

    private void requireNotRefunded() {
        if (refunded) {
            throw new IllegalStateException("Consumption " + id + " has already been refunded");
        }
    }
}
