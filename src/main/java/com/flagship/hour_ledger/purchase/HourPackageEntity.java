package com.flagship.hour_ledger.purchase;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for hour package persistence.
 *
 * No setters: status changes go through {@link #updateFromDomain(HourPackage)},
 * expiry changes through {@link #extendExpiry(Instant)}, and expiration bookkeeping
 * through {@link #markExpirationProcessed(Instant)}.
 * Metadata is a persistence concern and is passed separately from the domain object.
 */
@Entity
@Table(
    name = "hour_packages",
    indexes = {
        @Index(name = "idx_hour_packages_student_status", columnList = "student_id, status"),
        @Index(name = "idx_hour_packages_created_at", columnList = "created_at"),
        @Index(name = "idx_hour_packages_expires_at", columnList = "expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HourPackageEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false)
    private UUID studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "package_type", nullable = false, updatable = false, length = 20)
    private PackageType type;

    @Column(name = "hours_included", nullable = false, updatable = false, precision = 7, scale = 2)
    private BigDecimal hoursIncluded;

    @Column(nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PackageStatus status;

    @Column(name = "failure_reason")
    private String failureReason;

    @Column(name = "expires_at")
    private Instant expiresAt;

    @Column(name = "payment_reference", unique = true, updatable = false)
    private String paymentReference;

    @Column(name = "metadata", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "expiration_processed_at")
    private Instant expirationProcessedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = Instant.now();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Creates an entity from a domain package. The creation timestamp is kept from the
     * domain object because it drives FIFO consumption order.
     */
    public static HourPackageEntity fromDomain(HourPackage hourPackage, String metadataJson) {
        return new HourPackageEntity(
            hourPackage.getId(),
            hourPackage.getStudentId(),
            hourPackage.getType(),
            hourPackage.getHoursIncluded(),
            hourPackage.getAmount(),
            hourPackage.getStatus(),
            hourPackage.getFailureReason(),
            hourPackage.getExpiresAt(),
            hourPackage.getPaymentReference(),
            metadataJson != null ? metadataJson : "{}",
            null,
            hourPackage.getCreatedAt(),
            null
        );
    }

    public HourPackage toDomain() {
        return new HourPackage(
            id,
            studentId,
            type,
            hoursIncluded,
            amount,
            status,
            failureReason,
            expiresAt,
            paymentReference,
            createdAt,
            updatedAt
        );
    }

    /**
     * Only status and failure reason follow the domain object; everything else is fixed
     * once the purchase is recorded.
     */
    void updateFromDomain(HourPackage hourPackage) {
        this.status = hourPackage.getStatus();
        this.failureReason = hourPackage.getFailureReason();
    }

    public void extendExpiry(Instant newExpiry) {
        if (this.type == PackageType.SUBSCRIPTION) {
            throw new IllegalStateException("Subscription package " + this.id + " has no expiry to extend");
        }
        if (this.expirationProcessedAt != null) {
            throw new IllegalStateException(
                "Package " + this.id + " already had its unused hours expired at " + this.expirationProcessedAt);
        }
        if (newExpiry == null) {
            throw new IllegalArgumentException("New expiry is required");
        }
        this.expiresAt = newExpiry;
    }

    public void markExpirationProcessed(Instant processedAt) {
        if (this.expirationProcessedAt != null) {
            throw new IllegalStateException(
                "Expiration already processed for package " + this.id + " at " + this.expirationProcessedAt);
        }
        this.expirationProcessedAt = processedAt;
    }

    public boolean isExpirationProcessed() {
        return expirationProcessedAt != null;
    }
}
