package com.flagship.hour_ledger.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for a student's running hour totals.
 *
 * Mutated only through the ledger operations below, always while the row is locked
 * by the surrounding transaction. Remaining hours are purchased minus consumed.
 */
@Entity
@Table(name = "student_balances")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class StudentBalanceEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "student_id", nullable = false, updatable = false, unique = true)
    private UUID studentId;

    @Column(name = "hours_purchased", nullable = false, precision = 7, scale = 2)
    private BigDecimal hoursPurchased;

    @Column(name = "hours_consumed", nullable = false, precision = 7, scale = 2)
    private BigDecimal hoursConsumed;

    @Column(name = "balance_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal balanceAmount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private StudentBalanceEntity(UUID id, UUID studentId) {
        this.id = id;
        this.studentId = studentId;
        this.hoursPurchased = Hours.ZERO;
        this.hoursConsumed = Hours.ZERO;
        this.balanceAmount = BigDecimal.ZERO.setScale(2);
    }

    /**
     * Creates an empty balance. Production code creates balances through
     * {@link StudentBalanceService#findOrCreateForUpdate(UUID)} so that concurrent first
     * purchases cannot insert duplicates.
     */
    public static StudentBalanceEntity open(UUID studentId) {
        return new StudentBalanceEntity(UUID.randomUUID(), studentId);
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public BigDecimal getRemainingHours() {
        return hoursPurchased.subtract(hoursConsumed);
    }

    public void consume(BigDecimal hours) {
        requirePositive(hours);
        this.hoursConsumed = Hours.normalize(this.hoursConsumed.add(hours));
    }

    /**
     * Gives back previously consumed hours.
     *
     * @throws IllegalStateException if more hours would be restored than were consumed
     */
    public void restore(BigDecimal hours) {
        requirePositive(hours);
        BigDecimal updated = this.hoursConsumed.subtract(hours);
        if (updated.signum() < 0) {
            throw new IllegalStateException(String.format(
                "Cannot restore %s hours for student %s: only %s hours consumed",
                hours, studentId, hoursConsumed));
        }
        this.hoursConsumed = Hours.normalize(updated);
    }

    public void credit(BigDecimal hours, BigDecimal amount) {
        requirePositive(hours);
        if (amount == null || amount.signum() < 0) {
            throw new IllegalArgumentException("Credited amount must not be negative");
        }
        this.hoursPurchased = Hours.normalize(this.hoursPurchased.add(hours));
        this.balanceAmount = this.balanceAmount.add(amount).setScale(2, RoundingMode.HALF_UP);
    }

    /**
     * Removes unused hours of an expired package from the purchased total.
     */
    public void expire(BigDecimal hours) {
        requirePositive(hours);
        this.hoursPurchased = Hours.normalize(this.hoursPurchased.subtract(hours));
    }

    public StudentBalance toDomain() {
        return new StudentBalance(id, studentId, hoursPurchased, hoursConsumed, balanceAmount, updatedAt);
    }

    private static void requirePositive(BigDecimal hours) {
        if (!Hours.isPositive(hours)) {
            throw new IllegalArgumentException("Hours must be positive, got " + hours);
        }
    }
}
