package com.flagship.hour_ledger.purchase;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HourPackageRepository extends JpaRepository<HourPackageEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM HourPackageEntity p WHERE p.id = :id")
    Optional<HourPackageEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<HourPackageEntity> findByPaymentReference(String paymentReference);

    List<HourPackageEntity> findByStudentIdOrderByCreatedAtAsc(UUID studentId);

    /**
     * Packages a student can draw hours from, oldest first (FIFO).
     */
    @Query("SELECT p FROM HourPackageEntity p " +
           "WHERE p.studentId = :studentId " +
           "AND p.status = com.flagship.hour_ledger.purchase.PackageStatus.COMPLETED " +
           "AND (p.expiresAt IS NULL OR p.expiresAt > :now) " +
           "ORDER BY p.createdAt ASC, p.id ASC")
    List<HourPackageEntity> findEligiblePackages(@Param("studentId") UUID studentId, @Param("now") Instant now);

    long countByStudentIdAndStatus(UUID studentId, PackageStatus status);

    @Query("SELECT p FROM HourPackageEntity p " +
           "WHERE p.status = com.flagship.hour_ledger.purchase.PackageStatus.COMPLETED " +
           "AND p.expiresAt IS NOT NULL AND p.expiresAt >= :from AND p.expiresAt <= :to " +
           "ORDER BY p.expiresAt ASC")
    List<HourPackageEntity> findCompletedExpiringBetween(@Param("from") Instant from, @Param("to") Instant to);

    @Query("SELECT p FROM HourPackageEntity p " +
           "WHERE p.status = com.flagship.hour_ledger.purchase.PackageStatus.COMPLETED " +
           "AND p.expiresAt IS NOT NULL AND p.expiresAt < :cutoff " +
           "ORDER BY p.expiresAt ASC")
    List<HourPackageEntity> findCompletedExpiredBefore(@Param("cutoff") Instant cutoff);

    @Query("SELECT p FROM HourPackageEntity p " +
           "WHERE p.studentId = :studentId " +
           "AND p.status = com.flagship.hour_ledger.purchase.PackageStatus.COMPLETED " +
           "AND p.expiresAt IS NOT NULL AND p.expiresAt < :cutoff " +
           "ORDER BY p.expiresAt ASC")
    List<HourPackageEntity> findCompletedExpiredBeforeForStudent(@Param("studentId") UUID studentId,
                                                                 @Param("cutoff") Instant cutoff);

    @Query("SELECT p FROM HourPackageEntity p " +
           "WHERE p.status = com.flagship.hour_ledger.purchase.PackageStatus.COMPLETED " +
           "AND p.expiresAt IS NOT NULL AND p.expiresAt < :cutoff " +
           "AND p.expirationProcessedAt IS NULL " +
           "ORDER BY p.expiresAt ASC")
    List<HourPackageEntity> findUnprocessedExpiredBefore(@Param("cutoff") Instant cutoff);
}
