package com.flagship.hour_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Repository
public interface HourConsumptionRepository extends JpaRepository<HourConsumptionEntity, UUID> {

    /**
     * Non-refunded records of a session, locked so that two concurrent refunds of the same
     * session cannot both give the hours back.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM HourConsumptionEntity c " +
           "WHERE c.sessionId = :sessionId AND c.refunded = false " +
           "ORDER BY c.consumedAt ASC, c.id ASC")
    List<HourConsumptionEntity> findActiveBySessionForUpdate(@Param("sessionId") UUID sessionId);

    List<HourConsumptionEntity> findBySessionIdOrderByConsumedAtAsc(UUID sessionId);

    List<HourConsumptionEntity> findByStudentIdOrderByConsumedAtDesc(UUID studentId);

    @Query("SELECT COALESCE(SUM(c.hoursConsumed), 0) FROM HourConsumptionEntity c " +
           "WHERE c.packageId = :packageId AND c.refunded = false")
    BigDecimal sumActiveHoursByPackage(@Param("packageId") UUID packageId);

    @Query("SELECT COALESCE(SUM(c.hoursConsumed), 0) FROM HourConsumptionEntity c " +
           "WHERE c.sessionId = :sessionId AND c.refunded = false")
    BigDecimal sumActiveHoursBySession(@Param("sessionId") UUID sessionId);
}
