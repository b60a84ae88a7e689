package com.flagship.hour_ledger.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StudentBalanceRepository extends JpaRepository<StudentBalanceEntity, UUID> {

    Optional<StudentBalanceEntity> findByStudentId(UUID studentId);

    /**
     * Loads a balance with a row lock held until the surrounding transaction ends, so
     * concurrent ledger operations for the same student serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM StudentBalanceEntity b WHERE b.studentId = :studentId")
    Optional<StudentBalanceEntity> findByStudentIdForUpdate(@Param("studentId") UUID studentId);

    @Query("SELECT COUNT(b) FROM StudentBalanceEntity b WHERE b.hoursConsumed > b.hoursPurchased")
    long countOverdrawn();
}
