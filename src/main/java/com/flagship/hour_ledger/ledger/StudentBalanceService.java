package com.flagship.hour_ledger.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Creates, locks and reads student balances.
 *
 * Balances are created lazily with an upsert on the unique student_id column, then
 * re-read with a row lock. Two concurrent first purchases for the same student therefore
 * end up on the same row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StudentBalanceService {

    private final StudentBalanceRepository balanceRepository;
    private final JdbcTemplate jdbcTemplate;

    /**
     * Returns the student's balance, creating an empty one if needed, locked for the rest
     * of the caller's transaction.
     *
     * Must run inside an existing transaction, otherwise the lock would be released
     * immediately.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StudentBalanceEntity findOrCreateForUpdate(UUID studentId) {
        if (studentId == null) {
            throw new IllegalArgumentException("Student ID is required");
        }
        int inserted = jdbcTemplate.update(
            "INSERT INTO student_balances (id, student_id, hours_purchased, hours_consumed, balance_amount, created_at, updated_at) " +
            "VALUES (?, ?, 0, 0, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (student_id) DO NOTHING",
            UUID.randomUUID(),
            studentId
        );
        if (inserted > 0) {
            log.debug("Created balance for student {}", studentId);
        }
        return balanceRepository.findByStudentIdForUpdate(studentId)
            .orElseThrow(() -> new IllegalStateException("Balance row missing after upsert for student " + studentId));
    }

    /**
     * Locks the balances of several students in ascending student-id order so that two
     * transactions touching overlapping student sets cannot deadlock.
     *
     * @return balances keyed by student id, in lock order
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Map<UUID, StudentBalanceEntity> lockBalances(Collection<UUID> studentIds) {
        Map<UUID, StudentBalanceEntity> locked = new LinkedHashMap<>();
        for (UUID studentId : new TreeSet<>(studentIds)) {
            locked.put(studentId, findOrCreateForUpdate(studentId));
        }
        return locked;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public StudentBalanceEntity save(StudentBalanceEntity balance) {
        return balanceRepository.save(balance);
    }

    @Transactional(readOnly = true)
    public Optional<StudentBalance> findBalance(UUID studentId) {
        return balanceRepository.findByStudentId(studentId)
            .map(StudentBalanceEntity::toDomain);
    }

    /**
     * Balance snapshot for a student; students without a balance row get an empty one.
     */
    @Transactional(readOnly = true)
    public StudentBalance getBalance(UUID studentId) {
        return findBalance(studentId).orElseGet(() -> StudentBalance.empty(studentId));
    }
}
