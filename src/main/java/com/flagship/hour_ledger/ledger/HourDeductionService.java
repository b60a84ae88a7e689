package com.flagship.hour_ledger.ledger;

import com.flagship.hour_ledger.ledger.exception.InsufficientBalanceException;
import com.flagship.hour_ledger.ledger.exception.InvalidDurationException;
import com.flagship.hour_ledger.ledger.exception.PackageExpiredException;
import com.flagship.hour_ledger.observability.CorrelationContext;
import com.flagship.hour_ledger.observability.LedgerMetrics;
import com.flagship.hour_ledger.purchase.HourPackageEntity;
import com.flagship.hour_ledger.purchase.HourPackageRepository;
import com.flagship.hour_ledger.purchase.PackageStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Deducts and refunds tutoring hours for sessions.
 *
 * Key principles:
 * - Each mutating operation is one transaction. Balances of every participating student
 *   are locked in ascending student-id order before anything is validated.
 * - All students are validated before any of them is charged, so a group session charges
 *   everyone or no one.
 * - Hours are drawn from the oldest eligible package first (FIFO by creation time).
 * - Consumption records are never deleted; refunds reduce or flag them.
 *
 * Business-rule rejections are raised as {@link com.flagship.hour_ledger.ledger.exception.HourLedgerException}
 * subclasses and roll the transaction back. {@link #checkBookingEligibility(UUID, BigDecimal)}
 * is the only operation that never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HourDeductionService {

    private final StudentBalanceService balanceService;
    private final HourPackageRepository packageRepository;
    private final HourConsumptionRepository consumptionRepository;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Validates every enrolled student's balance, then charges each of them the session
     * duration from their oldest eligible package.
     *
     * @return one consumption record per student; empty for trial sessions and sessions
     *         without students
     * @throws InvalidDurationException if the duration is not positive
     * @throws InsufficientBalanceException if a student lacks hours or never bought a package
     * @throws PackageExpiredException if a student's packages have all expired
     */
    @Transactional
    public List<HourConsumption> validateAndDeduct(SessionDescriptor session) {
        if (session.isTrial()) {
            log.info("Trial session {}: no hours deducted", session.getSessionId());
            ledgerMetrics.recordDeduction("trial");
            return List.of();
        }
        if (!session.hasStudents()) {
            log.warn("Session {} has no enrolled students, nothing to deduct", session.getSessionId());
            ledgerMetrics.recordDeduction("no_students");
            return List.of();
        }
        BigDecimal requiredHours = requirePositiveDuration(session.getDurationHours());

        long startTime = System.currentTimeMillis();
        boolean correlationAdded = CorrelationContext.ensureMdc();
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, String.valueOf(session.getSessionId()));

        log.info("Deducting {} hours for {} student(s)", requiredHours, session.getStudentIds().size());

        try {
            List<HourConsumption> created = validateThenDeduct(session, requiredHours, null);

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordDeduction("success");
            ledgerMetrics.recordLatency("deduct", duration);
            log.info("Hours deducted: records={}, hoursEach={}, duration={}ms",
                    created.size(), requiredHours, duration);
            return created;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordDeduction("rejected");
            ledgerMetrics.recordLatency("deduct", duration);
            log.warn("Hour deduction rejected: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
            CorrelationContext.clearMdc(correlationAdded);
        }
    }

    /**
     * Refunds every non-refunded consumption record of the session in full.
     *
     * @return summary of what was refunded; an empty summary if nothing was billed
     */
    @Transactional
    public RefundSummary refundForCancellation(SessionDescriptor session, String reason) {
        UUID sessionId = session.getSessionId();
        long startTime = System.currentTimeMillis();
        boolean correlationAdded = CorrelationContext.ensureMdc();
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, String.valueOf(sessionId));

        try {
            List<HourConsumptionEntity> active = consumptionRepository.findActiveBySessionForUpdate(sessionId);
            if (active.isEmpty()) {
                log.info("No billed hours to refund for session");
                ledgerMetrics.recordRefund("cancellation", "nothing_to_refund");
                return RefundSummary.empty(sessionId);
            }

            Map<UUID, StudentBalanceEntity> balances = balanceService.lockBalances(studentsOf(active));

            RefundSummary.RefundSummaryBuilder summary = RefundSummary.builder().sessionId(sessionId);
            BigDecimal total = Hours.ZERO;
            for (HourConsumptionEntity consumption : active) {
                BigDecimal hours = consumption.refundAll(reason);
                StudentBalanceEntity balance = balances.get(consumption.getStudentId());
                balance.restore(hours);

                consumptionRepository.save(consumption);
                balanceService.save(balance);

                total = total.add(hours);
                summary.studentRefund(new RefundSummary.StudentRefund(
                        consumption.getStudentId(), consumption.getId(), hours));
                log.debug("Refunded {} hours to student {} from consumption {}",
                        hours, consumption.getStudentId(), consumption.getId());
            }

            RefundSummary result = summary
                    .refundedCount(active.size())
                    .totalHoursRefunded(Hours.normalize(total))
                    .build();

            long duration = System.currentTimeMillis() - startTime;
            ledgerMetrics.recordRefund("cancellation", "success");
            ledgerMetrics.recordHoursRefunded(result.getTotalHoursRefunded());
            ledgerMetrics.recordLatency("refund", duration);
            log.info("Session refunded: records={}, totalHours={}, reason={}, duration={}ms",
                    result.getRefundedCount(), result.getTotalHoursRefunded(), reason, duration);
            return result;

        } catch (RuntimeException e) {
            ledgerMetrics.recordRefund("cancellation", "error");
            log.error("Session refund failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
            CorrelationContext.clearMdc(correlationAdded);
        }
    }

    /**
     * Charges every enrolled student extra hours when a session ran longer than booked.
     * Validation and FIFO selection are the same as for the original booking.
     *
     * @return the new consumption records; empty when {@code extraHours} is not positive
     */
    @Transactional
    public List<HourConsumption> deductAdditionalHours(SessionDescriptor session, BigDecimal extraHours, String reason) {
        BigDecimal hours = Hours.normalize(extraHours);
        if (!Hours.isPositive(hours) || !session.hasStudents()) {
            return List.of();
        }
        boolean correlationAdded = CorrelationContext.ensureMdc();
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, String.valueOf(session.getSessionId()));

        try {
            List<HourConsumption> created = validateThenDeduct(session, hours, "Additional hours: " + reason);
            ledgerMetrics.recordDeduction("additional");
            log.info("Deducted additional {} hours from {} student(s): {}", hours, created.size(), reason);
            return created;
        } catch (RuntimeException e) {
            ledgerMetrics.recordDeduction("additional_rejected");
            log.warn("Additional hour deduction rejected: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
            CorrelationContext.clearMdc(correlationAdded);
        }
    }

    /**
     * Gives back hours when a session ran shorter than booked.
     *
     * Walks the session's non-refunded records oldest first and takes back
     * {@code excessHours} in total, as much as each record holds, until the excess is used
     * up. A record that reaches zero billed hours is marked refunded.
     *
     * @return the records that changed; empty when {@code excessHours} is not positive
     */
    @Transactional
    public List<HourConsumption> refundExcessHours(SessionDescriptor session, BigDecimal excessHours, String reason) {
        BigDecimal hours = Hours.normalize(excessHours);
        if (!Hours.isPositive(hours)) {
            return List.of();
        }
        boolean correlationAdded = CorrelationContext.ensureMdc();
        MDC.put(CorrelationContext.SESSION_ID_MDC_KEY, String.valueOf(session.getSessionId()));

        try {
            List<HourConsumptionEntity> active = consumptionRepository.findActiveBySessionForUpdate(session.getSessionId());
            if (active.isEmpty()) {
                log.info("No billed hours to partially refund for session");
                return List.of();
            }

            Map<UUID, StudentBalanceEntity> balances = balanceService.lockBalances(studentsOf(active));

            String refundReason = "Partial refund: " + reason;
            List<HourConsumption> updated = new ArrayList<>();
            BigDecimal outstanding = hours;
            for (HourConsumptionEntity consumption : active) {
                if (outstanding.signum() <= 0) {
                    break;
                }
                BigDecimal refund = Hours.min(outstanding, consumption.getHoursConsumed());
                if (refund.signum() <= 0) {
                    continue;
                }
                StudentBalanceEntity balance = balances.get(consumption.getStudentId());
                consumption.refundPartially(refund, refundReason);
                balance.restore(refund);
                consumptionRepository.save(consumption);
                balanceService.save(balance);
                outstanding = outstanding.subtract(refund);
                updated.add(consumption.toDomain());
                log.debug("Refunded {} excess hours to student {} from consumption {}",
                        refund, consumption.getStudentId(), consumption.getId());
            }
            BigDecimal total = Hours.normalize(hours.subtract(outstanding));

            ledgerMetrics.recordRefund("excess", "success");
            ledgerMetrics.recordHoursRefunded(total);
            log.info("Refunded excess hours: records={}, totalHours={}, reason={}", updated.size(), total, reason);
            return updated;

        } catch (RuntimeException e) {
            ledgerMetrics.recordRefund("excess", "error");
            log.error("Excess hour refund failed: error={}", e.getMessage());
            throw e;
        } finally {
            MDC.remove(CorrelationContext.SESSION_ID_MDC_KEY);
            CorrelationContext.clearMdc(correlationAdded);
        }
    }

    /**
     * Pre-flight check for the booking screen. Never throws: a duration that is not
     * positive comes back as ineligible with {@link BookingEligibility#INVALID_DURATION},
     * internal failures as ineligible with a reason describing the error.
     *
     * Not transactional: a failed query would mark the transaction rollback-only and the
     * caught error would resurface as a commit failure.
     */
    public BookingEligibility checkBookingEligibility(UUID studentId, BigDecimal durationHours) {
        MDC.put(CorrelationContext.STUDENT_ID_MDC_KEY, String.valueOf(studentId));
        try {
            if (studentId == null) {
                throw new IllegalArgumentException("Student ID is required");
            }
            BigDecimal required = Hours.normalize(durationHours);
            if (!Hours.isPositive(required)) {
                ledgerMetrics.recordEligibilityCheck(false);
                return BookingEligibility.invalidDuration(studentId, durationHours);
            }
            BigDecimal remaining = balanceService.getBalance(studentId).getRemainingHours();
            int activePackageCount = packageRepository.findEligiblePackages(studentId, Instant.now()).size();

            boolean hasActivePackages = activePackageCount > 0;
            boolean enoughHours = remaining.compareTo(required) >= 0;
            boolean eligible = enoughHours && hasActivePackages;

            String reason = null;
            if (!eligible) {
                if (!hasActivePackages) {
                    reason = BookingEligibility.NO_ACTIVE_PACKAGES;
                } else if (!enoughHours) {
                    reason = BookingEligibility.insufficientHours(required, remaining);
                } else {
                    reason = BookingEligibility.UNKNOWN;
                }
            }

            ledgerMetrics.recordEligibilityCheck(eligible);
            return BookingEligibility.builder()
                    .studentId(studentId)
                    .eligible(eligible)
                    .hoursRequired(required)
                    .hoursAvailable(remaining)
                    .remainingAfterBooking(enoughHours ? remaining.subtract(required) : remaining)
                    .hasActivePackages(hasActivePackages)
                    .activePackageCount(activePackageCount)
                    .reason(reason)
                    .build();

        } catch (Exception e) {
            log.error("Error checking booking eligibility for student {}: {}", studentId, e.getMessage());
            ledgerMetrics.recordEligibilityCheck(false);
            return BookingEligibility.error(studentId, durationHours, e);
        } finally {
            MDC.remove(CorrelationContext.STUDENT_ID_MDC_KEY);
        }
    }

    /**
     * All non-refunded hours currently billed for a session.
     */
    @Transactional(readOnly = true)
    public BigDecimal getBilledHours(UUID sessionId) {
        return Hours.normalize(consumptionRepository.sumActiveHoursBySession(sessionId));
    }

    @Transactional(readOnly = true)
    public List<HourConsumption> getConsumptionsForSession(UUID sessionId) {
        return consumptionRepository.findBySessionIdOrderByConsumedAtAsc(sessionId).stream()
                .map(HourConsumptionEntity::toDomain)
                .toList();
    }

    /**
     * Locks all balances, validates every student, then charges every student.
     * Runs inside the caller's transaction.
     */
    private List<HourConsumption> validateThenDeduct(SessionDescriptor session, BigDecimal hours, String reason) {
        Set<UUID> studentIds = new LinkedHashSet<>(session.getStudentIds());
        Map<UUID, StudentBalanceEntity> balances = balanceService.lockBalances(studentIds);
        Instant now = Instant.now();

        Map<UUID, HourPackageEntity> sourcePackages = new HashMap<>();
        for (UUID studentId : studentIds) {
            sourcePackages.put(studentId, validateStudent(balances.get(studentId), hours, now));
        }

        List<HourConsumption> created = new ArrayList<>(studentIds.size());
        for (UUID studentId : studentIds) {
            StudentBalanceEntity balance = balances.get(studentId);
            HourPackageEntity source = sourcePackages.get(studentId);

            HourConsumptionEntity consumption = HourConsumptionEntity.record(
                    balance, session.getSessionId(), source.getId(), hours, reason);
            balance.consume(hours);

            HourConsumptionEntity saved = consumptionRepository.save(consumption);
            balanceService.save(balance);
            ledgerMetrics.recordHoursDeducted(hours);

            log.debug("Charged student {} {} hours from package {}, remaining={}",
                    studentId, hours, source.getId(), balance.getRemainingHours());
            created.add(saved.toDomain());
        }
        return created;
    }

    /**
     * @return the oldest eligible package, which the deduction draws from
     */
    private HourPackageEntity validateStudent(StudentBalanceEntity balance, BigDecimal required, Instant now) {
        UUID studentId = balance.getStudentId();
        BigDecimal remaining = balance.getRemainingHours();
        if (remaining.compareTo(required) < 0) {
            throw InsufficientBalanceException.shortfall(studentId, required, remaining);
        }

        List<HourPackageEntity> eligible = packageRepository.findEligiblePackages(studentId, now);
        if (eligible.isEmpty()) {
            if (packageRepository.countByStudentIdAndStatus(studentId, PackageStatus.COMPLETED) > 0) {
                throw new PackageExpiredException(studentId);
            }
            throw InsufficientBalanceException.noPackages(studentId, required, remaining);
        }
        return eligible.get(0);
    }

    private static BigDecimal requirePositiveDuration(BigDecimal durationHours) {
        BigDecimal normalized = Hours.normalize(durationHours);
        if (!Hours.isPositive(normalized)) {
            throw new InvalidDurationException(durationHours);
        }
        return normalized;
    }

    private static Set<UUID> studentsOf(List<HourConsumptionEntity> consumptions) {
        return consumptions.stream()
                .map(HourConsumptionEntity::getStudentId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
