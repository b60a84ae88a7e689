package com.flagship.hour_ledger.session;

import com.flagship.hour_ledger.config.LedgerProperties;
import com.flagship.hour_ledger.ledger.HourConsumption;
import com.flagship.hour_ledger.ledger.HourDeductionService;
import com.flagship.hour_ledger.ledger.Hours;
import com.flagship.hour_ledger.ledger.RefundSummary;
import com.flagship.hour_ledger.ledger.SessionDescriptor;
import com.flagship.hour_ledger.ledger.SessionStatus;
import com.flagship.hour_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Applies session status rules before moving hours in the ledger.
 *
 * Rules:
 * - Only SCHEDULED sessions are charged when booked
 * - CANCELLED and COMPLETED sessions cannot be cancelled
 * - Only COMPLETED sessions can have their duration adjusted
 * - Trial sessions never move hours
 *
 * Not transactional itself: each ledger call is its own transaction, so a rejected
 * duration adjustment rolls back cleanly and is reported instead of thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionHourService {

    static final String TRIAL_NOTE = "Trial sessions don't affect hour consumption";

    private final HourDeductionService deductionService;
    private final LedgerProperties properties;
    private final LedgerMetrics ledgerMetrics;

    /**
     * Charges the enrolled students for a newly booked session.
     *
     * @return the consumption records; empty when the session is not SCHEDULED or is a trial
     */
    public List<HourConsumption> chargeBookedSession(SessionDescriptor session) {
        if (session.getStatus() != SessionStatus.SCHEDULED) {
            log.info("Session {} is {}, not charging", session.getSessionId(), session.getStatus());
            return List.of();
        }
        return deductionService.validateAndDeduct(session);
    }

    /**
     * Refunds a session that is being cancelled.
     *
     * @throws IllegalStateException if the session is already cancelled or completed
     */
    public RefundSummary cancelSession(SessionDescriptor session, String reason) {
        if (session.getStatus() == SessionStatus.CANCELLED) {
            throw new IllegalStateException("Session " + session.getSessionId() + " is already cancelled");
        }
        if (session.getStatus() == SessionStatus.COMPLETED) {
            throw new IllegalStateException("Cannot cancel completed session " + session.getSessionId());
        }
        if (session.isTrial()) {
            log.info("Trial session {} cancelled, nothing to refund", session.getSessionId());
            return RefundSummary.empty(session.getSessionId());
        }

        String refundReason = reason == null || reason.isBlank()
                ? "Session cancelled"
                : "Session cancelled: " + reason;
        RefundSummary summary = deductionService.refundForCancellation(session, refundReason);
        log.info("Session {} cancelled: {} hours refunded to {} record(s)",
                session.getSessionId(), summary.getTotalHoursRefunded(), summary.getRefundedCount());
        return summary;
    }

    /**
     * Charges or refunds the difference between booked and actual duration of a completed
     * session. Differences below the configured threshold are ignored.
     *
     * @throws IllegalStateException if the session is not COMPLETED
     * @throws IllegalArgumentException if the actual duration is missing or negative
     */
    public DurationAdjustment adjustSessionDuration(SessionDescriptor session, BigDecimal actualHours, String reason) {
        if (session.getStatus() != SessionStatus.COMPLETED) {
            throw new IllegalStateException("Can only adjust duration for completed sessions, session "
                    + session.getSessionId() + " is " + session.getStatus());
        }
        if (actualHours == null || actualHours.signum() < 0) {
            throw new IllegalArgumentException("Actual duration must not be negative, got " + actualHours);
        }

        BigDecimal original = Hours.normalize(session.getDurationHours());
        BigDecimal actual = Hours.normalize(actualHours);
        DurationAdjustment.DurationAdjustmentBuilder adjustment = DurationAdjustment.builder()
                .sessionId(session.getSessionId())
                .originalDuration(original)
                .actualDuration(actual);

        if (session.isTrial()) {
            ledgerMetrics.recordAdjustment("trial");
            return adjustment
                    .durationDifference(Hours.ZERO)
                    .note(TRIAL_NOTE)
                    .build();
        }

        BigDecimal difference = actual.subtract(original);
        adjustment.durationDifference(difference);

        if (difference.abs().compareTo(properties.getAdjustmentThreshold()) < 0) {
            log.info("Session {} duration changed by {} hours, below threshold {}",
                    session.getSessionId(), difference, properties.getAdjustmentThreshold());
            ledgerMetrics.recordAdjustment("below_threshold");
            return adjustment.build();
        }

        String adjustmentReason = "Duration adjustment: " + (reason == null ? "" : reason);
        AdjustmentType type = difference.signum() > 0
                ? AdjustmentType.ADDITIONAL_DEDUCTION
                : AdjustmentType.PARTIAL_REFUND;
        adjustment.adjustmentType(type);

        try {
            List<HourConsumption> records = type == AdjustmentType.ADDITIONAL_DEDUCTION
                    ? deductionService.deductAdditionalHours(session, difference, adjustmentReason)
                    : deductionService.refundExcessHours(session, difference.negate(), adjustmentReason);

            ledgerMetrics.recordAdjustment(type.name().toLowerCase());
            log.info("Session {} duration adjusted from {} to {} hours: {} record(s) changed",
                    session.getSessionId(), original, actual, records.size());
            return adjustment
                    .adjustmentApplied(true)
                    .adjustmentRecords(records)
                    .build();

        } catch (RuntimeException e) {
            log.error("Failed to process duration adjustment for session {}: {}", session.getSessionId(), e.getMessage());
            ledgerMetrics.recordAdjustment("error");
            return adjustment
                    .adjustmentError(e.getMessage())
                    .build();
        }
    }
}
