package com.flagship.hour_ledger.session;

import com.flagship.hour_ledger.config.LedgerProperties;
import com.flagship.hour_ledger.ledger.HourConsumption;
import com.flagship.hour_ledger.ledger.HourDeductionService;
import com.flagship.hour_ledger.ledger.RefundSummary;
import com.flagship.hour_ledger.ledger.SessionDescriptor;
import com.flagship.hour_ledger.ledger.SessionStatus;
import com.flagship.hour_ledger.ledger.exception.InsufficientBalanceException;
import com.flagship.hour_ledger.observability.LedgerMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SessionHourServiceTest {

    @Mock
    private HourDeductionService deductionService;

    private LedgerProperties properties;
    private SessionHourService service;

    @BeforeEach
    void setUp() {
        properties = new LedgerProperties();
        service = new SessionHourService(deductionService, properties, new LedgerMetrics(new SimpleMeterRegistry()));
    }

    private SessionDescriptor session(SessionStatus status, String hours) {
        return SessionDescriptor.builder()
                .sessionId(UUID.randomUUID())
                .durationHours(new BigDecimal(hours))
                .status(status)
                .studentId(UUID.randomUUID())
                .build();
    }

    private HourConsumption consumption(SessionDescriptor session, String hours) {
        return new HourConsumption(UUID.randomUUID(), UUID.randomUUID(), session.getStudentIds().get(0),
                session.getSessionId(), UUID.randomUUID(), new BigDecimal(hours), new BigDecimal(hours),
                false, null, Instant.now());
    }

    @Nested
    @DisplayName("Booking")
    class BookingTests {

        @Test
        @DisplayName("Scheduled sessions are charged")
        void testChargeScheduledSession() {
            SessionDescriptor scheduled = session(SessionStatus.SCHEDULED, "2");
            List<HourConsumption> charged = List.of(consumption(scheduled, "2"));
            when(deductionService.validateAndDeduct(scheduled)).thenReturn(charged);

            assertEquals(charged, service.chargeBookedSession(scheduled));
        }

        @Test
        @DisplayName("Sessions in any other status are not charged")
        void testOtherStatusesAreNotCharged() {
            assertTrue(service.chargeBookedSession(session(SessionStatus.COMPLETED, "2")).isEmpty());
            assertTrue(service.chargeBookedSession(session(SessionStatus.CANCELLED, "2")).isEmpty());
            verifyNoInteractions(deductionService);
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("Cancelled and completed sessions cannot be cancelled")
        void testInvalidStatuses() {
            assertThrows(IllegalStateException.class,
                    () -> service.cancelSession(session(SessionStatus.CANCELLED, "2"), "again"));
            assertThrows(IllegalStateException.class,
                    () -> service.cancelSession(session(SessionStatus.COMPLETED, "2"), "too late"));
            verifyNoInteractions(deductionService);
        }

        @Test
        @DisplayName("Trial cancellation refunds nothing")
        void testTrialCancellation() {
            SessionDescriptor trial = session(SessionStatus.SCHEDULED, "1").toBuilder().trial(true).build();

            RefundSummary summary = service.cancelSession(trial, "changed plans");

            assertTrue(summary.isEmpty());
            assertEquals(trial.getSessionId(), summary.getSessionId());
            verifyNoInteractions(deductionService);
        }

        @Test
        @DisplayName("Refund reason carries the cancellation reason")
        void testRefundReason() {
            SessionDescriptor scheduled = session(SessionStatus.SCHEDULED, "2");
            RefundSummary refunded = RefundSummary.builder()
                    .sessionId(scheduled.getSessionId())
                    .refundedCount(1)
                    .totalHoursRefunded(new BigDecimal("2.00"))
                    .build();
            when(deductionService.refundForCancellation(scheduled, "Session cancelled: student ill")).thenReturn(refunded);

            assertEquals(refunded, service.cancelSession(scheduled, "student ill"));
        }

        @Test
        @DisplayName("No-show sessions can still be cancelled")
        void testNoShowCancellation() {
            SessionDescriptor noShow = session(SessionStatus.NO_SHOW, "1");
            when(deductionService.refundForCancellation(noShow, "Session cancelled"))
                    .thenReturn(RefundSummary.empty(noShow.getSessionId()));

            assertTrue(service.cancelSession(noShow, null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Duration adjustment")
    class AdjustmentTests {

        @Test
        @DisplayName("Only completed sessions can be adjusted")
        void testRequiresCompletedSession() {
            assertThrows(IllegalStateException.class,
                    () -> service.adjustSessionDuration(session(SessionStatus.SCHEDULED, "2"), new BigDecimal("3"), "x"));
            assertThrows(IllegalArgumentException.class,
                    () -> service.adjustSessionDuration(session(SessionStatus.COMPLETED, "2"), new BigDecimal("-1"), "x"));
            verifyNoInteractions(deductionService);
        }

        @Test
        @DisplayName("Trial sessions never adjust hours")
        void testTrialNeverAdjusts() {
            SessionDescriptor trial = session(SessionStatus.COMPLETED, "1").toBuilder().trial(true).build();

            DurationAdjustment adjustment = service.adjustSessionDuration(trial, new BigDecimal("2"), "long trial");

            assertFalse(adjustment.isAdjustmentApplied());
            assertEquals(AdjustmentType.NONE, adjustment.getAdjustmentType());
            assertEquals(SessionHourService.TRIAL_NOTE, adjustment.getNote());
            verifyNoInteractions(deductionService);
        }

        @Test
        @DisplayName("A change of 0.05 hours is below the threshold")
        void testBelowThreshold() {
            SessionDescriptor completed = session(SessionStatus.COMPLETED, "2");

            DurationAdjustment adjustment = service.adjustSessionDuration(completed, new BigDecimal("2.05"), "rounding");

            assertFalse(adjustment.isAdjustmentApplied());
            assertEquals(AdjustmentType.NONE, adjustment.getAdjustmentType());
            assertEquals(new BigDecimal("0.05"), adjustment.getDurationDifference());
            verifyNoInteractions(deductionService);
        }

        @Test
        @DisplayName("A change of exactly the threshold is applied")
        void testAtThreshold() {
            SessionDescriptor completed = session(SessionStatus.COMPLETED, "2");
            when(deductionService.deductAdditionalHours(eq(completed), eq(new BigDecimal("0.10")), anyString()))
                    .thenReturn(List.of(consumption(completed, "0.10")));

            assertTrue(service.adjustSessionDuration(completed, new BigDecimal("2.1"), "ran over").isAdjustmentApplied());
        }

        @Test
        @DisplayName("Longer session deducts the extra 0.5 hours")
        void testLongerSession() {
            SessionDescriptor completed = session(SessionStatus.COMPLETED, "3");
            List<HourConsumption> extra = List.of(consumption(completed, "0.50"));
            when(deductionService.deductAdditionalHours(completed, new BigDecimal("0.50"), "Duration adjustment: ran over"))
                    .thenReturn(extra);

            DurationAdjustment adjustment = service.adjustSessionDuration(completed, new BigDecimal("3.5"), "ran over");

            assertTrue(adjustment.isAdjustmentApplied());
            assertEquals(AdjustmentType.ADDITIONAL_DEDUCTION, adjustment.getAdjustmentType());
            assertEquals(new BigDecimal("0.50"), adjustment.getDurationDifference());
            assertEquals(extra, adjustment.getAdjustmentRecords());
            assertFalse(adjustment.hasError());
            verify(deductionService, never()).refundExcessHours(any(), any(), anyString());
        }

        @Test
        @DisplayName("Shorter session refunds the excess hours")
        void testShorterSession() {
            SessionDescriptor completed = session(SessionStatus.COMPLETED, "2");
            when(deductionService.refundExcessHours(completed, new BigDecimal("0.50"), "Duration adjustment: ended early"))
                    .thenReturn(List.of(consumption(completed, "1.50")));

            DurationAdjustment adjustment = service.adjustSessionDuration(completed, new BigDecimal("1.5"), "ended early");

            assertTrue(adjustment.isAdjustmentApplied());
            assertEquals(AdjustmentType.PARTIAL_REFUND, adjustment.getAdjustmentType());
            assertEquals(new BigDecimal("-0.50"), adjustment.getDurationDifference());
        }

        @Test
        @DisplayName("Ledger rejection is reported, not thrown")
        void testLedgerRejectionIsReported() {
            SessionDescriptor completed = session(SessionStatus.COMPLETED, "2");
            UUID studentId = completed.getStudentIds().get(0);
            when(deductionService.deductAdditionalHours(eq(completed), eq(new BigDecimal("1.00")), anyString()))
                    .thenThrow(InsufficientBalanceException.shortfall(studentId, new BigDecimal("1.00"), new BigDecimal("0.25")));

            DurationAdjustment adjustment = assertDoesNotThrow(
                    () -> service.adjustSessionDuration(completed, new BigDecimal("3"), "ran over"));

            assertFalse(adjustment.isAdjustmentApplied());
            assertTrue(adjustment.hasError());
            assertTrue(adjustment.getAdjustmentError().contains("required 1.00 hours, available 0.25 hours"));
            assertTrue(adjustment.getAdjustmentRecords().isEmpty());
        }

        @Test
        @DisplayName("Threshold follows configuration")
        void testConfiguredThreshold() {
            properties.setAdjustmentThreshold(new BigDecimal("0.25"));
            SessionDescriptor completed = session(SessionStatus.COMPLETED, "2");

            DurationAdjustment adjustment = service.adjustSessionDuration(completed, new BigDecimal("2.2"), "slightly over");

            assertFalse(adjustment.isAdjustmentApplied());
            verifyNoInteractions(deductionService);
        }
    }
}
