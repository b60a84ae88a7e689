package com.flagship.hour_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of refunding a cancelled session. An empty summary is a normal result when the
 * session had nothing billed.
 */
@Value
@Builder
public class RefundSummary {
    UUID sessionId;
    int refundedCount;
    BigDecimal totalHoursRefunded;
    @Singular
    List<StudentRefund> studentRefunds;

    public static RefundSummary empty(UUID sessionId) {
        return RefundSummary.builder()
            .sessionId(sessionId)
            .refundedCount(0)
            .totalHoursRefunded(Hours.ZERO)
            .build();
    }

    public boolean isEmpty() {
        return refundedCount == 0;
    }

    @Value
    public static class StudentRefund {
        UUID studentId;
        UUID consumptionId;
        BigDecimal hoursRefunded;
    }
}
