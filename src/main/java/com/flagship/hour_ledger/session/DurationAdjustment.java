package com.flagship.hour_ledger.session;

import com.flagship.hour_ledger.ledger.HourConsumption;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * What happened to a completed session's billed hours after its actual duration was
 * recorded. When the ledger rejected the adjustment, {@code adjustmentApplied} is false
 * and {@code adjustmentError} holds the reason.
 */
@Value
@Builder
public class DurationAdjustment {
    UUID sessionId;
    BigDecimal originalDuration;
    BigDecimal actualDuration;
    BigDecimal durationDifference;
    boolean adjustmentApplied;
    @Builder.Default
    AdjustmentType adjustmentType = AdjustmentType.NONE;
    @Singular
    List<HourConsumption> adjustmentRecords;
    String note;
    String adjustmentError;

    public boolean hasError() {
        return adjustmentError != null;
    }
}
