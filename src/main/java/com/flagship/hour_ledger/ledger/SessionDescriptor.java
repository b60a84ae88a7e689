package com.flagship.hour_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

/**
 * What the ledger needs to know about a tutoring session: its identity, booked
 * duration in hours, whether it is a free trial, its status and the enrolled students.
 */
@Value
@Builder(toBuilder = true)
public class SessionDescriptor {
    UUID sessionId;
    BigDecimal durationHours;
    boolean trial;
    @Builder.Default
    SessionStatus status = SessionStatus.SCHEDULED;
    @Singular
    List<UUID> studentIds;

    public boolean hasStudents() {
        return studentIds != null && !studentIds.isEmpty();
    }
}
