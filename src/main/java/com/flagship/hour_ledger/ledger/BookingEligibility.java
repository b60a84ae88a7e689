package com.flagship.hour_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Answer to "can this student book a session of this length right now?".
 * {@code reason} is null when the booking is possible.
 */
@Value
@Builder
public class BookingEligibility {

    public static final String NO_ACTIVE_PACKAGES = "No active tutoring packages";
    public static final String UNKNOWN = "Unknown eligibility issue";
    public static final String INVALID_DURATION = "Invalid duration";

    UUID studentId;
    boolean eligible;
    BigDecimal hoursRequired;
    BigDecimal hoursAvailable;
    BigDecimal remainingAfterBooking;
    boolean hasActivePackages;
    int activePackageCount;
    String reason;

    static String insufficientHours(BigDecimal required, BigDecimal available) {
        return String.format("Insufficient hours (need %s, have %s)", required, available);
    }

    static BookingEligibility invalidDuration(UUID studentId, BigDecimal durationHours) {
        return BookingEligibility.builder()
            .studentId(studentId)
            .eligible(false)
            .hoursRequired(durationHours)
            .hoursAvailable(Hours.ZERO)
            .remainingAfterBooking(Hours.ZERO)
            .hasActivePackages(false)
            .activePackageCount(0)
            .reason(INVALID_DURATION)
            .build();
    }

    static BookingEligibility error(UUID studentId, BigDecimal hoursRequired, Exception cause) {
        return BookingEligibility.builder()
            .studentId(studentId)
            .eligible(false)
            .hoursRequired(hoursRequired)
            .hoursAvailable(Hours.ZERO)
            .remainingAfterBooking(Hours.ZERO)
            .hasActivePackages(false)
            .activePackageCount(0)
            .reason("Error checking eligibility: " + cause.getMessage())
            .build();
    }
}
