package com.flagship.hour_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Thread-local correlation id plus the MDC keys used by ledger log statements.
 *
 * The ledger runs in-process inside the caller's thread, so a caller that already put a
 * correlation id in the MDC keeps it; otherwise the ledger adds one for the duration of
 * the operation.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String SESSION_ID_MDC_KEY = "sessionId";
    public static final String STUDENT_ID_MDC_KEY = "studentId";
    public static final String PACKAGE_ID_MDC_KEY = "packageId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
        // Utility class
    }

    /**
     * Gets the current correlation ID, or generates a new one if not set.
     */
    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Adopts a caller-supplied correlation id, e.g. the id of the request that booked the
     * session. Blank ids are replaced by a generated one.
     */
    public static void setCorrelationId(String id) {
        if (id != null && !id.isBlank()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    /**
     * Puts the correlation id in the MDC unless one is already there.
     *
     * @return true if this call added it, in which case the caller removes it with
     *         {@link #clearMdc(boolean)}
     */
    public static boolean ensureMdc() {
        if (MDC.get(CORRELATION_ID_MDC_KEY) != null) {
            return false;
        }
        MDC.put(CORRELATION_ID_MDC_KEY, getCorrelationId());
        return true;
    }

    public static void clearMdc(boolean added) {
        if (added) {
            MDC.remove(CORRELATION_ID_MDC_KEY);
            clear();
        }
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short format for readability in logs.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
