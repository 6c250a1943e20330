package com.flagship.raffle_engine.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Thread-local correlation id plus the MDC keys used across the engine.
 *
 * HTTP requests take the id from the X-Correlation-ID header or get a fresh
 * one. Scheduler sweeps open their own with {@link #beginSweep()}, prefixed
 * so sweep log lines are easy to tell from request log lines.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String RAFFLE_ID_MDC_KEY = "raffleId";
    public static final String PAYOUT_ID_MDC_KEY = "payoutId";

    private static final String SWEEP_PREFIX = "sweep-";
    // caller-supplied ids end up in every log line
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    /**
     * Adopts a caller-supplied id, or generates one when it is missing or
     * not a plain token.
     */
    public static void setCorrelationId(String id) {
        if (id != null && ACCEPTED_ID.matcher(id).matches()) {
            correlationId.set(id);
        } else {
            correlationId.set(generateCorrelationId());
        }
    }

    public static String beginSweep() {
        String id = SWEEP_PREFIX + generateCorrelationId();
        correlationId.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    /**
     * Drops the thread's id and every engine MDC key.
     */
    public static void clear() {
        correlationId.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(RAFFLE_ID_MDC_KEY);
        MDC.remove(PAYOUT_ID_MDC_KEY);
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
