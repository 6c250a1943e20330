package com.flagship.raffle_engine.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the raffle engine.
 *
 * Metrics exposed:
 * - raffles.created{type}
 * - raffles.transitions{from,to}
 * - entries.submitted{result}, entries.tickets
 * - idempotency.cache{result}
 * - draws.completed, draws.winners, draw.duration
 * - payouts.recorded{outcome}
 * - engine.rejections{operation,code}
 * - engine.latency{operation}
 * - raffles.open, payouts.outstanding (gauges, refreshed by {@link MetricsScheduler})
 */
@Component
public class RaffleMetrics {

    private final MeterRegistry registry;
    private final Timer drawTimer;
    private final AtomicLong openRaffles = new AtomicLong(0);
    private final AtomicLong outstandingPayouts = new AtomicLong(0);

    public RaffleMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.drawTimer = Timer.builder("draw.duration")
                .description("Time taken to run a draw, from seed to committed winners")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        Gauge.builder("raffles.open", openRaffles, AtomicLong::get)
                .description("Raffles accepting entries (ACTIVE or ENDING)")
                .register(registry);
        Gauge.builder("payouts.outstanding", outstandingPayouts, AtomicLong::get)
                .description("Payouts not yet paid (PENDING, PROCESSING or FAILED)")
                .register(registry);
    }

    public void updateLifecycleGauges(long open, long outstanding) {
        openRaffles.set(open);
        outstandingPayouts.set(outstanding);
    }

    public void recordRaffleCreated(String type) {
        registry.counter("raffles.created", "type", sanitizeTag(type)).increment();
    }

    public void recordTransition(String from, String to) {
        registry.counter("raffles.transitions", "from", sanitizeTag(from), "to", sanitizeTag(to)).increment();
    }

    public void recordEntryAccepted(int tickets) {
        registry.counter("entries.submitted", "result", "accepted").increment();
        registry.counter("entries.tickets").increment(tickets);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    public void recordDrawCompleted(int winners, Duration duration) {
        registry.counter("draws.completed").increment();
        registry.counter("draws.winners").increment(winners);
        drawTimer.record(duration);
    }

    public void recordPayoutAttempt(boolean success) {
        registry.counter("payouts.recorded", "outcome", success ? "paid" : "failed").increment();
    }

    public void recordRejection(String operation, String code) {
        registry.counter("engine.rejections",
                "operation", sanitizeTag(operation),
                "code", sanitizeTag(code)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("engine.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
