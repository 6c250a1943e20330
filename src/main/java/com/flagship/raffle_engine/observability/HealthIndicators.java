package com.flagship.raffle_engine.observability;

import com.flagship.raffle_engine.raffle.RaffleRepository;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Actuator health indicators for the raffle engine.
 */
public class HealthIndicators {

    /**
     * Unhealthy when too many events wait to be published. Reads the cached
     * backlog so it costs no query.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxMetrics outboxMetrics;

        public OutboxHealthIndicator(OutboxMetrics outboxMetrics) {
            this.outboxMetrics = outboxMetrics;
        }

        @Override
        public Health health() {
            long backlogSize = outboxMetrics.getBacklogSize();
            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();
            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Warns when ended raffles are waiting for a draw, or when a raffle is
     * stuck in DRAWING (draws roll back on failure, so this should stay 0).
     */
    @Component("drawBacklogHealth")
    public static class DrawBacklogHealthIndicator implements HealthIndicator {

        private final RaffleRepository raffleRepository;
        private final Clock clock;

        public DrawBacklogHealthIndicator(RaffleRepository raffleRepository, Clock clock) {
            this.raffleRepository = raffleRepository;
            this.clock = clock;
        }

        @Override
        public Health health() {
            try {
                long awaitingDraw = raffleRepository
                        .findByStatusAndEndTimeLessThanEqualOrderByEndTimeAsc(RaffleStatus.ENDING, clock.instant())
                        .size();
                long drawing = raffleRepository.countByStatus(RaffleStatus.DRAWING);

                Health.Builder builder = drawing > 0 ? Health.status("WARNING") : Health.up();
                return builder
                        .withDetail("awaitingDraw", awaitingDraw)
                        .withDetail("drawing", drawing)
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Redis backs the entry idempotency fast path only; entries fall back to
     * the payment_reference lookup when it is down.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private static final String FALLBACK_NOTE = "Entry dedup falls back to the database";

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
            try {
                var connectionFactory = template.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.status("DEGRADED")
                            .withDetail("error", "No connection factory configured")
                            .withDetail("note", FALLBACK_NOTE)
                            .build();
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : Health.down().withDetail("response", result != null ? result : "null").build();
                }
            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", FALLBACK_NOTE)
                        .build();
            }
        }
    }

    @Component("kafkaHealth")
    public static class KafkaHealthIndicator implements HealthIndicator {

        private final KafkaTemplate<String, String> kafkaTemplate;

        public KafkaHealthIndicator(KafkaTemplate<String, String> kafkaTemplate) {
            this.kafkaTemplate = kafkaTemplate;
        }

        @Override
        public Health health() {
            try {
                var metrics = kafkaTemplate.metrics();
                if (metrics == null || metrics.isEmpty()) {
                    return Health.down()
                            .withDetail("error", "No Kafka connections established")
                            .build();
                }
                return Health.up()
                        .withDetail("metricsCount", metrics.size())
                        .build();
            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
