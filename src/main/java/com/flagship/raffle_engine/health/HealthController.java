package com.flagship.raffle_engine.health;

import com.flagship.raffle_engine.observability.HealthIndicators;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated probe for load balancers and orchestrators.
 *
 * Only the database decides liveness: every raffle, entry and payout lives
 * there. The idempotency cache is reported but a Redis outage only degrades
 * duplicate detection to the database path, so it never fails the probe.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final HealthIndicators.RedisHealthIndicator cacheHealth;
    private final Clock clock;

    @Value("${spring.application.name:raffle-engine}")
    private String serviceName;

    public HealthController(DataSource dataSource, HealthIndicators.RedisHealthIndicator cacheHealth, Clock clock) {
        this.dataSource = dataSource;
        this.cacheHealth = cacheHealth;
        this.clock = clock;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean databaseUp = databaseReachable();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("service", serviceName);
        body.put("timestamp", clock.instant().toString());
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("idempotencyCache", cacheHealth.health().getStatus().getCode());

        return databaseUp
                ? ResponseEntity.ok(body)
                : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database probe failed: {}", e.getMessage());
            return false;
        }
    }
}
