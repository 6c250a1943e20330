package com.flagship.raffle_engine.raffle;

import java.time.Duration;

/**
 * Raffle cadence. Each type carries the duration used when the creator
 * does not pass an explicit end time.
 */
public enum RaffleType {
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30)),
    FLASH(Duration.ofHours(1)),
    MEGA(Duration.ofDays(14));

    private final Duration defaultDuration;

    RaffleType(Duration defaultDuration) {
        this.defaultDuration = defaultDuration;
    }

    public Duration getDefaultDuration() {
        return defaultDuration;
    }
}
