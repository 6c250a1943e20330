package com.flagship.raffle_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every successful lifecycle transition.
 */
@Value
public class RaffleStatusChangedEvent implements RaffleEvent {
    UUID eventId;
    UUID raffleId;
    String fromStatus;
    String toStatus;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RaffleStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return raffleId;
    }

    public static RaffleStatusChangedEvent of(UUID raffleId, RaffleStatus from, RaffleStatus to, Instant now) {
        return new RaffleStatusChangedEvent(UUID.randomUUID(), raffleId, from.name(), to.name(), now);
    }
}
