package com.flagship.raffle_engine.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for events written to the outbox.
 *
 * Events are facts: they are written in the same transaction as the state
 * change they describe and never updated afterwards.
 */
public interface RaffleEvent {

    /**
     * Unique identifier for this event instance. Consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Aggregate the event is keyed by; also the Kafka message key.
     */
    UUID getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
