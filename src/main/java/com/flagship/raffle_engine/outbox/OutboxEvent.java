package com.flagship.raffle_engine.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An event waiting in (or already drained from) the outbox table.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Raffle" or "Payout"
    UUID aggregateId;
    String eventType;          // e.g. "EntrySubmitted"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until sent
    int retryCount;
    String lastError;
    Long sequenceNumber;

    static OutboxEvent create(String aggregateType, UUID aggregateId, String eventType,
                              String payload, Instant now) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            now,
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
