package com.flagship.raffle_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.raffle_engine.entry.Entry;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published once per accepted entry. Duplicate submissions do not publish again.
 * Keyed by raffle so entries of one raffle stay ordered on the topic.
 */
@Value
public class EntrySubmittedEvent implements RaffleEvent {
    UUID eventId;
    UUID raffleId;
    UUID entryId;
    String walletAddress;
    int numEntries;
    BigDecimal totalPaid;
    String paymentReference;
    boolean newParticipant;
    Instant occurredAt;

    public static final String EVENT_TYPE = "EntrySubmitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return raffleId;
    }

    public static EntrySubmittedEvent fromEntry(Entry entry, boolean newParticipant, Instant now) {
        return new EntrySubmittedEvent(
            UUID.randomUUID(),
            entry.getRaffleId(),
            entry.getId(),
            entry.getWalletAddress(),
            entry.getNumEntries(),
            entry.getTotalPaid(),
            entry.getPaymentReference(),
            newParticipant,
            now
        );
    }
}
