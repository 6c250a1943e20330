package com.flagship.raffle_engine.entry;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A confirmed ticket purchase.
 *
 * Immutable once created except for its status. The sequence number is
 * assigned by the database on insert and fixes the arrival order the draw
 * numbers tickets in.
 */
@Value
public class Entry {
    UUID id;
    UUID raffleId;
    String walletAddress;
    int numEntries;
    BigDecimal totalPaid;
    String paymentReference;
    EntryStatus status;
    Long sequenceNumber;
    Instant createdAt;

    public static Entry create(UUID raffleId, String walletAddress, int numEntries,
                               BigDecimal totalPaid, String paymentReference, Instant now) {
        return new Entry(
            UUID.randomUUID(),
            raffleId,
            walletAddress,
            numEntries,
            totalPaid,
            paymentReference,
            EntryStatus.CONFIRMED,
            null,
            now
        );
    }
}
