package com.flagship.raffle_engine.entry;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Stored entries for draw tests outside this package.
 */
public final class EntryFixtures {

    private EntryFixtures() {
    }

    public static EntryEntity confirmed(UUID raffleId, String walletAddress, int numEntries, Instant now) {
        Entry entry = Entry.create(raffleId, walletAddress, numEntries,
                BigDecimal.valueOf(5L * numEntries), "pay-" + UUID.randomUUID(), now);
        return EntryEntity.fromDomain(entry);
    }
}
