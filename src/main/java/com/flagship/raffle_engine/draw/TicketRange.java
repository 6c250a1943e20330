package com.flagship.raffle_engine.draw;

import lombok.Value;

import java.util.UUID;

/**
 * Contiguous, inclusive block of ticket numbers owned by one entry.
 */
@Value
public class TicketRange {
    long start;
    long end;
    String walletAddress;
    UUID entryId;

    public long size() {
        return end - start + 1;
    }
}
