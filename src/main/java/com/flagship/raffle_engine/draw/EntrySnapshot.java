package com.flagship.raffle_engine.draw;

import lombok.Value;

import java.util.UUID;

/**
 * One confirmed entry as seen by the draw, in arrival order.
 */
@Value
public class EntrySnapshot {
    UUID entryId;
    String walletAddress;
    int numEntries;
}
