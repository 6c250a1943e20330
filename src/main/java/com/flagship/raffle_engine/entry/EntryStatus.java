package com.flagship.raffle_engine.entry;

public enum EntryStatus {
    CONFIRMED,
    REFUNDED
}
