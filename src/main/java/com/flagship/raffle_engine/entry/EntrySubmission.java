package com.flagship.raffle_engine.entry;

import lombok.Value;

/**
 * Result of submitEntry. {@code duplicate} is true when the payment reference
 * had already been used and {@code entry} is the original.
 */
@Value
public class EntrySubmission {
    Entry entry;
    boolean duplicate;
}
