package com.flagship.raffle_engine.draw;

import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Result of replaying a stored draw from its seed and entry snapshot.
 * {@code mismatches} is empty when the replay reproduces every stored winner.
 */
@Value
public class DrawVerification {
    UUID raffleId;
    String randomSeed;
    long totalTickets;
    int storedWinners;
    boolean verified;
    List<String> mismatches;
}
