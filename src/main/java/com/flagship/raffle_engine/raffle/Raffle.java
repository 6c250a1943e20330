package com.flagship.raffle_engine.raffle;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Raffle domain object.
 *
 * Key invariants:
 * - prizePool == totalEntries * entryPrice
 * - protocolFee + winnerPayout == prizePool
 * - totalParticipants <= totalEntries
 * - status only moves along {@link RaffleStatus#canTransitionTo(RaffleStatus)}
 *
 * Counters and status are never changed on this object. They are changed by
 * conditional updates in storage and re-read from there.
 */
@Value
public class Raffle {
    UUID id;
    RaffleType type;
    String title;
    String description;
    RaffleStatus status;
    BigDecimal entryPrice;
    long totalEntries;
    long totalParticipants;
    BigDecimal prizePool;
    BigDecimal protocolFee;
    BigDecimal winnerPayout;
    int winnerCount;
    BigDecimal platformFeePercent;
    List<PrizeTier> prizeTiers;
    int maxEntriesPerUser;
    Instant startTime;
    Instant endTime;
    Instant drawTime;
    String randomSeed;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new SCHEDULED raffle with zeroed counters.
     */
    public static Raffle create(UUID id, RaffleType type, String title, String description,
                                BigDecimal entryPrice, BigDecimal platformFeePercent,
                                int maxEntriesPerUser, List<PrizeTier> prizeTiers,
                                Instant startTime, Instant endTime, Instant now) {
        int winnerCount = prizeTiers.stream().mapToInt(PrizeTier::getWinnerCount).sum();
        return new Raffle(
            id,
            type,
            title,
            description,
            RaffleStatus.SCHEDULED,
            entryPrice,
            0L,
            0L,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            BigDecimal.ZERO,
            winnerCount,
            platformFeePercent,
            List.copyOf(prizeTiers),
            maxEntriesPerUser,
            startTime,
            endTime,
            null,
            null,
            now,
            now
        );
    }

    public boolean isAcceptingEntries(Instant now) {
        return status.acceptsEntries() && now.isBefore(endTime);
    }

    public boolean hasStarted(Instant now) {
        return !now.isBefore(startTime);
    }

    public boolean hasEnded(Instant now) {
        return !now.isBefore(endTime);
    }

    /**
     * True when the end time is at most {@code threshold} away (or already passed).
     */
    public boolean isWithinEndingWindow(Instant now, Duration threshold) {
        return !now.plus(threshold).isBefore(endTime);
    }

    public boolean canTransitionTo(RaffleStatus target) {
        return status.canTransitionTo(target);
    }

    public boolean isDrawn() {
        return randomSeed != null;
    }
}
