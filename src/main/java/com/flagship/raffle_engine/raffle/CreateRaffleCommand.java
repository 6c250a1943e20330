package com.flagship.raffle_engine.raffle;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Administrative request to create a raffle.
 *
 * {@code endTime} may be null, in which case the type's default duration is
 * used. {@code winnerCount} may be null, in which case it is the sum of the
 * tier winner counts.
 */
@Value
@Builder
public class CreateRaffleCommand {
    RaffleType type;
    String title;
    String description;
    BigDecimal entryPrice;
    BigDecimal platformFeePercent;
    int maxEntriesPerUser;
    Integer winnerCount;
    List<PrizeTier> prizeTiers;
    Instant startTime;
    Instant endTime;
}
