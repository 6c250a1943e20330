package com.flagship.raffle_engine.raffle;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A named share of the winner payout, split evenly among {@code winnerCount} winners.
 */
@Value
public class PrizeTier {
    String name;
    BigDecimal percentage;
    int winnerCount;
}
