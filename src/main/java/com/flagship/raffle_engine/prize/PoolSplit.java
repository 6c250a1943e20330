package com.flagship.raffle_engine.prize;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Division of a prize pool into the protocol fee and the amount paid out to winners.
 * {@code protocolFee + winnerPayout == prizePool} always holds.
 */
@Value
public class PoolSplit {
    BigDecimal prizePool;
    BigDecimal protocolFee;
    BigDecimal winnerPayout;
}
