package com.flagship.raffle_engine.prize;

import com.flagship.raffle_engine.raffle.PrizeTier;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Amount reserved for one prize tier and the per-winner share of it.
 */
@Value
public class TierAllocation {
    PrizeTier tier;
    BigDecimal tierAmount;
    BigDecimal amountPerWinner;
}
