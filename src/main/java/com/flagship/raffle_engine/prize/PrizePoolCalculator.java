package com.flagship.raffle_engine.prize;

import com.flagship.raffle_engine.raffle.PrizeTier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;

/**
 * Pure arithmetic for prize pools. All amounts are integers in the smallest
 * currency unit (scale 0).
 *
 * Rounding rules:
 * - the protocol fee rounds half-up
 * - tier amounts and per-winner shares round down
 * - whatever rounding leaves over goes to the first winner of the top tier,
 *   so the prizes always sum to exactly the winner payout
 *
 * The entry path recomputes the fee inside its counter update with the same
 * half-up rule; the draw checks the stored split against {@link #split}.
 */
@Component
public class PrizePoolCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public BigDecimal prizePool(BigDecimal entryPrice, long totalEntries) {
        return entryPrice.multiply(BigDecimal.valueOf(totalEntries));
    }

    public PoolSplit split(BigDecimal prizePool, BigDecimal platformFeePercent) {
        BigDecimal fee = percentOf(prizePool, platformFeePercent);
        return new PoolSplit(prizePool, fee, prizePool.subtract(fee));
    }

    /**
     * Tiers ordered largest share first. Tiers with equal percentages keep
     * their configured order.
     */
    public List<PrizeTier> orderTiers(List<PrizeTier> tiers) {
        return tiers.stream()
                .sorted(Comparator.comparing(PrizeTier::getPercentage).reversed())
                .toList();
    }

    /**
     * Allocates the winner payout across tiers, in {@link #orderTiers} order.
     * Every amount is floored, so the allocations never exceed the payout.
     */
    public List<TierAllocation> allocate(BigDecimal winnerPayout, List<PrizeTier> tiers) {
        return orderTiers(tiers).stream()
                .map(tier -> {
                    BigDecimal tierAmount = winnerPayout.multiply(tier.getPercentage())
                            .divide(HUNDRED, 0, RoundingMode.DOWN);
                    BigDecimal perWinner = tierAmount.divide(
                            BigDecimal.valueOf(tier.getWinnerCount()), 0, RoundingMode.DOWN);
                    return new TierAllocation(tier, tierAmount, perWinner);
                })
                .toList();
    }

    /**
     * Amount left after paying {@code distributed}. Added to the first winner's prize.
     * Includes the shares of slots that could not be filled.
     */
    public BigDecimal remainder(BigDecimal winnerPayout, BigDecimal distributed) {
        BigDecimal remainder = winnerPayout.subtract(distributed);
        if (remainder.signum() < 0) {
            throw new IllegalStateException(
                    "Allocated " + distributed + " exceeds winner payout " + winnerPayout);
        }
        return remainder;
    }

    private BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return amount.multiply(percent).divide(HUNDRED, 0, RoundingMode.HALF_UP);
    }
}
