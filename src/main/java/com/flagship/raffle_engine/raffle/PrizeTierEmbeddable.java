package com.flagship.raffle_engine.raffle;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Row of raffle_prize_tiers. Position is kept by the owning collection's order column.
 */
@Embeddable
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PrizeTierEmbeddable {

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, precision = 5, scale = 2)
    private BigDecimal percentage;

    @Column(name = "winner_count", nullable = false)
    private int winnerCount;

    static PrizeTierEmbeddable fromDomain(PrizeTier tier) {
        return new PrizeTierEmbeddable(tier.getName(), tier.getPercentage(), tier.getWinnerCount());
    }

    PrizeTier toDomain() {
        return new PrizeTier(name, percentage, winnerCount);
    }
}
