package com.flagship.raffle_engine.draw;

import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class SelectionResult {
    String seed;
    long totalTickets;
    BigDecimal winnerPayout;
    List<SelectedWinner> winners;
    int unfilledSlots;

    public BigDecimal totalPrizes() {
        return winners.stream()
                .map(SelectedWinner::getPrize)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
