package com.flagship.raffle_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.raffle_engine.draw.Winner;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a draw completes. Carries the seed and every winner so the
 * draw can be checked independently.
 */
@Value
public class RaffleDrawnEvent implements RaffleEvent {
    UUID eventId;
    UUID raffleId;
    String randomSeed;
    long totalTickets;
    BigDecimal winnerPayout;
    int unfilledSlots;
    List<DrawnWinner> winners;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RaffleDrawn";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return raffleId;
    }

    @Value
    public static class DrawnWinner {
        UUID winnerId;
        int position;
        String tier;
        long ticketNumber;
        String walletAddress;
        BigDecimal prize;
    }

    public static RaffleDrawnEvent of(UUID raffleId, String seed, long totalTickets, BigDecimal winnerPayout,
                                      int unfilledSlots, List<Winner> winners, Instant now) {
        List<DrawnWinner> drawn = winners.stream()
                .map(w -> new DrawnWinner(w.getId(), w.getPosition(), w.getTier(),
                        w.getTicketNumber(), w.getWalletAddress(), w.getPrize()))
                .toList();
        return new RaffleDrawnEvent(UUID.randomUUID(), raffleId, seed, totalTickets, winnerPayout,
                unfilledSlots, drawn, now);
    }
}
