package com.flagship.raffle_engine.draw;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A stored draw result. Never recomputed after creation; a replay of the
 * draw must match these rows.
 */
@Value
public class Winner {
    UUID id;
    UUID raffleId;
    UUID entryId;
    String walletAddress;
    long ticketNumber;
    long totalTickets;
    BigDecimal prize;
    String tier;
    int position;
    Instant createdAt;

    public static Winner fromSelection(UUID raffleId, SelectedWinner selected, long totalTickets, Instant now) {
        return new Winner(
            UUID.randomUUID(),
            raffleId,
            selected.getEntryId(),
            selected.getWalletAddress(),
            selected.getTicketNumber(),
            totalTickets,
            selected.getPrize(),
            selected.getTier(),
            selected.getPosition(),
            now
        );
    }
}
