package com.flagship.raffle_engine.draw;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for raffle_winners. Insert-only.
 *
 * Unique (raffle_id, ticket_number), (raffle_id, position) and
 * (raffle_id, wallet_address) back the no-duplicate-winner rule in the schema.
 */
@Entity
@Table(
    name = "raffle_winners",
    indexes = {
        @Index(name = "idx_winners_raffle", columnList = "raffle_id, position"),
        @Index(name = "idx_winners_wallet", columnList = "wallet_address")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class WinnerEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "raffle_id", nullable = false, updatable = false)
    private UUID raffleId;

    @Column(name = "entry_id", nullable = false, updatable = false)
    private UUID entryId;

    @Column(name = "wallet_address", nullable = false, updatable = false, length = 42)
    private String walletAddress;

    @Column(name = "ticket_number", nullable = false, updatable = false)
    private long ticketNumber;

    @Column(name = "total_tickets", nullable = false, updatable = false)
    private long totalTickets;

    @Column(nullable = false, updatable = false, precision = 38, scale = 0)
    private BigDecimal prize;

    @Column(nullable = false, updatable = false, length = 100)
    private String tier;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static WinnerEntity fromDomain(Winner winner) {
        return new WinnerEntity(
            winner.getId(),
            winner.getRaffleId(),
            winner.getEntryId(),
            winner.getWalletAddress(),
            winner.getTicketNumber(),
            winner.getTotalTickets(),
            winner.getPrize(),
            winner.getTier(),
            winner.getPosition(),
            winner.getCreatedAt()
        );
    }

    public Winner toDomain() {
        return new Winner(id, raffleId, entryId, walletAddress, ticketNumber, totalTickets,
                prize, tier, position, createdAt);
    }
}
