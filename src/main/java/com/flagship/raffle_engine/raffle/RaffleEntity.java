package com.flagship.raffle_engine.raffle;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA entity for raffles.
 *
 * There are no setters. Status, seed and the entry counters are written by
 * conditional updates ({@link RaffleRepository} and
 * {@code RaffleCounterRepository}); this entity is only inserted and read.
 */
@Entity
@Table(
    name = "raffles",
    indexes = {
        @Index(name = "idx_raffles_status_start_time", columnList = "status, start_time"),
        @Index(name = "idx_raffles_status_end_time", columnList = "status, end_time")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RaffleEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "raffle_type", nullable = false, updatable = false, length = 20)
    private RaffleType type;

    @Column(nullable = false, updatable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private RaffleStatus status;

    @Column(name = "entry_price", nullable = false, updatable = false, precision = 38, scale = 0)
    private BigDecimal entryPrice;

    @Column(name = "total_entries", nullable = false)
    private long totalEntries;

    @Column(name = "total_participants", nullable = false)
    private long totalParticipants;

    @Column(name = "prize_pool", nullable = false, precision = 38, scale = 0)
    private BigDecimal prizePool;

    @Column(name = "protocol_fee", nullable = false, precision = 38, scale = 0)
    private BigDecimal protocolFee;

    @Column(name = "winner_payout", nullable = false, precision = 38, scale = 0)
    private BigDecimal winnerPayout;

    @Column(name = "winner_count", nullable = false, updatable = false)
    private int winnerCount;

    @Column(name = "platform_fee_percent", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal platformFeePercent;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "raffle_prize_tiers", joinColumns = @JoinColumn(name = "raffle_id"))
    @OrderColumn(name = "tier_position")
    private List<PrizeTierEmbeddable> prizeTiers = new ArrayList<>();

    @Column(name = "max_entries_per_user", nullable = false, updatable = false)
    private int maxEntriesPerUser;

    @Column(name = "start_time", nullable = false, updatable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false, updatable = false)
    private Instant endTime;

    @Column(name = "draw_time")
    private Instant drawTime;

    @Column(name = "random_seed", length = 256)
    private String randomSeed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static RaffleEntity fromDomain(Raffle raffle) {
        return new RaffleEntity(
            raffle.getId(),
            raffle.getType(),
            raffle.getTitle(),
            raffle.getDescription(),
            raffle.getStatus(),
            raffle.getEntryPrice(),
            raffle.getTotalEntries(),
            raffle.getTotalParticipants(),
            raffle.getPrizePool(),
            raffle.getProtocolFee(),
            raffle.getWinnerPayout(),
            raffle.getWinnerCount(),
            raffle.getPlatformFeePercent(),
            new ArrayList<>(raffle.getPrizeTiers().stream().map(PrizeTierEmbeddable::fromDomain).toList()),
            raffle.getMaxEntriesPerUser(),
            raffle.getStartTime(),
            raffle.getEndTime(),
            raffle.getDrawTime(),
            raffle.getRandomSeed(),
            raffle.getCreatedAt(),
            raffle.getUpdatedAt()
        );
    }

    public Raffle toDomain() {
        return new Raffle(
            id,
            type,
            title,
            description,
            status,
            entryPrice,
            totalEntries,
            totalParticipants,
            prizePool,
            protocolFee,
            winnerPayout,
            winnerCount,
            platformFeePercent,
            prizeTiers.stream().map(PrizeTierEmbeddable::toDomain).toList(),
            maxEntriesPerUser,
            startTime,
            endTime,
            drawTime,
            randomSeed,
            createdAt,
            updatedAt
        );
    }
}
