package com.flagship.raffle_engine.raffle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.raffle.PrizeTier;
import com.flagship.raffle_engine.raffle.Raffle;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import com.flagship.raffle_engine.raffle.RaffleType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RaffleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("type")
    RaffleType type;

    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    RaffleStatus status;

    @JsonProperty("entry_price")
    BigDecimal entryPrice;

    @JsonProperty("total_entries")
    long totalEntries;

    @JsonProperty("total_participants")
    long totalParticipants;

    @JsonProperty("prize_pool")
    BigDecimal prizePool;

    @JsonProperty("protocol_fee")
    BigDecimal protocolFee;

    @JsonProperty("winner_payout")
    BigDecimal winnerPayout;

    @JsonProperty("winner_count")
    int winnerCount;

    @JsonProperty("platform_fee_percent")
    BigDecimal platformFeePercent;

    @JsonProperty("prize_tiers")
    List<PrizeTier> prizeTiers;

    @JsonProperty("max_entries_per_user")
    int maxEntriesPerUser;

    @JsonProperty("start_time")
    Instant startTime;

    @JsonProperty("end_time")
    Instant endTime;

    @JsonProperty("draw_time")
    Instant drawTime;

    @JsonProperty("random_seed")
    String randomSeed;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static RaffleResponse from(Raffle raffle) {
        return RaffleResponse.builder()
            .id(raffle.getId())
            .type(raffle.getType())
            .title(raffle.getTitle())
            .description(raffle.getDescription())
            .status(raffle.getStatus())
            .entryPrice(raffle.getEntryPrice())
            .totalEntries(raffle.getTotalEntries())
            .totalParticipants(raffle.getTotalParticipants())
            .prizePool(raffle.getPrizePool())
            .protocolFee(raffle.getProtocolFee())
            .winnerPayout(raffle.getWinnerPayout())
            .winnerCount(raffle.getWinnerCount())
            .platformFeePercent(raffle.getPlatformFeePercent())
            .prizeTiers(raffle.getPrizeTiers())
            .maxEntriesPerUser(raffle.getMaxEntriesPerUser())
            .startTime(raffle.getStartTime())
            .endTime(raffle.getEndTime())
            .drawTime(raffle.getDrawTime())
            .randomSeed(raffle.getRandomSeed())
            .createdAt(raffle.getCreatedAt())
            .updatedAt(raffle.getUpdatedAt())
            .build();
    }
}
