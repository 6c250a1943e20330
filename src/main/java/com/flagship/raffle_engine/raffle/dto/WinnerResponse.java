package com.flagship.raffle_engine.raffle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.draw.Winner;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class WinnerResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("raffle_id")
    UUID raffleId;

    @JsonProperty("entry_id")
    UUID entryId;

    @JsonProperty("position")
    int position;

    @JsonProperty("tier")
    String tier;

    @JsonProperty("wallet_address")
    String walletAddress;

    @JsonProperty("ticket_number")
    long ticketNumber;

    @JsonProperty("total_tickets")
    long totalTickets;

    @JsonProperty("prize")
    BigDecimal prize;

    @JsonProperty("created_at")
    Instant createdAt;

    public static WinnerResponse from(Winner winner) {
        return WinnerResponse.builder()
            .id(winner.getId())
            .raffleId(winner.getRaffleId())
            .entryId(winner.getEntryId())
            .position(winner.getPosition())
            .tier(winner.getTier())
            .walletAddress(winner.getWalletAddress())
            .ticketNumber(winner.getTicketNumber())
            .totalTickets(winner.getTotalTickets())
            .prize(winner.getPrize())
            .createdAt(winner.getCreatedAt())
            .build();
    }
}
