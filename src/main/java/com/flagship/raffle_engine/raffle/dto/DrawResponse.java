package com.flagship.raffle_engine.raffle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.draw.DrawOutcome;
import lombok.Value;

import java.util.List;

@Value
public class DrawResponse {

    @JsonProperty("raffle")
    RaffleResponse raffle;

    @JsonProperty("total_tickets")
    long totalTickets;

    @JsonProperty("unfilled_slots")
    int unfilledSlots;

    @JsonProperty("winners")
    List<WinnerResponse> winners;

    public static DrawResponse from(DrawOutcome outcome) {
        return new DrawResponse(
            RaffleResponse.from(outcome.getRaffle()),
            outcome.getTotalTickets(),
            outcome.getUnfilledSlots(),
            outcome.getWinners().stream().map(WinnerResponse::from).toList()
        );
    }
}
