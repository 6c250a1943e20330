package com.flagship.raffle_engine.raffle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.raffle.PrizeTier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class PrizeTierRequest {

    @NotBlank(message = "Tier name is required")
    @JsonProperty("name")
    String name;

    @NotNull(message = "Tier percentage is required")
    @JsonProperty("percentage")
    BigDecimal percentage;

    @NotNull(message = "Tier winner count is required")
    @JsonProperty("winner_count")
    Integer winnerCount;

    public PrizeTier toPrizeTier() {
        return new PrizeTier(name, percentage, winnerCount);
    }
}
