package com.flagship.raffle_engine.raffle.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.raffle.CreateRaffleCommand;
import com.flagship.raffle_engine.raffle.RaffleType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Request DTO for creating a raffle.
 *
 * Bean validation covers the shape of the request; the business rules
 * (tier sums, fee range, duration) are enforced by the engine.
 */
@Value
public class CreateRaffleRequest {

    @NotNull(message = "Raffle type is required")
    @JsonProperty("type")
    RaffleType type;

    @NotBlank(message = "Title is required")
    @JsonProperty("title")
    String title;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Entry price is required")
    @DecimalMin(value = "0", inclusive = false, message = "Entry price must be greater than 0")
    @JsonProperty("entry_price")
    BigDecimal entryPrice;

    @NotNull(message = "Platform fee percent is required")
    @JsonProperty("platform_fee_percent")
    BigDecimal platformFeePercent;

    @NotNull(message = "Max entries per user is required")
    @Min(value = 1, message = "Max entries per user must be at least 1")
    @JsonProperty("max_entries_per_user")
    Integer maxEntriesPerUser;

    @JsonProperty("winner_count")
    Integer winnerCount;

    @NotEmpty(message = "At least one prize tier is required")
    @Valid
    @JsonProperty("prize_tiers")
    List<PrizeTierRequest> prizeTiers;

    @JsonProperty("start_time")
    Instant startTime;

    @JsonProperty("end_time")
    Instant endTime;

    public CreateRaffleCommand toCommand() {
        return CreateRaffleCommand.builder()
            .type(type)
            .title(title)
            .description(description)
            .entryPrice(entryPrice)
            .platformFeePercent(platformFeePercent)
            .maxEntriesPerUser(maxEntriesPerUser)
            .winnerCount(winnerCount)
            .prizeTiers(prizeTiers.stream().map(PrizeTierRequest::toPrizeTier).toList())
            .startTime(startTime)
            .endTime(endTime)
            .build();
    }
}
