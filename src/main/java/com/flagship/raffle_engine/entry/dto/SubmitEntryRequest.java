package com.flagship.raffle_engine.entry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment confirmation for a ticket purchase. The payment reference travels
 * in the Idempotency-Key header.
 */
@Value
public class SubmitEntryRequest {

    @NotBlank(message = "Wallet address is required")
    @JsonProperty("wallet_address")
    String walletAddress;

    @NotNull(message = "Number of entries is required")
    @Min(value = 1, message = "Number of entries must be at least 1")
    @JsonProperty("num_entries")
    Integer numEntries;

    @NotNull(message = "Total paid is required")
    @JsonProperty("total_paid")
    BigDecimal totalPaid;
}
