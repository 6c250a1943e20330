package com.flagship.raffle_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.payout.Payout;
import com.flagship.raffle_engine.payout.PayoutStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PayoutResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("winner_id")
    UUID winnerId;

    @JsonProperty("raffle_id")
    UUID raffleId;

    @JsonProperty("wallet_address")
    String walletAddress;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("status")
    PayoutStatus status;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("error")
    String error;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("processed_at")
    Instant processedAt;

    public static PayoutResponse from(Payout payout) {
        return PayoutResponse.builder()
            .id(payout.getId())
            .winnerId(payout.getWinnerId())
            .raffleId(payout.getRaffleId())
            .walletAddress(payout.getWalletAddress())
            .amount(payout.getAmount())
            .status(payout.getStatus())
            .paymentReference(payout.getPaymentReference())
            .error(payout.getError())
            .attempts(payout.getAttempts())
            .createdAt(payout.getCreatedAt())
            .processedAt(payout.getProcessedAt())
            .build();
    }
}
