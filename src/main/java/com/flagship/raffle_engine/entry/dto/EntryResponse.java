package com.flagship.raffle_engine.entry.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.entry.Entry;
import com.flagship.raffle_engine.entry.EntryStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class EntryResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("raffle_id")
    UUID raffleId;

    @JsonProperty("wallet_address")
    String walletAddress;

    @JsonProperty("num_entries")
    int numEntries;

    @JsonProperty("total_paid")
    BigDecimal totalPaid;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("status")
    EntryStatus status;

    @JsonProperty("duplicate")
    boolean duplicate;

    @JsonProperty("created_at")
    Instant createdAt;

    public static EntryResponse from(Entry entry) {
        return from(entry, false);
    }

    public static EntryResponse from(Entry entry, boolean duplicate) {
        return EntryResponse.builder()
            .id(entry.getId())
            .raffleId(entry.getRaffleId())
            .walletAddress(entry.getWalletAddress())
            .numEntries(entry.getNumEntries())
            .totalPaid(entry.getTotalPaid())
            .paymentReference(entry.getPaymentReference())
            .status(entry.getStatus())
            .duplicate(duplicate)
            .createdAt(entry.getCreatedAt())
            .build();
    }
}
