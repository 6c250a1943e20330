package com.flagship.raffle_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.raffle_engine.payout.Payout;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Published for each recorded payout attempt, successful or not.
 */
@Value
public class PayoutRecordedEvent implements RaffleEvent {
    UUID eventId;
    UUID payoutId;
    UUID winnerId;
    UUID raffleId;
    String walletAddress;
    BigDecimal amount;
    String status;
    String paymentReference;
    String error;
    int attempts;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return payoutId;
    }

    public static PayoutRecordedEvent fromPayout(Payout payout, Instant now) {
        return new PayoutRecordedEvent(
            UUID.randomUUID(),
            payout.getId(),
            payout.getWinnerId(),
            payout.getRaffleId(),
            payout.getWalletAddress(),
            payout.getAmount(),
            payout.getStatus().name(),
            payout.getPaymentReference(),
            payout.getError(),
            payout.getAttempts(),
            now
        );
    }
}
