package com.flagship.raffle_engine.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.raffle_engine.raffle.Raffle;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class RaffleCreatedEvent implements RaffleEvent {
    UUID eventId;
    UUID raffleId;
    String raffleType;
    String title;
    String status;
    BigDecimal entryPrice;
    BigDecimal platformFeePercent;
    int winnerCount;
    int maxEntriesPerUser;
    Instant startTime;
    Instant endTime;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RaffleCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return raffleId;
    }

    public static RaffleCreatedEvent fromRaffle(Raffle raffle, Instant now) {
        return new RaffleCreatedEvent(
            UUID.randomUUID(),
            raffle.getId(),
            raffle.getType().name(),
            raffle.getTitle(),
            raffle.getStatus().name(),
            raffle.getEntryPrice(),
            raffle.getPlatformFeePercent(),
            raffle.getWinnerCount(),
            raffle.getMaxEntriesPerUser(),
            raffle.getStartTime(),
            raffle.getEndTime(),
            now
        );
    }
}
