package com.flagship.raffle_engine.draw;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One winner produced by {@link WinnerSelector}, before it is persisted.
 * Positions start at 1 in draw order.
 */
@Value
public class SelectedWinner {
    int position;
    String tier;
    long ticketNumber;
    String walletAddress;
    UUID entryId;
    BigDecimal prize;
}
