package com.flagship.raffle_engine.payout;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payout progress of one raffle. {@code fullyPaid} is true once the paid
 * total equals the raffle's winner payout.
 */
@Value
public class PayoutSummary {
    UUID raffleId;
    BigDecimal winnerPayout;
    int totalPayouts;
    int pending;
    int processing;
    int paid;
    int failed;
    BigDecimal paidAmount;
    BigDecimal outstandingAmount;
    boolean fullyPaid;
}
