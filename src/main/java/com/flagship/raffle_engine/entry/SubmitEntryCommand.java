package com.flagship.raffle_engine.entry;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * A payment confirmation from the payment collaborator, asking for tickets.
 */
@Value
public class SubmitEntryCommand {
    UUID raffleId;
    String walletAddress;
    int numEntries;
    BigDecimal totalPaid;
    String paymentReference;
}
