package com.flagship.raffle_engine.stats;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Platform-wide running totals. Only ever incremented.
 */
@Value
public class PlatformStats {
    long totalRaffles;
    long completedRaffles;
    long cancelledRaffles;
    long totalEntries;
    long totalParticipations;
    BigDecimal totalRevenue;
    long totalWinners;
    BigDecimal totalPaidOut;
    long failedPayoutAttempts;
    Instant updatedAt;
}
