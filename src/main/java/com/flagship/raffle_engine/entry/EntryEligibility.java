package com.flagship.raffle_engine.entry;

import com.flagship.raffle_engine.common.RaffleErrorCode;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Pre-flight answer to "could this wallet buy n tickets right now?".
 * Advisory only: submitEntry re-checks everything atomically.
 */
@Value
public class EntryEligibility {
    boolean eligible;
    RaffleErrorCode reason;
    String message;
    long currentEntries;
    long remainingAllowance;
    BigDecimal requiredPayment;

    static EntryEligibility eligible(long current, long remaining, BigDecimal requiredPayment) {
        return new EntryEligibility(true, null, null, current, remaining, requiredPayment);
    }

    static EntryEligibility rejected(RaffleErrorCode reason, String message, long current, long remaining,
                                     BigDecimal requiredPayment) {
        return new EntryEligibility(false, reason, message, current, remaining, requiredPayment);
    }
}
