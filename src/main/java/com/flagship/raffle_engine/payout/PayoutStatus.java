package com.flagship.raffle_engine.payout;

/**
 * pending -> processing -> paid, or pending/processing -> failed.
 * failed -> processing allows retries. PAID is terminal.
 */
public enum PayoutStatus {
    PENDING,
    PROCESSING,
    PAID,
    FAILED;

    public boolean canTransitionTo(PayoutStatus target) {
        return switch (this) {
            case PENDING -> target == PROCESSING || target == FAILED;
            case PROCESSING -> target == PAID || target == FAILED;
            case FAILED -> target == PROCESSING;
            case PAID -> false;
        };
    }

    public boolean isTerminal() {
        return this == PAID;
    }
}
