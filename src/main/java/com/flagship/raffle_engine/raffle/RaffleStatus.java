package com.flagship.raffle_engine.raffle;

/**
 * Lifecycle of a raffle.
 *
 * scheduled -> active -> ending -> drawing -> completed, with cancellation
 * allowed from scheduled, active and ending. COMPLETED and CANCELLED are terminal.
 */
public enum RaffleStatus {
    SCHEDULED,
    ACTIVE,
    ENDING,
    DRAWING,
    COMPLETED,
    CANCELLED;

    /**
     * Entries are accepted while active and during the final window before the end time.
     */
    public boolean acceptsEntries() {
        return this == ACTIVE || this == ENDING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean canTransitionTo(RaffleStatus target) {
        return switch (this) {
            case SCHEDULED -> target == ACTIVE || target == CANCELLED;
            case ACTIVE -> target == ENDING || target == CANCELLED;
            case ENDING -> target == DRAWING || target == CANCELLED;
            case DRAWING -> target == COMPLETED;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
