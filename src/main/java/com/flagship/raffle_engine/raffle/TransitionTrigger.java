package com.flagship.raffle_engine.raffle;

/**
 * Events that move a raffle through its lifecycle, with the status each one targets.
 */
public enum TransitionTrigger {
    START(RaffleStatus.ACTIVE),
    ENDING_WINDOW(RaffleStatus.ENDING),
    DRAW(RaffleStatus.DRAWING),
    COMPLETE(RaffleStatus.COMPLETED),
    CANCEL(RaffleStatus.CANCELLED);

    private final RaffleStatus target;

    TransitionTrigger(RaffleStatus target) {
        this.target = target;
    }

    public RaffleStatus getTarget() {
        return target;
    }
}
