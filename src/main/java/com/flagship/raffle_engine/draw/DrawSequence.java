package com.flagship.raffle_engine.draw;

/**
 * Deterministic stream of uniform picks for one draw.
 */
public interface DrawSequence {

    /**
     * Next pick in {@code [0, bound)}. Each call advances the sequence.
     */
    long nextIndex(long bound);

    /**
     * Number of picks taken so far.
     */
    long position();
}
