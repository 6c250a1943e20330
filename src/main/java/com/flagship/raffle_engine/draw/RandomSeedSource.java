package com.flagship.raffle_engine.draw;

import java.util.UUID;

/**
 * Supplies the seed a draw is run with. The seed is stored on the raffle
 * before selection so the draw can be replayed.
 */
public interface RandomSeedSource {

    String nextSeed(UUID raffleId);
}
