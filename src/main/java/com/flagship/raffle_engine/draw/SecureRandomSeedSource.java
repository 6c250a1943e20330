package com.flagship.raffle_engine.draw;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.UUID;

/**
 * 32 random bytes from {@link SecureRandom}, hex-encoded with a 0x prefix.
 */
@Component
public class SecureRandomSeedSource implements RandomSeedSource {

    private static final int SEED_BYTES = 32;

    private final SecureRandom random = new SecureRandom();

    @Override
    public String nextSeed(UUID raffleId) {
        byte[] bytes = new byte[SEED_BYTES];
        random.nextBytes(bytes);
        return "0x" + HexFormat.of().formatHex(bytes);
    }
}
