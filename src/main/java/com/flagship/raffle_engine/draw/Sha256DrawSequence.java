package com.flagship.raffle_engine.draw;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Pick i is {@code SHA-256(seed + ":" + i)} read as an unsigned big-endian
 * integer, reduced modulo the bound. Anyone holding the seed and the entry
 * list can replay the sequence.
 */
public class Sha256DrawSequence implements DrawSequence {

    private final String seed;
    private final MessageDigest digest;
    private long counter;

    public Sha256DrawSequence(String seed) {
        if (seed == null || seed.isEmpty()) {
            throw new IllegalArgumentException("Draw seed cannot be null or empty");
        }
        this.seed = seed;
        try {
            this.digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public long nextIndex(long bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("Bound must be positive: " + bound);
        }
        byte[] hash = digest.digest((seed + ":" + counter).getBytes(StandardCharsets.UTF_8));
        counter++;
        return new BigInteger(1, hash).mod(BigInteger.valueOf(bound)).longValueExact();
    }

    @Override
    public long position() {
        return counter;
    }
}
