package com.flagship.raffle_engine.common;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization for EVM wallet addresses.
 * Addresses are compared case-insensitively, so they are stored lower-cased.
 */
public final class WalletAddresses {

    private static final Pattern ADDRESS = Pattern.compile("^0x[0-9a-f]{40}$");

    private WalletAddresses() {
    }

    /**
     * @throws RaffleEngineException INVALID_ENTRY if the address is malformed
     */
    public static String normalize(String walletAddress) {
        if (walletAddress == null || walletAddress.isBlank()) {
            throw RaffleEngineException.invalidEntry("wallet address is required");
        }
        String normalized = walletAddress.trim().toLowerCase(Locale.ROOT);
        if (!ADDRESS.matcher(normalized).matches()) {
            throw RaffleEngineException.invalidEntry("malformed wallet address " + walletAddress);
        }
        return normalized;
    }
}
