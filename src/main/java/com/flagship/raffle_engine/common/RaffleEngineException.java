package com.flagship.raffle_engine.common;

import java.util.UUID;

/**
 * Tagged failure raised inside the engine services.
 *
 * Being unchecked, it rolls back the surrounding transaction. The engine
 * boundary converts it into an {@link EngineResult} failure.
 */
public class RaffleEngineException extends RuntimeException {

    private final RaffleErrorCode code;

    public RaffleEngineException(RaffleErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public RaffleErrorCode getCode() {
        return code;
    }

    public static RaffleEngineException raffleNotFound(UUID raffleId) {
        return new RaffleEngineException(RaffleErrorCode.RAFFLE_NOT_FOUND,
                "Raffle not found: " + raffleId);
    }

    public static RaffleEngineException raffleNotActive(UUID raffleId, String reason) {
        return new RaffleEngineException(RaffleErrorCode.RAFFLE_NOT_ACTIVE,
                String.format("Raffle %s is not accepting entries (%s)", raffleId, reason));
    }

    public static RaffleEngineException invalidEntry(String reason) {
        return new RaffleEngineException(RaffleErrorCode.INVALID_ENTRY, "Invalid entry: " + reason);
    }

    public static RaffleEngineException maxEntriesExceeded(long current, long additional, long max) {
        return new RaffleEngineException(RaffleErrorCode.MAX_ENTRIES_EXCEEDED,
                String.format("Max entries exceeded: %d current + %d new = %d, max allowed: %d",
                        current, additional, current + additional, max));
    }

    public static RaffleEngineException invalidTransition(UUID id, Object from, Object to, String reason) {
        return new RaffleEngineException(RaffleErrorCode.INVALID_STATUS_TRANSITION,
                String.format("Cannot move %s from %s to %s: %s", id, from, to, reason));
    }

    public static RaffleEngineException noEntriesForDraw(UUID raffleId) {
        return new RaffleEngineException(RaffleErrorCode.NO_ENTRIES_FOR_DRAW,
                "Raffle " + raffleId + " has no entries to draw from");
    }

    public static RaffleEngineException payoutAlreadyProcessed(UUID payoutId) {
        return new RaffleEngineException(RaffleErrorCode.PAYOUT_ALREADY_PROCESSED,
                "Payout already paid: " + payoutId);
    }

    public static RaffleEngineException validation(String field, String reason) {
        return new RaffleEngineException(RaffleErrorCode.VALIDATION_ERROR,
                String.format("Invalid raffle config - %s: %s", field, reason));
    }

    public static RaffleEngineException winnerNotFound(UUID winnerId) {
        return new RaffleEngineException(RaffleErrorCode.WINNER_NOT_FOUND,
                "Winner not found: " + winnerId);
    }

    public static RaffleEngineException payoutNotFound(String key) {
        return new RaffleEngineException(RaffleErrorCode.PAYOUT_NOT_FOUND,
                "Payout not found: " + key);
    }
}
