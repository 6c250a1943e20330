package com.flagship.raffle_engine.payout;

import com.flagship.raffle_engine.draw.Winner;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Payout domain object, one per winner.
 *
 * Key principles:
 * - amount always equals the winner's prize and never changes
 * - transitions follow {@link PayoutStatus#canTransitionTo(PayoutStatus)}
 * - every transition returns a new instance
 */
@Value
public class Payout {
    UUID id;
    UUID winnerId;
    UUID raffleId;
    String walletAddress;
    BigDecimal amount;
    PayoutStatus status;
    String paymentReference;
    String error;
    int attempts;
    Instant createdAt;
    Instant updatedAt;
    Instant processedAt;

    public static Payout createFor(Winner winner, Instant now) {
        return new Payout(
            UUID.randomUUID(),
            winner.getId(),
            winner.getRaffleId(),
            winner.getWalletAddress(),
            winner.getPrize(),
            PayoutStatus.PENDING,
            null,
            null,
            0,
            now,
            now,
            null
        );
    }

    /**
     * Starts an attempt. Valid from PENDING or FAILED.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Payout startProcessing(Instant now) {
        requireTransition(PayoutStatus.PROCESSING);
        return new Payout(id, winnerId, raffleId, walletAddress, amount, PayoutStatus.PROCESSING,
                paymentReference, error, attempts + 1, createdAt, now, processedAt);
    }

    /**
     * Records a confirmed transfer. Valid from PROCESSING only.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Payout markPaid(String reference, Instant now) {
        requireTransition(PayoutStatus.PAID);
        return new Payout(id, winnerId, raffleId, walletAddress, amount, PayoutStatus.PAID,
                reference, null, attempts, createdAt, now, now);
    }

    /**
     * Records a failed transfer. Valid from PENDING or PROCESSING.
     *
     * @throws IllegalStateException if the transition is not allowed
     */
    public Payout markFailed(String reason, Instant now) {
        requireTransition(PayoutStatus.FAILED);
        return new Payout(id, winnerId, raffleId, walletAddress, amount, PayoutStatus.FAILED,
                null, reason, attempts, createdAt, now, processedAt);
    }

    public boolean isPaid() {
        return status == PayoutStatus.PAID;
    }

    private void requireTransition(PayoutStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException(String.format(
                "Cannot move payout %s from %s to %s", id, status, target));
        }
    }
}
