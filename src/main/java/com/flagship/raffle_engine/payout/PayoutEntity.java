package com.flagship.raffle_engine.payout;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payouts.
 *
 * winner_id is unique: a winner has exactly one payout row, retried in place.
 * Updates go through {@link PayoutRepository#compareAndSet}, never through
 * dirty checking.
 */
@Entity
@Table(
    name = "payouts",
    indexes = {
        @Index(name = "idx_payouts_status_created", columnList = "status, created_at"),
        @Index(name = "idx_payouts_raffle", columnList = "raffle_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PayoutEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "winner_id", nullable = false, updatable = false, unique = true)
    private UUID winnerId;

    @Column(name = "raffle_id", nullable = false, updatable = false)
    private UUID raffleId;

    @Column(name = "wallet_address", nullable = false, updatable = false, length = 42)
    private String walletAddress;

    @Column(nullable = false, updatable = false, precision = 38, scale = 0)
    private BigDecimal amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PayoutStatus status;

    @Column(name = "payment_reference", length = 128)
    private String paymentReference;

    @Column(columnDefinition = "TEXT")
    private String error;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    static PayoutEntity fromDomain(Payout payout) {
        return new PayoutEntity(
            payout.getId(),
            payout.getWinnerId(),
            payout.getRaffleId(),
            payout.getWalletAddress(),
            payout.getAmount(),
            payout.getStatus(),
            payout.getPaymentReference(),
            payout.getError(),
            payout.getAttempts(),
            payout.getCreatedAt(),
            payout.getUpdatedAt(),
            payout.getProcessedAt()
        );
    }

    public Payout toDomain() {
        return new Payout(id, winnerId, raffleId, walletAddress, amount, status, paymentReference,
                error, attempts, createdAt, updatedAt, processedAt);
    }
}
