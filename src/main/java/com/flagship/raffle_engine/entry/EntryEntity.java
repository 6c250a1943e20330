package com.flagship.raffle_engine.entry;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for raffle_entries.
 *
 * payment_reference carries a unique constraint; it is the durable half of
 * entry idempotency. Only status may change after insert.
 */
@Entity
@Table(
    name = "raffle_entries",
    indexes = {
        @Index(name = "idx_entries_raffle_sequence", columnList = "raffle_id, sequence_number"),
        @Index(name = "idx_entries_wallet", columnList = "wallet_address")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EntryEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "raffle_id", nullable = false, updatable = false)
    private UUID raffleId;

    @Column(name = "wallet_address", nullable = false, updatable = false, length = 42)
    private String walletAddress;

    @Column(name = "num_entries", nullable = false, updatable = false)
    private int numEntries;

    @Column(name = "total_paid", nullable = false, updatable = false, precision = 38, scale = 0)
    private BigDecimal totalPaid;

    @Column(name = "payment_reference", nullable = false, updatable = false, unique = true, length = 128)
    private String paymentReference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EntryStatus status;

    @Column(name = "sequence_number", insertable = false, updatable = false)
    private Long sequenceNumber;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static EntryEntity fromDomain(Entry entry) {
        return new EntryEntity(
            entry.getId(),
            entry.getRaffleId(),
            entry.getWalletAddress(),
            entry.getNumEntries(),
            entry.getTotalPaid(),
            entry.getPaymentReference(),
            entry.getStatus(),
            null,  // assigned by the database
            entry.getCreatedAt()
        );
    }

    public Entry toDomain() {
        return new Entry(
            id,
            raffleId,
            walletAddress,
            numEntries,
            totalPaid,
            paymentReference,
            status,
            sequenceNumber,
            createdAt
        );
    }
}
