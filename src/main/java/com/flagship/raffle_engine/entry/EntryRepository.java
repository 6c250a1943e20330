package com.flagship.raffle_engine.entry;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface EntryRepository extends JpaRepository<EntryEntity, UUID> {

    Optional<EntryEntity> findByPaymentReference(String paymentReference);

    /**
     * Draw snapshot: confirmed entries of a raffle in arrival order.
     */
    List<EntryEntity> findByRaffleIdAndStatusOrderBySequenceNumberAsc(UUID raffleId, EntryStatus status);

    List<EntryEntity> findByRaffleIdOrderBySequenceNumberAsc(UUID raffleId);

    List<EntryEntity> findByWalletAddressOrderByCreatedAtDesc(String walletAddress);
}
