package com.flagship.raffle_engine.draw;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface WinnerRepository extends JpaRepository<WinnerEntity, UUID> {

    List<WinnerEntity> findByRaffleIdOrderByPositionAsc(UUID raffleId);

    List<WinnerEntity> findByWalletAddressOrderByCreatedAtDesc(String walletAddress);
}
