package com.flagship.raffle_engine.payout;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PayoutRepository extends JpaRepository<PayoutEntity, UUID> {

    Optional<PayoutEntity> findByWinnerId(UUID winnerId);

    List<PayoutEntity> findByRaffleIdOrderByCreatedAtAsc(UUID raffleId);

    /**
     * Retry sweep lookup, oldest first.
     */
    List<PayoutEntity> findByStatusOrderByCreatedAtAsc(PayoutStatus status);

    long countByStatusIn(List<PayoutStatus> statuses);

    /**
     * Writes the new payout state only if status and attempt count are still
     * the ones the caller read. Returns 0 when another attempt got there first.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE PayoutEntity p
        SET p.status = :status, p.paymentReference = :paymentReference, p.error = :error,
            p.attempts = :attempts, p.processedAt = :processedAt, p.updatedAt = :updatedAt
        WHERE p.id = :id AND p.status = :expectedStatus AND p.attempts = :expectedAttempts
        """)
    int compareAndSet(@Param("id") UUID id,
                      @Param("expectedStatus") PayoutStatus expectedStatus,
                      @Param("expectedAttempts") int expectedAttempts,
                      @Param("status") PayoutStatus status,
                      @Param("paymentReference") String paymentReference,
                      @Param("error") String error,
                      @Param("attempts") int attempts,
                      @Param("processedAt") Instant processedAt,
                      @Param("updatedAt") Instant updatedAt);
}
