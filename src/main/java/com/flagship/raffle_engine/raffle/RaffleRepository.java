package com.flagship.raffle_engine.raffle;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for raffles.
 *
 * Status changes are compare-and-set updates: they only apply when the row is
 * still in the expected status, and return the number of rows changed. Under
 * concurrent callers exactly one sees 1; the others see 0.
 */
@Repository
public interface RaffleRepository extends JpaRepository<RaffleEntity, UUID> {

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE RaffleEntity r SET r.status = :to, r.updatedAt = :now
        WHERE r.id = :id AND r.status = :from
        """)
    int compareAndSetStatus(@Param("id") UUID id,
                            @Param("from") RaffleStatus from,
                            @Param("to") RaffleStatus to,
                            @Param("now") Instant now);

    /**
     * Moves an ENDING raffle to DRAWING and records the seed in the same statement.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE RaffleEntity r
        SET r.status = com.flagship.raffle_engine.raffle.RaffleStatus.DRAWING,
            r.randomSeed = :seed, r.drawTime = :now, r.updatedAt = :now
        WHERE r.id = :id AND r.status = com.flagship.raffle_engine.raffle.RaffleStatus.ENDING
        """)
    int beginDrawing(@Param("id") UUID id, @Param("seed") String seed, @Param("now") Instant now);

    List<RaffleEntity> findByStatusAndStartTimeLessThanEqualOrderByStartTimeAsc(RaffleStatus status, Instant time);

    List<RaffleEntity> findByStatusAndEndTimeLessThanEqualOrderByEndTimeAsc(RaffleStatus status, Instant time);

    List<RaffleEntity> findByStatusOrderByEndTimeAsc(RaffleStatus status);

    long countByStatus(RaffleStatus status);

    long countByStatusIn(List<RaffleStatus> statuses);
}
