package com.flagship.raffle_engine.raffle;

import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.event.RaffleCreatedEvent;
import com.flagship.raffle_engine.observability.RaffleMetrics;
import com.flagship.raffle_engine.outbox.OutboxService;
import com.flagship.raffle_engine.stats.StatsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Administrative raffle operations: create and look up.
 * Lifecycle changes go through {@link RaffleStateMachine}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RaffleService {

    private final RaffleRepository raffleRepository;
    private final RaffleConfigValidator validator;
    private final StatsAggregator statsAggregator;
    private final OutboxService outboxService;
    private final RaffleMetrics metrics;
    private final Clock clock;

    /**
     * Creates a raffle in SCHEDULED status.
     *
     * @throws RaffleEngineException VALIDATION_ERROR for malformed configuration
     */
    @Transactional
    public Raffle createRaffle(CreateRaffleCommand command) {
        if (command.getType() == null) {
            throw RaffleEngineException.validation("type", "is required");
        }
        Instant now = clock.instant();
        Instant startTime = command.getStartTime() != null ? command.getStartTime() : now;
        Instant endTime = command.getEndTime() != null
                ? command.getEndTime()
                : startTime.plus(command.getType().getDefaultDuration());

        validator.validate(command, startTime, endTime);

        List<PrizeTier> tiers = command.getPrizeTiers().stream()
                .map(t -> new PrizeTier(t.getName().trim(), t.getPercentage(), t.getWinnerCount()))
                .toList();

        Raffle raffle = Raffle.create(
                UUID.randomUUID(),
                command.getType(),
                command.getTitle().trim(),
                command.getDescription(),
                command.getEntryPrice(),
                command.getPlatformFeePercent(),
                command.getMaxEntriesPerUser(),
                tiers,
                startTime,
                endTime,
                now);

        Raffle saved = raffleRepository.save(RaffleEntity.fromDomain(raffle)).toDomain();
        statsAggregator.recordRaffleCreated();
        outboxService.saveEvent(OutboxService.AGGREGATE_RAFFLE, RaffleCreatedEvent.fromRaffle(saved, now));
        metrics.recordRaffleCreated(saved.getType().name());

        log.info("Raffle created: raffleId={}, type={}, entryPrice={}, fee={}%, winners={}, start={}, end={}",
                saved.getId(), saved.getType(), saved.getEntryPrice(), saved.getPlatformFeePercent(),
                saved.getWinnerCount(), saved.getStartTime(), saved.getEndTime());
        return saved;
    }

    @Transactional(readOnly = true)
    public Raffle getRaffle(UUID raffleId) {
        return raffleRepository.findById(raffleId)
                .map(RaffleEntity::toDomain)
                .orElseThrow(() -> RaffleEngineException.raffleNotFound(raffleId));
    }

    @Transactional(readOnly = true)
    public List<Raffle> findByStatus(RaffleStatus status) {
        return raffleRepository.findByStatusOrderByEndTimeAsc(status).stream()
                .map(RaffleEntity::toDomain)
                .toList();
    }

    /**
     * SCHEDULED raffles whose start time has been reached.
     */
    @Transactional(readOnly = true)
    public List<UUID> findDueToStart(Instant now) {
        return raffleRepository.findByStatusAndStartTimeLessThanEqualOrderByStartTimeAsc(RaffleStatus.SCHEDULED, now)
                .stream().map(RaffleEntity::getId).toList();
    }

    /**
     * Raffles in {@code status} whose end time is at or before {@code cutoff}.
     */
    @Transactional(readOnly = true)
    public List<UUID> findEndingBy(RaffleStatus status, Instant cutoff) {
        return raffleRepository.findByStatusAndEndTimeLessThanEqualOrderByEndTimeAsc(status, cutoff)
                .stream().map(RaffleEntity::getId).toList();
    }
}
