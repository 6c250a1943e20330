package com.flagship.raffle_engine.raffle;

import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.event.RaffleStatusChangedEvent;
import com.flagship.raffle_engine.observability.RaffleMetrics;
import com.flagship.raffle_engine.outbox.OutboxService;
import com.flagship.raffle_engine.stats.StatsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Applies raffle lifecycle transitions.
 *
 * Every transition is a compare-and-set on the stored status. Explicit
 * triggers that lose the race fail with INVALID_STATUS_TRANSITION so the
 * caller can tell "someone else did it" from success. Time-driven advances
 * ({@link #advanceTime}) treat a lost race as already done.
 *
 * Each applied transition writes a RaffleStatusChanged event to the outbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RaffleStateMachine {

    private final RaffleRepository raffleRepository;
    private final StatsAggregator statsAggregator;
    private final OutboxService outboxService;
    private final RaffleMetrics metrics;
    private final Clock clock;

    @Value("${raffle.lifecycle.ending-threshold:PT5M}")
    private Duration endingThreshold;

    /**
     * Applies whichever time-based transitions are due:
     * scheduled -> active once the start time is reached, then
     * active -> ending once the end time is within the ending threshold.
     */
    @Transactional
    public Raffle advanceTime(UUID raffleId) {
        Raffle raffle = load(raffleId);
        Instant now = clock.instant();

        if (raffle.getStatus() == RaffleStatus.SCHEDULED && raffle.hasStarted(now)) {
            apply(raffle, RaffleStatus.ACTIVE, now);
            raffle = load(raffleId);
        }
        if (raffle.getStatus() == RaffleStatus.ACTIVE && raffle.isWithinEndingWindow(now, endingThreshold)) {
            apply(raffle, RaffleStatus.ENDING, now);
            raffle = load(raffleId);
        }
        return raffle;
    }

    /**
     * Applies an explicit trigger. DRAW and COMPLETE belong to the draw and
     * are rejected here.
     *
     * @throws RaffleEngineException INVALID_STATUS_TRANSITION if the trigger
     *         does not apply to the stored status or its time condition is unmet
     */
    @Transactional
    public Raffle transition(UUID raffleId, TransitionTrigger trigger) {
        Raffle raffle = load(raffleId);
        Instant now = clock.instant();
        RaffleStatus target = trigger.getTarget();

        if (!raffle.canTransitionTo(target)) {
            throw RaffleEngineException.invalidTransition(raffleId, raffle.getStatus(), target,
                    "not allowed by the raffle lifecycle");
        }
        switch (trigger) {
            case START -> {
                if (!raffle.hasStarted(now)) {
                    throw RaffleEngineException.invalidTransition(raffleId, raffle.getStatus(), target,
                            "start time " + raffle.getStartTime() + " not reached");
                }
            }
            case ENDING_WINDOW -> {
                if (!raffle.isWithinEndingWindow(now, endingThreshold)) {
                    throw RaffleEngineException.invalidTransition(raffleId, raffle.getStatus(), target,
                            "more than " + endingThreshold + " before end time");
                }
            }
            case CANCEL -> {
                // allowed from any pre-drawing status
            }
            case DRAW, COMPLETE -> throw RaffleEngineException.invalidTransition(raffleId, raffle.getStatus(),
                    target, "only reachable through a draw request");
        }

        if (!apply(raffle, target, now)) {
            Raffle current = load(raffleId);
            throw RaffleEngineException.invalidTransition(raffleId, current.getStatus(), target,
                    "status changed concurrently");
        }
        if (target == RaffleStatus.CANCELLED) {
            statsAggregator.recordRaffleCancelled();
        }
        return load(raffleId);
    }

    /**
     * ending -> drawing, storing the seed. Single-flight: of two concurrent
     * callers exactly one gets the raffle back, the other an INVALID_STATUS_TRANSITION.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Raffle beginDrawing(Raffle raffle, String seed) {
        Instant now = clock.instant();
        if (!raffle.hasEnded(now)) {
            throw RaffleEngineException.invalidTransition(raffle.getId(), raffle.getStatus(), RaffleStatus.DRAWING,
                    "end time " + raffle.getEndTime() + " not reached");
        }
        if (raffleRepository.beginDrawing(raffle.getId(), seed, now) == 0) {
            Raffle current = load(raffle.getId());
            throw RaffleEngineException.invalidTransition(raffle.getId(), current.getStatus(), RaffleStatus.DRAWING,
                    "raffle is not ENDING, a draw may already be in progress");
        }
        recordTransition(raffle.getId(), RaffleStatus.ENDING, RaffleStatus.DRAWING, now);
        return load(raffle.getId());
    }

    /**
     * drawing -> completed, once winners are stored.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Raffle complete(UUID raffleId, int winners) {
        Instant now = clock.instant();
        if (raffleRepository.compareAndSetStatus(raffleId, RaffleStatus.DRAWING, RaffleStatus.COMPLETED, now) == 0) {
            Raffle current = load(raffleId);
            throw RaffleEngineException.invalidTransition(raffleId, current.getStatus(), RaffleStatus.COMPLETED,
                    "raffle is not DRAWING");
        }
        recordTransition(raffleId, RaffleStatus.DRAWING, RaffleStatus.COMPLETED, now);
        statsAggregator.recordRaffleCompleted(winners);
        return load(raffleId);
    }

    Duration getEndingThreshold() {
        return endingThreshold;
    }

    private boolean apply(Raffle raffle, RaffleStatus target, Instant now) {
        int updated = raffleRepository.compareAndSetStatus(raffle.getId(), raffle.getStatus(), target, now);
        if (updated == 0) {
            log.info("Transition lost to a concurrent change: raffleId={}, from={}, to={}",
                    raffle.getId(), raffle.getStatus(), target);
            return false;
        }
        recordTransition(raffle.getId(), raffle.getStatus(), target, now);
        return true;
    }

    private void recordTransition(UUID raffleId, RaffleStatus from, RaffleStatus to, Instant now) {
        outboxService.saveEvent(OutboxService.AGGREGATE_RAFFLE, RaffleStatusChangedEvent.of(raffleId, from, to, now));
        metrics.recordTransition(from.name(), to.name());
        log.info("Raffle transitioned: raffleId={}, from={}, to={}", raffleId, from, to);
    }

    private Raffle load(UUID raffleId) {
        return raffleRepository.findById(raffleId)
                .map(RaffleEntity::toDomain)
                .orElseThrow(() -> RaffleEngineException.raffleNotFound(raffleId));
    }
}
