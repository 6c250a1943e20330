package com.flagship.raffle_engine.engine;

import com.flagship.raffle_engine.common.EngineResult;
import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.draw.DrawOutcome;
import com.flagship.raffle_engine.draw.DrawService;
import com.flagship.raffle_engine.draw.DrawVerification;
import com.flagship.raffle_engine.draw.Winner;
import com.flagship.raffle_engine.entry.Entry;
import com.flagship.raffle_engine.entry.EntryEligibility;
import com.flagship.raffle_engine.entry.EntryLedger;
import com.flagship.raffle_engine.entry.EntrySubmission;
import com.flagship.raffle_engine.entry.SubmitEntryCommand;
import com.flagship.raffle_engine.observability.RaffleMetrics;
import com.flagship.raffle_engine.payout.Payout;
import com.flagship.raffle_engine.payout.PayoutOutcome;
import com.flagship.raffle_engine.payout.PayoutStatus;
import com.flagship.raffle_engine.payout.PayoutSummary;
import com.flagship.raffle_engine.payout.PayoutTracker;
import com.flagship.raffle_engine.raffle.CreateRaffleCommand;
import com.flagship.raffle_engine.raffle.Raffle;
import com.flagship.raffle_engine.raffle.RaffleService;
import com.flagship.raffle_engine.raffle.RaffleStateMachine;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import com.flagship.raffle_engine.raffle.TransitionTrigger;
import com.flagship.raffle_engine.stats.PlatformStats;
import com.flagship.raffle_engine.stats.StatsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Entry point for every caller of the engine: HTTP adapter, scheduler and
 * payment collaborator.
 *
 * Each operation returns an {@link EngineResult}. Rejections raised by the
 * services as {@link RaffleEngineException} become failures tagged with
 * their {@link com.flagship.raffle_engine.common.RaffleErrorCode}; anything
 * else (storage, broker) propagates so the caller can retry with the same
 * idempotent input.
 *
 * Not transactional itself: every delegated call commits or rolls back on
 * its own, which lets a lost unique-constraint race be answered from a
 * fresh transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RaffleEngine {

    private final RaffleService raffleService;
    private final RaffleStateMachine stateMachine;
    private final EntryLedger entryLedger;
    private final DrawService drawService;
    private final PayoutTracker payoutTracker;
    private final StatsAggregator statsAggregator;
    private final RaffleMetrics metrics;

    // Raffles

    /**
     * Creates a raffle in SCHEDULED status and immediately applies any
     * time-based transition that is already due.
     *
     * Creation and the first transition commit separately. Once the raffle is
     * stored the call succeeds: if the transition fails, the SCHEDULED raffle
     * is returned and the lifecycle scheduler starts it on its next tick.
     */
    public EngineResult<Raffle> createRaffle(CreateRaffleCommand command) {
        return execute("createRaffle", () -> {
            Raffle created = raffleService.createRaffle(command);
            try {
                return stateMachine.advanceTime(created.getId());
            } catch (RuntimeException e) {
                log.error("Raffle created but initial transition failed, left to the scheduler: raffleId={}, status={}",
                        created.getId(), created.getStatus(), e);
                return created;
            }
        });
    }

    public EngineResult<Raffle> getRaffle(UUID raffleId) {
        return execute("getRaffle", () -> raffleService.getRaffle(raffleId));
    }

    public EngineResult<List<Raffle>> findRaffles(RaffleStatus status) {
        return execute("findRaffles", () -> raffleService.findByStatus(status));
    }

    public EngineResult<Raffle> cancelRaffle(UUID raffleId) {
        return execute("cancelRaffle", () -> stateMachine.transition(raffleId, TransitionTrigger.CANCEL));
    }

    public EngineResult<Raffle> advanceTime(UUID raffleId) {
        return execute("advanceTime", () -> stateMachine.advanceTime(raffleId));
    }

    /**
     * Applies an explicit trigger. DRAW runs a full draw with a fresh seed;
     * COMPLETE is never accepted from outside.
     */
    public EngineResult<Raffle> tryTransition(UUID raffleId, TransitionTrigger trigger) {
        if (trigger == TransitionTrigger.DRAW) {
            return requestDraw(raffleId, null).map(DrawOutcome::getRaffle);
        }
        return execute("tryTransition", () -> stateMachine.transition(raffleId, trigger));
    }

    // Draw

    /**
     * @param seedOverride administrative seed; null to take one from the seed source
     */
    public EngineResult<DrawOutcome> requestDraw(UUID raffleId, String seedOverride) {
        return execute("requestDraw", () -> drawService.requestDraw(raffleId, seedOverride));
    }

    public EngineResult<DrawVerification> verifyDraw(UUID raffleId) {
        return execute("verifyDraw", () -> drawService.verifyDraw(raffleId));
    }

    public EngineResult<List<Winner>> getWinners(UUID raffleId) {
        return execute("getWinners", () -> {
            raffleService.getRaffle(raffleId);
            return drawService.getWinners(raffleId);
        });
    }

    public EngineResult<List<Winner>> getWalletWins(String walletAddress) {
        return execute("getWalletWins", () -> drawService.getWalletWins(walletAddress));
    }

    // Entries

    /**
     * Records a paid entry. A repeated payment reference returns the original
     * entry flagged as a duplicate, including when two submissions race and
     * this one loses on the unique constraint.
     */
    public EngineResult<EntrySubmission> submitEntry(SubmitEntryCommand command) {
        return execute("submitEntry", () -> {
            try {
                return entryLedger.submitEntry(command);
            } catch (DataIntegrityViolationException e) {
                Optional<Entry> original = entryLedger.findByPaymentReference(command.getPaymentReference());
                if (original.isEmpty()) {
                    throw e;
                }
                metrics.recordIdempotencyHit();
                log.info("Concurrent submission with the same payment reference, returning original entry: "
                        + "entryId={}, reference={}", original.get().getId(), command.getPaymentReference());
                return new EntrySubmission(original.get(), true);
            }
        });
    }

    public EngineResult<EntryEligibility> checkEligibility(UUID raffleId, String walletAddress, int numEntries) {
        return execute("checkEligibility",
                () -> entryLedger.validateEntryEligibility(raffleId, walletAddress, numEntries));
    }

    public EngineResult<List<Entry>> getEntries(UUID raffleId) {
        return execute("getEntries", () -> {
            raffleService.getRaffle(raffleId);
            return entryLedger.getEntries(raffleId);
        });
    }

    public EngineResult<List<Entry>> getWalletEntries(String walletAddress) {
        return execute("getWalletEntries", () -> entryLedger.getWalletEntries(walletAddress));
    }

    // Payouts

    public EngineResult<Payout> markPayoutProcessing(UUID payoutId) {
        return execute("markPayoutProcessing", () -> payoutTracker.markProcessing(payoutId));
    }

    public EngineResult<Payout> recordPayoutAttempt(UUID winnerId, PayoutOutcome outcome) {
        return execute("recordPayoutAttempt", () -> payoutTracker.recordPayoutAttempt(winnerId, outcome));
    }

    public EngineResult<PayoutSummary> getPayoutSummary(UUID raffleId) {
        return execute("getPayoutSummary", () -> payoutTracker.getRaffleSummary(raffleId));
    }

    public EngineResult<List<Payout>> findPayoutsByStatus(PayoutStatus status) {
        return execute("findPayoutsByStatus", () -> payoutTracker.findByStatus(status));
    }

    public EngineResult<PlatformStats> getPlatformStats() {
        return execute("getPlatformStats", statsAggregator::getStats);
    }

    private <T> EngineResult<T> execute(String operation, Supplier<T> action) {
        long startTime = System.currentTimeMillis();
        try {
            return EngineResult.success(action.get());
        } catch (RaffleEngineException e) {
            metrics.recordRejection(operation, e.getCode().name());
            log.warn("Engine operation rejected: operation={}, code={}, message={}",
                    operation, e.getCode(), e.getMessage());
            return EngineResult.failure(e);
        } finally {
            metrics.recordLatency(operation, System.currentTimeMillis() - startTime);
        }
    }
}
