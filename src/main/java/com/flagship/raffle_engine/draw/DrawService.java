package com.flagship.raffle_engine.draw;

import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.common.WalletAddresses;
import com.flagship.raffle_engine.entry.EntryEntity;
import com.flagship.raffle_engine.entry.EntryRepository;
import com.flagship.raffle_engine.entry.EntryStatus;
import com.flagship.raffle_engine.event.RaffleDrawnEvent;
import com.flagship.raffle_engine.observability.CorrelationContext;
import com.flagship.raffle_engine.observability.RaffleMetrics;
import com.flagship.raffle_engine.outbox.OutboxService;
import com.flagship.raffle_engine.payout.PayoutTracker;
import com.flagship.raffle_engine.prize.PoolSplit;
import com.flagship.raffle_engine.prize.PrizePoolCalculator;
import com.flagship.raffle_engine.raffle.Raffle;
import com.flagship.raffle_engine.raffle.RaffleEntity;
import com.flagship.raffle_engine.raffle.RaffleRepository;
import com.flagship.raffle_engine.raffle.RaffleStateMachine;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs raffle draws.
 *
 * A draw is one transaction:
 * 1. ending -> drawing, storing the seed (compare-and-set, so only one caller wins)
 * 2. snapshot confirmed entries in arrival order
 * 3. select winners and split the winner payout
 * 4. store winners and their PENDING payouts
 * 5. drawing -> completed, plus a RaffleDrawn event in the outbox
 *
 * The status update in step 1 holds the raffle row lock until commit, so no
 * entry can change the counters between the snapshot and the result. Any
 * failure rolls the raffle back to ENDING with no seed, ready for a retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DrawService {

    private final RaffleRepository raffleRepository;
    private final EntryRepository entryRepository;
    private final WinnerRepository winnerRepository;
    private final RaffleStateMachine stateMachine;
    private final WinnerSelector winnerSelector;
    private final PrizePoolCalculator calculator;
    private final RandomSeedSource seedSource;
    private final PayoutTracker payoutTracker;
    private final OutboxService outboxService;
    private final RaffleMetrics metrics;
    private final Clock clock;

    /**
     * Draws winners for a raffle whose end time has passed.
     *
     * @param seedOverride seed to use instead of a fresh one from the seed source; may be null
     * @throws RaffleEngineException RAFFLE_NOT_FOUND, INVALID_STATUS_TRANSITION
     *         (not ENDING, end time not reached, or another draw won the race)
     *         or NO_ENTRIES_FOR_DRAW
     */
    @Transactional
    public DrawOutcome requestDraw(UUID raffleId, String seedOverride) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.RAFFLE_ID_MDC_KEY, raffleId.toString());

        try {
            Raffle raffle = load(raffleId);
            Instant now = clock.instant();

            if (raffle.getStatus() == RaffleStatus.ACTIVE && raffle.hasEnded(now)) {
                raffle = stateMachine.advanceTime(raffleId);
            }
            if (raffle.getStatus() != RaffleStatus.ENDING) {
                throw RaffleEngineException.invalidTransition(raffleId, raffle.getStatus(), RaffleStatus.DRAWING,
                        "only an ENDING raffle can be drawn");
            }
            if (raffle.getTotalEntries() == 0) {
                throw RaffleEngineException.noEntriesForDraw(raffleId);
            }

            String seed = seedOverride != null && !seedOverride.isBlank()
                    ? seedOverride.trim()
                    : seedSource.nextSeed(raffleId);
            Raffle drawing = stateMachine.beginDrawing(raffle, seed);

            List<EntrySnapshot> snapshot = snapshot(raffleId);
            checkConsistency(drawing, snapshot);

            SelectionResult result = winnerSelector.select(
                    snapshot, seed, drawing.getWinnerPayout(), drawing.getPrizeTiers());
            if (result.totalPrizes().compareTo(drawing.getWinnerPayout()) != 0) {
                throw new IllegalStateException(String.format(
                        "Prizes %s do not add up to winner payout %s for raffle %s",
                        result.totalPrizes(), drawing.getWinnerPayout(), raffleId));
            }

            Instant drawnAt = clock.instant();
            List<Winner> winners = result.getWinners().stream()
                    .map(selected -> Winner.fromSelection(raffleId, selected, result.getTotalTickets(), drawnAt))
                    .toList();
            winnerRepository.saveAll(winners.stream().map(WinnerEntity::fromDomain).toList());
            payoutTracker.createPendingPayouts(winners);

            Raffle completed = stateMachine.complete(raffleId, winners.size());
            outboxService.saveEvent(OutboxService.AGGREGATE_RAFFLE, RaffleDrawnEvent.of(
                    raffleId, seed, result.getTotalTickets(), drawing.getWinnerPayout(),
                    result.getUnfilledSlots(), winners, drawnAt));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordDrawCompleted(winners.size(), Duration.ofMillis(duration));
            log.info("Draw completed: totalTickets={}, winners={}, unfilledSlots={}, winnerPayout={}, duration={}ms",
                    result.getTotalTickets(), winners.size(), result.getUnfilledSlots(),
                    drawing.getWinnerPayout(), duration);

            return new DrawOutcome(completed, winners, result.getTotalTickets(), result.getUnfilledSlots());

        } catch (RuntimeException e) {
            log.warn("Draw failed: error={}, duration={}ms", e.getMessage(), System.currentTimeMillis() - startTime);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.RAFFLE_ID_MDC_KEY);
        }
    }

    /**
     * Replays a completed draw from its stored seed and the confirmed entries,
     * and compares the result with the stored winners.
     */
    @Transactional(readOnly = true)
    public DrawVerification verifyDraw(UUID raffleId) {
        Raffle raffle = load(raffleId);
        if (raffle.getStatus() != RaffleStatus.COMPLETED || !raffle.isDrawn()) {
            throw RaffleEngineException.invalidTransition(raffleId, raffle.getStatus(), RaffleStatus.COMPLETED,
                    "raffle has not been drawn");
        }

        List<Winner> stored = getWinners(raffleId);
        SelectionResult replay = winnerSelector.select(
                snapshot(raffleId), raffle.getRandomSeed(), raffle.getWinnerPayout(), raffle.getPrizeTiers());

        List<String> mismatches = new ArrayList<>();
        if (replay.getWinners().size() != stored.size()) {
            mismatches.add(String.format("winner count: stored %d, replayed %d",
                    stored.size(), replay.getWinners().size()));
        }
        int compared = Math.min(stored.size(), replay.getWinners().size());
        for (int i = 0; i < compared; i++) {
            Winner s = stored.get(i);
            SelectedWinner r = replay.getWinners().get(i);
            if (!s.getWalletAddress().equals(r.getWalletAddress())
                    || s.getTicketNumber() != r.getTicketNumber()
                    || !s.getTier().equals(r.getTier())
                    || s.getPrize().compareTo(r.getPrize()) != 0) {
                mismatches.add(String.format(
                        "position %d: stored %s/#%d/%s/%s, replayed %s/#%d/%s/%s",
                        s.getPosition(),
                        s.getWalletAddress(), s.getTicketNumber(), s.getTier(), s.getPrize(),
                        r.getWalletAddress(), r.getTicketNumber(), r.getTier(), r.getPrize()));
            }
        }

        if (!mismatches.isEmpty()) {
            log.error("Draw replay mismatch: raffleId={}, mismatches={}", raffleId, mismatches);
        }
        return new DrawVerification(raffleId, raffle.getRandomSeed(), replay.getTotalTickets(),
                stored.size(), mismatches.isEmpty(), List.copyOf(mismatches));
    }

    @Transactional(readOnly = true)
    public List<Winner> getWinners(UUID raffleId) {
        return winnerRepository.findByRaffleIdOrderByPositionAsc(raffleId).stream()
                .map(WinnerEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Winner> getWalletWins(String walletAddress) {
        return winnerRepository.findByWalletAddressOrderByCreatedAtDesc(WalletAddresses.normalize(walletAddress))
                .stream()
                .map(WinnerEntity::toDomain)
                .toList();
    }

    private List<EntrySnapshot> snapshot(UUID raffleId) {
        return entryRepository.findByRaffleIdAndStatusOrderBySequenceNumberAsc(raffleId, EntryStatus.CONFIRMED)
                .stream()
                .map(EntryEntity::toDomain)
                .map(entry -> new EntrySnapshot(entry.getId(), entry.getWalletAddress(), entry.getNumEntries()))
                .toList();
    }

    /**
     * The stored counters must agree with the entries and with a fresh pool split.
     */
    private void checkConsistency(Raffle raffle, List<EntrySnapshot> snapshot) {
        long tickets = snapshot.stream().mapToLong(EntrySnapshot::getNumEntries).sum();
        if (tickets != raffle.getTotalEntries()) {
            throw new IllegalStateException(String.format(
                    "Raffle %s counts %d entries but snapshot holds %d tickets",
                    raffle.getId(), raffle.getTotalEntries(), tickets));
        }
        PoolSplit expected = calculator.split(
                calculator.prizePool(raffle.getEntryPrice(), raffle.getTotalEntries()),
                raffle.getPlatformFeePercent());
        if (expected.getPrizePool().compareTo(raffle.getPrizePool()) != 0
                || expected.getProtocolFee().compareTo(raffle.getProtocolFee()) != 0
                || expected.getWinnerPayout().compareTo(raffle.getWinnerPayout()) != 0) {
            throw new IllegalStateException(String.format(
                    "Raffle %s pool split %s/%s/%s differs from recomputed %s/%s/%s",
                    raffle.getId(), raffle.getPrizePool(), raffle.getProtocolFee(), raffle.getWinnerPayout(),
                    expected.getPrizePool(), expected.getProtocolFee(), expected.getWinnerPayout()));
        }
    }

    private Raffle load(UUID raffleId) {
        return raffleRepository.findById(raffleId)
                .map(RaffleEntity::toDomain)
                .orElseThrow(() -> RaffleEngineException.raffleNotFound(raffleId));
    }
}
