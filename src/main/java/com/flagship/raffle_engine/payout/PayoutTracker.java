package com.flagship.raffle_engine.payout;

import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.draw.Winner;
import com.flagship.raffle_engine.draw.WinnerEntity;
import com.flagship.raffle_engine.draw.WinnerRepository;
import com.flagship.raffle_engine.event.PayoutRecordedEvent;
import com.flagship.raffle_engine.observability.CorrelationContext;
import com.flagship.raffle_engine.observability.RaffleMetrics;
import com.flagship.raffle_engine.outbox.OutboxService;
import com.flagship.raffle_engine.raffle.RaffleEntity;
import com.flagship.raffle_engine.raffle.RaffleRepository;
import com.flagship.raffle_engine.stats.StatsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Tracks payouts to winners.
 *
 * The engine never moves funds itself. An external payment collaborator
 * transfers the prize and reports the outcome here; this service records it.
 *
 * Key principles:
 * - one payout per winner, created PENDING in the draw transaction
 * - a PAID payout is never touched again
 * - each state write is a compare-and-set on (status, attempts), so two
 *   concurrent reports for the same payout cannot both apply
 * - paid totals and failed attempts flow into platform stats in the same transaction
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutTracker {

    private static final String UNKNOWN_ERROR = "unknown error";

    private final PayoutRepository payoutRepository;
    private final WinnerRepository winnerRepository;
    private final RaffleRepository raffleRepository;
    private final StatsAggregator statsAggregator;
    private final OutboxService outboxService;
    private final RaffleMetrics metrics;
    private final Clock clock;

    /**
     * Creates one PENDING payout per winner. Runs inside the draw transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Payout> createPendingPayouts(List<Winner> winners) {
        Instant now = clock.instant();
        List<PayoutEntity> entities = winners.stream()
                .map(winner -> PayoutEntity.fromDomain(Payout.createFor(winner, now)))
                .toList();
        List<Payout> payouts = payoutRepository.saveAll(entities).stream()
                .map(PayoutEntity::toDomain)
                .toList();
        log.debug("Created pending payouts: count={}", payouts.size());
        return payouts;
    }

    /**
     * Marks a payout as handed to the payment collaborator.
     * Valid from PENDING or FAILED; increments the attempt count.
     *
     * @throws RaffleEngineException PAYOUT_NOT_FOUND, PAYOUT_ALREADY_PROCESSED or
     *         INVALID_STATUS_TRANSITION
     */
    @Transactional
    public Payout markProcessing(UUID payoutId) {
        MDC.put(CorrelationContext.PAYOUT_ID_MDC_KEY, payoutId.toString());
        try {
            Payout payout = payoutRepository.findById(payoutId)
                    .map(PayoutEntity::toDomain)
                    .orElseThrow(() -> RaffleEngineException.payoutNotFound(payoutId.toString()));
            if (payout.isPaid()) {
                throw RaffleEngineException.payoutAlreadyProcessed(payoutId);
            }
            if (!payout.getStatus().canTransitionTo(PayoutStatus.PROCESSING)) {
                throw RaffleEngineException.invalidTransition(payoutId, payout.getStatus(),
                        PayoutStatus.PROCESSING, "payout attempt already in progress");
            }

            Payout processing = payout.startProcessing(clock.instant());
            write(payout, processing);
            log.info("Payout processing: attempt={}", processing.getAttempts());
            return processing;
        } finally {
            MDC.remove(CorrelationContext.PAYOUT_ID_MDC_KEY);
        }
    }

    /**
     * Records the collaborator's outcome for a winner's payout.
     *
     * A PENDING or FAILED payout is moved through PROCESSING first, so every
     * recorded outcome counts as one attempt.
     *
     * @throws RaffleEngineException WINNER_NOT_FOUND, PAYOUT_NOT_FOUND,
     *         PAYOUT_ALREADY_PROCESSED, VALIDATION_ERROR (success without a
     *         reference) or INVALID_STATUS_TRANSITION (lost a concurrent update)
     */
    @Transactional
    public Payout recordPayoutAttempt(UUID winnerId, PayoutOutcome outcome) {
        if (outcome == null) {
            throw RaffleEngineException.validation("outcome", "is required");
        }
        if (outcome.isSuccess() && (outcome.getPaymentReference() == null
                || outcome.getPaymentReference().isBlank())) {
            throw RaffleEngineException.validation("paymentReference", "is required for a successful payout");
        }

        Winner winner = winnerRepository.findById(winnerId)
                .map(WinnerEntity::toDomain)
                .orElseThrow(() -> RaffleEngineException.winnerNotFound(winnerId));
        Payout payout = payoutRepository.findByWinnerId(winnerId)
                .map(PayoutEntity::toDomain)
                .orElseThrow(() -> RaffleEngineException.payoutNotFound("winner " + winnerId));

        MDC.put(CorrelationContext.PAYOUT_ID_MDC_KEY, payout.getId().toString());
        MDC.put(CorrelationContext.RAFFLE_ID_MDC_KEY, payout.getRaffleId().toString());
        try {
            if (payout.isPaid()) {
                throw RaffleEngineException.payoutAlreadyProcessed(payout.getId());
            }
            if (payout.getAmount().compareTo(winner.getPrize()) != 0) {
                throw new IllegalStateException(String.format(
                        "Payout %s amount %s does not match winner prize %s",
                        payout.getId(), payout.getAmount(), winner.getPrize()));
            }

            Instant now = clock.instant();
            Payout inFlight = payout.getStatus() == PayoutStatus.PROCESSING
                    ? payout
                    : payout.startProcessing(now);
            Payout recorded = outcome.isSuccess()
                    ? inFlight.markPaid(outcome.getPaymentReference().trim(), now)
                    : inFlight.markFailed(failureReason(outcome), now);

            write(payout, recorded);

            if (recorded.isPaid()) {
                statsAggregator.recordPayoutPaid(recorded.getAmount());
            } else {
                statsAggregator.recordPayoutFailure();
            }
            outboxService.saveEvent(OutboxService.AGGREGATE_PAYOUT, PayoutRecordedEvent.fromPayout(recorded, now));
            metrics.recordPayoutAttempt(recorded.isPaid());

            if (recorded.isPaid()) {
                log.info("Payout paid: amount={}, wallet={}, reference={}, attempts={}",
                        recorded.getAmount(), recorded.getWalletAddress(),
                        recorded.getPaymentReference(), recorded.getAttempts());
            } else {
                log.warn("Payout attempt failed: amount={}, wallet={}, error={}, attempts={}",
                        recorded.getAmount(), recorded.getWalletAddress(),
                        recorded.getError(), recorded.getAttempts());
            }
            return recorded;
        } finally {
            MDC.remove(CorrelationContext.PAYOUT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.RAFFLE_ID_MDC_KEY);
        }
    }

    @Transactional(readOnly = true)
    public List<Payout> findByStatus(PayoutStatus status) {
        return payoutRepository.findByStatusOrderByCreatedAtAsc(status).stream()
                .map(PayoutEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Payout> getRafflePayouts(UUID raffleId) {
        return payoutRepository.findByRaffleIdOrderByCreatedAtAsc(raffleId).stream()
                .map(PayoutEntity::toDomain)
                .toList();
    }

    /**
     * Payout progress of a raffle, compared against its winner payout.
     */
    @Transactional(readOnly = true)
    public PayoutSummary getRaffleSummary(UUID raffleId) {
        RaffleEntity raffle = raffleRepository.findById(raffleId)
                .orElseThrow(() -> RaffleEngineException.raffleNotFound(raffleId));
        List<Payout> payouts = getRafflePayouts(raffleId);

        int pending = 0;
        int processing = 0;
        int paid = 0;
        int failed = 0;
        BigDecimal paidAmount = BigDecimal.ZERO;
        BigDecimal outstanding = BigDecimal.ZERO;
        for (Payout payout : payouts) {
            switch (payout.getStatus()) {
                case PENDING -> pending++;
                case PROCESSING -> processing++;
                case PAID -> paid++;
                case FAILED -> failed++;
            }
            if (payout.isPaid()) {
                paidAmount = paidAmount.add(payout.getAmount());
            } else {
                outstanding = outstanding.add(payout.getAmount());
            }
        }

        boolean fullyPaid = !payouts.isEmpty() && paid == payouts.size()
                && paidAmount.compareTo(raffle.getWinnerPayout()) == 0;
        return new PayoutSummary(raffleId, raffle.getWinnerPayout(), payouts.size(),
                pending, processing, paid, failed, paidAmount, outstanding, fullyPaid);
    }

    private void write(Payout observed, Payout next) {
        int updated = payoutRepository.compareAndSet(
                observed.getId(),
                observed.getStatus(),
                observed.getAttempts(),
                next.getStatus(),
                next.getPaymentReference(),
                next.getError(),
                next.getAttempts(),
                next.getProcessedAt(),
                next.getUpdatedAt());
        if (updated == 0) {
            Payout current = payoutRepository.findById(observed.getId())
                    .map(PayoutEntity::toDomain)
                    .orElseThrow(() -> RaffleEngineException.payoutNotFound(observed.getId().toString()));
            if (current.isPaid()) {
                throw RaffleEngineException.payoutAlreadyProcessed(current.getId());
            }
            throw RaffleEngineException.invalidTransition(observed.getId(), current.getStatus(), next.getStatus(),
                    "payout changed concurrently");
        }
    }

    private static String failureReason(PayoutOutcome outcome) {
        String error = outcome.getError();
        return error == null || error.isBlank() ? UNKNOWN_ERROR : error.trim();
    }
}
