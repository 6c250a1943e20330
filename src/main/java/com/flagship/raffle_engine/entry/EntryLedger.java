package com.flagship.raffle_engine.entry;

import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.common.RaffleErrorCode;
import com.flagship.raffle_engine.common.WalletAddresses;
import com.flagship.raffle_engine.event.EntrySubmittedEvent;
import com.flagship.raffle_engine.observability.CorrelationContext;
import com.flagship.raffle_engine.observability.RaffleMetrics;
import com.flagship.raffle_engine.outbox.OutboxService;
import com.flagship.raffle_engine.raffle.Raffle;
import com.flagship.raffle_engine.raffle.RaffleEntity;
import com.flagship.raffle_engine.raffle.RaffleRepository;
import com.flagship.raffle_engine.stats.StatsAggregator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Records paid entries against raffles.
 *
 * submitEntry runs as one transaction:
 * 1. Return the original entry if the payment reference was seen before
 * 2. Validate status, end time, payment amount and the per-wallet cap
 * 3. Insert the entry (payment_reference is unique)
 * 4. Add the tickets to the wallet's running total, capped in the same statement
 * 5. Add tickets, pool, fee split and participant count to the raffle in one statement
 * 6. Bump platform stats and write EntrySubmitted to the outbox
 *
 * Any rejection after step 3 rolls the whole entry back. Two concurrent
 * submissions with the same reference race on the unique constraint; the
 * loser's failure is turned into a duplicate answer by the engine facade.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntryLedger {

    private final RaffleRepository raffleRepository;
    private final EntryRepository entryRepository;
    private final RaffleCounterRepository counterRepository;
    private final EntryIdempotencyService idempotencyService;
    private final StatsAggregator statsAggregator;
    private final OutboxService outboxService;
    private final RaffleMetrics metrics;
    private final Clock clock;

    @Value("${raffle.entry.max-tickets-per-purchase:10000}")
    private int maxTicketsPerPurchase;

    @Transactional
    public EntrySubmission submitEntry(SubmitEntryCommand command) {
        MDC.put(CorrelationContext.RAFFLE_ID_MDC_KEY, String.valueOf(command.getRaffleId()));
        try {
            String wallet = validateCommand(command);

            Optional<Entry> existing = findExisting(command.getPaymentReference());
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Payment reference already used, returning original entry: entryId={}, reference={}",
                        existing.get().getId(), command.getPaymentReference());
                return new EntrySubmission(existing.get(), true);
            }
            metrics.recordIdempotencyMiss();

            Instant now = clock.instant();
            Raffle raffle = loadRaffle(command.getRaffleId());
            checkAcceptingEntries(raffle, now);
            checkPayment(raffle, command.getNumEntries(), command.getTotalPaid());
            if (command.getNumEntries() > raffle.getMaxEntriesPerUser()) {
                throw RaffleEngineException.maxEntriesExceeded(
                        counterRepository.walletEntries(raffle.getId(), wallet),
                        command.getNumEntries(), raffle.getMaxEntriesPerUser());
            }

            Entry entry = Entry.create(raffle.getId(), wallet, command.getNumEntries(),
                    command.getTotalPaid(), command.getPaymentReference(), now);
            EntryEntity saved = entryRepository.saveAndFlush(EntryEntity.fromDomain(entry));

            boolean newParticipant = counterRepository
                    .reserveWalletEntries(raffle.getId(), wallet, command.getNumEntries(), raffle.getMaxEntriesPerUser())
                    .orElseThrow(() -> RaffleEngineException.maxEntriesExceeded(
                            counterRepository.walletEntries(raffle.getId(), wallet),
                            command.getNumEntries(), raffle.getMaxEntriesPerUser()));

            EntryCounterUpdate update = counterRepository
                    .applyEntry(raffle.getId(), command.getNumEntries(), command.getTotalPaid(), newParticipant, now)
                    .orElseThrow(() -> RaffleEngineException.raffleNotActive(
                            raffle.getId(), "closed before the entry was recorded"));

            statsAggregator.recordEntry(command.getNumEntries(), update.revenueDelta(), newParticipant);

            Entry stored = saved.toDomain();
            outboxService.saveEvent(OutboxService.AGGREGATE_RAFFLE,
                    EntrySubmittedEvent.fromEntry(stored, newParticipant, now));
            rememberAfterCommit(stored);

            metrics.recordEntryAccepted(command.getNumEntries());
            log.info("Entry accepted: entryId={}, wallet={}, tickets={}, paid={}, newParticipant={}",
                    stored.getId(), wallet, command.getNumEntries(), command.getTotalPaid(), newParticipant);

            return new EntrySubmission(stored, false);
        } finally {
            MDC.remove(CorrelationContext.RAFFLE_ID_MDC_KEY);
        }
    }

    /**
     * Read-only pre-check of what submitEntry would decide for this wallet right now.
     */
    @Transactional(readOnly = true)
    public EntryEligibility validateEntryEligibility(UUID raffleId, String walletAddress, int numEntries) {
        String wallet = WalletAddresses.normalize(walletAddress);
        Raffle raffle = loadRaffle(raffleId);
        BigDecimal required = raffle.getEntryPrice().multiply(BigDecimal.valueOf(Math.max(numEntries, 0)));
        long current = counterRepository.walletEntries(raffleId, wallet);
        long remaining = Math.max(0, raffle.getMaxEntriesPerUser() - current);

        if (!raffle.isAcceptingEntries(clock.instant())) {
            return EntryEligibility.rejected(RaffleErrorCode.RAFFLE_NOT_ACTIVE,
                    "Raffle is " + raffle.getStatus() + " and not accepting entries", current, remaining, required);
        }
        if (numEntries <= 0 || numEntries > maxTicketsPerPurchase) {
            return EntryEligibility.rejected(RaffleErrorCode.INVALID_ENTRY,
                    "numEntries must be between 1 and " + maxTicketsPerPurchase, current, remaining, required);
        }
        if (numEntries > remaining) {
            return EntryEligibility.rejected(RaffleErrorCode.MAX_ENTRIES_EXCEEDED,
                    "Only " + remaining + " more entries allowed for this wallet", current, remaining, required);
        }
        return EntryEligibility.eligible(current, remaining, required);
    }

    @Transactional(readOnly = true)
    public Optional<Entry> findByPaymentReference(String paymentReference) {
        return entryRepository.findByPaymentReference(paymentReference).map(EntryEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Entry> getEntries(UUID raffleId) {
        loadRaffle(raffleId);
        return entryRepository.findByRaffleIdOrderBySequenceNumberAsc(raffleId).stream()
                .map(EntryEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<Entry> getWalletEntries(String walletAddress) {
        return entryRepository.findByWalletAddressOrderByCreatedAtDesc(WalletAddresses.normalize(walletAddress))
                .stream()
                .map(EntryEntity::toDomain)
                .toList();
    }

    private String validateCommand(SubmitEntryCommand command) {
        if (command.getPaymentReference() == null || command.getPaymentReference().isBlank()) {
            throw RaffleEngineException.invalidEntry("payment reference is required");
        }
        if (command.getNumEntries() <= 0) {
            throw RaffleEngineException.invalidEntry("numEntries must be positive, got " + command.getNumEntries());
        }
        if (command.getNumEntries() > maxTicketsPerPurchase) {
            throw RaffleEngineException.invalidEntry(
                    "at most " + maxTicketsPerPurchase + " tickets per purchase, got " + command.getNumEntries());
        }
        if (command.getTotalPaid() == null || command.getTotalPaid().signum() <= 0) {
            throw RaffleEngineException.invalidEntry("totalPaid must be positive");
        }
        return WalletAddresses.normalize(command.getWalletAddress());
    }

    private Optional<Entry> findExisting(String paymentReference) {
        Optional<UUID> entryId = idempotencyService.findEntryId(paymentReference);
        if (entryId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Entry> entry = entryRepository.findById(entryId.get()).map(EntryEntity::toDomain);
        if (entry.isEmpty()) {
            log.warn("Cached payment reference {} points at missing entry {}, treating as new",
                    paymentReference, entryId.get());
        }
        return entry;
    }

    private Raffle loadRaffle(UUID raffleId) {
        return raffleRepository.findById(raffleId)
                .map(RaffleEntity::toDomain)
                .orElseThrow(() -> RaffleEngineException.raffleNotFound(raffleId));
    }

    private void checkAcceptingEntries(Raffle raffle, Instant now) {
        if (!raffle.getStatus().acceptsEntries()) {
            throw RaffleEngineException.raffleNotActive(raffle.getId(), "status is " + raffle.getStatus());
        }
        if (raffle.hasEnded(now)) {
            throw RaffleEngineException.raffleNotActive(raffle.getId(), "ended at " + raffle.getEndTime());
        }
    }

    private void checkPayment(Raffle raffle, int numEntries, BigDecimal totalPaid) {
        BigDecimal expected = raffle.getEntryPrice().multiply(BigDecimal.valueOf(numEntries));
        if (totalPaid.compareTo(expected) != 0) {
            throw RaffleEngineException.invalidEntry(String.format(
                    "paid %s for %d tickets at %s each, expected %s",
                    totalPaid.toPlainString(), numEntries, raffle.getEntryPrice().toPlainString(),
                    expected.toPlainString()));
        }
    }

    private void rememberAfterCommit(Entry entry) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyService.remember(entry.getPaymentReference(), entry.getId());
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.remember(entry.getPaymentReference(), entry.getId());
            }
        });
    }
}
