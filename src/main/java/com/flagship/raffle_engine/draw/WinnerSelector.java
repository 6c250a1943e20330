package com.flagship.raffle_engine.draw;

import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.common.RaffleErrorCode;
import com.flagship.raffle_engine.prize.PrizePoolCalculator;
import com.flagship.raffle_engine.prize.TierAllocation;
import com.flagship.raffle_engine.raffle.PrizeTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Ticket-weighted winner selection without replacement.
 *
 * Algorithm:
 * 1. Number tickets 1..N in entry arrival order ({@link TicketIndex})
 * 2. Walk tiers largest share first, one pick per configured slot
 * 3. Each pick takes the next value of the seeded {@link DrawSequence} modulo the
 *    remaining ticket count and maps it to the owning wallet
 * 4. Remove every ticket of that wallet so it cannot win again
 * 5. Stop early when no tickets remain; the slots left are reported as unfilled
 *
 * The first winner of the top tier also receives the rounding remainder,
 * which makes the prizes sum to exactly the winner payout.
 *
 * Same seed and same ordered entries always give the same winners.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WinnerSelector {

    private final PrizePoolCalculator calculator;

    public SelectionResult select(List<EntrySnapshot> entries, String seed,
                                  BigDecimal winnerPayout, List<PrizeTier> tiers) {
        return select(entries, new Sha256DrawSequence(seed), seed, winnerPayout, tiers);
    }

    /**
     * @throws RaffleEngineException NO_ENTRIES_FOR_DRAW if there is nothing to draw from
     */
    public SelectionResult select(List<EntrySnapshot> entries, DrawSequence sequence, String seed,
                                  BigDecimal winnerPayout, List<PrizeTier> tiers) {
        if (entries.isEmpty()) {
            throw new RaffleEngineException(RaffleErrorCode.NO_ENTRIES_FOR_DRAW, "No entries to draw from");
        }

        TicketIndex index = TicketIndex.build(entries);
        List<TierAllocation> allocations = calculator.allocate(winnerPayout, tiers);
        int configuredSlots = tiers.stream().mapToInt(PrizeTier::getWinnerCount).sum();

        List<SelectedWinner> winners = new ArrayList<>(configuredSlots);
        BigDecimal distributed = BigDecimal.ZERO;

        for (TierAllocation allocation : allocations) {
            for (int slot = 0; slot < allocation.getTier().getWinnerCount() && !index.isEmpty(); slot++) {
                long k = sequence.nextIndex(index.remainingTickets());
                DrawnTicket ticket = index.resolve(k);
                String wallet = ticket.getRange().getWalletAddress();
                index.removeWallet(wallet);

                winners.add(new SelectedWinner(
                    winners.size() + 1,
                    allocation.getTier().getName(),
                    ticket.getTicketNumber(),
                    wallet,
                    ticket.getRange().getEntryId(),
                    allocation.getAmountPerWinner()
                ));
                distributed = distributed.add(allocation.getAmountPerWinner());
            }
        }

        BigDecimal remainder = calculator.remainder(winnerPayout, distributed);
        if (remainder.signum() != 0) {
            SelectedWinner first = winners.get(0);
            winners.set(0, new SelectedWinner(
                first.getPosition(),
                first.getTier(),
                first.getTicketNumber(),
                first.getWalletAddress(),
                first.getEntryId(),
                first.getPrize().add(remainder)
            ));
        }

        int unfilled = configuredSlots - winners.size();
        if (unfilled > 0) {
            log.info("Draw ran out of distinct wallets: filled={}, unfilled={}, remainderToFirst={}",
                    winners.size(), unfilled, remainder);
        }

        return new SelectionResult(seed, index.totalTickets(), winnerPayout, List.copyOf(winners), unfilled);
    }
}
