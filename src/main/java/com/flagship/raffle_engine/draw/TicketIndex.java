package com.flagship.raffle_engine.draw;

import java.util.ArrayList;
import java.util.List;

/**
 * Ticket numbering for a draw.
 *
 * Tickets are numbered from 1 in entry arrival order, so an entry of n tickets
 * owns a contiguous block of n numbers. Once a wallet wins, all of its blocks
 * are removed and later picks index only the remaining tickets.
 *
 * Not thread-safe; one instance belongs to one draw.
 */
public final class TicketIndex {

    private final List<TicketRange> alive;
    private final long totalTickets;
    private long remainingTickets;

    private TicketIndex(List<TicketRange> ranges, long totalTickets) {
        this.alive = ranges;
        this.totalTickets = totalTickets;
        this.remainingTickets = totalTickets;
    }

    public static TicketIndex build(List<EntrySnapshot> entries) {
        List<TicketRange> ranges = new ArrayList<>(entries.size());
        long next = 1;
        for (EntrySnapshot entry : entries) {
            if (entry.getNumEntries() <= 0) {
                throw new IllegalArgumentException("Entry " + entry.getEntryId() + " has no tickets");
            }
            long end = next + entry.getNumEntries() - 1;
            ranges.add(new TicketRange(next, end, entry.getWalletAddress(), entry.getEntryId()));
            next = end + 1;
        }
        return new TicketIndex(ranges, next - 1);
    }

    public long totalTickets() {
        return totalTickets;
    }

    public long remainingTickets() {
        return remainingTickets;
    }

    public boolean isEmpty() {
        return remainingTickets == 0;
    }

    /**
     * Resolves the k-th remaining ticket (0-based) to its number and owner.
     *
     * @throws IndexOutOfBoundsException if k is outside [0, remainingTickets)
     */
    public DrawnTicket resolve(long k) {
        if (k < 0 || k >= remainingTickets) {
            throw new IndexOutOfBoundsException("Ticket offset " + k + " outside 0.." + remainingTickets);
        }
        long offset = k;
        for (TicketRange range : alive) {
            if (offset < range.size()) {
                return new DrawnTicket(range.getStart() + offset, range);
            }
            offset -= range.size();
        }
        throw new IllegalStateException("Remaining ticket count out of sync with ranges");
    }

    /**
     * Removes every block owned by the wallet.
     *
     * @return number of tickets removed
     */
    public long removeWallet(String walletAddress) {
        long removed = 0;
        var it = alive.iterator();
        while (it.hasNext()) {
            TicketRange range = it.next();
            if (range.getWalletAddress().equals(walletAddress)) {
                removed += range.size();
                it.remove();
            }
        }
        remainingTickets -= removed;
        return removed;
    }
}
