package com.flagship.raffle_engine.draw;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TicketIndexTest {

    private static final String WALLET_A = "0x" + "a".repeat(40);
    private static final String WALLET_B = "0x" + "b".repeat(40);
    private static final String WALLET_C = "0x" + "c".repeat(40);

    private static EntrySnapshot entry(String wallet, int tickets) {
        return new EntrySnapshot(UUID.randomUUID(), wallet, tickets);
    }

    @Test
    @DisplayName("Tickets are numbered from 1 in arrival order")
    void testNumbering() {
        TicketIndex index = TicketIndex.build(List.of(entry(WALLET_A, 10), entry(WALLET_B, 5)));

        assertEquals(15, index.totalTickets());
        assertEquals(1, index.resolve(0).getTicketNumber());
        assertEquals(WALLET_A, index.resolve(9).getRange().getWalletAddress());
        assertEquals(11, index.resolve(10).getTicketNumber());
        assertEquals(WALLET_B, index.resolve(14).getRange().getWalletAddress());
    }

    @Test
    @DisplayName("Removing a wallet drops all of its blocks and keeps original ticket numbers")
    void testRemoveWallet() {
        TicketIndex index = TicketIndex.build(List.of(
                entry(WALLET_A, 3), entry(WALLET_B, 2), entry(WALLET_A, 4), entry(WALLET_C, 1)));

        long removed = index.removeWallet(WALLET_A);

        assertEquals(7, removed);
        assertEquals(3, index.remainingTickets());
        assertEquals(10, index.totalTickets());
        assertEquals(4, index.resolve(0).getTicketNumber());
        assertEquals(5, index.resolve(1).getTicketNumber());
        assertEquals(10, index.resolve(2).getTicketNumber());
        assertEquals(WALLET_C, index.resolve(2).getRange().getWalletAddress());
    }

    @Test
    @DisplayName("Offsets outside the remaining tickets are rejected")
    void testResolveOutOfRange() {
        TicketIndex index = TicketIndex.build(List.of(entry(WALLET_A, 2)));

        assertThrows(IndexOutOfBoundsException.class, () -> index.resolve(2));
        assertThrows(IndexOutOfBoundsException.class, () -> index.resolve(-1));

        index.removeWallet(WALLET_A);
        assertTrue(index.isEmpty());
    }

    @Test
    @DisplayName("An entry without tickets cannot be indexed")
    void testRejectsEmptyEntry() {
        assertThrows(IllegalArgumentException.class,
                () -> TicketIndex.build(List.of(entry(WALLET_A, 0))));
    }
}
