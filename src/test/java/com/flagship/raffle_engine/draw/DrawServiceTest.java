package com.flagship.raffle_engine.draw;

import com.flagship.raffle_engine.common.RaffleEngineException;
import com.flagship.raffle_engine.common.RaffleErrorCode;
import com.flagship.raffle_engine.entry.EntryEntity;
import com.flagship.raffle_engine.entry.EntryFixtures;
import com.flagship.raffle_engine.entry.EntryRepository;
import com.flagship.raffle_engine.entry.EntryStatus;
import com.flagship.raffle_engine.event.RaffleDrawnEvent;
import com.flagship.raffle_engine.observability.RaffleMetrics;
import com.flagship.raffle_engine.outbox.OutboxService;
import com.flagship.raffle_engine.payout.PayoutTracker;
import com.flagship.raffle_engine.prize.PrizePoolCalculator;
import com.flagship.raffle_engine.raffle.Raffle;
import com.flagship.raffle_engine.raffle.RaffleFixtures;
import com.flagship.raffle_engine.raffle.RaffleRepository;
import com.flagship.raffle_engine.raffle.RaffleStateMachine;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Draw orchestration with real selection and mocked storage.
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DrawServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final String WALLET_A = "0x" + "a".repeat(40);
    private static final String WALLET_B = "0x" + "b".repeat(40);

    @Mock
    private RaffleRepository raffleRepository;
    @Mock
    private EntryRepository entryRepository;
    @Mock
    private WinnerRepository winnerRepository;
    @Mock
    private RaffleStateMachine stateMachine;
    @Mock
    private RandomSeedSource seedSource;
    @Mock
    private PayoutTracker payoutTracker;
    @Mock
    private OutboxService outboxService;
    @Mock
    private RaffleMetrics metrics;

    @Captor
    private ArgumentCaptor<List<WinnerEntity>> savedWinners;

    private DrawService drawService;
    private UUID raffleId;
    private Instant start;
    private Instant end;

    @BeforeEach
    void setUp() {
        PrizePoolCalculator calculator = new PrizePoolCalculator();
        drawService = new DrawService(raffleRepository, entryRepository, winnerRepository, stateMachine,
                new WinnerSelector(calculator), calculator, seedSource, payoutTracker, outboxService, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
        raffleId = UUID.randomUUID();
        start = NOW.minusSeconds(7200);
        end = NOW.minusSeconds(60);
    }

    private Raffle raffle(RaffleStatus status, long totalEntries, String seed) {
        return RaffleFixtures.raffle(raffleId, status, start, end, totalEntries, 2, seed);
    }

    private void givenStored(Raffle raffle) {
        when(raffleRepository.findById(raffleId)).thenReturn(Optional.of(RaffleFixtures.entityOf(raffle)));
    }

    private void givenEntries(EntryEntity... entries) {
        when(entryRepository.findByRaffleIdAndStatusOrderBySequenceNumberAsc(raffleId, EntryStatus.CONFIRMED))
                .thenReturn(List.of(entries));
    }

    private void givenDrawable(String seed) {
        givenStored(raffle(RaffleStatus.ENDING, 15, null));
        givenEntries(EntryFixtures.confirmed(raffleId, WALLET_A, 10, start),
                EntryFixtures.confirmed(raffleId, WALLET_B, 5, start));
        when(stateMachine.beginDrawing(any(Raffle.class), eq(seed)))
                .thenReturn(raffle(RaffleStatus.DRAWING, 15, seed));
        when(stateMachine.complete(raffleId, 2)).thenReturn(raffle(RaffleStatus.COMPLETED, 15, seed));
    }

    @Test
    @DisplayName("Draw with a fixed seed picks the expected tickets and stores winners and payouts")
    void testRequestDraw_FixedSeed() {
        givenDrawable("seed-17");

        DrawOutcome outcome = drawService.requestDraw(raffleId, "seed-17");

        assertEquals(RaffleStatus.COMPLETED, outcome.getRaffle().getStatus());
        assertEquals(15, outcome.getTotalTickets());
        assertEquals(0, outcome.getUnfilledSlots());
        List<Winner> winners = outcome.getWinners();
        assertEquals(2, winners.size());
        assertEquals(WALLET_A, winners.get(0).getWalletAddress());
        assertEquals(7, winners.get(0).getTicketNumber());
        assertEquals(0, new BigDecimal("41").compareTo(winners.get(0).getPrize()));
        assertEquals(WALLET_B, winners.get(1).getWalletAddress());
        assertEquals(13, winners.get(1).getTicketNumber());
        assertEquals(0, new BigDecimal("26").compareTo(winners.get(1).getPrize()));

        verify(seedSource, never()).nextSeed(any());
        verify(winnerRepository).saveAll(savedWinners.capture());
        assertEquals(2, savedWinners.getValue().size());
        verify(payoutTracker).createPendingPayouts(winners);
        verify(outboxService).saveEvent(eq(OutboxService.AGGREGATE_RAFFLE), any(RaffleDrawnEvent.class));
    }

    @Test
    @DisplayName("Without an override the seed comes from the seed source")
    void testRequestDraw_FreshSeed() {
        when(seedSource.nextSeed(raffleId)).thenReturn("fresh-seed");
        givenDrawable("fresh-seed");

        DrawOutcome outcome = drawService.requestDraw(raffleId, null);

        assertEquals("fresh-seed", outcome.getRaffle().getRandomSeed());
        verify(stateMachine).beginDrawing(any(Raffle.class), eq("fresh-seed"));
    }

    @Test
    @DisplayName("An active raffle before its end time cannot be drawn")
    void testRequestDraw_NotEnding() {
        end = NOW.plusSeconds(3600);
        givenStored(raffle(RaffleStatus.ACTIVE, 15, null));

        RaffleEngineException e = assertThrows(RaffleEngineException.class,
                () -> drawService.requestDraw(raffleId, "seed"));

        assertEquals(RaffleErrorCode.INVALID_STATUS_TRANSITION, e.getCode());
        verify(stateMachine, never()).beginDrawing(any(), any());
    }

    @Test
    @DisplayName("A raffle with no tickets is refused before any state change")
    void testRequestDraw_NoEntries() {
        givenStored(raffle(RaffleStatus.ENDING, 0, null));

        RaffleEngineException e = assertThrows(RaffleEngineException.class,
                () -> drawService.requestDraw(raffleId, "seed"));

        assertEquals(RaffleErrorCode.NO_ENTRIES_FOR_DRAW, e.getCode());
        verify(stateMachine, never()).beginDrawing(any(), any());
    }

    @Test
    @DisplayName("Counters that disagree with the stored entries abort the draw")
    void testRequestDraw_InconsistentCounters() {
        givenStored(raffle(RaffleStatus.ENDING, 15, null));
        givenEntries(EntryFixtures.confirmed(raffleId, WALLET_A, 10, start));
        when(stateMachine.beginDrawing(any(Raffle.class), eq("seed")))
                .thenReturn(raffle(RaffleStatus.DRAWING, 15, "seed"));

        assertThrows(IllegalStateException.class, () -> drawService.requestDraw(raffleId, "seed"));
        verify(winnerRepository, never()).saveAll(anyList());
        verify(stateMachine, never()).complete(any(), org.mockito.ArgumentMatchers.anyInt());
    }

    @Test
    @DisplayName("Verification replays the draw and flags altered winners")
    void testVerifyDraw() {
        givenDrawable("seed-17");
        List<Winner> drawn = drawService.requestDraw(raffleId, "seed-17").getWinners();

        givenStored(raffle(RaffleStatus.COMPLETED, 15, "seed-17"));
        when(winnerRepository.findByRaffleIdOrderByPositionAsc(raffleId))
                .thenReturn(drawn.stream().map(WinnerEntity::fromDomain).toList());

        DrawVerification verification = drawService.verifyDraw(raffleId);
        assertTrue(verification.isVerified(), () -> verification.getMismatches().toString());
        assertEquals(15, verification.getTotalTickets());

        List<WinnerEntity> tampered = new ArrayList<>();
        Winner first = drawn.get(0);
        tampered.add(WinnerEntity.fromDomain(new Winner(first.getId(), raffleId, first.getEntryId(),
                WALLET_B, first.getTicketNumber(), 15, first.getPrize(), first.getTier(), 1, NOW)));
        tampered.add(WinnerEntity.fromDomain(drawn.get(1)));
        when(winnerRepository.findByRaffleIdOrderByPositionAsc(raffleId)).thenReturn(tampered);

        DrawVerification failed = drawService.verifyDraw(raffleId);
        assertFalse(failed.isVerified());
        assertEquals(1, failed.getMismatches().size());
        assertTrue(failed.getMismatches().get(0).startsWith("position 1"));
    }

    @Test
    @DisplayName("Undrawn raffles cannot be verified")
    void testVerifyDraw_NotDrawn() {
        givenStored(raffle(RaffleStatus.ENDING, 15, null));

        RaffleEngineException e = assertThrows(RaffleEngineException.class, () -> drawService.verifyDraw(raffleId));
        assertEquals(RaffleErrorCode.INVALID_STATUS_TRANSITION, e.getCode());
    }
}
