package com.flagship.raffle_engine.integration;

import com.flagship.raffle_engine.common.EngineResult;
import com.flagship.raffle_engine.common.RaffleErrorCode;
import com.flagship.raffle_engine.config.MutableClock;
import com.flagship.raffle_engine.draw.DrawOutcome;
import com.flagship.raffle_engine.draw.DrawVerification;
import com.flagship.raffle_engine.draw.Winner;
import com.flagship.raffle_engine.engine.RaffleEngine;
import com.flagship.raffle_engine.entry.EntrySubmission;
import com.flagship.raffle_engine.entry.SubmitEntryCommand;
import com.flagship.raffle_engine.event.EntrySubmittedEvent;
import com.flagship.raffle_engine.event.RaffleCreatedEvent;
import com.flagship.raffle_engine.event.RaffleDrawnEvent;
import com.flagship.raffle_engine.outbox.OutboxEvent;
import com.flagship.raffle_engine.outbox.OutboxService;
import com.flagship.raffle_engine.payout.Payout;
import com.flagship.raffle_engine.payout.PayoutOutcome;
import com.flagship.raffle_engine.payout.PayoutStatus;
import com.flagship.raffle_engine.payout.PayoutSummary;
import com.flagship.raffle_engine.raffle.CreateRaffleCommand;
import com.flagship.raffle_engine.raffle.PrizeTier;
import com.flagship.raffle_engine.raffle.Raffle;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import com.flagship.raffle_engine.raffle.RaffleType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end engine behaviour against PostgreSQL and Redis.
 *
 * These tests verify:
 * - pool, fee and winner payout stay consistent as entries arrive
 * - payment references are idempotent, also under concurrent resubmission
 * - per-wallet caps hold under concurrent purchases
 * - exactly one of several concurrent draws wins
 * - a stored draw replays to the same winners and its payouts can be settled
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class RaffleEngineIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("raffle_engine_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // Kafka is not started: the outbox keeps its rows and the scheduler stays off
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("raffle.scheduler.enabled", () -> "false");
    }

    @TestConfiguration
    static class ClockTestConfig {
        @Bean
        @Primary
        MutableClock testClock() {
            return new MutableClock(Instant.now().truncatedTo(ChronoUnit.MILLIS));
        }
    }

    private static final BigDecimal PRICE = BigDecimal.valueOf(5);
    private static final List<PrizeTier> TWO_TIERS = List.of(
            new PrizeTier("Grand", BigDecimal.valueOf(60), 1),
            new PrizeTier("Runner-up", BigDecimal.valueOf(40), 1));

    @Autowired
    private RaffleEngine engine;

    @Autowired
    private MutableClock clock;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static String wallet(int n) {
        return String.format("0x%040x", n);
    }

    private Raffle createRaffle(int maxEntriesPerUser, List<PrizeTier> tiers) {
        Instant now = clock.instant();
        CreateRaffleCommand command = CreateRaffleCommand.builder()
                .type(RaffleType.FLASH)
                .title("Flash raffle " + UUID.randomUUID())
                .entryPrice(PRICE)
                .platformFeePercent(BigDecimal.TEN)
                .maxEntriesPerUser(maxEntriesPerUser)
                .prizeTiers(tiers)
                .startTime(now)
                .endTime(now.plus(Duration.ofHours(1)))
                .build();
        Raffle raffle = engine.createRaffle(command).getValue();
        assertEquals(RaffleStatus.ACTIVE, raffle.getStatus());
        return raffle;
    }

    private EngineResult<EntrySubmission> submit(UUID raffleId, String wallet, int tickets, String reference) {
        return engine.submitEntry(new SubmitEntryCommand(raffleId, wallet, tickets,
                PRICE.multiply(BigDecimal.valueOf(tickets)), reference));
    }

    private void passEndTime() {
        clock.advance(Duration.ofHours(1).plusSeconds(1));
    }

    private static void assertAmount(long expected, BigDecimal actual) {
        assertEquals(0, BigDecimal.valueOf(expected).compareTo(actual),
                "expected " + expected + " but was " + actual);
    }

    @Test
    @DisplayName("15 tickets at 5 with a 10% fee: pool 75, fee 8, winner payout 67")
    void testPoolSplit() {
        printTestHeader("Pool split as entries arrive");
        Raffle raffle = createRaffle(50, TWO_TIERS);

        submit(raffle.getId(), wallet(1), 5, "pool-" + UUID.randomUUID()).orElseThrow();
        submit(raffle.getId(), wallet(2), 4, "pool-" + UUID.randomUUID()).orElseThrow();
        submit(raffle.getId(), wallet(1), 6, "pool-" + UUID.randomUUID()).orElseThrow();

        Raffle stored = engine.getRaffle(raffle.getId()).getValue();
        printOutput("Total entries", stored.getTotalEntries());
        printOutput("Pool / fee / payout", stored.getPrizePool() + " / " + stored.getProtocolFee()
                + " / " + stored.getWinnerPayout());

        assertEquals(15, stored.getTotalEntries());
        assertEquals(2, stored.getTotalParticipants());
        assertAmount(75, stored.getPrizePool());
        assertAmount(8, stored.getProtocolFee());
        assertAmount(67, stored.getWinnerPayout());
        assertEquals(3, engine.getEntries(raffle.getId()).getValue().size());
        printSuccess("Counters match the entries");
    }

    @Test
    @DisplayName("Resubmitting a payment reference returns the original entry once")
    void testDuplicateReference() {
        printTestHeader("Duplicate payment reference");
        Raffle raffle = createRaffle(50, TWO_TIERS);
        String reference = "dup-" + UUID.randomUUID();
        printInput("Payment reference", reference);

        EntrySubmission first = submit(raffle.getId(), wallet(3), 3, reference).getValue();
        EntrySubmission second = submit(raffle.getId(), wallet(3), 3, reference).getValue();

        assertFalse(first.isDuplicate());
        assertTrue(second.isDuplicate());
        assertEquals(first.getEntry().getId(), second.getEntry().getId());
        assertEquals(3, engine.getRaffle(raffle.getId()).getValue().getTotalEntries());
        printSuccess("Second submission did not add tickets");
    }

    @Test
    @DisplayName("Concurrent resubmissions of one reference create exactly one entry")
    void testConcurrentDuplicateReference() throws Exception {
        printTestHeader("Concurrent duplicate payment reference");
        Raffle raffle = createRaffle(50, TWO_TIERS);
        String reference = "race-" + UUID.randomUUID();
        int threadCount = 8;

        List<EntrySubmission> results = Collections.synchronizedList(new ArrayList<>());
        runConcurrently(threadCount, i -> results.add(submit(raffle.getId(), wallet(4), 2, reference).getValue()));

        Set<UUID> entryIds = results.stream().map(r -> r.getEntry().getId()).collect(Collectors.toSet());
        long fresh = results.stream().filter(r -> !r.isDuplicate()).count();
        printOutput("Results", results.size());
        printOutput("Fresh entries", fresh);

        assertEquals(threadCount, results.size());
        assertEquals(1, entryIds.size());
        assertEquals(1, fresh);
        assertEquals(2, engine.getRaffle(raffle.getId()).getValue().getTotalEntries());
        printSuccess("One entry, every caller got it back");
    }

    @Test
    @DisplayName("Concurrent purchases keep tickets, pool and participants consistent")
    void testConcurrentEntries() throws Exception {
        printTestHeader("Concurrent entries");
        Raffle raffle = createRaffle(50, TWO_TIERS);
        int threadCount = 20;

        runConcurrently(threadCount, i ->
                submit(raffle.getId(), wallet(100 + i % 10), 1 + i % 3, "conc-" + UUID.randomUUID()).orElseThrow());

        long expectedTickets = 0;
        for (int i = 0; i < threadCount; i++) {
            expectedTickets += 1 + i % 3;
        }
        Raffle stored = engine.getRaffle(raffle.getId()).getValue();
        printOutput("Total entries", stored.getTotalEntries());
        printOutput("Participants", stored.getTotalParticipants());

        assertEquals(expectedTickets, stored.getTotalEntries());
        assertEquals(10, stored.getTotalParticipants());
        assertAmount(expectedTickets * 5, stored.getPrizePool());
        assertEquals(0, stored.getProtocolFee().add(stored.getWinnerPayout()).compareTo(stored.getPrizePool()));
        Long participantRows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM raffle_participants WHERE raffle_id = ?", Long.class, raffle.getId());
        assertEquals(10L, participantRows);
        printSuccess("No lost updates");
    }

    @Test
    @DisplayName("Wallet cap holds when one wallet buys concurrently")
    void testConcurrentWalletCap() throws Exception {
        printTestHeader("Concurrent wallet cap");
        Raffle raffle = createRaffle(10, TWO_TIERS);
        AtomicInteger accepted = new AtomicInteger();
        AtomicInteger capped = new AtomicInteger();
        printInput("Cap", 10);
        printInput("Purchases", "8 x 3 tickets");

        runConcurrently(8, i -> {
            EngineResult<EntrySubmission> result = submit(raffle.getId(), wallet(7), 3, "cap-" + UUID.randomUUID());
            if (result.isSuccess()) {
                accepted.incrementAndGet();
            } else if (result.getErrorCode() == RaffleErrorCode.MAX_ENTRIES_EXCEEDED) {
                capped.incrementAndGet();
            }
        });

        Raffle stored = engine.getRaffle(raffle.getId()).getValue();
        printOutput("Accepted", accepted.get());
        printOutput("Capped", capped.get());

        assertEquals(3, accepted.get());
        assertEquals(5, capped.get());
        assertEquals(9, stored.getTotalEntries());
        assertEquals(1, stored.getTotalParticipants());
        assertEquals(3, engine.getEntries(raffle.getId()).getValue().size());
        printSuccess("Rejected purchases left no trace");
    }

    @Test
    @DisplayName("Entries after the end time or after cancellation are rejected")
    void testClosedRaffle() {
        printTestHeader("Closed raffle");
        Raffle cancelled = createRaffle(50, TWO_TIERS);
        engine.cancelRaffle(cancelled.getId()).orElseThrow();
        assertEquals(RaffleErrorCode.RAFFLE_NOT_ACTIVE,
                submit(cancelled.getId(), wallet(8), 1, "closed-" + UUID.randomUUID()).getErrorCode());

        Raffle ended = createRaffle(50, TWO_TIERS);
        passEndTime();
        assertEquals(RaffleErrorCode.RAFFLE_NOT_ACTIVE,
                submit(ended.getId(), wallet(8), 1, "late-" + UUID.randomUUID()).getErrorCode());
        assertEquals(0, engine.getRaffle(ended.getId()).getValue().getTotalEntries());
        printSuccess("No entries recorded");
    }

    @Test
    @DisplayName("Fixed seed picks ticket 7 for the grand prize and 13 for the runner-up")
    void testFullFlow() {
        printTestHeader("Draw, verify and settle");
        Raffle raffle = createRaffle(50, TWO_TIERS);
        String walletA = wallet(0xA);
        String walletB = wallet(0xB);
        submit(raffle.getId(), walletA, 10, "flow-" + UUID.randomUUID()).orElseThrow();
        submit(raffle.getId(), walletB, 5, "flow-" + UUID.randomUUID()).orElseThrow();
        passEndTime();

        DrawOutcome outcome = engine.requestDraw(raffle.getId(), "seed-17").getValue();
        List<Winner> winners = outcome.getWinners();
        winners.forEach(w -> printOutput(w.getTier(), w.getWalletAddress() + " #" + w.getTicketNumber()
                + " prize " + w.getPrize()));

        assertEquals(RaffleStatus.COMPLETED, outcome.getRaffle().getStatus());
        assertEquals("seed-17", outcome.getRaffle().getRandomSeed());
        assertEquals(15, outcome.getTotalTickets());
        assertEquals(2, winners.size());
        assertEquals(walletA, winners.get(0).getWalletAddress());
        assertEquals(7, winners.get(0).getTicketNumber());
        assertAmount(41, winners.get(0).getPrize());
        assertEquals(walletB, winners.get(1).getWalletAddress());
        assertEquals(13, winners.get(1).getTicketNumber());
        assertAmount(26, winners.get(1).getPrize());

        DrawVerification verification = engine.verifyDraw(raffle.getId()).getValue();
        assertTrue(verification.isVerified(), () -> verification.getMismatches().toString());
        assertEquals(1, engine.getWalletWins(walletB).getValue().size());

        // grand prize fails once, then succeeds; runner-up pays first time
        Winner grand = winners.get(0);
        Payout failed = engine.recordPayoutAttempt(grand.getId(), PayoutOutcome.failed("nonce too low"))
                .getValue();
        assertEquals(PayoutStatus.FAILED, failed.getStatus());
        Payout processing = engine.markPayoutProcessing(failed.getId()).getValue();
        assertEquals(2, processing.getAttempts());
        engine.recordPayoutAttempt(grand.getId(), PayoutOutcome.succeeded("0xtx-grand")).orElseThrow();
        engine.recordPayoutAttempt(winners.get(1).getId(), PayoutOutcome.succeeded("0xtx-runner")).orElseThrow();

        EngineResult<Payout> again = engine.recordPayoutAttempt(grand.getId(), PayoutOutcome.succeeded("0xtx-2"));
        assertEquals(RaffleErrorCode.PAYOUT_ALREADY_PROCESSED, again.getErrorCode());

        PayoutSummary summary = engine.getPayoutSummary(raffle.getId()).getValue();
        printOutput("Paid amount", summary.getPaidAmount());
        assertEquals(2, summary.getPaid());
        assertAmount(67, summary.getPaidAmount());
        assertTrue(summary.isFullyPaid());

        List<String> eventTypes = outboxService.getEventsForAggregate(OutboxService.AGGREGATE_RAFFLE, raffle.getId())
                .stream().map(OutboxEvent::getEventType).toList();
        assertTrue(eventTypes.contains(RaffleCreatedEvent.EVENT_TYPE));
        assertTrue(eventTypes.contains(EntrySubmittedEvent.EVENT_TYPE));
        assertTrue(eventTypes.contains(RaffleDrawnEvent.EVENT_TYPE));
        printSuccess("Draw replayed and all prizes paid");
    }

    @Test
    @DisplayName("Of concurrent draw requests exactly one succeeds")
    void testConcurrentDraws() throws Exception {
        printTestHeader("Concurrent draws");
        Raffle raffle = createRaffle(50, TWO_TIERS);
        for (int i = 0; i < 5; i++) {
            submit(raffle.getId(), wallet(200 + i), 2, "draw-" + UUID.randomUUID()).orElseThrow();
        }
        passEndTime();
        assertEquals(RaffleStatus.ENDING, engine.advanceTime(raffle.getId()).getValue().getStatus());

        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();
        runConcurrently(4, i -> {
            EngineResult<DrawOutcome> result = engine.requestDraw(raffle.getId(), null);
            if (result.isSuccess()) {
                succeeded.incrementAndGet();
            } else if (result.getErrorCode() == RaffleErrorCode.INVALID_STATUS_TRANSITION) {
                rejected.incrementAndGet();
            }
        });

        printOutput("Succeeded", succeeded.get());
        printOutput("Rejected", rejected.get());
        assertEquals(1, succeeded.get());
        assertEquals(3, rejected.get());

        List<Winner> winners = engine.getWinners(raffle.getId()).getValue();
        assertEquals(2, winners.size());
        assertEquals(2, winners.stream().map(Winner::getWalletAddress).distinct().count());
        assertTrue(engine.verifyDraw(raffle.getId()).getValue().isVerified());
        printSuccess("Single draw stored");
    }

    @Test
    @DisplayName("Raffle without entries cannot be drawn and stays ENDING")
    void testDrawWithoutEntries() {
        printTestHeader("Draw without entries");
        Raffle raffle = createRaffle(50, TWO_TIERS);
        passEndTime();

        EngineResult<DrawOutcome> result = engine.requestDraw(raffle.getId(), null);

        assertEquals(RaffleErrorCode.NO_ENTRIES_FOR_DRAW, result.getErrorCode());
        Raffle stored = engine.getRaffle(raffle.getId()).getValue();
        assertEquals(RaffleStatus.ENDING, stored.getStatus());
        assertNull(stored.getRandomSeed());
        assertTrue(engine.cancelRaffle(raffle.getId()).isSuccess());
        printSuccess("Raffle can still be cancelled");
    }

    @Test
    @DisplayName("Draw before the end time is rejected")
    void testDrawTooEarly() {
        Raffle raffle = createRaffle(50, TWO_TIERS);
        submit(raffle.getId(), wallet(9), 1, "early-" + UUID.randomUUID()).orElseThrow();

        EngineResult<DrawOutcome> result = engine.requestDraw(raffle.getId(), "seed-early");

        assertEquals(RaffleErrorCode.INVALID_STATUS_TRANSITION, result.getErrorCode());
        assertEquals(RaffleStatus.ACTIVE, engine.getRaffle(raffle.getId()).getValue().getStatus());
    }

    private void runConcurrently(int threadCount, ThrowingTask task) throws InterruptedException {
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(threadCount);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

        for (int i = 0; i < threadCount; i++) {
            int index = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    task.run(index);
                } catch (Throwable t) {
                    errors.add(t);
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "threads did not finish");
        executor.shutdown();
        assertTrue(errors.isEmpty(), () -> "unexpected errors: " + errors);
    }

    @FunctionalInterface
    private interface ThrowingTask {
        void run(int index) throws Exception;
    }
}
