package com.flagship.raffle_engine.raffle;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.raffle_engine.config.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP adapter tests.
 *
 * These tests verify:
 * - request validation and error bodies
 * - Idempotency-Key handling on entries (201 first, 200 on replay)
 * - engine failure codes map to HTTP statuses
 * - a raffle can be run from creation to paid payouts over the API
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class RaffleControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("raffle_engine_api_test")
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

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Map<String, Object> raffleRequest() {
        Instant now = clock.instant();
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("type", "FLASH");
        request.put("title", "API raffle");
        request.put("entry_price", 5);
        request.put("platform_fee_percent", 10);
        request.put("max_entries_per_user", 50);
        request.put("prize_tiers", List.of(
                Map.of("name", "Grand", "percentage", 60, "winner_count", 1),
                Map.of("name", "Runner-up", "percentage", 40, "winner_count", 1)));
        request.put("start_time", now.toString());
        request.put("end_time", now.plus(Duration.ofHours(1)).toString());
        return request;
    }

    private String createRaffle() throws Exception {
        String json = mockMvc.perform(post("/api/raffles")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(raffleRequest())))
            .andExpect(status().isCreated())
            .andReturn()
            .getResponse()
            .getContentAsString();
        return objectMapper.readTree(json).get("id").asText();
    }

    private String entryBody(String wallet, int tickets, int paid) throws Exception {
        return objectMapper.writeValueAsString(Map.of(
                "wallet_address", wallet,
                "num_entries", tickets,
                "total_paid", paid));
    }

    @Test
    @DisplayName("Creating a raffle returns 201 with the raffle ACTIVE and counters at zero")
    void testCreateRaffle() throws Exception {
        printTestHeader("Create raffle");

        mockMvc.perform(post("/api/raffles")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(raffleRequest())))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").exists())
            .andExpect(jsonPath("$.status").value("ACTIVE"))
            .andExpect(jsonPath("$.winner_count").value(2))
            .andExpect(jsonPath("$.total_entries").value(0))
            .andExpect(jsonPath("$.prize_tiers.length()").value(2));

        printSuccess("Raffle created");
    }

    @Test
    @DisplayName("Tier percentages not summing to 100 are rejected with VALIDATION_ERROR")
    void testCreateRaffle_InvalidTiers() throws Exception {
        Map<String, Object> request = raffleRequest();
        request.put("prize_tiers", List.of(Map.of("name", "Grand", "percentage", 90, "winner_count", 1)));

        mockMvc.perform(post("/api/raffles")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"));
    }

    @Test
    @DisplayName("Missing required fields are rejected by request validation")
    void testCreateRaffle_MissingTitle() throws Exception {
        Map<String, Object> request = raffleRequest();
        request.remove("title");

        mockMvc.perform(post("/api/raffles")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
            .andExpect(jsonPath("$.details.title").exists());
    }

    @Test
    @DisplayName("Unknown raffle is 404")
    void testGetRaffle_NotFound() throws Exception {
        mockMvc.perform(get("/api/raffles/" + UUID.randomUUID()))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("RAFFLE_NOT_FOUND"));
    }

    @Test
    @DisplayName("Same Idempotency-Key twice: 201 then 200 with the same entry")
    void testSubmitEntry_Idempotent() throws Exception {
        printTestHeader("Idempotent entry");
        String raffleId = createRaffle();
        String key = "pay-" + UUID.randomUUID();
        String body = entryBody("0x" + "1".repeat(40), 3, 15);

        String first = mockMvc.perform(post("/api/raffles/" + raffleId + "/entries")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.duplicate").value(false))
            .andReturn().getResponse().getContentAsString();

        String second = mockMvc.perform(post("/api/raffles/" + raffleId + "/entries")
                .header("Idempotency-Key", key)
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.duplicate").value(true))
            .andReturn().getResponse().getContentAsString();

        String firstId = objectMapper.readTree(first).get("id").asText();
        String secondId = objectMapper.readTree(second).get("id").asText();
        printOutput("First entry", firstId);
        printOutput("Second entry", secondId);
        assertEquals(firstId, secondId);

        mockMvc.perform(get("/api/raffles/" + raffleId))
            .andExpect(jsonPath("$.total_entries").value(3));
        printSuccess("Replay did not add tickets");
    }

    @Test
    @DisplayName("Entry without Idempotency-Key is rejected")
    void testSubmitEntry_MissingKey() throws Exception {
        String raffleId = createRaffle();

        mockMvc.perform(post("/api/raffles/" + raffleId + "/entries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryBody("0x" + "2".repeat(40), 1, 5)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Required Header"));
    }

    @Test
    @DisplayName("Wrong payment amount maps to INVALID_ENTRY")
    void testSubmitEntry_WrongPayment() throws Exception {
        String raffleId = createRaffle();

        mockMvc.perform(post("/api/raffles/" + raffleId + "/entries")
                .header("Idempotency-Key", "pay-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryBody("0x" + "3".repeat(40), 2, 9)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_ENTRY"));
    }

    @Test
    @DisplayName("Eligibility reports the remaining allowance")
    void testEligibility() throws Exception {
        String raffleId = createRaffle();

        mockMvc.perform(get("/api/raffles/" + raffleId + "/eligibility")
                .param("wallet", "0x" + "4".repeat(40))
                .param("num_entries", "60"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.eligible").value(false))
            .andExpect(jsonPath("$.reason").value("MAX_ENTRIES_EXCEEDED"))
            .andExpect(jsonPath("$.remainingAllowance").value(50));
    }

    @Test
    @DisplayName("Raffle run over the API: entries, draw, verification, payouts")
    void testFullFlow() throws Exception {
        printTestHeader("Full flow over HTTP");
        String raffleId = createRaffle();
        String walletA = "0x" + "a".repeat(40);
        String walletB = "0x" + "b".repeat(40);

        mockMvc.perform(post("/api/raffles/" + raffleId + "/entries")
                .header("Idempotency-Key", "flow-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryBody(walletA, 10, 50)))
            .andExpect(status().isCreated());
        mockMvc.perform(post("/api/raffles/" + raffleId + "/entries")
                .header("Idempotency-Key", "flow-" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .content(entryBody(walletB, 5, 25)))
            .andExpect(status().isCreated());

        clock.advance(Duration.ofHours(1).plusSeconds(1));

        String drawJson = mockMvc.perform(post("/api/raffles/" + raffleId + "/draw").param("seed", "seed-17"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.raffle.status").value("COMPLETED"))
            .andExpect(jsonPath("$.total_tickets").value(15))
            .andExpect(jsonPath("$.winners[0].ticket_number").value(7))
            .andExpect(jsonPath("$.winners[0].wallet_address").value(walletA))
            .andExpect(jsonPath("$.winners[0].prize").value(41))
            .andExpect(jsonPath("$.winners[1].ticket_number").value(13))
            .andExpect(jsonPath("$.winners[1].prize").value(26))
            .andReturn().getResponse().getContentAsString();
        printOutput("Draw", drawJson);

        mockMvc.perform(post("/api/raffles/" + raffleId + "/draw"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INVALID_STATUS_TRANSITION"));

        mockMvc.perform(get("/api/raffles/" + raffleId + "/verification"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.verified").value(true));

        JsonNode winners = objectMapper.readTree(drawJson).get("winners");
        for (JsonNode winner : winners) {
            mockMvc.perform(post("/api/payouts/winners/" + winner.get("id").asText() + "/attempts")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(Map.of(
                            "success", true,
                            "payment_reference", "0xtx-" + winner.get("position").asText()))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PAID"))
                .andExpect(jsonPath("$.attempts").value(1));
        }

        mockMvc.perform(get("/api/payouts/raffles/" + raffleId + "/summary"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.paid").value(2))
            .andExpect(jsonPath("$.fullyPaid").value(true));

        mockMvc.perform(get("/api/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.completedRaffles").exists());
        printSuccess("Raffle completed and paid out");
    }

    @Test
    @DisplayName("Health endpoint reports the database")
    void testHealth() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("UP"))
            .andExpect(jsonPath("$.database").value("UP"))
            .andExpect(jsonPath("$.idempotencyCache").value("UP"));
    }
}
