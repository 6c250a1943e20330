package com.flagship.raffle_engine.entry;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Add-in-place counter updates for the entry path.
 *
 * Both statements are single conditional writes, so concurrent entries on
 * the same raffle serialize on the row lock instead of overwriting each
 * other. Neither reads a counter into the application and writes it back.
 */
@Repository
public class RaffleCounterRepository {

    private static final String RESERVE_WALLET_ENTRIES = """
        INSERT INTO raffle_participants (raffle_id, wallet_address, entries_count, created_at, updated_at)
        VALUES (?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)
        ON CONFLICT (raffle_id, wallet_address) DO UPDATE
            SET entries_count = raffle_participants.entries_count + EXCLUDED.entries_count,
                updated_at = CURRENT_TIMESTAMP
            WHERE raffle_participants.entries_count + EXCLUDED.entries_count <= ?
        RETURNING (xmax = 0) AS inserted
        """;

    // Fee rounding mirrors PrizePoolCalculator.split: ROUND on numeric is half away from zero.
    private static final String APPLY_ENTRY = """
        UPDATE raffles
        SET total_entries = total_entries + ?,
            prize_pool = prize_pool + ?,
            protocol_fee = ROUND((prize_pool + ?) * platform_fee_percent / 100),
            winner_payout = (prize_pool + ?) - ROUND((prize_pool + ?) * platform_fee_percent / 100),
            total_participants = total_participants + ?,
            updated_at = CURRENT_TIMESTAMP
        WHERE id = ? AND status IN ('ACTIVE', 'ENDING') AND end_time > ?
        RETURNING protocol_fee, ROUND((prize_pool - ?) * platform_fee_percent / 100) AS previous_fee
        """;

    private final JdbcTemplate jdbcTemplate;

    public RaffleCounterRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Adds tickets to the wallet's running total for the raffle, unless that
     * would take it above {@code maxEntriesPerUser}.
     *
     * @return empty if the cap would be exceeded; otherwise whether this is
     *         the wallet's first entry in the raffle
     */
    public Optional<Boolean> reserveWalletEntries(UUID raffleId, String walletAddress,
                                                  int numEntries, int maxEntriesPerUser) {
        return jdbcTemplate.query(RESERVE_WALLET_ENTRIES,
            rs -> rs.next() ? Optional.of(rs.getBoolean("inserted")) : Optional.<Boolean>empty(),
            raffleId, walletAddress, numEntries, maxEntriesPerUser);
    }

    public long walletEntries(UUID raffleId, String walletAddress) {
        Long count = jdbcTemplate.query(
            "SELECT entries_count FROM raffle_participants WHERE raffle_id = ? AND wallet_address = ?",
            rs -> rs.next() ? rs.getLong(1) : 0L,
            raffleId, walletAddress);
        return count != null ? count : 0L;
    }

    /**
     * Adds one entry to the raffle's ticket count, pool, fee split and
     * participant count in a single statement.
     *
     * @return empty if the raffle is no longer accepting entries
     */
    public Optional<EntryCounterUpdate> applyEntry(UUID raffleId, int numEntries, BigDecimal amount,
                                                   boolean newParticipant, Instant now) {
        return jdbcTemplate.query(APPLY_ENTRY,
            rs -> rs.next()
                ? Optional.of(new EntryCounterUpdate(rs.getBigDecimal("previous_fee"), rs.getBigDecimal("protocol_fee")))
                : Optional.<EntryCounterUpdate>empty(),
            numEntries, amount, amount, amount, amount, newParticipant ? 1 : 0,
            raffleId, Timestamp.from(now), amount);
    }
}
