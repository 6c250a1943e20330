package com.flagship.raffle_engine.stats;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.sql.Timestamp;

/**
 * Maintains the single platform_stats row.
 *
 * Every write is an in-place {@code SET x = x + ?} so concurrent updates
 * never lose increments. Writes join the caller's transaction, so the totals
 * move together with the entry, draw or payout that caused them.
 *
 * Uses JDBC directly; the row is a counter block, not an entity.
 */
@Service
public class StatsAggregator {

    static final String GLOBAL_STAT_ID = "global";

    private static final RowMapper<PlatformStats> STATS_MAPPER = (rs, rowNum) -> {
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return new PlatformStats(
            rs.getLong("total_raffles"),
            rs.getLong("completed_raffles"),
            rs.getLong("cancelled_raffles"),
            rs.getLong("total_entries"),
            rs.getLong("total_participations"),
            rs.getBigDecimal("total_revenue"),
            rs.getLong("total_winners"),
            rs.getBigDecimal("total_paid_out"),
            rs.getLong("failed_payout_attempts"),
            updatedAt != null ? updatedAt.toInstant() : null
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public StatsAggregator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordRaffleCreated() {
        increment("total_raffles = total_raffles + 1");
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordRaffleCancelled() {
        increment("cancelled_raffles = cancelled_raffles + 1");
    }

    /**
     * @param revenueDelta growth of the raffle's protocol fee caused by this entry
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordEntry(int tickets, BigDecimal revenueDelta, boolean newParticipant) {
        increment("total_entries = total_entries + ?, "
                + "total_revenue = total_revenue + ?, "
                + "total_participations = total_participations + ?",
                tickets, revenueDelta, newParticipant ? 1 : 0);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordRaffleCompleted(int winners) {
        increment("completed_raffles = completed_raffles + 1, total_winners = total_winners + ?", winners);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordPayoutPaid(BigDecimal amount) {
        increment("total_paid_out = total_paid_out + ?", amount);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordPayoutFailure() {
        increment("failed_payout_attempts = failed_payout_attempts + 1");
    }

    @Transactional(readOnly = true)
    public PlatformStats getStats() {
        return jdbcTemplate.queryForObject(
            "SELECT * FROM platform_stats WHERE stat_id = ?", STATS_MAPPER, GLOBAL_STAT_ID);
    }

    private void increment(String assignments, Object... args) {
        Object[] params = new Object[args.length + 1];
        System.arraycopy(args, 0, params, 0, args.length);
        params[args.length] = GLOBAL_STAT_ID;

        int updated = jdbcTemplate.update(
            "UPDATE platform_stats SET " + assignments + ", updated_at = CURRENT_TIMESTAMP WHERE stat_id = ?",
            params);
        if (updated != 1) {
            throw new IllegalStateException("platform_stats row '" + GLOBAL_STAT_ID + "' is missing");
        }
    }
}
