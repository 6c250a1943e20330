package com.flagship.raffle_engine.raffle;

import com.flagship.raffle_engine.common.RaffleEngineException;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * Validates raffle configuration at creation time. Every failure is a
 * VALIDATION_ERROR naming the offending field.
 */
@Component
public class RaffleConfigValidator {

    static final BigDecimal MAX_FEE_PERCENT = BigDecimal.valueOf(50);
    static final int MAX_WINNERS = 100;
    static final int MAX_TITLE_LENGTH = 200;
    static final Duration MIN_DURATION = Duration.ofMinutes(5);
    static final Duration MAX_DURATION = Duration.ofDays(31);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param endTime resolved end time (default duration already applied)
     */
    public void validate(CreateRaffleCommand command, Instant startTime, Instant endTime) {
        if (command.getType() == null) {
            throw RaffleEngineException.validation("type", "is required");
        }
        if (command.getTitle() == null || command.getTitle().isBlank()) {
            throw RaffleEngineException.validation("title", "is required");
        }
        if (command.getTitle().length() > MAX_TITLE_LENGTH) {
            throw RaffleEngineException.validation("title", "longer than " + MAX_TITLE_LENGTH + " characters");
        }
        validateEntryPrice(command.getEntryPrice());
        validateFee(command.getPlatformFeePercent());
        if (command.getMaxEntriesPerUser() < 1) {
            throw RaffleEngineException.validation("maxEntriesPerUser", "must be at least 1");
        }
        validateTiers(command);
        validateWindow(startTime, endTime);
    }

    private void validateEntryPrice(BigDecimal entryPrice) {
        if (entryPrice == null || entryPrice.signum() <= 0) {
            throw RaffleEngineException.validation("entryPrice", "must be positive");
        }
        if (entryPrice.stripTrailingZeros().scale() > 0) {
            throw RaffleEngineException.validation("entryPrice", "must be a whole number of the smallest currency unit");
        }
    }

    private void validateFee(BigDecimal feePercent) {
        if (feePercent == null || feePercent.signum() < 0 || feePercent.compareTo(MAX_FEE_PERCENT) > 0) {
            throw RaffleEngineException.validation("platformFeePercent", "must be between 0 and " + MAX_FEE_PERCENT);
        }
        if (feePercent.stripTrailingZeros().scale() > 2) {
            throw RaffleEngineException.validation("platformFeePercent", "at most two decimal places");
        }
    }

    private void validateTiers(CreateRaffleCommand command) {
        if (command.getPrizeTiers() == null || command.getPrizeTiers().isEmpty()) {
            throw RaffleEngineException.validation("prizeTiers", "at least one tier is required");
        }

        Set<String> names = new HashSet<>();
        BigDecimal percentTotal = BigDecimal.ZERO;
        int winnerTotal = 0;
        for (PrizeTier tier : command.getPrizeTiers()) {
            if (tier == null || tier.getName() == null || tier.getName().isBlank()) {
                throw RaffleEngineException.validation("prizeTiers.name", "is required");
            }
            if (!names.add(tier.getName().trim())) {
                throw RaffleEngineException.validation("prizeTiers.name", "duplicate tier '" + tier.getName() + "'");
            }
            if (tier.getPercentage() == null || tier.getPercentage().signum() <= 0) {
                throw RaffleEngineException.validation("prizeTiers.percentage",
                        "tier '" + tier.getName() + "' must have a positive percentage");
            }
            if (tier.getPercentage().stripTrailingZeros().scale() > 2) {
                throw RaffleEngineException.validation("prizeTiers.percentage",
                        "tier '" + tier.getName() + "' allows at most two decimal places");
            }
            if (tier.getWinnerCount() < 1) {
                throw RaffleEngineException.validation("prizeTiers.winnerCount",
                        "tier '" + tier.getName() + "' must have at least one winner");
            }
            percentTotal = percentTotal.add(tier.getPercentage());
            winnerTotal += tier.getWinnerCount();
        }

        if (percentTotal.compareTo(HUNDRED) != 0) {
            throw RaffleEngineException.validation("prizeTiers.percentage",
                    "percentages sum to " + percentTotal.toPlainString() + ", expected 100");
        }
        int winnerCount = command.getWinnerCount() != null ? command.getWinnerCount() : winnerTotal;
        if (winnerCount < 1 || winnerCount > MAX_WINNERS) {
            throw RaffleEngineException.validation("winnerCount", "must be between 1 and " + MAX_WINNERS);
        }
        if (winnerTotal != winnerCount) {
            throw RaffleEngineException.validation("prizeTiers.winnerCount",
                    "tier winner counts sum to " + winnerTotal + ", expected " + winnerCount);
        }
    }

    private void validateWindow(Instant startTime, Instant endTime) {
        if (!endTime.isAfter(startTime)) {
            throw RaffleEngineException.validation("endTime", "must be after startTime");
        }
        Duration duration = Duration.between(startTime, endTime);
        if (duration.compareTo(MIN_DURATION) < 0 || duration.compareTo(MAX_DURATION) > 0) {
            throw RaffleEngineException.validation("endTime",
                    "duration " + duration + " outside " + MIN_DURATION + ".." + MAX_DURATION);
        }
    }
}
