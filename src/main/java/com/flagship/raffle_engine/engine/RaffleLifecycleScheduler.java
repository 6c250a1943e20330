package com.flagship.raffle_engine.engine;

import com.flagship.raffle_engine.common.EngineResult;
import com.flagship.raffle_engine.common.RaffleErrorCode;
import com.flagship.raffle_engine.draw.DrawOutcome;
import com.flagship.raffle_engine.observability.CorrelationContext;
import com.flagship.raffle_engine.raffle.RaffleService;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * In-process scheduler collaborator.
 *
 * Each sweep:
 * 1. starts SCHEDULED raffles whose start time has come
 * 2. moves ACTIVE raffles into ENDING once inside the ending window
 * 3. with auto-draw on, draws ENDING raffles whose end time has passed
 *
 * Everything goes through {@link RaffleEngine}, exactly as an external
 * scheduler calling the HTTP API would. Set {@code raffle.scheduler.enabled=false}
 * to leave the triggering to such a scheduler.
 */
@Component
@ConditionalOnProperty(name = "raffle.scheduler.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class RaffleLifecycleScheduler {

    private final RaffleEngine engine;
    private final RaffleService raffleService;
    private final Clock clock;

    @Value("${raffle.lifecycle.ending-threshold:PT5M}")
    private Duration endingThreshold;

    @Value("${raffle.scheduler.auto-draw:true}")
    private boolean autoDraw;

    @Scheduled(fixedRateString = "${raffle.scheduler.interval-ms:30000}")
    public void sweep() {
        CorrelationContext.beginSweep();
        try {
            Instant now = clock.instant();
            forEach(raffleService.findDueToStart(now), engine::advanceTime);
            forEach(raffleService.findEndingBy(RaffleStatus.ACTIVE, now.plus(endingThreshold)), engine::advanceTime);
            if (autoDraw) {
                forEach(raffleService.findEndingBy(RaffleStatus.ENDING, now), this::draw);
            }
        } catch (Exception e) {
            log.error("Error in raffle lifecycle sweep", e);
        } finally {
            CorrelationContext.clear();
        }
    }

    private void draw(UUID raffleId) {
        EngineResult<DrawOutcome> result = engine.requestDraw(raffleId, null);
        if (result.isFailure() && result.getErrorCode() == RaffleErrorCode.NO_ENTRIES_FOR_DRAW) {
            log.error("Raffle ended without entries and needs an operator decision: raffleId={}", raffleId);
        }
    }

    private void forEach(List<UUID> raffleIds, Consumer<UUID> action) {
        for (UUID raffleId : raffleIds) {
            MDC.put(CorrelationContext.RAFFLE_ID_MDC_KEY, raffleId.toString());
            try {
                action.accept(raffleId);
            } catch (Exception e) {
                log.error("Scheduled raffle operation failed, will retry next sweep", e);
            } finally {
                MDC.remove(CorrelationContext.RAFFLE_ID_MDC_KEY);
            }
        }
    }
}
