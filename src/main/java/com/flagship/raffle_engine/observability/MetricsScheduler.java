package com.flagship.raffle_engine.observability;

import com.flagship.raffle_engine.payout.PayoutRepository;
import com.flagship.raffle_engine.payout.PayoutStatus;
import com.flagship.raffle_engine.raffle.RaffleRepository;
import com.flagship.raffle_engine.raffle.RaffleStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Refreshes gauges that need a database query, so scrapes stay cheap.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private static final List<RaffleStatus> OPEN = List.of(RaffleStatus.ACTIVE, RaffleStatus.ENDING);
    private static final List<PayoutStatus> OUTSTANDING =
            List.of(PayoutStatus.PENDING, PayoutStatus.PROCESSING, PayoutStatus.FAILED);

    private final OutboxMetrics outboxMetrics;
    private final RaffleMetrics raffleMetrics;
    private final RaffleRepository raffleRepository;
    private final PayoutRepository payoutRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    @Transactional(readOnly = true)
    public void refreshLifecycleMetrics() {
        try {
            raffleMetrics.updateLifecycleGauges(
                    raffleRepository.countByStatusIn(OPEN),
                    payoutRepository.countByStatusIn(OUTSTANDING));
        } catch (Exception e) {
            log.warn("Failed to refresh lifecycle metrics: {}", e.getMessage());
        }
    }
}
