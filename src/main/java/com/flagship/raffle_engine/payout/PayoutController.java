package com.flagship.raffle_engine.payout;

import com.flagship.raffle_engine.engine.RaffleEngine;
import com.flagship.raffle_engine.payout.dto.PayoutResponse;
import com.flagship.raffle_engine.payout.dto.RecordPayoutAttemptRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller used by the payment collaborator to report payout progress.
 */
@RestController
@RequestMapping("/api/payouts")
@RequiredArgsConstructor
public class PayoutController {

    private final RaffleEngine engine;

    @PostMapping("/{id}/processing")
    public ResponseEntity<PayoutResponse> markProcessing(@PathVariable("id") UUID payoutId) {
        return ResponseEntity.ok(PayoutResponse.from(engine.markPayoutProcessing(payoutId).orElseThrow()));
    }

    @PostMapping("/winners/{winnerId}/attempts")
    public ResponseEntity<PayoutResponse> recordAttempt(@PathVariable("winnerId") UUID winnerId,
                                                        @Valid @RequestBody RecordPayoutAttemptRequest request) {
        Payout payout = engine.recordPayoutAttempt(winnerId, request.toOutcome()).orElseThrow();
        return ResponseEntity.ok(PayoutResponse.from(payout));
    }

    /**
     * Retry sweep lookup, oldest first.
     */
    @GetMapping
    public ResponseEntity<List<PayoutResponse>> findByStatus(@RequestParam("status") PayoutStatus status) {
        return ResponseEntity.ok(engine.findPayoutsByStatus(status).orElseThrow().stream()
                .map(PayoutResponse::from)
                .toList());
    }

    @GetMapping("/raffles/{raffleId}/summary")
    public ResponseEntity<PayoutSummary> getSummary(@PathVariable("raffleId") UUID raffleId) {
        return ResponseEntity.ok(engine.getPayoutSummary(raffleId).orElseThrow());
    }
}
