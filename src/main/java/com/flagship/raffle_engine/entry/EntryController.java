package com.flagship.raffle_engine.entry;

import com.flagship.raffle_engine.engine.RaffleEngine;
import com.flagship.raffle_engine.entry.dto.EntryResponse;
import com.flagship.raffle_engine.entry.dto.SubmitEntryRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * REST controller for raffle entries.
 *
 * Key features:
 * - Requires Idempotency-Key header, used as the payment reference
 * - Returns the original entry with 200 for a repeated key, 201 for a new one
 */
@RestController
@RequestMapping("/api/raffles")
@RequiredArgsConstructor
@Slf4j
public class EntryController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final RaffleEngine engine;

    @PostMapping("/{id}/entries")
    public ResponseEntity<EntryResponse> submitEntry(
            @PathVariable("id") UUID raffleId,
            @Valid @RequestBody SubmitEntryRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey) {

        log.info("Received entry: raffleId={}, idempotencyKey={}, tickets={}, paid={}",
                raffleId, idempotencyKey, request.getNumEntries(), request.getTotalPaid());

        EntrySubmission submission = engine.submitEntry(new SubmitEntryCommand(
                raffleId,
                request.getWalletAddress(),
                request.getNumEntries(),
                request.getTotalPaid(),
                idempotencyKey
        )).orElseThrow();

        HttpStatus status = submission.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status)
                .body(EntryResponse.from(submission.getEntry(), submission.isDuplicate()));
    }

    @GetMapping("/{id}/entries")
    public ResponseEntity<List<EntryResponse>> getEntries(@PathVariable("id") UUID raffleId) {
        return ResponseEntity.ok(engine.getEntries(raffleId).orElseThrow().stream()
                .map(EntryResponse::from)
                .toList());
    }

    @GetMapping("/{id}/eligibility")
    public ResponseEntity<EntryEligibility> checkEligibility(
            @PathVariable("id") UUID raffleId,
            @RequestParam("wallet") String wallet,
            @RequestParam(value = "num_entries", defaultValue = "1") int numEntries) {
        return ResponseEntity.ok(engine.checkEligibility(raffleId, wallet, numEntries).orElseThrow());
    }

    @GetMapping("/wallets/{wallet}/entries")
    public ResponseEntity<List<EntryResponse>> getWalletEntries(@PathVariable("wallet") String wallet) {
        return ResponseEntity.ok(engine.getWalletEntries(wallet).orElseThrow().stream()
                .map(EntryResponse::from)
                .toList());
    }
}
