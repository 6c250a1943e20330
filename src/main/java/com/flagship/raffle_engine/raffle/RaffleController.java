package com.flagship.raffle_engine.raffle;

import com.flagship.raffle_engine.draw.DrawVerification;
import com.flagship.raffle_engine.engine.RaffleEngine;
import com.flagship.raffle_engine.raffle.dto.CreateRaffleRequest;
import com.flagship.raffle_engine.raffle.dto.DrawResponse;
import com.flagship.raffle_engine.raffle.dto.RaffleResponse;
import com.flagship.raffle_engine.raffle.dto.WinnerResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
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
 * REST controller for raffle administration, lifecycle and draws.
 *
 * Thin adapter over {@link RaffleEngine}: engine failures are unwrapped with
 * orElseThrow and mapped to HTTP by the global exception handler. Endpoints
 * under /advance, /transitions and /draw are what an external scheduler calls
 * when the in-process one is disabled.
 */
@RestController
@RequestMapping("/api/raffles")
@RequiredArgsConstructor
@Slf4j
public class RaffleController {

    private final RaffleEngine engine;

    @PostMapping
    public ResponseEntity<RaffleResponse> createRaffle(@Valid @RequestBody CreateRaffleRequest request) {
        log.info("Received raffle creation request: type={}, title={}", request.getType(), request.getTitle());
        Raffle raffle = engine.createRaffle(request.toCommand()).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(RaffleResponse.from(raffle));
    }

    @GetMapping("/{id}")
    public ResponseEntity<RaffleResponse> getRaffle(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(RaffleResponse.from(engine.getRaffle(id).orElseThrow()));
    }

    @GetMapping
    public ResponseEntity<List<RaffleResponse>> findRaffles(@RequestParam("status") RaffleStatus status) {
        return ResponseEntity.ok(engine.findRaffles(status).orElseThrow().stream()
                .map(RaffleResponse::from)
                .toList());
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<RaffleResponse> cancelRaffle(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(RaffleResponse.from(engine.cancelRaffle(id).orElseThrow()));
    }

    @PostMapping("/{id}/advance")
    public ResponseEntity<RaffleResponse> advanceTime(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(RaffleResponse.from(engine.advanceTime(id).orElseThrow()));
    }

    @PostMapping("/{id}/transitions/{trigger}")
    public ResponseEntity<RaffleResponse> transition(@PathVariable("id") UUID id,
                                                     @PathVariable("trigger") TransitionTrigger trigger) {
        return ResponseEntity.ok(RaffleResponse.from(engine.tryTransition(id, trigger).orElseThrow()));
    }

    /**
     * Draws winners. {@code seed} is an administrative override; without it
     * the configured seed source supplies one.
     */
    @PostMapping("/{id}/draw")
    public ResponseEntity<DrawResponse> requestDraw(@PathVariable("id") UUID id,
                                                    @RequestParam(value = "seed", required = false) String seed) {
        return ResponseEntity.ok(DrawResponse.from(engine.requestDraw(id, seed).orElseThrow()));
    }

    @GetMapping("/{id}/verification")
    public ResponseEntity<DrawVerification> verifyDraw(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(engine.verifyDraw(id).orElseThrow());
    }

    @GetMapping("/{id}/winners")
    public ResponseEntity<List<WinnerResponse>> getWinners(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(engine.getWinners(id).orElseThrow().stream()
                .map(WinnerResponse::from)
                .toList());
    }

    @GetMapping("/wallets/{wallet}/wins")
    public ResponseEntity<List<WinnerResponse>> getWalletWins(@PathVariable("wallet") String wallet) {
        return ResponseEntity.ok(engine.getWalletWins(wallet).orElseThrow().stream()
                .map(WinnerResponse::from)
                .toList());
    }
}
