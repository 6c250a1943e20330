package com.flagship.raffle_engine.stats;

import com.flagship.raffle_engine.engine.RaffleEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatsController {

    private final RaffleEngine engine;

    @GetMapping("/api/stats")
    public ResponseEntity<PlatformStats> getStats() {
        return ResponseEntity.ok(engine.getPlatformStats().orElseThrow());
    }
}
