package com.flagship.raffle_engine.draw;

import com.flagship.raffle_engine.raffle.Raffle;
import lombok.Value;

import java.util.List;

/**
 * A completed draw: the raffle in COMPLETED status and its stored winners in
 * position order.
 */
@Value
public class DrawOutcome {
    Raffle raffle;
    List<Winner> winners;
    long totalTickets;
    int unfilledSlots;
}
