package com.flagship.raffle_engine.draw;

import lombok.Value;

/**
 * A picked ticket number and the block it falls in.
 */
@Value
public class DrawnTicket {
    long ticketNumber;
    TicketRange range;
}
