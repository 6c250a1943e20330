package com.flagship.raffle_engine.entry;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Protocol fee of a raffle before and after an entry was added to it.
 */
@Value
public class EntryCounterUpdate {
    BigDecimal previousProtocolFee;
    BigDecimal protocolFee;

    public BigDecimal revenueDelta() {
        return protocolFee.subtract(previousProtocolFee);
    }
}
