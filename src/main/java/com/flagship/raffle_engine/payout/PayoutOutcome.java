package com.flagship.raffle_engine.payout;

import lombok.Value;

/**
 * What the payment collaborator reports for one payout attempt:
 * success with a transaction reference, or failure with a reason.
 */
@Value
public class PayoutOutcome {
    boolean success;
    String paymentReference;
    String error;

    public static PayoutOutcome succeeded(String paymentReference) {
        return new PayoutOutcome(true, paymentReference, null);
    }

    public static PayoutOutcome failed(String error) {
        return new PayoutOutcome(false, null, error);
    }
}
