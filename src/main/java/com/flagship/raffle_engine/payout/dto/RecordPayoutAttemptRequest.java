package com.flagship.raffle_engine.payout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.raffle_engine.payout.PayoutOutcome;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Outcome reported by the payment collaborator: a transaction reference on
 * success, a reason on failure.
 */
@Value
public class RecordPayoutAttemptRequest {

    @NotNull(message = "Success flag is required")
    @JsonProperty("success")
    Boolean success;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("error")
    String error;

    public PayoutOutcome toOutcome() {
        return success ? PayoutOutcome.succeeded(paymentReference) : PayoutOutcome.failed(error);
    }
}
