package com.flagship.raffle_engine.common;

import org.springframework.http.HttpStatus;

/**
 * Closed set of failure kinds the engine reports to its callers.
 *
 * Every code is a validation-class failure: it is returned synchronously and
 * never retried automatically. Infrastructure failures (storage, broker) are
 * not represented here and propagate as exceptions.
 */
public enum RaffleErrorCode {
    RAFFLE_NOT_FOUND(HttpStatus.NOT_FOUND),
    RAFFLE_NOT_ACTIVE(HttpStatus.BAD_REQUEST),
    INVALID_ENTRY(HttpStatus.BAD_REQUEST),
    MAX_ENTRIES_EXCEEDED(HttpStatus.BAD_REQUEST),
    INVALID_STATUS_TRANSITION(HttpStatus.CONFLICT),
    NO_ENTRIES_FOR_DRAW(HttpStatus.UNPROCESSABLE_ENTITY),
    PAYOUT_ALREADY_PROCESSED(HttpStatus.CONFLICT),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    WINNER_NOT_FOUND(HttpStatus.NOT_FOUND),
    PAYOUT_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus httpStatus;

    RaffleErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
