package com.flagship.raffle_engine.common;

import java.util.function.Function;

/**
 * Outcome of an engine operation: either a value or a tagged failure.
 *
 * Callers branch on {@link #getErrorCode()} instead of catching exceptions.
 *
 * @param <T> type of the success value
 */
public final class EngineResult<T> {

    private final T value;
    private final RaffleErrorCode errorCode;
    private final String message;

    private EngineResult(T value, RaffleErrorCode errorCode, String message) {
        this.value = value;
        this.errorCode = errorCode;
        this.message = message;
    }

    public static <T> EngineResult<T> success(T value) {
        return new EngineResult<>(value, null, null);
    }

    public static <T> EngineResult<T> failure(RaffleErrorCode code, String message) {
        return new EngineResult<>(null, code, message);
    }

    public static <T> EngineResult<T> failure(RaffleEngineException e) {
        return failure(e.getCode(), e.getMessage());
    }

    public boolean isSuccess() {
        return errorCode == null;
    }

    public boolean isFailure() {
        return errorCode != null;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (isFailure()) {
            throw new IllegalStateException("No value on failed result: " + errorCode + " - " + message);
        }
        return value;
    }

    public RaffleErrorCode getErrorCode() {
        return errorCode;
    }

    public String getMessage() {
        return message;
    }

    public <R> EngineResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return failure(errorCode, message);
        }
        return success(mapper.apply(value));
    }

    /**
     * Unwraps the value, re-raising the failure as a {@link RaffleEngineException}.
     */
    public T orElseThrow() {
        if (isFailure()) {
            throw new RaffleEngineException(errorCode, message);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "EngineResult[success=" + value + "]"
                : "EngineResult[failure=" + errorCode + ", message=" + message + "]";
    }
}
