package com.expensesnap.core.exception;

/**
 * Internal signal that live exchange rates could not be fetched. Never reaches a caller:
 * the conversion service catches it and degrades to cached or fallback rates.
 */
public class RateFetchDegradedException extends Exception {

    public RateFetchDegradedException(String message) {
        super(message);
    }

    public RateFetchDegradedException(String message, Throwable cause) {
        super(message, cause);
    }
}
