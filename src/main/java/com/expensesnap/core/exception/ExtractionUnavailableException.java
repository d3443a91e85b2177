package com.expensesnap.core.exception;

/**
 * The vision extraction service failed, timed out or answered with an error status.
 */
public class ExtractionUnavailableException extends ExpenseSnapException {

    public ExtractionUnavailableException(String message) {
        super(ErrorKind.EXTRACTION_UNAVAILABLE, message);
    }

    public ExtractionUnavailableException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_UNAVAILABLE, message, cause);
    }
}
