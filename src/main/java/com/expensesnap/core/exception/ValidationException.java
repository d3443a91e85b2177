package com.expensesnap.core.exception;

/**
 * Missing or malformed input, rejected before any external call.
 */
public class ValidationException extends ExpenseSnapException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, cause);
    }
}
