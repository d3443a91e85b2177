package com.expensesnap.core.exception;

/**
 * Thrown when a caller acts outside the tenant scope its role allows.
 */
public class AccessDeniedException extends ExpenseSnapException {

    public AccessDeniedException(String message) {
        super(ErrorKind.ACCESS_DENIED, message);
    }

    public AccessDeniedException(String message, Throwable cause) {
        super(ErrorKind.ACCESS_DENIED, message, cause);
    }
}
