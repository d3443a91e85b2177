package com.expensesnap.core.exception;

/**
 * Missing, invalid or unknown credentials.
 */
public class UnauthorizedException extends ExpenseSnapException {

    public UnauthorizedException(String message) {
        super(ErrorKind.UNAUTHORIZED, message);
    }

    public UnauthorizedException(String message, Throwable cause) {
        super(ErrorKind.UNAUTHORIZED, message, cause);
    }
}
