package com.expensesnap.core.exception;

/**
 * The addressed record does not exist (or, for invite codes, was already used).
 */
public class NotFoundException extends ExpenseSnapException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(ErrorKind.NOT_FOUND, message, cause);
    }
}
