package com.expensesnap.core.exception;

/**
 * Base of every terminal error raised by the core. None of them is retried automatically.
 */
public abstract class ExpenseSnapException extends RuntimeException {

    private final ErrorKind kind;

    protected ExpenseSnapException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ExpenseSnapException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
