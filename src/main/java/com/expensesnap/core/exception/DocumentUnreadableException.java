package com.expensesnap.core.exception;

/**
 * A PDF upload could not be opened or rendered.
 */
public class DocumentUnreadableException extends ExpenseSnapException {

    public DocumentUnreadableException(String message) {
        super(ErrorKind.DOCUMENT_UNREADABLE, message);
    }

    public DocumentUnreadableException(String message, Throwable cause) {
        super(ErrorKind.DOCUMENT_UNREADABLE, message, cause);
    }
}
