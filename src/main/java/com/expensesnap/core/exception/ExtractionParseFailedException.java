package com.expensesnap.core.exception;

/**
 * The extraction service answered with content that is not a JSON object.
 */
public class ExtractionParseFailedException extends ExpenseSnapException {

    public ExtractionParseFailedException(String message) {
        super(ErrorKind.EXTRACTION_PARSE_FAILED, message);
    }

    public ExtractionParseFailedException(String message, Throwable cause) {
        super(ErrorKind.EXTRACTION_PARSE_FAILED, message, cause);
    }
}
