package com.expensesnap.core.exception;

/**
 * An HEIC/HEIF upload could not be decoded into a JPEG.
 */
public class ConversionFailedException extends ExpenseSnapException {

    public ConversionFailedException(String message) {
        super(ErrorKind.CONVERSION_FAILED, message);
    }

    public ConversionFailedException(String message, Throwable cause) {
        super(ErrorKind.CONVERSION_FAILED, message, cause);
    }
}
