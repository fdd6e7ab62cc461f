package com.vrwx.core.exception;

/** Referenced entity or balance is missing or too small. */
public class InsufficientResourceException extends LedgerException {

    public InsufficientResourceException(ErrorCode code) {
        this(code, code.description());
    }

    public InsufficientResourceException(ErrorCode code, String message) {
        super(code, message);
        if (code.category() != ErrorCategory.RESOURCE) {
            throw new IllegalArgumentException(code + " is not a RESOURCE code");
        }
    }
}
