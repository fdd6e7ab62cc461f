package com.vrwx.core.exception;

/** Argument failed validation. */
public class ValidationException extends LedgerException {

    public ValidationException(ErrorCode code) {
        this(code, code.description());
    }

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
        if (code.category() != ErrorCategory.VALIDATION) {
            throw new IllegalArgumentException(code + " is not a VALIDATION code");
        }
    }
}
