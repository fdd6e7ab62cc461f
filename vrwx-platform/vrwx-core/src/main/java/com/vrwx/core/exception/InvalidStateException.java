package com.vrwx.core.exception;

/** Operation is not allowed in the entity's current state. */
public class InvalidStateException extends LedgerException {

    public InvalidStateException(ErrorCode code) {
        this(code, code.description());
    }

    public InvalidStateException(ErrorCode code, String message) {
        super(code, message);
        if (code.category() != ErrorCategory.STATE) {
            throw new IllegalArgumentException(code + " is not a STATE code");
        }
    }
}
