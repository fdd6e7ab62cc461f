package com.vrwx.core.exception;

/** Caller may not perform the operation. */
public class AuthorizationException extends LedgerException {

    public AuthorizationException(ErrorCode code) {
        this(code, code.description());
    }

    public AuthorizationException(ErrorCode code, String message) {
        super(code, message);
        if (code.category() != ErrorCategory.AUTHORIZATION) {
            throw new IllegalArgumentException(code + " is not a AUTHORIZATION code");
        }
    }
}
