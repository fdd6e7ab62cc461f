package com.vrwx.core.exception;

import java.util.Objects;

/**
 * Base unchecked exception for ledger operations. Every instance carries an {@link ErrorCode};
 * callers branch on the code or its category, never on the message.
 */
public class LedgerException extends RuntimeException {

    private final ErrorCode code;

    public LedgerException(ErrorCode code) {
        this(code, code.description());
    }

    public LedgerException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "Error code cannot be null");
    }

    public LedgerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "Error code cannot be null");
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.category();
    }

    /**
     * Builds the category-specific subclass for the code.
     */
    public static LedgerException of(ErrorCode code) {
        return of(code, code.description());
    }

    public static LedgerException of(ErrorCode code, String message) {
        return switch (code.category()) {
            case AUTHORIZATION -> new AuthorizationException(code, message);
            case STATE -> new InvalidStateException(code, message);
            case VALIDATION -> new ValidationException(code, message);
            case RESOURCE -> new InsufficientResourceException(code, message);
        };
    }
}
