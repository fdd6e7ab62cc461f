package com.vrwx.services.module;

/**
 * Raised when a job spec or execution manifest does not satisfy a service module's schema.
 */
public class ManifestValidationException extends RuntimeException {

    public ManifestValidationException(String message) {
        super(message);
    }
}
