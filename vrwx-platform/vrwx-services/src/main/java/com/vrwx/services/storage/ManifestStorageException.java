package com.vrwx.services.storage;

/**
 * A manifest backend could not complete a read or write.
 */
public class ManifestStorageException extends Exception {

    public ManifestStorageException(String message) {
        super(message);
    }

    public ManifestStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
