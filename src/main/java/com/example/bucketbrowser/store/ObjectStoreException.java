package com.example.bucketbrowser.store;

/**
 * Raised when the object store cannot complete a call (network failure, throttling, denied access).
 * A missing object is not an error and is reported through {@link ObjectStore#probeObject} instead.
 */
public class ObjectStoreException extends RuntimeException {
    public ObjectStoreException(String message) {
        super(message);
    }

    public ObjectStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
