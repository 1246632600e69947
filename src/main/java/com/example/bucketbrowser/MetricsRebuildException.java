package com.example.bucketbrowser;

/**
 * Raised when a metrics rebuild cannot produce a snapshot at all. The previously persisted snapshot is
 * left in place.
 */
public class MetricsRebuildException extends RuntimeException {
    public MetricsRebuildException(String message) {
        super(message);
    }

    public MetricsRebuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
