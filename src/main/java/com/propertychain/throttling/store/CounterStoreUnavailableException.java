package com.propertychain.throttling.store;

/**
 * Raised when the shared counter service cannot be reached or returns something unusable.
 * <p>
 * Never surfaced to request-handling code: the failover stores catch it and continue
 * against the in-process backend.
 */
public class CounterStoreUnavailableException extends RuntimeException {

    public CounterStoreUnavailableException(String message) {
        super(message);
    }

    public CounterStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
