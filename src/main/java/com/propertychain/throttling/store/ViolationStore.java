package com.propertychain.throttling.store;

/**
 * Per-identity violation counts that expire 24 hours after the last recorded violation.
 */
public interface ViolationStore {

    /**
     * @return current violation count, 0 when no record exists
     */
    long count(String identity);

    void increment(String identity);

    void clear(String identity);
}
