package com.propertychain.throttling.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses the shared violation store while it answers and the local one otherwise.
 */
public class FailoverViolationStore implements ViolationStore {

    private static final Logger log = LoggerFactory.getLogger(FailoverViolationStore.class);

    private final ViolationStore primary;
    private final ViolationStore fallback;

    public FailoverViolationStore(ViolationStore primary, ViolationStore fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public long count(String identity) {
        try {
            return primary.count(identity);
        } catch (RuntimeException ex) {
            log.warn("Shared violation store unavailable, reading {} locally: {}", identity, ex.getMessage());
            return fallback.count(identity);
        }
    }

    @Override
    public void increment(String identity) {
        try {
            primary.increment(identity);
        } catch (RuntimeException ex) {
            log.warn("Shared violation store unavailable, recording {} locally: {}", identity, ex.getMessage());
            fallback.increment(identity);
        }
    }

    @Override
    public void clear(String identity) {
        // Clear both so a record written during an outage cannot outlive the reset.
        fallback.clear(identity);
        try {
            primary.clear(identity);
        } catch (RuntimeException ex) {
            log.warn("Shared violation store unavailable, cleared {} locally only: {}", identity, ex.getMessage());
        }
    }
}
