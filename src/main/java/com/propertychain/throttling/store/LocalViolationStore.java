package com.propertychain.throttling.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Clock;
import java.time.Duration;

/**
 * In-process violation counts. Every write restarts the entry's expiry, so a record lives
 * for {@code retention} after the most recent violation.
 */
public class LocalViolationStore implements ViolationStore {

    private final Cache<String, Long> violations;

    public LocalViolationStore(long maximumSize, Duration retention, Clock clock) {
        this.violations = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(LocalWindowCounterStore.clockTicker(clock))
                .expireAfterWrite(retention)
                .build();
    }

    @Override
    public long count(String identity) {
        Long count = violations.getIfPresent(identity);
        return count != null ? count : 0L;
    }

    @Override
    public void increment(String identity) {
        violations.asMap().merge(identity, 1L, Long::sum);
    }

    @Override
    public void clear(String identity) {
        violations.invalidate(identity);
    }
}
