package com.propertychain.throttling.store;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import com.propertychain.throttling.model.WindowCounter;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * In-process window counters, used when Redis is unavailable or not deployed.
 * <p>
 * Counts are local to this JVM. The cache is bounded; once full, Caffeine evicts by its
 * size policy, and each entry expires on its own when its window closes.
 * Increments go through {@code asMap().compute}, which is atomic per key.
 */
public class LocalWindowCounterStore implements WindowCounterStore {

    private final Cache<String, WindowCounter> counters;
    private final Clock clock;

    public LocalWindowCounterStore(long maximumSize, Clock clock) {
        this.clock = clock;
        this.counters = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(clockTicker(clock))
                .expireAfter(new WindowExpiry())
                .build();
    }

    @Override
    public WindowCounter increment(String key, Duration window) {
        long now = clock.millis();
        long windowMillis = window.toMillis();
        long expiresAt = (Math.floorDiv(now, windowMillis) + 1) * windowMillis;

        return counters.asMap().compute(key, (k, current) -> {
            if (current == null || current.expiresAtMillis() <= now) {
                return new WindowCounter(1L, expiresAt);
            }
            return current.increment();
        });
    }

    /**
     * Number of live counters; approximate, as reported by the cache.
     */
    public long size() {
        counters.cleanUp();
        return counters.estimatedSize();
    }

    static Ticker clockTicker(Clock clock) {
        return () -> TimeUnit.MILLISECONDS.toNanos(clock.millis());
    }

    private static final class WindowExpiry implements Expiry<String, WindowCounter> {

        @Override
        public long expireAfterCreate(String key, WindowCounter value, long currentTime) {
            return untilExpiry(value, currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, WindowCounter value, long currentTime, long currentDuration) {
            return untilExpiry(value, currentTime);
        }

        @Override
        public long expireAfterRead(String key, WindowCounter value, long currentTime, long currentDuration) {
            return currentDuration;
        }

        private static long untilExpiry(WindowCounter value, long currentTimeNanos) {
            return Math.max(0L, TimeUnit.MILLISECONDS.toNanos(value.expiresAtMillis()) - currentTimeNanos);
        }
    }
}
