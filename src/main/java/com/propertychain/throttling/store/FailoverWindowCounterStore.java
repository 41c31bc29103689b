package com.propertychain.throttling.store;

import com.propertychain.throttling.model.WindowCounter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Tries the shared store first and counts locally when it fails.
 * <p>
 * Counts taken during a fallback period are never merged back into the shared store;
 * once Redis answers again, counting resumes there.
 */
public class FailoverWindowCounterStore implements WindowCounterStore {

    private static final Logger log = LoggerFactory.getLogger(FailoverWindowCounterStore.class);

    private final WindowCounterStore primary;
    private final WindowCounterStore fallback;

    public FailoverWindowCounterStore(WindowCounterStore primary, WindowCounterStore fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public WindowCounter increment(String key, Duration window) {
        try {
            return primary.increment(key, window);
        } catch (CounterStoreUnavailableException ex) {
            log.warn("Shared counter store unavailable, counting {} locally: {}", key, ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Unexpected error from shared counter store, counting {} locally", key, ex);
        }
        return fallback.increment(key, window);
    }
}
