package com.propertychain.throttling.store;

import com.propertychain.throttling.model.WindowCounter;

import java.time.Duration;

/**
 * Per-key request counter for one fixed window.
 */
public interface WindowCounterStore {

    /**
     * Atomically count one more request for {@code key}.
     *
     * @param key    window-scoped key, already carrying the window index
     * @param window length of the window the key belongs to
     * @return the count after this increment and the instant the window closes
     */
    WindowCounter increment(String key, Duration window);
}
