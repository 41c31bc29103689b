package com.propertychain.throttling.model;

/**
 * Request count observed for one key within one fixed window.
 *
 * @param count           number of requests counted so far in the window, including the current one
 * @param expiresAtMillis epoch millis at or after which the record may be purged
 */
public record WindowCounter(long count, long expiresAtMillis) {

    public WindowCounter increment() {
        return new WindowCounter(count + 1, expiresAtMillis);
    }
}
