package com.propertychain.throttling.store;

import com.propertychain.throttling.model.WindowCounter;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;

/**
 * Window counters kept in Redis, shared by every instance of the service.
 * <p>
 * The increment and the expiry are issued by one Lua script, so a key never outlives
 * its window by more than the TTL set on the last increment. Atomicity across processes
 * comes from Redis executing the script as a single command.
 */
public class RedisWindowCounterStore implements WindowCounterStore {

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> incrementScript;
    private final Clock clock;

    public RedisWindowCounterStore(StringRedisTemplate redisTemplate, RedisScript<Long> incrementScript, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = incrementScript;
        this.clock = clock;
    }

    @Override
    public WindowCounter increment(String key, Duration window) {
        long now = clock.millis();
        long windowMillis = window.toMillis();
        long expiresAt = (Math.floorDiv(now, windowMillis) + 1) * windowMillis;
        long ttlMillis = Math.max(1L, expiresAt - now);

        Long count;
        try {
            count = redisTemplate.execute(
                    incrementScript,
                    Collections.singletonList(key),
                    Long.toString(ttlMillis)
            );
        } catch (DataAccessException ex) {
            throw new CounterStoreUnavailableException("Redis increment failed for key " + key, ex);
        } catch (RuntimeException ex) {
            // Lettuce and serializer failures that escape the DataAccessException translation.
            throw new CounterStoreUnavailableException("Unexpected Redis failure for key " + key, ex);
        }

        if (count == null) {
            throw new CounterStoreUnavailableException("Redis returned no count for key " + key);
        }
        return new WindowCounter(count, expiresAt);
    }
}
