package com.propertychain.throttling.store;

import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.Collections;

/**
 * Violation counts shared through Redis under {@code rate_limit:violations:<identity>}.
 */
public class RedisViolationStore implements ViolationStore {

    static final String KEY_PREFIX = "rate_limit:violations:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> incrementScript;
    private final Duration retention;

    public RedisViolationStore(StringRedisTemplate redisTemplate, RedisScript<Long> incrementScript, Duration retention) {
        this.redisTemplate = redisTemplate;
        this.incrementScript = incrementScript;
        this.retention = retention;
    }

    @Override
    public long count(String identity) {
        String value;
        try {
            value = redisTemplate.opsForValue().get(KEY_PREFIX + identity);
        } catch (DataAccessException ex) {
            throw new CounterStoreUnavailableException("Redis read failed for violations of " + identity, ex);
        }
        if (value == null) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            throw new CounterStoreUnavailableException("Unparseable violation count for " + identity + ": " + value, ex);
        }
    }

    @Override
    public void increment(String identity) {
        try {
            redisTemplate.execute(
                    incrementScript,
                    Collections.singletonList(KEY_PREFIX + identity),
                    Long.toString(retention.toMillis())
            );
        } catch (DataAccessException ex) {
            throw new CounterStoreUnavailableException("Redis increment failed for violations of " + identity, ex);
        }
    }

    @Override
    public void clear(String identity) {
        try {
            redisTemplate.delete(KEY_PREFIX + identity);
        } catch (DataAccessException ex) {
            throw new CounterStoreUnavailableException("Redis delete failed for violations of " + identity, ex);
        }
    }
}
