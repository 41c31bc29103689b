package com.propertychain.throttling.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisViolationStoreTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private final RedisScript<Long> script = new DefaultRedisScript<>("return 1", Long.class);
    private RedisViolationStore store;

    @BeforeEach
    void setUp() {
        store = new RedisViolationStore(redisTemplate, script, Duration.ofHours(24));
    }

    @Test
    void absentKeyMeansNoViolations() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("rate_limit:violations:ip:1")).thenReturn(null);

        assertThat(store.count("ip:1")).isZero();
    }

    @Test
    void readsStoredCount() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("rate_limit:violations:ip:1")).thenReturn("7");

        assertThat(store.count("ip:1")).isEqualTo(7L);
    }

    @Test
    void incrementRefreshesTwentyFourHourExpiry() {
        store.increment("ip:1");

        verify(redisTemplate).execute(script, List.of("rate_limit:violations:ip:1"), "86400000");
    }

    @Test
    void translatesRedisFailures() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.get("rate_limit:violations:ip:1"))
                .thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.count("ip:1")).isInstanceOf(CounterStoreUnavailableException.class);
    }
}
