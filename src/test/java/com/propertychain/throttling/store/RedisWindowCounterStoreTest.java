package com.propertychain.throttling.store;

import com.propertychain.throttling.model.WindowCounter;
import com.propertychain.throttling.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisWindowCounterStoreTest {

    private static final long WINDOW_START = 1_700_000_040_000L;
    private static final String KEY = "rate_limit:ip:203.0.113.5:28333334";

    @Mock
    private StringRedisTemplate redisTemplate;

    private final RedisScript<Long> script = new DefaultRedisScript<>("return 1", Long.class);
    private MutableClock clock;
    private RedisWindowCounterStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(WINDOW_START + 45_000);
        store = new RedisWindowCounterStore(redisTemplate, script, clock);
    }

    @Test
    void expiresKeyWhenTheWindowCloses() {
        when(redisTemplate.execute(eq(script), eq(List.of(KEY)), anyString())).thenReturn(4L);

        WindowCounter counter = store.increment(KEY, Duration.ofSeconds(60));

        assertThat(counter.count()).isEqualTo(4);
        assertThat(counter.expiresAtMillis()).isEqualTo(WINDOW_START + 60_000);
        verify(redisTemplate).execute(script, List.of(KEY), "15000");
    }

    @Test
    void translatesConnectionFailure() {
        when(redisTemplate.execute(eq(script), eq(List.of(KEY)), anyString()))
                .thenThrow(new RedisConnectionFailureException("refused"));

        assertThatThrownBy(() -> store.increment(KEY, Duration.ofSeconds(60)))
                .isInstanceOf(CounterStoreUnavailableException.class)
                .hasCauseInstanceOf(RedisConnectionFailureException.class);
    }

    @Test
    void treatsMissingResultAsUnavailable() {
        when(redisTemplate.execute(eq(script), eq(List.of(KEY)), anyString())).thenReturn(null);

        assertThatThrownBy(() -> store.increment(KEY, Duration.ofSeconds(60)))
                .isInstanceOf(CounterStoreUnavailableException.class);
    }
}
