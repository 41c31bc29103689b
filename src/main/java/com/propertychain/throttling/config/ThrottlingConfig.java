package com.propertychain.throttling.config;

import com.propertychain.throttling.service.ClientIdentityResolver;
import com.propertychain.throttling.service.ProgressivePenaltyTracker;
import com.propertychain.throttling.service.RateLimiterService;
import com.propertychain.throttling.store.FailoverViolationStore;
import com.propertychain.throttling.store.FailoverWindowCounterStore;
import com.propertychain.throttling.store.LocalViolationStore;
import com.propertychain.throttling.store.LocalWindowCounterStore;
import com.propertychain.throttling.store.RedisViolationStore;
import com.propertychain.throttling.store.RedisWindowCounterStore;
import com.propertychain.throttling.store.ViolationStore;
import com.propertychain.throttling.store.WindowCounterStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;

/**
 * Wires the counter and violation backends selected in {@link RateLimiterProperties}.
 */
@Configuration
public class ThrottlingConfig {

    private static final Logger log = LoggerFactory.getLogger(ThrottlingConfig.class);

    @Bean
    public WindowCounterStore windowCounterStore(
            RateLimiterProperties properties,
            StringRedisTemplate redisTemplate,
            RedisScript<Long> incrementWithTtlScript,
            Clock clock
    ) {
        LocalWindowCounterStore local = new LocalWindowCounterStore(properties.getLocal().getMaximumSize(), clock);
        if (properties.getStore() == RateLimiterProperties.StoreType.MEMORY) {
            log.info("Window counters kept in process only (max {} entries)", properties.getLocal().getMaximumSize());
            return local;
        }
        log.info("Window counters kept in Redis with in-process fallback");
        return new FailoverWindowCounterStore(
                new RedisWindowCounterStore(redisTemplate, incrementWithTtlScript, clock),
                local
        );
    }

    @Bean
    public ViolationStore violationStore(
            RateLimiterProperties properties,
            StringRedisTemplate redisTemplate,
            RedisScript<Long> incrementWithTtlScript,
            Clock clock
    ) {
        RateLimiterProperties.Penalty penalty = properties.getPenalty();
        LocalViolationStore local = new LocalViolationStore(penalty.getMaximumSize(), penalty.getRetention(), clock);
        if (penalty.getStore() == RateLimiterProperties.StoreType.MEMORY) {
            return local;
        }
        return new FailoverViolationStore(
                new RedisViolationStore(redisTemplate, incrementWithTtlScript, penalty.getRetention()),
                local
        );
    }

    @Bean
    public ProgressivePenaltyTracker progressivePenaltyTracker(ViolationStore violationStore) {
        return new ProgressivePenaltyTracker(violationStore);
    }

    @Bean
    public RateLimiterService rateLimiterService(
            WindowCounterStore windowCounterStore,
            ProgressivePenaltyTracker progressivePenaltyTracker,
            ClientIdentityResolver clientIdentityResolver,
            Clock clock
    ) {
        return new RateLimiterService(windowCounterStore, progressivePenaltyTracker, clientIdentityResolver, clock);
    }
}
