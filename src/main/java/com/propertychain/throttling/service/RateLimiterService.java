package com.propertychain.throttling.service;

import com.propertychain.throttling.model.RateLimitDecision;
import com.propertychain.throttling.model.RateLimitPolicy;
import com.propertychain.throttling.model.WindowCounter;
import com.propertychain.throttling.store.WindowCounterStore;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Evaluates fixed-window rate limits for incoming requests.
 *
 * This service is responsible for:
 *  - resolving the identity and honouring allowlist / policy bypass
 *  - building the window key
 *  - counting through the configured {@link WindowCounterStore}
 *  - scaling the budget with the {@link ProgressivePenaltyTracker}
 *  - failing open when no store can count the request
 *
 * Being denied is a normal outcome reported in the returned decision, never an exception.
 */
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    static final String KEY_PREFIX = "rate_limit:";

    private final WindowCounterStore counterStore;
    private final ProgressivePenaltyTracker penaltyTracker;
    private final ClientIdentityResolver identityResolver;
    private final Clock clock;

    public RateLimiterService(
            WindowCounterStore counterStore,
            ProgressivePenaltyTracker penaltyTracker,
            ClientIdentityResolver identityResolver,
            Clock clock
    ) {
        this.counterStore = counterStore;
        this.penaltyTracker = penaltyTracker;
        this.identityResolver = identityResolver;
        this.clock = clock;
    }

    /**
     * Count one request against {@code policy} and decide whether it may proceed.
     */
    public RateLimitDecision evaluate(HttpServletRequest request, RateLimitPolicy policy) {
        long now = clock.millis();
        long windowMillis = policy.getWindowMillis();
        long windowIndex = Math.floorDiv(now, windowMillis);
        long resetAt = (windowIndex + 1) * windowMillis;

        String clientIp = identityResolver.clientIp(request);
        if (identityResolver.isAllowlisted(clientIp) || bypassed(request, policy)) {
            return RateLimitDecision.admit(policy.getMaxRequests(), 0L, resetAt);
        }

        String identity = identityFor(request, policy);
        String key = windowKey(policy, identity, windowIndex);

        WindowCounter counter;
        try {
            counter = counterStore.increment(key, policy.getWindow());
        } catch (RuntimeException ex) {
            // Rate limiting must not turn into a denial of service against what it protects.
            log.error("No counter store could count {} for policy {}, admitting request", identity, policy.getName(), ex);
            return RateLimitDecision.admit(policy.getMaxRequests(), 1L, resetAt);
        }

        int effectiveLimit = effectiveLimit(policy.getMaxRequests(), penaltyTracker.multiplierFor(identity));
        long observed = counter.count();

        if (observed <= effectiveLimit) {
            return RateLimitDecision.admit(effectiveLimit, observed, resetAt);
        }

        log.debug("Rate limit exceeded for {} on policy {}: {} > {}", identity, policy.getName(), observed, effectiveLimit);
        penaltyTracker.recordViolation(identity);
        try {
            policy.denied(request);
        } catch (RuntimeException ex) {
            log.error("onDenied hook of policy {} failed for {}", policy.getName(), identity, ex);
        }
        return RateLimitDecision.deny(effectiveLimit, observed, resetAt);
    }

    /**
     * Key that requests of {@code request}'s client are counted and penalised under.
     * A key function that fails or yields a blank key falls back to the client IP identity.
     */
    public String identityFor(HttpServletRequest request, RateLimitPolicy policy) {
        if (policy.getKeyFunction() != null) {
            try {
                String key = policy.getKeyFunction().apply(request);
                if (key != null && !key.isBlank()) {
                    return key;
                }
                log.warn("Key function of policy {} returned no key, using client IP", policy.getName());
            } catch (RuntimeException ex) {
                log.error("Key function of policy {} failed, using client IP", policy.getName(), ex);
            }
        }
        return identityResolver.identityKey(request);
    }

    /**
     * Counter key for one policy, identity and window. The policy name keeps presets that cover
     * the same request from sharing a counter.
     */
    static String windowKey(RateLimitPolicy policy, String identity, long windowIndex) {
        return KEY_PREFIX + policy.getName() + ":" + identity + ":" + windowIndex;
    }

    private boolean bypassed(HttpServletRequest request, RateLimitPolicy policy) {
        try {
            return policy.isBypassed(request);
        } catch (RuntimeException ex) {
            log.error("Bypass predicate of policy {} failed, applying the limit", policy.getName(), ex);
            return false;
        }
    }

    static int effectiveLimit(int maxRequests, double multiplier) {
        return (int) Math.max(1L, (long) Math.floor(maxRequests * multiplier));
    }
}
