package com.propertychain.throttling.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertychain.throttling.filter.RateLimitingFilter;
import com.propertychain.throttling.service.RateLimiterService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

import java.time.Clock;
import java.util.List;

/**
 * Registers one {@link RateLimitingFilter} per preset, mapped to the URL patterns configured
 * under {@code rate-limiter.routes.<policy>}. A preset without routes is registered disabled.
 * <p>
 * The general "api" filter runs first, so a request on a narrower surface is counted by both
 * and the narrower policy's headers are the ones the client sees.
 */
@Configuration
public class ThrottlingFilterConfig {

    private static final Logger log = LoggerFactory.getLogger(ThrottlingFilterConfig.class);

    private static final int BASE_ORDER = Ordered.HIGHEST_PRECEDENCE + 10;

    private final RateLimiterService rateLimiterService;
    private final RateLimitPolicies policies;
    private final RateLimiterProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ThrottlingFilterConfig(
            RateLimiterService rateLimiterService,
            RateLimitPolicies policies,
            RateLimiterProperties properties,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.rateLimiterService = rateLimiterService;
        this.policies = policies;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        // Fail at startup on a route bound to a policy that does not exist.
        properties.getRoutes().keySet().forEach(policies::get);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> apiRateLimitFilter() {
        return register(RateLimitPolicies.API, 0);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> authRateLimitFilter() {
        return register(RateLimitPolicies.AUTH, 1);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> passwordResetRateLimitFilter() {
        return register(RateLimitPolicies.PASSWORD_RESET, 2);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> emailRateLimitFilter() {
        return register(RateLimitPolicies.EMAIL, 3);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> uploadRateLimitFilter() {
        return register(RateLimitPolicies.UPLOAD, 4);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> transactionRateLimitFilter() {
        return register(RateLimitPolicies.TRANSACTION, 5);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> searchRateLimitFilter() {
        return register(RateLimitPolicies.SEARCH, 6);
    }

    @Bean
    public FilterRegistrationBean<RateLimitingFilter> adminRateLimitFilter() {
        return register(RateLimitPolicies.ADMIN, 7);
    }

    private FilterRegistrationBean<RateLimitingFilter> register(String policyName, int position) {
        RateLimitingFilter filter = new RateLimitingFilter(rateLimiterService, policies.get(policyName), objectMapper, clock);
        FilterRegistrationBean<RateLimitingFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setName("rateLimit-" + policyName);
        registration.setOrder(BASE_ORDER + position);

        List<String> patterns = properties.getRoutes().getOrDefault(policyName, List.of());
        if (patterns.isEmpty()) {
            registration.setEnabled(false);
            log.info("Rate limit policy {} has no routes, filter disabled", policyName);
        } else {
            registration.setUrlPatterns(patterns);
            log.info("Rate limit policy {} applied to {}", policyName, patterns);
        }
        return registration;
    }
}
