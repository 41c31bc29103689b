package com.propertychain.throttling.config;

import com.propertychain.throttling.model.RateLimitPolicy;
import com.propertychain.throttling.service.ClientIdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named policy presets shipped with the service. Built once at startup and handed to the
 * throttling filters; nothing here is mutable after construction.
 */
@Component
public class RateLimitPolicies {

    private static final Logger log = LoggerFactory.getLogger(RateLimitPolicies.class);

    public static final String API = "api";
    public static final String AUTH = "auth";
    public static final String PASSWORD_RESET = "passwordReset";
    public static final String EMAIL = "email";
    public static final String UPLOAD = "upload";
    public static final String TRANSACTION = "transaction";
    public static final String SEARCH = "search";
    public static final String ADMIN = "admin";

    private final Map<String, RateLimitPolicy> policies;

    public RateLimitPolicies(ClientIdentityResolver identityResolver) {
        Map<String, RateLimitPolicy> presets = new LinkedHashMap<>();

        register(presets, RateLimitPolicy.builder(API)
                .window(Duration.ofMinutes(15))
                .maxRequests(1000)
                .rejectionMessage("API rate limit exceeded. Please try again in 15 minutes."));

        register(presets, RateLimitPolicy.builder(AUTH)
                .window(Duration.ofMinutes(15))
                .maxRequests(10)
                .rejectionMessage("Too many authentication attempts. Please try again in 15 minutes.")
                .onDenied(request -> log.warn("Auth rate limit exceeded: ip={}, userAgent={}, path={}",
                        identityResolver.clientIp(request), request.getHeader("User-Agent"), request.getRequestURI())));

        register(presets, RateLimitPolicy.builder(PASSWORD_RESET)
                .window(Duration.ofHours(1))
                .maxRequests(5)
                .rejectionMessage("Too many password reset attempts. Please try again in 1 hour."));

        register(presets, RateLimitPolicy.builder(EMAIL)
                .window(Duration.ofHours(1))
                .maxRequests(10)
                .rejectionMessage("Email rate limit exceeded. Please try again later."));

        register(presets, RateLimitPolicy.builder(UPLOAD)
                .window(Duration.ofHours(1))
                .maxRequests(50)
                .rejectionMessage("File upload rate limit exceeded. Please try again later."));

        register(presets, RateLimitPolicy.builder(TRANSACTION)
                .window(Duration.ofMinutes(1))
                .maxRequests(5)
                .rejectionMessage("Transaction rate limit exceeded. Please wait before submitting another transaction."));

        register(presets, RateLimitPolicy.builder(SEARCH)
                .window(Duration.ofMinutes(1))
                .maxRequests(60)
                .rejectionMessage("Search rate limit exceeded. Please slow down."));

        register(presets, RateLimitPolicy.builder(ADMIN)
                .window(Duration.ofMinutes(1))
                .maxRequests(30)
                .rejectionMessage("Admin operation rate limit exceeded.")
                .bypass(request -> isLocalDevelopmentRequest(identityResolver, request)));

        this.policies = Collections.unmodifiableMap(presets);
    }

    /**
     * @throws IllegalArgumentException if no preset has that name
     */
    public RateLimitPolicy get(String name) {
        RateLimitPolicy policy = policies.get(name);
        if (policy == null) {
            throw new IllegalArgumentException("Unknown rate limit policy '" + name + "', known: " + policies.keySet());
        }
        return policy;
    }

    public Set<String> names() {
        return policies.keySet();
    }

    private static void register(Map<String, RateLimitPolicy> presets, RateLimitPolicy.Builder builder) {
        RateLimitPolicy policy = builder.build();
        presets.put(policy.getName(), policy);
    }

    private static boolean isLocalDevelopmentRequest(ClientIdentityResolver identityResolver, HttpServletRequest request) {
        return identityResolver.isDevelopment() && identityResolver.isLoopback(identityResolver.clientIp(request));
    }
}
