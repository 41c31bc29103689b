package com.propertychain.throttling.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertychain.throttling.model.RateLimitDecision;
import com.propertychain.throttling.model.RateLimitPolicy;
import com.propertychain.throttling.service.RateLimiterService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Map;

/**
 * Servlet filter that applies one {@link RateLimitPolicy} to the requests it is mapped to.
 *
 * The filter is deliberately simple: it delegates all decision-making to {@link RateLimiterService}
 * and translates the decision into HTTP semantics (the policy's rejection status, usually 429).
 */
public class RateLimitingFilter extends OncePerRequestFilter {

    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";
    public static final String POLICY_HEADER = "X-RateLimit-Policy";

    private final RateLimiterService rateLimiterService;
    private final RateLimitPolicy policy;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitingFilter(
            RateLimiterService rateLimiterService,
            RateLimitPolicy policy,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.rateLimiterService = rateLimiterService;
        this.policy = policy;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        RateLimitDecision decision = rateLimiterService.evaluate(request, policy);

        if (policy.isEmitHeaders()) {
            addHeaders(response, decision);
        }

        if (decision.isAdmitted()) {
            filterChain.doFilter(request, response);
            return;
        }

        response.setStatus(policy.getRejectionStatus());
        response.setHeader(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds(decision)));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.getWriter().write(objectMapper.writeValueAsString(Map.of("error", policy.getRejectionMessage())));
    }

    private void addHeaders(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader(LIMIT_HEADER, Integer.toString(decision.getLimit()));
        response.setHeader(REMAINING_HEADER, Long.toString(decision.getRemaining()));
        response.setHeader(RESET_HEADER, Long.toString(decision.getResetAtMillis()));
        response.setHeader(POLICY_HEADER, policy.policyDescriptor());
    }

    private long retryAfterSeconds(RateLimitDecision decision) {
        long millisLeft = decision.getResetAtMillis() - clock.millis();
        return Math.max(1L, (millisLeft + 999L) / 1000L);
    }
}
