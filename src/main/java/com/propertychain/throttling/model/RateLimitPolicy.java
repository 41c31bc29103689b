package com.propertychain.throttling.model;

import jakarta.servlet.http.HttpServletRequest;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Immutable throttling policy for one protected surface (for example "auth" or "search").
 * <p>
 * Instances are created through {@link #builder(String)}; a policy with a non-positive window or
 * request budget is rejected at {@link Builder#build()} time.
 */
public final class RateLimitPolicy {

    public static final int DEFAULT_REJECTION_STATUS = 429;
    public static final String DEFAULT_REJECTION_MESSAGE = "Too many requests, please try again later.";

    private final String name;
    private final Duration window;
    private final int maxRequests;
    private final int rejectionStatus;
    private final String rejectionMessage;
    private final Function<HttpServletRequest, String> keyFunction;
    private final Predicate<HttpServletRequest> bypass;
    private final boolean emitHeaders;
    private final Consumer<HttpServletRequest> onDenied;

    private RateLimitPolicy(Builder builder) {
        this.name = builder.name;
        this.window = builder.window;
        this.maxRequests = builder.maxRequests;
        this.rejectionStatus = builder.rejectionStatus;
        this.rejectionMessage = builder.rejectionMessage;
        this.keyFunction = builder.keyFunction;
        this.bypass = builder.bypass;
        this.emitHeaders = builder.emitHeaders;
        this.onDenied = builder.onDenied;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public Duration getWindow() {
        return window;
    }

    public long getWindowMillis() {
        return window.toMillis();
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public int getRejectionStatus() {
        return rejectionStatus;
    }

    public String getRejectionMessage() {
        return rejectionMessage;
    }

    /**
     * @return the custom identity key function, or {@code null} when the client IP identity applies.
     */
    public Function<HttpServletRequest, String> getKeyFunction() {
        return keyFunction;
    }

    public boolean isBypassed(HttpServletRequest request) {
        return bypass.test(request);
    }

    public boolean isEmitHeaders() {
        return emitHeaders;
    }

    public void denied(HttpServletRequest request) {
        onDenied.accept(request);
    }

    /**
     * Descriptor published in the {@code X-RateLimit-Policy} header, e.g. {@code 10;w=900000}.
     */
    public String policyDescriptor() {
        return maxRequests + ";w=" + getWindowMillis();
    }

    @Override
    public String toString() {
        return "RateLimitPolicy{" + name + ", " + policyDescriptor() + '}';
    }

    public static final class Builder {

        private final String name;
        private Duration window;
        private int maxRequests;
        private int rejectionStatus = DEFAULT_REJECTION_STATUS;
        private String rejectionMessage = DEFAULT_REJECTION_MESSAGE;
        private Function<HttpServletRequest, String> keyFunction;
        private Predicate<HttpServletRequest> bypass = request -> false;
        private boolean emitHeaders = true;
        private Consumer<HttpServletRequest> onDenied = request -> { };

        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder window(Duration window) {
            this.window = window;
            return this;
        }

        public Builder maxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
            return this;
        }

        public Builder rejectionStatus(int rejectionStatus) {
            this.rejectionStatus = rejectionStatus;
            return this;
        }

        public Builder rejectionMessage(String rejectionMessage) {
            this.rejectionMessage = Objects.requireNonNull(rejectionMessage, "rejectionMessage");
            return this;
        }

        public Builder keyFunction(Function<HttpServletRequest, String> keyFunction) {
            this.keyFunction = keyFunction;
            return this;
        }

        public Builder bypass(Predicate<HttpServletRequest> bypass) {
            this.bypass = Objects.requireNonNull(bypass, "bypass");
            return this;
        }

        public Builder emitHeaders(boolean emitHeaders) {
            this.emitHeaders = emitHeaders;
            return this;
        }

        public Builder onDenied(Consumer<HttpServletRequest> onDenied) {
            this.onDenied = Objects.requireNonNull(onDenied, "onDenied");
            return this;
        }

        /**
         * @throws IllegalArgumentException if the window or request budget is not positive,
         *                                  or the rejection status is not an HTTP error status
         */
        public RateLimitPolicy build() {
            if (window == null || window.isZero() || window.isNegative() || window.toMillis() <= 0) {
                throw new IllegalArgumentException("Policy '" + name + "': window must be > 0, was " + window);
            }
            if (maxRequests <= 0) {
                throw new IllegalArgumentException("Policy '" + name + "': maxRequests must be > 0, was " + maxRequests);
            }
            if (rejectionStatus < 400 || rejectionStatus > 599) {
                throw new IllegalArgumentException("Policy '" + name + "': rejectionStatus must be 4xx or 5xx, was " + rejectionStatus);
            }
            return new RateLimitPolicy(this);
        }
    }
}
