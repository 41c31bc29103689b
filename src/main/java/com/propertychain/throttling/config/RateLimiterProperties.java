package com.propertychain.throttling.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "rate-limiter")
public class RateLimiterProperties {

    public enum StoreType {
        /**
         * Redis first, in-process cache when Redis fails.
         */
        REDIS,

        /**
         * In-process cache only.
         */
        MEMORY
    }

    /**
     * Deployment environment. Loopback clients are allowlisted automatically only in "development".
     */
    private String environment = "production";

    /**
     * Backend for the fixed-window counters.
     */
    private StoreType store = StoreType.REDIS;

    private final Local local = new Local();

    private final Identity identity = new Identity();

    private final Penalty penalty = new Penalty();

    /**
     * Servlet URL patterns bound to each named policy, e.g. {@code auth: [/api/auth/login]}.
     */
    private Map<String, List<String>> routes = new LinkedHashMap<>();

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public boolean isDevelopment() {
        return "development".equalsIgnoreCase(environment);
    }

    public StoreType getStore() {
        return store;
    }

    public void setStore(StoreType store) {
        this.store = store;
    }

    public Local getLocal() {
        return local;
    }

    public Identity getIdentity() {
        return identity;
    }

    public Penalty getPenalty() {
        return penalty;
    }

    public Map<String, List<String>> getRoutes() {
        return routes;
    }

    public void setRoutes(Map<String, List<String>> routes) {
        this.routes = routes;
    }

    public static class Local {

        /**
         * Maximum number of window counters kept in process.
         */
        private long maximumSize = 10_000L;

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }
    }

    public static class Identity {

        /**
         * Client IPs that are never throttled. Bound from a comma-separated value.
         */
        private List<String> allowlist = new ArrayList<>();

        /**
         * When set, the only forwarding header trusted for the client address (e.g. X-Real-IP).
         */
        private String trustedProxyHeader;

        public List<String> getAllowlist() {
            return allowlist;
        }

        public void setAllowlist(List<String> allowlist) {
            this.allowlist = allowlist;
        }

        public String getTrustedProxyHeader() {
            return trustedProxyHeader;
        }

        public void setTrustedProxyHeader(String trustedProxyHeader) {
            this.trustedProxyHeader = trustedProxyHeader;
        }
    }

    public static class Penalty {

        /**
         * Backend for violation records, independent of the counter backend.
         */
        private StoreType store = StoreType.MEMORY;

        private long maximumSize = 10_000L;

        /**
         * How long a violation record survives after the last violation.
         */
        private Duration retention = Duration.ofHours(24);

        public StoreType getStore() {
            return store;
        }

        public void setStore(StoreType store) {
            this.store = store;
        }

        public long getMaximumSize() {
            return maximumSize;
        }

        public void setMaximumSize(long maximumSize) {
            this.maximumSize = maximumSize;
        }

        public Duration getRetention() {
            return retention;
        }

        public void setRetention(Duration retention) {
            this.retention = retention;
        }
    }
}
