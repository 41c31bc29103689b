package com.propertychain.throttling.service;

import com.propertychain.throttling.config.RateLimiterProperties;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives the client identity used for throttling from request headers and the socket address.
 * <p>
 * Without a trusted proxy header the precedence is: first entry of {@code X-Forwarded-For},
 * {@code X-Real-IP}, {@code CF-Connecting-IP}, the remote address, then {@code "unknown"}.
 * Forwarding headers are client-controllable, so deployments behind a proxy should configure
 * {@code rate-limiter.identity.trusted-proxy-header}; only that header is then consulted.
 */
@Component
public class ClientIdentityResolver {

    public static final String FORWARDED_FOR = "X-Forwarded-For";
    public static final String REAL_IP = "X-Real-IP";
    public static final String CF_CONNECTING_IP = "CF-Connecting-IP";
    public static final String UNKNOWN = "unknown";

    static final String IDENTITY_PREFIX = "ip:";

    private static final Set<String> LOOPBACK = Set.of("127.0.0.1", "::1", "0:0:0:0:0:0:0:1", "localhost");
    private static final List<String> DEFAULT_HEADERS = List.of(FORWARDED_FOR, REAL_IP, CF_CONNECTING_IP);

    private final List<String> headers;
    private final Set<String> allowlist;
    private final boolean development;

    public ClientIdentityResolver(RateLimiterProperties properties) {
        String trusted = properties.getIdentity().getTrustedProxyHeader();
        this.headers = trusted == null || trusted.isBlank() ? DEFAULT_HEADERS : List.of(trusted.trim());
        this.allowlist = properties.getIdentity().getAllowlist().stream()
                .map(String::trim)
                .filter(ip -> !ip.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
        this.development = properties.isDevelopment();
    }

    public String clientIp(HttpServletRequest request) {
        for (String header : headers) {
            String value = firstEntry(request.getHeader(header));
            if (value != null) {
                return value;
            }
        }
        String remote = request.getRemoteAddr();
        if (remote != null && !remote.isBlank()) {
            return remote.trim();
        }
        return UNKNOWN;
    }

    /**
     * Default throttling key: {@code ip:<client address>}.
     */
    public String identityKey(HttpServletRequest request) {
        return IDENTITY_PREFIX + clientIp(request);
    }

    public boolean isAllowlisted(String ip) {
        return allowlist.contains(ip) || (development && isLoopback(ip));
    }

    public boolean isLoopback(String ip) {
        return LOOPBACK.contains(ip);
    }

    public boolean isDevelopment() {
        return development;
    }

    private static String firstEntry(String headerValue) {
        if (headerValue == null) {
            return null;
        }
        int comma = headerValue.indexOf(',');
        String first = (comma >= 0 ? headerValue.substring(0, comma) : headerValue).trim();
        return first.isEmpty() ? null : first;
    }
}
