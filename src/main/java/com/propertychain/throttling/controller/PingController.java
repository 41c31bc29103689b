package com.propertychain.throttling.controller;

import com.propertychain.throttling.service.ClientIdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Diagnostic endpoint under the "api" policy. Echoes the identity the throttling filters count
 * this caller under, which is the quickest way to check proxy header configuration.
 */
@RestController
public class PingController {

    private final ClientIdentityResolver identityResolver;

    public PingController(ClientIdentityResolver identityResolver) {
        this.identityResolver = identityResolver;
    }

    @GetMapping("/api/ping")
    public ResponseEntity<Map<String, Object>> ping(HttpServletRequest request) {
        String clientIp = identityResolver.clientIp(request);
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "identity", identityResolver.identityKey(request),
                "allowlisted", identityResolver.isAllowlisted(clientIp)
        ));
    }
}
