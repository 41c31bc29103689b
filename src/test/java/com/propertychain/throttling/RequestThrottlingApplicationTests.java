package com.propertychain.throttling;

import com.propertychain.throttling.filter.RateLimitingFilter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "rate-limiter.store=memory",
        "rate-limiter.penalty.store=memory",
        "rate-limiter.identity.allowlist=192.0.2.10"
})
@AutoConfigureMockMvc
class RequestThrottlingApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void pingCarriesApiPolicyHeaders() throws Exception {
        mockMvc.perform(get("/api/ping").header("X-Forwarded-For", "203.0.113.50"))
                .andExpect(status().isOk())
                .andExpect(header().string(RateLimitingFilter.LIMIT_HEADER, "1000"))
                .andExpect(header().string(RateLimitingFilter.REMAINING_HEADER, "999"))
                .andExpect(header().string(RateLimitingFilter.POLICY_HEADER, "1000;w=900000"));
    }

    @Test
    void generalApiTrafficDoesNotConsumeLoginBudget() throws Exception {
        for (int i = 0; i < 10; i++) {
            mockMvc.perform(get("/api/ping").header("X-Forwarded-For", "203.0.113.52"))
                    .andExpect(status().isOk());
        }

        mockMvc.perform(post("/api/auth/login").header("X-Forwarded-For", "203.0.113.52"))
                .andExpect(status().is(not(429)))
                .andExpect(header().string(RateLimitingFilter.LIMIT_HEADER, "10"))
                .andExpect(header().string(RateLimitingFilter.REMAINING_HEADER, "9"));
    }

    @Test
    void pingReportsResolvedIdentity() throws Exception {
        mockMvc.perform(get("/api/ping").header("X-Forwarded-For", "192.0.2.10, 10.0.0.1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.identity").value("ip:192.0.2.10"))
                .andExpect(jsonPath("$.allowlisted").value(true));
    }

    @Test
    void loginIsThrottledAfterTenAttempts() throws Exception {
        for (int i = 0; i < 10; i++) {
            mockMvc.perform(post("/api/auth/login").header("X-Forwarded-For", "203.0.113.51"))
                    .andExpect(header().string(RateLimitingFilter.LIMIT_HEADER, "10"));
        }

        mockMvc.perform(post("/api/auth/login").header("X-Forwarded-For", "203.0.113.51"))
                .andExpect(status().isTooManyRequests())
                .andExpect(jsonPath("$.error").value("Too many authentication attempts. Please try again in 15 minutes."))
                .andExpect(header().string(RateLimitingFilter.REMAINING_HEADER, "0"))
                .andExpect(header().string(RateLimitingFilter.POLICY_HEADER, "10;w=900000"));
    }

    @Test
    void allowlistedClientIsNeverThrottled() throws Exception {
        for (int i = 0; i < 12; i++) {
            mockMvc.perform(post("/api/auth/login").header("X-Forwarded-For", "192.0.2.10"))
                    .andExpect(header().string(RateLimitingFilter.REMAINING_HEADER, "10"));
        }
    }
}
