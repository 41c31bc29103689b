package com.propertychain.throttling.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RateLimitPolicy")
class RateLimitPolicyTest {

    @Test
    void defaultsApplyWhenOnlyBudgetIsGiven() {
        RateLimitPolicy policy = RateLimitPolicy.builder("search")
                .window(Duration.ofMinutes(1))
                .maxRequests(60)
                .build();

        assertThat(policy.getRejectionStatus()).isEqualTo(429);
        assertThat(policy.getRejectionMessage()).isEqualTo(RateLimitPolicy.DEFAULT_REJECTION_MESSAGE);
        assertThat(policy.isEmitHeaders()).isTrue();
        assertThat(policy.getKeyFunction()).isNull();
        assertThat(policy.policyDescriptor()).isEqualTo("60;w=60000");
    }

    @Test
    void rejectsNonPositiveMaxRequests() {
        assertThatThrownBy(() -> RateLimitPolicy.builder("broken")
                .window(Duration.ofMinutes(1))
                .maxRequests(0)
                .build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxRequests");
    }

    @Test
    void rejectsMissingOrNonPositiveWindow() {
        assertThatThrownBy(() -> RateLimitPolicy.builder("broken").maxRequests(5).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("window");

        assertThatThrownBy(() -> RateLimitPolicy.builder("broken")
                .window(Duration.ofSeconds(-1))
                .maxRequests(5)
                .build())
                .isInstanceOf(IllegalArgumentException.class);

        assertThatThrownBy(() -> RateLimitPolicy.builder("broken")
                .window(Duration.ofNanos(10))
                .maxRequests(5)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNonErrorRejectionStatus() {
        assertThatThrownBy(() -> RateLimitPolicy.builder("broken")
                .window(Duration.ofMinutes(1))
                .maxRequests(5)
                .rejectionStatus(200)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
