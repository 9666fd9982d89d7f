package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitInterceptor Unit Tests")
class RateLimitInterceptorTest {

    @Mock
    private RateLimitService rateLimitService;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private RateLimitInterceptor interceptor;

    @BeforeEach
    void setUp() {
        interceptor = new RateLimitInterceptor(rateLimitService, objectMapper);
    }

    private MockHttpServletRequest bidRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/lots/lot-1/bids");
        request.addHeader("X-Forwarded-For", "203.0.113.7, 10.0.0.1");
        return request;
    }

    @Test
    @DisplayName("Rejected caller gets 429 with the auction error body")
    void rejected_Returns429() throws Exception {
        // Given
        when(rateLimitService.checkRateLimit(eq("203.0.113.7"), isNull(), isNull()))
                .thenReturn(RateLimitResult.rejected("203.0.113.7", UserTier.TIER_2, 42));
        MockHttpServletResponse response = new MockHttpServletResponse();

        // When
        boolean proceed = interceptor.preHandle(bidRequest(), response, new Object());

        // Then
        assertThat(proceed).isFalse();
        assertThat(response.getStatus()).isEqualTo(429);
        assertThat(response.getHeader("Retry-After")).isEqualTo("42");

        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.get("code").asText()).isEqualTo(RateLimitResult.CODE);
        assertThat(body.get("retryable").asBoolean()).isTrue();
        assertThat(body.get("path").asText()).isEqualTo("/api/v1/lots/lot-1/bids");
        assertThat(body.get("details").get("tier").asText()).isEqualTo("TIER_2");
        assertThat(body.get("details").get("retryAfterSeconds").asLong()).isEqualTo(42L);
    }

    @Test
    @DisplayName("Degraded check lets the bid through and flags the response")
    void degraded_AllowsAndFlags() throws Exception {
        when(rateLimitService.checkRateLimit(anyString(), any(), any()))
                .thenReturn(RateLimitResult.degraded("203.0.113.7", UserTier.TIER_2));
        MockHttpServletResponse response = new MockHttpServletResponse();

        assertThat(interceptor.preHandle(bidRequest(), response, new Object())).isTrue();
        assertThat(response.getHeader("X-RateLimit-Degraded")).isEqualTo("true");
        assertThat(response.getHeader("X-RateLimit-Remaining")).isEqualTo("30");
    }

    @Test
    @DisplayName("Reads are not counted")
    void getRequest_NotCounted() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/lots/lot-1/bids");

        assertThat(interceptor.preHandle(request, new MockHttpServletResponse(), new Object())).isTrue();
        verifyNoInteractions(rateLimitService);
    }
}
