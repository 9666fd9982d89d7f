package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RateLimitService Unit Tests")
class RateLimitServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private CloudWatchMetricsService metricsService;

    private RateLimitService rateLimitService;

    @BeforeEach
    void setUp() {
        rateLimitService = new RateLimitService(redisTemplate, new UserTierService(redisTemplate), metricsService);
    }

    @Test
    @DisplayName("First request of a window sets the expiry")
    void firstRequest_SetsExpiry() {
        when(redisTemplate.hasKey("blacklist:user:bidder-001")).thenReturn(false);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("rate_limit:window:TIER_3:bidder-001")).thenReturn(1L);

        RateLimitResult result = rateLimitService.checkRateLimit("bidder-001", Role.MEMBER, "Mozilla/5.0");

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.getTier()).isEqualTo(UserTier.TIER_3);
        assertThat(result.getRemainingTokens()).isEqualTo(119);
        assertThat(result.isDegraded()).isFalse();
        verify(redisTemplate).expire("rate_limit:window:TIER_3:bidder-001", Duration.ofSeconds(60));
    }

    @Test
    @DisplayName("Request past the quota is rejected with the remaining window")
    void overQuota_Rejected() {
        when(redisTemplate.hasKey("blacklist:user:bidder-001")).thenReturn(false);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("rate_limit:window:TIER_3:bidder-001")).thenReturn(121L);
        when(redisTemplate.getExpire("rate_limit:window:TIER_3:bidder-001")).thenReturn(17L);

        RateLimitResult result = rateLimitService.checkRateLimit("bidder-001", Role.MEMBER, "Mozilla/5.0");

        assertThat(result.isAllowed()).isFalse();
        assertThat(result.getRetryAfterSeconds()).isEqualTo(17L);
        assertThat(result.getCallerId()).isEqualTo("bidder-001");
        verify(metricsService).recordRateLimited("TIER_3");
    }

    @Test
    @DisplayName("Automation user agent is demoted to TIER_1")
    void botUserAgent_Tier1() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.increment("rate_limit:window:TIER_1:bidder-001")).thenReturn(2L);

        RateLimitResult result = rateLimitService.checkRateLimit("bidder-001", Role.STAFF, "python-requests/2.31");

        assertThat(result.getTier()).isEqualTo(UserTier.TIER_1);
        assertThat(result.getRemainingTokens()).isEqualTo(3);
    }

    @Test
    @DisplayName("Staff get the widest tier")
    void staff_Tier4() {
        when(redisTemplate.hasKey("blacklist:user:staff-001")).thenReturn(null);

        assertThat(new UserTierService(redisTemplate).getUserTier("staff-001", Role.STAFF, null))
                .isEqualTo(UserTier.TIER_4);
    }

    @Test
    @DisplayName("Redis outage fails open")
    void redisDown_FailsOpen() {
        when(redisTemplate.hasKey(anyString())).thenReturn(false);
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("connection refused"));

        RateLimitResult result = rateLimitService.checkRateLimit("10.0.0.1", null, null);

        assertThat(result.isAllowed()).isTrue();
        assertThat(result.isDegraded()).isTrue();
        assertThat(result.getTier()).isEqualTo(UserTier.TIER_2);
        verify(metricsService).recordError("RATE_LIMIT_CHECK_ERROR", "checkRateLimit");
    }
}
