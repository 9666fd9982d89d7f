package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import com.cred.freestyle.jewelryauction.infrastructure.metrics.CloudWatchMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Fixed-window rate limiter backed by Redis counters.
 *
 * Each caller gets one counter per tier window. The first request of a window creates
 * the counter with a TTL equal to the window, later requests increment it. Once the
 * count passes the tier's quota, requests are rejected until the key expires.
 *
 * Redis failures fail open: bidding must not stop because the limiter is unavailable.
 *
 * @author Jewelry Auction Team
 */
@Service
public class RateLimitService {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitService.class);

    private static final String WINDOW_KEY_PREFIX = "rate_limit:window:";

    private final StringRedisTemplate redisTemplate;
    private final UserTierService userTierService;
    private final CloudWatchMetricsService metricsService;

    public RateLimitService(
            StringRedisTemplate redisTemplate,
            UserTierService userTierService,
            CloudWatchMetricsService metricsService
    ) {
        this.redisTemplate = redisTemplate;
        this.userTierService = userTierService;
        this.metricsService = metricsService;
    }

    /**
     * Check and consume one request from the caller's quota.
     *
     * @param userId User ID, or client IP for anonymous callers
     * @param role Caller role, null when anonymous
     * @param userAgent User-Agent header
     * @return RateLimitResult with allow/reject decision
     */
    public RateLimitResult checkRateLimit(String userId, Role role, String userAgent) {
        UserTier tier = userTierService.getUserTier(userId, role, userAgent);

        try {
            String key = WINDOW_KEY_PREFIX + tier.name() + ":" + userId;
            Long count = redisTemplate.opsForValue().increment(key);

            if (count != null && count == 1) {
                redisTemplate.expire(key, Duration.ofSeconds(tier.getWindowSeconds()));
            }

            if (count == null || count <= tier.getMaxRequests()) {
                int remaining = count == null ? tier.getMaxRequests() : (int) (tier.getMaxRequests() - count);
                return RateLimitResult.allowed(userId, tier, remaining);
            }

            Long ttl = redisTemplate.getExpire(key);
            long retryAfterSeconds = (ttl != null && ttl > 0) ? ttl : tier.getWindowSeconds();

            logger.warn("Rate limit EXCEEDED for user: {}, tier: {}", userId, tier);
            metricsService.recordRateLimited(tier.name());

            return RateLimitResult.rejected(userId, tier, retryAfterSeconds);

        } catch (Exception e) {
            logger.error("Error checking rate limit for user: {}, defaulting to ALLOW", userId, e);
            metricsService.recordError("RATE_LIMIT_CHECK_ERROR", "checkRateLimit");
            return RateLimitResult.degraded(userId, tier);
        }
    }
}
