package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

import com.cred.freestyle.jewelryauction.domain.model.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves the rate-limit tier of a caller.
 *
 * The role sets the base tier; automation signatures in the User-Agent and an entry in
 * the Redis blacklist push the caller down to TIER_1.
 *
 * @author Jewelry Auction Team
 */
@Service
public class UserTierService {

    private static final Logger logger = LoggerFactory.getLogger(UserTierService.class);

    private static final String BLACKLIST_KEY_PREFIX = "blacklist:user:";

    private static final Set<String> SUSPICIOUS_USER_AGENTS = new HashSet<>(Arrays.asList(
        "bot", "crawler", "spider", "scraper", "python-requests"
    ));

    private final StringRedisTemplate redisTemplate;

    public UserTierService(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * Determine the caller's tier.
     *
     * @param userId User ID (or client IP for anonymous callers)
     * @param role Caller role, null when anonymous
     * @param userAgent User-Agent header
     * @return Tier to rate limit against
     */
    public UserTier getUserTier(String userId, Role role, String userAgent) {
        if (isSuspiciousUserAgent(userAgent) || isBlacklisted(userId)) {
            logger.debug("Caller {} demoted to TIER_1", userId);
            return UserTier.TIER_1;
        }
        if (role == null || role == Role.GUEST) {
            return UserTier.TIER_2;
        }
        return role.atLeast(Role.STAFF) ? UserTier.TIER_4 : UserTier.TIER_3;
    }

    private boolean isSuspiciousUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isEmpty()) {
            return false;
        }
        String lowerUserAgent = userAgent.toLowerCase(Locale.ROOT);
        return SUSPICIOUS_USER_AGENTS.stream().anyMatch(lowerUserAgent::contains);
    }

    private boolean isBlacklisted(String userId) {
        try {
            Boolean blacklisted = redisTemplate.hasKey(BLACKLIST_KEY_PREFIX + userId);
            return blacklisted != null && blacklisted;
        } catch (Exception e) {
            logger.error("Error checking blacklist for user: {}", userId, e);
            return false;
        }
    }
}
