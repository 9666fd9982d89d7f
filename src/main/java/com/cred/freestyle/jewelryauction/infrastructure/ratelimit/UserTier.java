package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

/**
 * User tier for rate limiting bid submission.
 *
 * @author Jewelry Auction Team
 */
public enum UserTier {
    /**
     * Suspected automation. Very restrictive.
     */
    TIER_1(5, 60),

    /**
     * Unverified caller or unknown role.
     */
    TIER_2(30, 60),

    /**
     * Regular member.
     */
    TIER_3(120, 60),

    /**
     * Staff and above, who bid on behalf of phone and floor bidders.
     */
    TIER_4(600, 60);

    private final int maxRequests;
    private final int windowSeconds;

    UserTier(int maxRequests, int windowSeconds) {
        this.maxRequests = maxRequests;
        this.windowSeconds = windowSeconds;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    public int getWindowSeconds() {
        return windowSeconds;
    }
}
