package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

import com.cred.freestyle.jewelryauction.api.dto.ErrorResponse;
import org.springframework.http.HttpStatus;

/**
 * Outcome of one bid-submission quota check for a caller.
 * A degraded result means the quota store was unreachable and the request was let through.
 *
 * @author Jewelry Auction Team
 */
public final class RateLimitResult {

    public static final String CODE = "RATE_LIMITED";

    private final String callerId;
    private final UserTier tier;
    private final boolean allowed;
    private final boolean degraded;
    private final int remainingTokens;
    private final long retryAfterSeconds;

    private RateLimitResult(String callerId, UserTier tier, boolean allowed, boolean degraded,
                            int remainingTokens, long retryAfterSeconds) {
        this.callerId = callerId;
        this.tier = tier;
        this.allowed = allowed;
        this.degraded = degraded;
        this.remainingTokens = remainingTokens;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RateLimitResult allowed(String callerId, UserTier tier, int remainingTokens) {
        return new RateLimitResult(callerId, tier, true, false, remainingTokens, 0);
    }

    public static RateLimitResult rejected(String callerId, UserTier tier, long retryAfterSeconds) {
        return new RateLimitResult(callerId, tier, false, false, 0, retryAfterSeconds);
    }

    public static RateLimitResult degraded(String callerId, UserTier tier) {
        return new RateLimitResult(callerId, tier, true, true, tier.getMaxRequests(), 0);
    }

    /**
     * 429 body for a rejected caller, in the same shape as every other API error.
     */
    public ErrorResponse toErrorResponse(String path) {
        ErrorResponse response = ErrorResponse.of(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", CODE,
                "Too many bids from this caller, retry after " + retryAfterSeconds + " seconds", path);
        response.setRetryable(true);
        response.addDetail("tier", tier.name());
        response.addDetail("limit", tier.getMaxRequests());
        response.addDetail("windowSeconds", tier.getWindowSeconds());
        response.addDetail("retryAfterSeconds", retryAfterSeconds);
        return response;
    }

    public String getCallerId() {
        return callerId;
    }

    public UserTier getTier() {
        return tier;
    }

    public boolean isAllowed() {
        return allowed;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public int getRemainingTokens() {
        return remainingTokens;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
