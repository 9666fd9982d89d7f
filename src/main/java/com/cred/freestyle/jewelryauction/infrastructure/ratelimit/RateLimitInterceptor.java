package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

import com.cred.freestyle.jewelryauction.security.AuthenticatedUser;
import com.cred.freestyle.jewelryauction.security.SecurityUtils;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Interceptor applying rate limiting to bid submission before the controller runs.
 * Only POST requests are counted; bid history reads pass through.
 *
 * @author Jewelry Auction Team
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimitService rateLimitService;
    private final ObjectMapper objectMapper;

    public RateLimitInterceptor(RateLimitService rateLimitService, ObjectMapper objectMapper) {
        this.rateLimitService = rateLimitService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {

        if (!"POST".equalsIgnoreCase(request.getMethod())) {
            return true;
        }

        AuthenticatedUser user = SecurityUtils.getCurrentUser();
        String callerId = user != null ? user.getUserId() : getClientIp(request);
        String userAgent = request.getHeader("User-Agent");

        RateLimitResult result = rateLimitService.checkRateLimit(
                callerId, user != null ? user.getRole() : null, userAgent);

        response.setHeader("X-RateLimit-Limit", String.valueOf(result.getTier().getMaxRequests()));
        response.setHeader("X-RateLimit-Tier", result.getTier().name());

        if (result.isAllowed()) {
            response.setHeader("X-RateLimit-Remaining", String.valueOf(result.getRemainingTokens()));
            if (result.isDegraded()) {
                response.setHeader("X-RateLimit-Degraded", "true");
            }
            return true;
        }

        logger.warn("Rate limit exceeded for caller: {}, tier: {}", result.getCallerId(), result.getTier());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(result.getRetryAfterSeconds()));
        response.setHeader("X-RateLimit-Remaining", "0");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), result.toErrorResponse(request.getRequestURI()));

        return false;
    }

    /**
     * Get client IP address, handling proxies and load balancers.
     */
    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        return request.getRemoteAddr();
    }
}
