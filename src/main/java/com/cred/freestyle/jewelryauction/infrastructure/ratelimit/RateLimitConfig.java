package com.cred.freestyle.jewelryauction.infrastructure.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Registers the rate limiting interceptor on the bid submission endpoint.
 *
 * @author Jewelry Auction Team
 */
@Configuration
public class RateLimitConfig implements WebMvcConfigurer {

    private final RateLimitInterceptor rateLimitInterceptor;

    @Value("${auction.rate-limiting.enabled:true}")
    private boolean rateLimitingEnabled;

    public RateLimitConfig(RateLimitInterceptor rateLimitInterceptor) {
        this.rateLimitInterceptor = rateLimitInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (rateLimitingEnabled) {
            registry.addInterceptor(rateLimitInterceptor)
                   .addPathPatterns("/api/v1/lots/*/bids");
        }
    }
}
