package com.demoBank.chatbox.ratelimit;

import com.demoBank.chatbox.config.ChatboxProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Three independent limiters: per-user chat messages, per-admin actions and per-IP public endpoints.
 */
@Configuration
public class RateLimiterConfiguration {
    
    @Bean(initMethod = "start", destroyMethod = "stop")
    public SlidingWindowRateLimiter messageRateLimiter(ChatboxProperties properties) {
        return create("message", properties.getRateLimit().getMessage(), properties);
    }
    
    @Bean(initMethod = "start", destroyMethod = "stop")
    public SlidingWindowRateLimiter adminRateLimiter(ChatboxProperties properties) {
        return create("admin", properties.getRateLimit().getAdmin(), properties);
    }
    
    @Bean(initMethod = "start", destroyMethod = "stop")
    public SlidingWindowRateLimiter publicRateLimiter(ChatboxProperties properties) {
        return create("public", properties.getRateLimit().getPublicEndpoints(), properties);
    }
    
    private SlidingWindowRateLimiter create(String name, ChatboxProperties.Limit limit, ChatboxProperties properties) {
        return new SlidingWindowRateLimiter(name, limit.getLimit(), limit.getWindow(),
                properties.getRateLimit().getCleanupInterval());
    }
}
