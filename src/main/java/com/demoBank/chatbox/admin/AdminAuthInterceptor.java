package com.demoBank.chatbox.admin;

import com.demoBank.chatbox.auth.AuthClaims;
import com.demoBank.chatbox.auth.ForbiddenException;
import com.demoBank.chatbox.auth.JwtService;
import com.demoBank.chatbox.auth.UnauthorizedException;
import com.demoBank.chatbox.common.exception.ErrorCode;
import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.ratelimit.RateLimitExceededException;
import com.demoBank.chatbox.ratelimit.SlidingWindowRateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Guards the admin HTTP routes.
 *
 * Checks, in order:
 * - Bearer token present and valid (401)
 * - Admin role (403)
 * - Admin rate limit (429 with Retry-After)
 *
 * Failures are thrown and rendered by {@link GlobalExceptionHandler}.
 */
@Slf4j
@Component
public class AdminAuthInterceptor implements HandlerInterceptor {

    public static final String CLAIMS_ATTRIBUTE = "chatbox.adminClaims";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;
    private final SlidingWindowRateLimiter adminRateLimiter;

    public AdminAuthInterceptor(JwtService jwtService,
                                @Qualifier("adminRateLimiter") SlidingWindowRateLimiter adminRateLimiter) {
        this.jwtService = jwtService;
        this.adminRateLimiter = adminRateLimiter;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, "Unauthorized");
        }

        AuthClaims claims = jwtService.parse(header.substring(BEARER_PREFIX.length()).trim());
        if (!claims.isAdmin()) {
            log.warn("Admin route called without admin role - userId: {}, path: {}",
                    UserIdMasker.mask(claims.getUserId()), request.getRequestURI());
            throw new ForbiddenException();
        }

        if (!adminRateLimiter.allow(claims.getUserId())) {
            int retryAfter = adminRateLimiter.getRetryAfterSeconds(claims.getUserId());
            log.warn("Admin rate limit exceeded - adminId: {}, retryAfter: {}s",
                    UserIdMasker.mask(claims.getUserId()), retryAfter);
            throw new RateLimitExceededException(retryAfter);
        }

        request.setAttribute(CLAIMS_ATTRIBUTE, claims);
        return true;
    }
}
