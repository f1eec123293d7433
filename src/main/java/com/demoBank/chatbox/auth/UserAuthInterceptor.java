package com.demoBank.chatbox.auth;

import com.demoBank.chatbox.common.exception.ErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Requires a valid Bearer token on user HTTP routes and exposes its claims as a request attribute.
 */
@Component
@RequiredArgsConstructor
public class UserAuthInterceptor implements HandlerInterceptor {

    public static final String CLAIMS_ATTRIBUTE = "chatbox.userClaims";

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtService jwtService;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException(ErrorCode.INVALID_TOKEN, "Unauthorized");
        }
        request.setAttribute(CLAIMS_ATTRIBUTE, jwtService.parse(header.substring(BEARER_PREFIX.length()).trim()));
        return true;
    }
}
