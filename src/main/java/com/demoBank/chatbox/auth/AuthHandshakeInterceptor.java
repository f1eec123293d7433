package com.demoBank.chatbox.auth;

import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.connection.ConnectionManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Authenticates the WebSocket upgrade request before the socket is opened.
 *
 * The token comes from {@code Authorization: Bearer <token>} or, for browsers that cannot set headers,
 * the {@code token} query parameter (deprecated, logged). A rejected handshake never upgrades:
 * 401 for a bad token, 429 when the user already holds the maximum number of connections.
 */
@Slf4j
@Component
public class AuthHandshakeInterceptor implements HandshakeInterceptor {

    public static final String CLAIMS_ATTRIBUTE = "chatbox.claims";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String TOKEN_PARAM = "token";

    private final JwtService jwtService;
    private final ConnectionManager connectionManager;

    public AuthHandshakeInterceptor(JwtService jwtService, ConnectionManager connectionManager) {
        this.jwtService = jwtService;
        this.connectionManager = connectionManager;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        String token = extractToken(request);
        if (token == null) {
            log.warn("WebSocket handshake without token - remote: {}", request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        AuthClaims claims;
        try {
            claims = jwtService.parse(token);
        } catch (UnauthorizedException e) {
            log.warn("WebSocket handshake rejected - code: {}, remote: {}", e.getCode(), request.getRemoteAddress());
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }

        // checked again on register, this only saves the upgrade
        if (connectionManager.connectionCount(claims.getUserId()) >= connectionManager.getMaxConnectionsPerUser()) {
            log.warn("WebSocket handshake rejected, connection limit reached - userId: {}",
                    UserIdMasker.mask(claims.getUserId()));
            response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
            return false;
        }

        attributes.put(CLAIMS_ATTRIBUTE, claims);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            log.warn("WebSocket handshake failed - remote: {}, error: {}",
                    request.getRemoteAddress(), exception.getMessage());
        }
    }

    static String extractToken(ServerHttpRequest request) {
        String header = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }

        String queryToken = UriComponentsBuilder.fromUri(request.getURI())
                .build()
                .getQueryParams()
                .getFirst(TOKEN_PARAM);
        if (queryToken != null && !queryToken.isBlank()) {
            log.warn("Token passed as query parameter, this is deprecated - use the Authorization header");
            return queryToken;
        }
        return null;
    }
}
