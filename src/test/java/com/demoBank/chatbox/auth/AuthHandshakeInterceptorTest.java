package com.demoBank.chatbox.auth;

import com.demoBank.chatbox.connection.ClientConnection;
import com.demoBank.chatbox.connection.ConnectionManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketSession;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AuthHandshakeInterceptorTest {

    private ConnectionManager connectionManager;
    private AuthHandshakeInterceptor interceptor;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        connectionManager = new ConnectionManager(new ObjectMapper(), Runnable::run, Runnable::run, 1, 16);
        interceptor = new AuthHandshakeInterceptor(new JwtService(JwtServiceTest.SECRET), connectionManager);
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    @Test
    @DisplayName("Bearer header token is accepted and its claims stored for the handler")
    void beforeHandshake_headerToken() {
        MockHttpServletRequest request = upgradeRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token("user-1"));

        boolean accepted = handshake(request);

        assertThat(accepted).isTrue();
        AuthClaims claims = (AuthClaims) attributes.get(AuthHandshakeInterceptor.CLAIMS_ATTRIBUTE);
        assertThat(claims.getUserId()).isEqualTo("user-1");
    }

    @Test
    @DisplayName("Query parameter token is still accepted")
    void beforeHandshake_queryToken() {
        MockHttpServletRequest request = upgradeRequest();
        request.setQueryString("token=" + token("user-1"));

        assertThat(handshake(request)).isTrue();
    }

    @Test
    @DisplayName("Missing token is refused with 401 before the upgrade")
    void beforeHandshake_missingToken() {
        assertThat(handshake(upgradeRequest())).isFalse();

        assertThat(servletResponse.getStatus()).isEqualTo(401);
        assertThat(attributes).isEmpty();
    }

    @Test
    @DisplayName("Bad token is refused with 401")
    void beforeHandshake_badToken() {
        MockHttpServletRequest request = upgradeRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer abc.def.ghi");

        assertThat(handshake(request)).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("User at the connection cap is refused with 429")
    void beforeHandshake_connectionCap() {
        WebSocketSession socket = mock(WebSocketSession.class);
        when(socket.isOpen()).thenReturn(true);
        ClientConnection existing = connectionManager.newConnection(socket,
                AuthClaims.builder().userId("user-1").name("user-1").roles(List.of("user")).build());
        connectionManager.register(existing);
        MockHttpServletRequest request = upgradeRequest();
        request.addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + token("user-1"));

        assertThat(handshake(request)).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(429);
    }

    private boolean handshake(MockHttpServletRequest request) {
        return interceptor.beforeHandshake(new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse), null, attributes);
    }

    private static MockHttpServletRequest upgradeRequest() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/chatbox/ws");
        request.setServerName("localhost");
        return request;
    }

    private static String token(String userId) {
        return Jwts.builder()
                .claim("user_id", userId)
                .claim("roles", List.of("user"))
                .signWith(Keys.hmacShaKeyFor(JwtServiceTest.SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
