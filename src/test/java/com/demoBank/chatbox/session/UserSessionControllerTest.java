package com.demoBank.chatbox.session;

import com.demoBank.chatbox.admin.GlobalExceptionHandler;
import com.demoBank.chatbox.auth.JwtService;
import com.demoBank.chatbox.auth.UserAuthInterceptor;
import com.demoBank.chatbox.storage.SessionStore;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class UserSessionControllerTest {

    private static final String SECRET = "k9Lq2Vx7Rp4Zm8Wn3Bt6Yc1Hd5Jf0Gs2Qa";

    @Mock
    private SessionStore sessionStore;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new UserSessionController(sessionStore))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addInterceptors(new UserAuthInterceptor(new JwtService(SECRET)))
                .build();
    }

    @Test
    @DisplayName("User gets their own stored sessions with a count")
    void sessions_listsOwnSessions() throws Exception {
        when(sessionStore.listSessionsByUser("user-1", UserSessionController.DEFAULT_LIMIT)).thenReturn(List.of(
                summary("session-2", Instant.parse("2025-03-02T09:00:00Z")),
                summary("session-1", Instant.parse("2025-03-01T09:00:00Z"))));

        mockMvc.perform(get("/chatbox/sessions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("user-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user_id").value("user-1"))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.sessions[0].session_id").value("session-2"))
                .andExpect(jsonPath("$.sessions[1].session_id").value("session-1"));
    }

    @Test
    @DisplayName("Limit above the cap falls back to the default")
    void sessions_limitCapped() throws Exception {
        when(sessionStore.listSessionsByUser("user-1", UserSessionController.DEFAULT_LIMIT)).thenReturn(List.of());

        mockMvc.perform(get("/chatbox/sessions")
                        .param("limit", "5000")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("user-1")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(0));
    }

    @Test
    @DisplayName("Missing token is a generic 401")
    void sessions_withoutToken() throws Exception {
        mockMvc.perform(get("/chatbox/sessions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Unauthorized"));

        verifyNoInteractions(sessionStore);
    }

    @Test
    @DisplayName("Invalid token is a generic 401")
    void sessions_invalidToken() throws Exception {
        mockMvc.perform(get("/chatbox/sessions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(sessionStore);
    }

    private static SessionSummary summary(String sessionId, Instant startTime) {
        return SessionSummary.builder()
                .sessionId(sessionId)
                .userId("user-1")
                .startTime(startTime)
                .build();
    }

    private static String token(String userId) {
        return Jwts.builder()
                .claim("user_id", userId)
                .claim("name", "Dana")
                .claim("roles", List.of("user"))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
