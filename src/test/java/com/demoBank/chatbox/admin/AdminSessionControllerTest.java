package com.demoBank.chatbox.admin;

import com.demoBank.chatbox.auth.JwtService;
import com.demoBank.chatbox.ratelimit.SlidingWindowRateLimiter;
import com.demoBank.chatbox.router.MessageRouter;
import com.demoBank.chatbox.session.AdminAssistanceConflictException;
import com.demoBank.chatbox.session.SessionNotFoundException;
import com.demoBank.chatbox.session.SessionRegistry;
import com.demoBank.chatbox.session.SessionSummary;
import com.demoBank.chatbox.storage.SessionMetrics;
import com.demoBank.chatbox.storage.SessionStore;
import com.demoBank.chatbox.support.MutableClock;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.AfterEach;
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
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AdminSessionControllerTest {

    private static final String SECRET = "k9Lq2Vx7Rp4Zm8Wn3Bt6Yc1Hd5Jf0Gs2Qa";

    @Mock
    private MessageRouter messageRouter;

    @Mock
    private SessionRegistry sessionRegistry;

    @Mock
    private SessionStore sessionStore;

    private SlidingWindowRateLimiter adminRateLimiter;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        adminRateLimiter = new SlidingWindowRateLimiter("admin", 2, Duration.ofMinutes(1), null);
        AdminAuthInterceptor interceptor = new AdminAuthInterceptor(new JwtService(SECRET), adminRateLimiter);
        mockMvc = MockMvcBuilders.standaloneSetup(new AdminSessionController(messageRouter, sessionRegistry,
                        sessionStore, MutableClock.atEpoch()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addInterceptors(interceptor)
                .build();
    }

    @AfterEach
    void tearDown() {
        adminRateLimiter.stop();
    }

    @Test
    @DisplayName("Admin takes over a session and gets its summary back")
    void takeover_returnsSummary() throws Exception {
        when(messageRouter.takeover("admin-1", "Alex", "session-1")).thenReturn(SessionSummary.builder()
                .sessionId("session-1")
                .userId("user-1")
                .active(true)
                .adminAssisted(true)
                .assistingAdminId("admin-1")
                .assistingAdminName("Alex")
                .build());

        mockMvc.perform(post("/chatbox/admin/takeover/session-1")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("admin-1", "Alex", "admin")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.session_id").value("session-1"))
                .andExpect(jsonPath("$.admin_assisted").value(true))
                .andExpect(jsonPath("$.assisting_admin_id").value("admin-1"));
    }

    @Test
    @DisplayName("Missing token is rejected with a generic 401")
    void takeover_withoutToken() throws Exception {
        mockMvc.perform(post("/chatbox/admin/takeover/session-1"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_TOKEN"))
                .andExpect(jsonPath("$.message").value("Unauthorized"));

        verifyNoInteractions(messageRouter);
    }

    @Test
    @DisplayName("Invalid token is rejected with a generic 401")
    void takeover_invalidToken() throws Exception {
        mockMvc.perform(post("/chatbox/admin/takeover/session-1")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer not-a-jwt"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.message").value("Unauthorized"));
    }

    @Test
    @DisplayName("Valid token without the admin role is forbidden")
    void takeover_notAdmin() throws Exception {
        mockMvc.perform(post("/chatbox/admin/takeover/session-1")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("user-1", "Dana", "user")))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("INSUFFICIENT_PERMISSIONS"))
                .andExpect(jsonPath("$.message").value("Forbidden"));

        verifyNoInteractions(messageRouter);
    }

    @Test
    @DisplayName("Session already assisted by another admin is a conflict")
    void takeover_conflict() throws Exception {
        when(messageRouter.takeover(anyString(), anyString(), anyString()))
                .thenThrow(new AdminAssistanceConflictException("Session is already assisted by another admin"));

        mockMvc.perform(post("/chatbox/admin/takeover/session-1")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("admin-2", "Sam", "chat_admin")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("ADMIN_ALREADY_ASSISTING"));
    }

    @Test
    @DisplayName("Unknown session is a 404")
    void leave_unknownSession() throws Exception {
        when(messageRouter.leave("admin-1", "Alex", "missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(post("/chatbox/admin/leave/missing")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("admin-1", "Alex", "admin")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    @DisplayName("Admin requests over the limit get 429 with Retry-After")
    void adminRoutes_rateLimited() throws Exception {
        when(sessionRegistry.listSessions()).thenReturn(List.of());
        String bearer = "Bearer " + token("admin-1", "Alex", "admin");

        mockMvc.perform(get("/chatbox/admin/sessions").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk());
        mockMvc.perform(get("/chatbox/admin/sessions").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isOk());
        mockMvc.perform(get("/chatbox/admin/sessions").header(HttpHeaders.AUTHORIZATION, bearer))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists(HttpHeaders.RETRY_AFTER))
                .andExpect(jsonPath("$.code").value("TOO_MANY_REQUESTS"));

        verify(sessionRegistry, times(2)).listSessions();
    }

    @Test
    @DisplayName("Metrics default to the last 24 hours")
    void metrics_defaultRange() throws Exception {
        Instant end = Instant.parse("2025-01-01T00:00:00Z");
        Instant start = Instant.parse("2024-12-31T00:00:00Z");
        when(sessionStore.aggregateMetrics(start, end)).thenReturn(SessionMetrics.builder()
                .totalSessions(12)
                .activeSessions(3)
                .adminAssistedCount(2)
                .totalTokens(4_200)
                .maxResponseTimeMs(2_500)
                .avgResponseTimeMs(800)
                .build());

        mockMvc.perform(get("/chatbox/admin/metrics")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("admin-1", "Alex", "admin")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics.total_sessions").value(12))
                .andExpect(jsonPath("$.metrics.active_sessions").value(3))
                .andExpect(jsonPath("$.metrics.admin_assisted_count").value(2))
                .andExpect(jsonPath("$.metrics.total_tokens").value(4200))
                .andExpect(jsonPath("$.metrics.max_response_time_ms").value(2500))
                .andExpect(jsonPath("$.metrics.avg_response_time_ms").value(800))
                .andExpect(jsonPath("$.time_range.start").value("2024-12-31T00:00:00Z"))
                .andExpect(jsonPath("$.time_range.end").value("2025-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Explicit RFC 3339 bounds with an offset are honoured")
    void metrics_explicitRange() throws Exception {
        Instant start = Instant.parse("2025-02-01T00:00:00Z");
        Instant end = Instant.parse("2025-02-02T10:00:00Z");
        when(sessionStore.aggregateMetrics(start, end)).thenReturn(SessionMetrics.builder().totalSessions(1).build());

        mockMvc.perform(get("/chatbox/admin/metrics")
                        .param("start_time", "2025-02-01T00:00:00Z")
                        .param("end_time", "2025-02-02T12:00:00+02:00")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("admin-1", "Alex", "admin")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metrics.total_sessions").value(1));
    }

    @Test
    @DisplayName("Malformed time bound is a 400 and nothing is queried")
    void metrics_badTime() throws Exception {
        mockMvc.perform(get("/chatbox/admin/metrics")
                        .param("start_time", "yesterday")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("admin-1", "Alex", "admin")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_FORMAT"));

        verify(sessionStore, times(0)).aggregateMetrics(any(), any());
    }

    @Test
    @DisplayName("Metrics are admin only")
    void metrics_notAdmin() throws Exception {
        mockMvc.perform(get("/chatbox/admin/metrics")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + token("user-1", "Dana", "user")))
                .andExpect(status().isForbidden());

        verifyNoInteractions(sessionStore);
    }

    private static String token(String userId, String name, String role) {
        return Jwts.builder()
                .claim("user_id", userId)
                .claim("name", name)
                .claim("roles", List.of(role))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
    }
}
