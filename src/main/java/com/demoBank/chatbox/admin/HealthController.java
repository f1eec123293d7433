package com.demoBank.chatbox.admin;

import com.demoBank.chatbox.connection.ConnectionManager;
import com.demoBank.chatbox.llm.LlmService;
import com.demoBank.chatbox.ratelimit.RateLimitExceededException;
import com.demoBank.chatbox.ratelimit.SlidingWindowRateLimiter;
import com.demoBank.chatbox.session.SessionRegistry;
import com.demoBank.chatbox.storage.SessionStore;
import com.demoBank.chatbox.storage.StorageException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Public liveness and readiness endpoints, rate limited per client IP.
 */
@Slf4j
@RestController
@RequestMapping("${chatbox.path-prefix:/chatbox}")
public class HealthController {

    private static final String READY = "ready";
    private static final String NOT_READY = "not ready";

    private final SlidingWindowRateLimiter publicRateLimiter;
    private final ConnectionManager connectionManager;
    private final SessionRegistry sessionRegistry;
    private final SessionStore sessionStore;
    private final LlmService llmService;

    public HealthController(@Qualifier("publicRateLimiter") SlidingWindowRateLimiter publicRateLimiter,
                            ConnectionManager connectionManager,
                            SessionRegistry sessionRegistry,
                            SessionStore sessionStore,
                            LlmService llmService) {
        this.publicRateLimiter = publicRateLimiter;
        this.connectionManager = connectionManager;
        this.sessionRegistry = sessionRegistry;
        this.sessionStore = sessionStore;
        this.llmService = llmService;
    }

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, Object>> health(HttpServletRequest request) {
        checkRateLimit(request);

        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "connections", connectionManager.connectionCount(),
                "sessions", sessionRegistry.size()));
    }

    /**
     * Ready when the database answers a ping and at least one model is routable.
     * Failure details stay in the log.
     */
    @GetMapping("/readyz")
    public ResponseEntity<Map<String, Object>> ready(HttpServletRequest request) {
        checkRateLimit(request);

        Map<String, Object> checks = new LinkedHashMap<>();
        boolean ready = true;

        try {
            sessionStore.ping();
            checks.put("mongodb", Map.of("status", READY));
        } catch (StorageException e) {
            log.warn("Readiness check failed - component: mongodb", e);
            checks.put("mongodb", Map.of("status", NOT_READY, "reason", "Database connectivity check failed"));
            ready = false;
        }

        if (llmService.getAvailableModels().isEmpty()) {
            log.warn("Readiness check failed - component: llm, reason: no models configured");
            checks.put("llm", Map.of("status", NOT_READY, "reason", "No LLM providers configured"));
            ready = false;
        } else {
            checks.put("llm", Map.of("status", READY, "providers_count", llmService.getProviderCount()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", ready ? READY : NOT_READY);
        body.put("timestamp", Instant.now().truncatedTo(ChronoUnit.SECONDS).toString());
        body.put("checks", checks);
        return ResponseEntity.status(ready ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    private void checkRateLimit(HttpServletRequest request) {
        String clientIp = request.getRemoteAddr();
        if (!publicRateLimiter.allow(clientIp)) {
            int retryAfter = publicRateLimiter.getRetryAfterSeconds(clientIp);
            log.debug("Public rate limit exceeded - ip: {}, retryAfter: {}s", clientIp, retryAfter);
            throw new RateLimitExceededException(retryAfter);
        }
    }
}
