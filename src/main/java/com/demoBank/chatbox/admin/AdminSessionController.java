package com.demoBank.chatbox.admin;

import com.demoBank.chatbox.auth.AuthClaims;
import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;
import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.router.MessageRouter;
import com.demoBank.chatbox.session.SessionRegistry;
import com.demoBank.chatbox.session.SessionSummary;
import com.demoBank.chatbox.storage.SessionMetrics;
import com.demoBank.chatbox.storage.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Admin REST controller - thin HTTP layer over session takeover.
 *
 * Responsibilities:
 * - Take over and release a session on behalf of the authenticated admin
 * - List in-memory sessions, newest first
 * - Aggregate stored session metrics over a time range
 *
 * Authentication, role and rate-limit checks happen in {@link AdminAuthInterceptor}.
 */
@Slf4j
@RestController
@RequestMapping("${chatbox.path-prefix:/chatbox}/admin")
public class AdminSessionController {

    private static final Duration DEFAULT_METRICS_RANGE = Duration.ofHours(24);

    private final MessageRouter messageRouter;
    private final SessionRegistry sessionRegistry;
    private final SessionStore sessionStore;
    private final Clock clock;

    @Autowired
    public AdminSessionController(MessageRouter messageRouter, SessionRegistry sessionRegistry, SessionStore sessionStore) {
        this(messageRouter, sessionRegistry, sessionStore, Clock.systemUTC());
    }

    AdminSessionController(MessageRouter messageRouter, SessionRegistry sessionRegistry, SessionStore sessionStore,
                           Clock clock) {
        this.messageRouter = messageRouter;
        this.sessionRegistry = sessionRegistry;
        this.sessionStore = sessionStore;
        this.clock = clock;
    }

    @PostMapping("/takeover/{sessionId}")
    public ResponseEntity<SessionSummary> takeover(
            @PathVariable String sessionId,
            @RequestAttribute(AdminAuthInterceptor.CLAIMS_ATTRIBUTE) AuthClaims admin) {

        SessionSummary summary = messageRouter.takeover(admin.getUserId(), admin.getName(), sessionId);
        log.info("Admin takeover via HTTP - adminId: {}, sessionId: {}", UserIdMasker.mask(admin.getUserId()), sessionId);
        return ResponseEntity.ok(summary);
    }

    @PostMapping("/leave/{sessionId}")
    public ResponseEntity<SessionSummary> leave(
            @PathVariable String sessionId,
            @RequestAttribute(AdminAuthInterceptor.CLAIMS_ATTRIBUTE) AuthClaims admin) {

        SessionSummary summary = messageRouter.leave(admin.getUserId(), admin.getName(), sessionId);
        log.info("Admin leave via HTTP - adminId: {}, sessionId: {}", UserIdMasker.mask(admin.getUserId()), sessionId);
        return ResponseEntity.ok(summary);
    }

    @GetMapping("/sessions")
    public ResponseEntity<List<SessionSummary>> sessions() {
        return ResponseEntity.ok(sessionRegistry.listSessions());
    }

    /**
     * Totals over the stored sessions that started in the range. Both bounds are RFC 3339;
     * the range defaults to the last 24 hours.
     */
    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics(
            @RequestParam(name = "start_time", required = false) String startTime,
            @RequestParam(name = "end_time", required = false) String endTime) {

        Instant end = endTime == null ? clock.instant() : parseTime("end_time", endTime);
        Instant start = startTime == null ? end.minus(DEFAULT_METRICS_RANGE) : parseTime("start_time", startTime);
        if (start.isAfter(end)) {
            throw new ChatException(ErrorCode.INVALID_FORMAT, "start_time must not be after end_time");
        }

        SessionMetrics metrics = sessionStore.aggregateMetrics(start, end);
        log.debug("Session metrics aggregated - start: {}, end: {}, sessions: {}", start, end, metrics.getTotalSessions());
        return ResponseEntity.ok(Map.of(
                "metrics", metrics,
                "time_range", Map.of("start", start.toString(), "end", end.toString())));
    }

    private static Instant parseTime(String name, String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            throw new ChatException(ErrorCode.INVALID_FORMAT, "Invalid " + name + " format, use RFC3339", e);
        }
    }
}
