package com.demoBank.chatbox.session;

import com.demoBank.chatbox.auth.AuthClaims;
import com.demoBank.chatbox.auth.UserAuthInterceptor;
import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.storage.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Lets an authenticated user list their own stored sessions, newest first.
 */
@Slf4j
@RestController
@RequestMapping("${chatbox.path-prefix:/chatbox}")
@RequiredArgsConstructor
public class UserSessionController {

    static final int DEFAULT_LIMIT = 100;
    static final int MAX_LIMIT = 1000;

    private final SessionStore sessionStore;

    @GetMapping("/sessions")
    public ResponseEntity<Map<String, Object>> sessions(
            @RequestAttribute(UserAuthInterceptor.CLAIMS_ATTRIBUTE) AuthClaims user,
            @RequestParam(name = "limit", required = false) Integer limit) {

        // out-of-range limits fall back to the default
        int effectiveLimit = limit == null || limit <= 0 || limit > MAX_LIMIT ? DEFAULT_LIMIT : limit;
        List<SessionSummary> sessions = sessionStore.listSessionsByUser(user.getUserId(), effectiveLimit);
        log.debug("User sessions listed - userId: {}, count: {}", UserIdMasker.mask(user.getUserId()), sessions.size());
        return ResponseEntity.ok(Map.of(
                "sessions", sessions,
                "user_id", user.getUserId(),
                "count", sessions.size()));
    }
}
