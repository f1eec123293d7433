package com.demoBank.chatbox.router;

import com.demoBank.chatbox.auth.ForbiddenException;
import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;
import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.connection.ClientConnection;
import com.demoBank.chatbox.connection.ConnectionClosedException;
import com.demoBank.chatbox.connection.ConnectionManager;
import com.demoBank.chatbox.connection.ConnectionState;
import com.demoBank.chatbox.llm.LlmResponse;
import com.demoBank.chatbox.llm.LlmService;
import com.demoBank.chatbox.message.ChatMessage;
import com.demoBank.chatbox.message.MessageType;
import com.demoBank.chatbox.message.SenderType;
import com.demoBank.chatbox.metrics.ChatMetrics;
import com.demoBank.chatbox.notification.NotificationEvent;
import com.demoBank.chatbox.notification.NotificationService;
import com.demoBank.chatbox.ratelimit.RateLimitExceededException;
import com.demoBank.chatbox.ratelimit.SlidingWindowRateLimiter;
import com.demoBank.chatbox.session.ChatSession;
import com.demoBank.chatbox.session.SessionMessage;
import com.demoBank.chatbox.session.SessionRegistry;
import com.demoBank.chatbox.session.SessionSummary;
import com.demoBank.chatbox.storage.SessionStore;
import com.demoBank.chatbox.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * Routes validated inbound messages to their handlers.
 *
 * Responsibilities:
 * - Rate limit chat messages per user
 * - Resolve (or create) the session a message belongs to and bind it to the connection
 * - Orchestrate an AI turn: loading frame, streamed chunks, final reply, metrics, persistence
 * - Relay messages between a user and the admin who took over the session
 * - Report failures to the originating connection only, with a stable code and generic text
 *
 * Flow for a user message:
 * 1. Rate limit check
 * 2. Session resolution
 * 3. Record + persist the user message
 * 4. Relay to the admin (taken over) or stream an AI reply (default)
 */
@Slf4j
@Service
public class MessageRouter {

    static final String META_STREAMING = "streaming";
    static final String META_DONE = "done";

    private final SessionRegistry sessionRegistry;
    private final ConnectionManager connectionManager;
    private final SessionStore sessionStore;
    private final LlmService llmService;
    private final NotificationService notificationService;
    private final SlidingWindowRateLimiter messageRateLimiter;
    private final SlidingWindowRateLimiter adminRateLimiter;
    private final ChatMetrics metrics;

    public MessageRouter(SessionRegistry sessionRegistry,
                         ConnectionManager connectionManager,
                         SessionStore sessionStore,
                         LlmService llmService,
                         NotificationService notificationService,
                         @Qualifier("messageRateLimiter") SlidingWindowRateLimiter messageRateLimiter,
                         @Qualifier("adminRateLimiter") SlidingWindowRateLimiter adminRateLimiter,
                         ChatMetrics metrics) {
        this.sessionRegistry = sessionRegistry;
        this.connectionManager = connectionManager;
        this.sessionStore = sessionStore;
        this.llmService = llmService;
        this.notificationService = notificationService;
        this.messageRateLimiter = messageRateLimiter;
        this.adminRateLimiter = adminRateLimiter;
        this.metrics = metrics;
    }

    /**
     * Handles one inbound message. Never throws; failures become an error frame on the originating connection.
     * Does not wait for the AI reply.
     *
     * @param connection Connection the message arrived on
     * @param message Validated message
     * @return Completes once the message is fully handled, including any AI reply it started; never fails
     */
    public CompletableFuture<Void> dispatch(ClientConnection connection, ChatMessage message) {
        if (connection.getState() != ConnectionState.ACTIVE) {
            log.debug("Dropping message for closed connection - type: {}, connectionId: {}",
                    message.getType(), connection.getId());
            return done();
        }
        try {
            if (message.getType() == MessageType.USER_MESSAGE) {
                checkMessageRateLimit(connection);
            }
            metrics.recordMessageReceived();

            return switch (message.getType()) {
                case USER_MESSAGE -> handleUserMessage(connection, message);
                case FILE_UPLOAD, VOICE_MESSAGE -> handleFileMessage(connection, message);
                case HELP_REQUEST -> {
                    handleHelpRequest(connection, message);
                    yield done();
                }
                case MODEL_SELECT -> {
                    handleModelSelect(connection, message);
                    yield done();
                }
                case ADMIN_TAKEOVER -> {
                    handleAdminTakeover(connection, message);
                    yield done();
                }
                case ADMIN_LEAVE -> {
                    handleAdminLeave(connection, message);
                    yield done();
                }
                default -> throw ChatException.invalidFormat("unsupported message type " + message.getType().getValue());
            };
        } catch (ConnectionClosedException e) {
            log.debug("Connection closed while handling message - type: {}, connectionId: {}",
                    message.getType(), connection.getId());
        } catch (ChatException e) {
            reportError(connection, message, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error while routing message - type: {}, connectionId: {}",
                    message.getType(), connection.getId(), e);
            reportError(connection, message, new ChatException(ErrorCode.SERVICE_ERROR));
        }
        return done();
    }

    /**
     * Assigns the admin to the session and tells both sides.
     * Used by the WebSocket admin_takeover message and the HTTP admin API.
     *
     * @throws com.demoBank.chatbox.session.SessionNotFoundException if the session does not exist
     * @throws com.demoBank.chatbox.session.AdminAssistanceConflictException if another admin already assists it
     */
    public SessionSummary takeover(String adminId, String adminName, String sessionId) {
        SessionSummary summary = sessionRegistry.setAdminAssistance(sessionId, adminId, adminName);
        persistSessionUpdate(summary);
        metrics.recordAdminTakeover();

        ChatMessage notice = ChatMessage.builder()
                .type(MessageType.ADMIN_TAKEOVER)
                .sessionId(sessionId)
                .sender(SenderType.SYSTEM)
                .content(adminName + " has joined the conversation")
                .timestamp(Instant.now())
                .metadata(Map.of("admin_id", adminId, "admin_name", adminName))
                .build();
        connectionManager.broadcastToUsers(List.of(summary.getUserId(), adminId), notice);
        return summary;
    }

    /**
     * Releases the admin from the session; AI replies resume afterwards.
     */
    public SessionSummary leave(String adminId, String adminName, String sessionId) {
        SessionSummary summary = sessionRegistry.clearAdminAssistance(sessionId, adminId);
        persistSessionUpdate(summary);

        ChatMessage notice = ChatMessage.builder()
                .type(MessageType.ADMIN_LEAVE)
                .sessionId(sessionId)
                .sender(SenderType.SYSTEM)
                .content(adminName + " has left the conversation")
                .timestamp(Instant.now())
                .metadata(Map.of("admin_id", adminId, "admin_name", adminName))
                .build();
        connectionManager.broadcastToUsers(List.of(summary.getUserId(), adminId), notice);
        return summary;
    }

    /**
     * Releases the connection's hold on its session. Called once the connection is closed.
     * A message still queued on the connection can no longer attach it to a session afterwards.
     */
    public void onConnectionClosed(ClientConnection connection) {
        String sessionId = connection.releaseSession();
        if (sessionId != null) {
            releaseSession(sessionId);
        }
    }

    // Handlers

    private CompletableFuture<Void> handleUserMessage(ClientConnection connection, ChatMessage message) {
        Optional<ChatSession> assisted = sessionAssistedBy(connection, message.getSessionId());
        if (assisted.isPresent()) {
            relayAdminMessage(connection, assisted.get(), message);
            return done();
        }

        ChatSession session = resolveSession(connection, message);
        SessionMessage userMessage = SessionMessage.builder()
                .id(newMessageId())
                .content(message.getContent())
                .sender(SenderType.USER)
                .timestamp(message.getTimestamp())
                .metadata(message.getMetadata())
                .build();
        sessionRegistry.recordMessage(session.getId(), userMessage);
        sessionRegistry.setSessionNameFromMessage(session.getId(), message.getContent());
        persistUserMessage(connection, session.getId(), userMessage);

        if (session.isAdminAssisted()) {
            // a human is handling the session, no AI reply
            ChatMessage relay = ChatMessage.builder()
                    .type(MessageType.USER_MESSAGE)
                    .sessionId(session.getId())
                    .content(message.getContent())
                    .sender(SenderType.USER)
                    .timestamp(userMessage.getTimestamp())
                    .metadata(Map.of("user_id", connection.getUserId(), "user_name", connection.getName()))
                    .build();
            connectionManager.broadcastToUsers(participants(session), relay);
            metrics.recordMessageSent();
            log.debug("User message relayed to admin - sessionId: {}", session.getId());
            return done();
        }

        return streamAiReply(connection, session, message.getContent());
    }

    private CompletableFuture<Void> handleFileMessage(ClientConnection connection, ChatMessage message) {
        ChatSession session = resolveSession(connection, message);
        boolean voice = message.getType() == MessageType.VOICE_MESSAGE;
        String content = message.getContent() != null && !message.getContent().isBlank()
                ? message.getContent()
                : (voice ? "[voice message] " : "[file] ") + message.getFileUrl();

        SessionMessage fileMessage = SessionMessage.builder()
                .id(newMessageId())
                .content(content)
                .sender(SenderType.USER)
                .timestamp(message.getTimestamp())
                .fileId(message.getFileId())
                .fileUrl(message.getFileUrl())
                .metadata(message.getMetadata())
                .build();
        sessionRegistry.recordMessage(session.getId(), fileMessage);
        persistUserMessage(connection, session.getId(), fileMessage);

        ChatMessage echo = ChatMessage.builder()
                .type(message.getType())
                .sessionId(session.getId())
                .content(message.getContent())
                .fileId(message.getFileId())
                .fileUrl(message.getFileUrl())
                .sender(SenderType.USER)
                .timestamp(fileMessage.getTimestamp())
                .metadata(message.getMetadata())
                .build();
        connectionManager.broadcastToUsers(participants(session), echo);
        log.info("File message recorded - sessionId: {}, type: {}, fileId: {}",
                session.getId(), message.getType().getValue(), message.getFileId());

        if (voice && session.getModelId() != null && !session.isAdminAssisted()) {
            return streamAiReply(connection, session, content);
        }
        return done();
    }

    private void handleHelpRequest(ClientConnection connection, ChatMessage message) {
        ChatSession session = resolveSession(connection, message);
        sessionRegistry.markHelpRequested(session.getId());
        persistSessionUpdate(session.toSummary());

        connectionManager.broadcastToUser(session.getUserId(),
                ChatMessage.status(session.getId(), Map.of("status", "help_requested")));

        notificationService.notify(NotificationEvent.builder()
                .type(NotificationEvent.Type.HELP_REQUESTED)
                .sessionId(session.getId())
                .userId(session.getUserId())
                .userName(connection.getName())
                .sessionName(session.getName())
                .timestamp(Instant.now())
                .build());
        log.info("Help requested - sessionId: {}, userId: {}", session.getId(), UserIdMasker.mask(session.getUserId()));
    }

    private void handleModelSelect(ClientConnection connection, ChatMessage message) {
        if (!llmService.isKnownModel(message.getModelId())) {
            throw new ChatException(ErrorCode.UNKNOWN_MODEL);
        }
        ChatSession session = resolveSession(connection, message);
        sessionRegistry.setModel(session.getId(), message.getModelId());
        persistSessionUpdate(session.toSummary());

        ChatMessage ack = ChatMessage.builder()
                .type(MessageType.MODEL_SELECT)
                .sessionId(session.getId())
                .modelId(message.getModelId())
                .sender(SenderType.SYSTEM)
                .timestamp(Instant.now())
                .build();
        connectionManager.broadcastToUser(session.getUserId(), ack);
    }

    private void handleAdminTakeover(ClientConnection connection, ChatMessage message) {
        requireAdmin(connection);
        checkAdminRateLimit(connection);
        takeover(connection.getUserId(), connection.getName(), message.getSessionId());
    }

    private void handleAdminLeave(ClientConnection connection, ChatMessage message) {
        requireAdmin(connection);
        checkAdminRateLimit(connection);
        leave(connection.getUserId(), connection.getName(), message.getSessionId());
    }

    private void relayAdminMessage(ClientConnection connection, ChatSession session, ChatMessage message) {
        SessionMessage adminMessage = SessionMessage.builder()
                .id(newMessageId())
                .content(message.getContent())
                .sender(SenderType.ADMIN)
                .timestamp(message.getTimestamp())
                .metadata(Map.of("admin_id", connection.getUserId(), "admin_name", connection.getName()))
                .build();
        sessionRegistry.recordMessage(session.getId(), adminMessage);
        persistUserMessage(connection, session.getId(), adminMessage);

        ChatMessage relay = ChatMessage.builder()
                .type(MessageType.USER_MESSAGE)
                .sessionId(session.getId())
                .content(message.getContent())
                .sender(SenderType.ADMIN)
                .timestamp(adminMessage.getTimestamp())
                .metadata(adminMessage.getMetadata())
                .build();
        connectionManager.broadcastToUsers(participants(session), relay);
        metrics.recordMessageSent();
    }

    // AI turn

    /**
     * Starts the AI turn and returns without waiting for the provider.
     * The returned stage completes once the reply or its error frame has been sent.
     */
    private CompletableFuture<Void> streamAiReply(ClientConnection connection, ChatSession session, String prompt) {
        String sessionId = session.getId();
        List<String> recipients = participants(session);
        String model = session.getModelId() != null ? session.getModelId() : llmService.getDefaultModel();

        connectionManager.broadcastToUsers(recipients, ChatMessage.loading(sessionId));

        Instant started = Instant.now();
        CompletableFuture<LlmResponse> call = llmService.stream(model, session.getMessages(), chunk ->
                connectionManager.broadcastToUsers(recipients, aiResponse(sessionId, model, chunk, false)));
        connection.trackInFlight(call);

        return call.handle((response, error) -> {
            connection.untrackInFlight(call);
            try {
                if (error == null) {
                    completeAiReply(session, model, prompt, response, Duration.between(started, Instant.now()), recipients);
                } else {
                    failAiReply(connection, sessionId, model, recipients, LlmService.unwrap(error));
                }
            } catch (RuntimeException e) {
                log.error("Failed to finish AI reply - sessionId: {}, model: {}", sessionId, model, e);
            }
            return null;
        });
    }

    private void failAiReply(ClientConnection connection, String sessionId, String model, List<String> recipients,
                             Throwable error) {
        if (error instanceof CancellationException) {
            log.info("LLM call cancelled - sessionId: {}, connectionId: {}", sessionId, connection.getId());
            return;
        }
        if (error instanceof TimeoutException) {
            log.error("LLM call timed out - sessionId: {}, model: {}, timeout: {}",
                    sessionId, model, llmService.getTimeout());
        } else {
            log.error("LLM call failed - sessionId: {}, model: {}", sessionId, model, error);
        }
        broadcastError(recipients, sessionId, ChatException.llmUnavailable(error));
    }

    private void completeAiReply(ChatSession session, String model, String prompt, LlmResponse response,
                                 Duration elapsed, List<String> recipients) {
        String sessionId = session.getId();
        String replyModel = response.getModel() != null ? response.getModel() : model;
        SessionMessage aiMessage = SessionMessage.builder()
                .id(newMessageId())
                .content(response.getContent())
                .sender(SenderType.AI)
                .timestamp(Instant.now())
                .metadata(Map.of("model_id", replyModel))
                .build();

        long tokens = response.getTotalTokens() > 0
                ? response.getTotalTokens()
                : LlmService.estimateTokens(prompt) + LlmService.estimateTokens(response.getContent());
        sessionRegistry.recordMessage(sessionId, aiMessage);
        sessionRegistry.recordTokenUsage(sessionId, tokens);
        sessionRegistry.recordResponseTime(sessionId, elapsed);

        // persistence failures here are logged only; the reply still goes out
        persist("record ai response", () -> sessionStore.recordMessage(sessionId, aiMessage));
        persistSessionUpdate(session.toSummary());

        ChatMessage finalFrame = aiResponse(sessionId, replyModel, response.getContent(), true);
        connectionManager.broadcastToUsers(recipients, finalFrame);
        metrics.recordMessageSent();
        log.info("AI reply completed - sessionId: {}, model: {}, tokens: {}, elapsedMs: {}",
                sessionId, replyModel, tokens, elapsed.toMillis());
    }

    private ChatMessage aiResponse(String sessionId, String model, String content, boolean done) {
        return ChatMessage.builder()
                .type(MessageType.AI_RESPONSE)
                .sessionId(sessionId)
                .content(content)
                .modelId(model)
                .sender(SenderType.AI)
                .timestamp(Instant.now())
                .metadata(Map.of(META_STREAMING, String.valueOf(!done), META_DONE, String.valueOf(done)))
                .build();
    }

    // Session resolution

    /**
     * @throws ConnectionClosedException if the connection closed while the message was queued
     */
    private ChatSession resolveSession(ClientConnection connection, ChatMessage message) {
        String current = connection.getSessionId();
        String requested = message.getSessionId() != null ? message.getSessionId() : current;
        ChatSession session = sessionRegistry.getOrCreateSession(requested, connection.getUserId());
        if (session.getId().equals(current)) {
            return session;
        }

        // counted before binding so a concurrent close always has a count to release
        sessionRegistry.attachConnection(session.getId());
        String previous;
        try {
            previous = connection.attachSession(session.getId());
        } catch (ConnectionClosedException e) {
            releaseSession(session.getId());
            throw e;
        }
        if (previous != null) {
            releaseSession(previous);
        }
        persist("create session", () -> sessionStore.createSession(session.toSummary()));
        connectionManager.sendTo(connection, ChatMessage.status(session.getId(),
                Map.of("status", "session_attached", "connection_id", connection.getId())));
        log.info("Connection attached to session - connectionId: {}, sessionId: {}",
                connection.getId(), session.getId());
        return session;
    }

    private void releaseSession(String sessionId) {
        if (sessionRegistry.detachConnection(sessionId)) {
            sessionRegistry.getSession(sessionId)
                    .map(ChatSession::getEndTime)
                    .ifPresent(endTime -> persist("end session", () -> sessionStore.endSession(sessionId, endTime)));
        }
    }

    private Optional<ChatSession> sessionAssistedBy(ClientConnection connection, String sessionId) {
        if (!connection.isAdmin() || sessionId == null) {
            return Optional.empty();
        }
        return sessionRegistry.getSession(sessionId)
                .filter(session -> session.isAssistedBy(connection.getUserId()));
    }

    private List<String> participants(ChatSession session) {
        List<String> users = new ArrayList<>(2);
        users.add(session.getUserId());
        String adminId = session.getAssistingAdminId();
        if (adminId != null && !adminId.equals(session.getUserId())) {
            users.add(adminId);
        }
        return users;
    }

    // Guards

    private void checkMessageRateLimit(ClientConnection connection) {
        if (!messageRateLimiter.allow(connection.getUserId())) {
            int retryAfter = messageRateLimiter.getRetryAfterSeconds(connection.getUserId());
            log.warn("Message rate limit exceeded - userId: {}, retryAfter: {}s",
                    UserIdMasker.mask(connection.getUserId()), retryAfter);
            throw new RateLimitExceededException(retryAfter);
        }
    }

    private void checkAdminRateLimit(ClientConnection connection) {
        if (!adminRateLimiter.allow(connection.getUserId())) {
            int retryAfter = adminRateLimiter.getRetryAfterSeconds(connection.getUserId());
            log.warn("Admin rate limit exceeded - adminId: {}, retryAfter: {}s",
                    UserIdMasker.mask(connection.getUserId()), retryAfter);
            throw new RateLimitExceededException(retryAfter);
        }
    }

    private void requireAdmin(ClientConnection connection) {
        if (!connection.isAdmin()) {
            log.warn("Admin action without admin role - userId: {}", UserIdMasker.mask(connection.getUserId()));
            throw new ForbiddenException();
        }
    }

    // Persistence

    private void persistUserMessage(ClientConnection connection, String sessionId, SessionMessage message) {
        try {
            sessionStore.recordMessage(sessionId, message);
        } catch (StorageException e) {
            log.error("Failed to persist message - sessionId: {}, messageId: {}, transient: {}",
                    sessionId, message.getId(), e.isTransient(), e);
            connectionManager.sendTo(connection, ChatMessage.error(sessionId, e));
        }
    }

    private void persistSessionUpdate(SessionSummary summary) {
        persist("update session", () -> sessionStore.updateSession(summary));
    }

    private void persist(String operation, Runnable write) {
        try {
            write.run();
        } catch (StorageException e) {
            log.error("Storage write failed - operation: {}, transient: {}", operation, e.isTransient(), e);
        }
    }

    // Errors

    private void reportError(ClientConnection connection, ChatMessage message, ChatException e) {
        switch (e.getCategory()) {
            case RATE_LIMIT, VALIDATION, CONFLICT -> log.debug("Message rejected - code: {}, connectionId: {}",
                    e.getCode(), connection.getId());
            case AUTH -> log.warn("Message denied - code: {}, connectionId: {}", e.getCode(), connection.getId());
            case SERVICE -> log.error("Message failed - code: {}, connectionId: {}",
                    e.getCode(), connection.getId(), e);
        }
        metrics.recordMessageError(e.getCode().name());
        String sessionId = message.getSessionId() != null ? message.getSessionId() : connection.getSessionId();
        connectionManager.sendTo(connection, ChatMessage.error(sessionId, e));
    }

    private void broadcastError(List<String> recipients, String sessionId, ChatException e) {
        connectionManager.broadcastToUsers(recipients, ChatMessage.error(sessionId, e));
    }

    private static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    private static String newMessageId() {
        return UUID.randomUUID().toString();
    }
}
