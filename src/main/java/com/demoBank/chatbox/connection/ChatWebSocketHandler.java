package com.demoBank.chatbox.connection;

import com.demoBank.chatbox.auth.AuthClaims;
import com.demoBank.chatbox.auth.AuthHandshakeInterceptor;
import com.demoBank.chatbox.common.exception.ChatException;
import com.demoBank.chatbox.common.exception.ErrorCode;
import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.config.ChatboxProperties;
import com.demoBank.chatbox.message.ChatMessage;
import com.demoBank.chatbox.message.MessageValidator;
import com.demoBank.chatbox.router.MessageRouter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.websocket.Session;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.adapter.NativeWebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Duration;
import java.util.Map;

/**
 * WebSocket endpoint. Bridges Spring's socket callbacks to {@link ConnectionManager} and {@link MessageRouter}.
 *
 * Responsibilities:
 * - Register the connection for the identity the handshake authenticated
 * - Decode and validate each text frame, answering bad frames on the same connection only
 * - Hand valid frames to the router through the connection's ordered inbound queue
 * - Release the connection and its session binding when the socket closes
 */
@Slf4j
@Component
public class ChatWebSocketHandler extends TextWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "chatbox.connection";

    // Tomcat user property for the blocking write deadline
    private static final String BLOCKING_SEND_TIMEOUT = "org.apache.tomcat.websocket.BLOCKING_SEND_TIMEOUT";

    private final ConnectionManager connectionManager;
    private final MessageRouter messageRouter;
    private final MessageValidator messageValidator;
    private final ObjectMapper objectMapper;
    private final int maxMessageSize;
    private final Duration writeTimeout;

    @Autowired
    public ChatWebSocketHandler(ConnectionManager connectionManager,
                                MessageRouter messageRouter,
                                MessageValidator messageValidator,
                                ObjectMapper objectMapper,
                                ChatboxProperties properties) {
        this(connectionManager, messageRouter, messageValidator, objectMapper,
                properties.getWebsocket().getMaxMessageSize(), properties.getWebsocket().getWriteTimeout());
    }

    public ChatWebSocketHandler(ConnectionManager connectionManager,
                                MessageRouter messageRouter,
                                MessageValidator messageValidator,
                                ObjectMapper objectMapper,
                                int maxMessageSize,
                                Duration writeTimeout) {
        this.connectionManager = connectionManager;
        this.messageRouter = messageRouter;
        this.messageValidator = messageValidator;
        this.objectMapper = objectMapper;
        this.maxMessageSize = maxMessageSize;
        this.writeTimeout = writeTimeout;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession socket) throws Exception {
        AuthClaims claims = (AuthClaims) socket.getAttributes().get(AuthHandshakeInterceptor.CLAIMS_ATTRIBUTE);
        if (claims == null) {
            // the handshake interceptor always sets claims; reaching here means the endpoint was misconfigured
            log.error("WebSocket opened without authenticated claims - socketId: {}", socket.getId());
            socket.close(CloseStatus.POLICY_VIOLATION);
            return;
        }

        applyWriteTimeout(socket);

        ClientConnection connection = connectionManager.newConnection(socket, claims);
        if (!connectionManager.register(connection)) {
            ChatException limit = new ChatException(ErrorCode.CONNECTION_LIMIT_EXCEEDED);
            socket.sendMessage(new TextMessage(objectMapper.writeValueAsString(ChatMessage.error(null, limit))));
            socket.close(CloseStatus.POLICY_VIOLATION.withReason("connection limit exceeded"));
            return;
        }
        socket.getAttributes().put(CONNECTION_ATTRIBUTE, connection.getId());

        connectionManager.sendTo(connection, ChatMessage.status(null,
                Map.of("status", "connected", "connection_id", connection.getId(), "user_id", connection.getUserId())));
        log.info("WebSocket connected - userId: {}, connectionId: {}",
                UserIdMasker.mask(connection.getUserId()), connection.getId());
    }

    @Override
    protected void handleTextMessage(WebSocketSession socket, TextMessage frame) {
        ClientConnection connection = connectionOf(socket);
        if (connection == null) {
            return;
        }
        connection.touch();

        if (frame.getPayloadLength() > maxMessageSize) {
            log.warn("Frame too large, closing connection - connectionId: {}, size: {}, max: {}",
                    connection.getId(), frame.getPayloadLength(), maxMessageSize);
            closeConnection(connection, CloseStatus.TOO_BIG_TO_PROCESS);
            return;
        }

        ChatMessage message;
        try {
            message = objectMapper.readValue(frame.getPayload(), ChatMessage.class);
            messageValidator.validate(message);
        } catch (JsonProcessingException e) {
            log.debug("Malformed frame - connectionId: {}, error: {}", connection.getId(), e.getOriginalMessage());
            connectionManager.sendTo(connection, ChatMessage.error(connection.getSessionId(),
                    ChatException.invalidFormat("malformed JSON", e)));
            return;
        } catch (ChatException e) {
            log.debug("Invalid frame - connectionId: {}, code: {}, message: {}",
                    connection.getId(), e.getCode(), e.getMessage());
            connectionManager.sendTo(connection, ChatMessage.error(connection.getSessionId(), e));
            return;
        }

        if (!connection.dispatch(() -> messageRouter.dispatch(connection, message))) {
            connectionManager.sendTo(connection, ChatMessage.error(message.getSessionId(),
                    new ChatException(ErrorCode.TOO_MANY_REQUESTS)));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession socket, Throwable exception) {
        ClientConnection connection = connectionOf(socket);
        log.warn("WebSocket transport error - connectionId: {}, error: {}",
                connection != null ? connection.getId() : socket.getId(), exception.getMessage());
        if (connection != null) {
            closeConnection(connection, CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession socket, CloseStatus status) {
        String connectionId = (String) socket.getAttributes().get(CONNECTION_ATTRIBUTE);
        if (connectionId == null) {
            return;
        }
        connectionManager.unregister(connectionId).ifPresent(connection -> {
            messageRouter.onConnectionClosed(connection);
            log.info("WebSocket closed - userId: {}, connectionId: {}, code: {}",
                    UserIdMasker.mask(connection.getUserId()), connectionId, status.getCode());
        });
    }

    // whichever of this and afterConnectionClosed unregisters first releases the session
    private void closeConnection(ClientConnection connection, CloseStatus status) {
        connection.close(status);
        connectionManager.unregister(connection.getId()).ifPresent(messageRouter::onConnectionClosed);
    }

    private ClientConnection connectionOf(WebSocketSession socket) {
        String connectionId = (String) socket.getAttributes().get(CONNECTION_ATTRIBUTE);
        if (connectionId == null) {
            return null;
        }
        return connectionManager.getConnection(connectionId).orElse(null);
    }

    private void applyWriteTimeout(WebSocketSession socket) {
        if (socket instanceof NativeWebSocketSession nativeSocket) {
            Session session = nativeSocket.getNativeSession(Session.class);
            if (session != null) {
                session.getUserProperties().put(BLOCKING_SEND_TIMEOUT, writeTimeout.toMillis());
            }
        }
    }
}
