package com.demoBank.chatbox.connection;

import com.demoBank.chatbox.auth.AuthClaims;
import com.demoBank.chatbox.common.util.UserIdMasker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * One authenticated WebSocket connection.
 * 
 * Outbound frames go through a bounded per-connection queue that is drained by a shared pool,
 * so a slow socket only delays its own frames. Inbound frames are dispatched in arrival order
 * through a second per-connection queue.
 */
@Slf4j
public class ClientConnection {
    
    private final String id;
    private final WebSocketSession socket;
    private final AuthClaims claims;
    private final SerialExecutor outbound;
    private final SerialExecutor inbound;
    private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final CompletableFuture<Void> closed = new CompletableFuture<>();
    private final Clock clock;
    
    private ConnectionState state = ConnectionState.AUTHENTICATED;
    private String sessionId;
    private boolean sessionReleased;
    private volatile Instant lastActivity;
    
    public ClientConnection(String id, WebSocketSession socket, AuthClaims claims,
                            Executor outboundExecutor, Executor inboundExecutor, int queueCapacity, Clock clock) {
        this.id = id;
        this.socket = socket;
        this.claims = claims;
        this.clock = clock;
        this.lastActivity = clock.instant();
        this.outbound = new SerialExecutor(outboundExecutor, queueCapacity);
        this.inbound = new SerialExecutor(inboundExecutor, queueCapacity);
    }
    
    public String getId() {
        return id;
    }
    
    public String getUserId() {
        return claims.getUserId();
    }
    
    public String getName() {
        return claims.getName();
    }
    
    public List<String> getRoles() {
        return claims.getRoles();
    }
    
    public AuthClaims getClaims() {
        return claims;
    }
    
    public boolean isAdmin() {
        return claims.isAdmin();
    }
    
    public synchronized ConnectionState getState() {
        return state;
    }
    
    public synchronized String getSessionId() {
        return sessionId;
    }
    
    /**
     * Binds the connection to a chat session.
     * 
     * @return The previously bound session ID, or null
     * @throws ConnectionClosedException if the connection stopped being active or already gave up its session
     */
    public synchronized String attachSession(String newSessionId) {
        if (sessionReleased || state != ConnectionState.ACTIVE) {
            throw new ConnectionClosedException(id);
        }
        String previous = this.sessionId;
        this.sessionId = newSessionId;
        return previous;
    }
    
    /**
     * Gives up the bound session for good. Any later {@link #attachSession(String)} fails.
     * 
     * @return The session that was bound, or null
     */
    public synchronized String releaseSession() {
        sessionReleased = true;
        String released = this.sessionId;
        this.sessionId = null;
        return released;
    }
    
    public Instant getLastActivity() {
        return lastActivity;
    }
    
    public void touch() {
        lastActivity = clock.instant();
    }
    
    public boolean isOpen() {
        return getState() == ConnectionState.ACTIVE && socket.isOpen();
    }
    
    synchronized boolean markActive() {
        if (state != ConnectionState.AUTHENTICATED) {
            return false;
        }
        state = ConnectionState.ACTIVE;
        return true;
    }
    
    /**
     * Queues a frame for writing.
     * 
     * @return false if the connection is not open or its outbound queue is full
     */
    public boolean send(TextMessage frame) {
        if (!isOpen()) {
            return false;
        }
        if (!outbound.offer(() -> write(frame))) {
            log.warn("Outbound queue full, dropping frame - connectionId: {}, userId: {}", 
                    id, UserIdMasker.mask(getUserId()));
            return false;
        }
        return true;
    }
    
    /**
     * Queues an inbound task behind the ones already received on this connection.
     * The next task starts once the stage returned by this one completes.
     */
    public boolean dispatch(Supplier<? extends CompletionStage<?>> task) {
        if (getState() != ConnectionState.ACTIVE) {
            return false;
        }
        if (!inbound.offerAsync(task)) {
            log.warn("Inbound queue full, dropping frame - connectionId: {}, userId: {}", 
                    id, UserIdMasker.mask(getUserId()));
            return false;
        }
        return true;
    }
    
    /**
     * Tracks a background call (LLM stream) so it can be cancelled when the connection closes.
     */
    public void trackInFlight(Future<?> future) {
        if (getState() == ConnectionState.CLOSED) {
            future.cancel(true);
            return;
        }
        inFlight.add(future);
    }
    
    public void untrackInFlight(Future<?> future) {
        inFlight.remove(future);
    }
    
    public int inFlightCount() {
        return inFlight.size();
    }
    
    /**
     * Starts closing the socket. Calling it again after the first time has no effect.
     */
    void close(CloseStatus status) {
        synchronized (this) {
            if (state == ConnectionState.CLOSING || state == ConnectionState.CLOSED) {
                return;
            }
            state = ConnectionState.CLOSING;
        }
        cancelInFlight();
        inbound.shutdown();
        outbound.shutdown();
        try {
            if (socket.isOpen()) {
                socket.close(status);
            }
        } catch (IOException e) {
            log.debug("Error closing socket - connectionId: {}, status: {}", id, status, e);
        }
    }
    
    /**
     * Final transition; called once the connection is out of every index.
     */
    void markClosed() {
        synchronized (this) {
            state = ConnectionState.CLOSED;
        }
        cancelInFlight();
        inbound.shutdown();
        outbound.shutdown();
        closed.complete(null);
    }
    
    CompletableFuture<Void> closedFuture() {
        return closed;
    }
    
    private void cancelInFlight() {
        for (Future<?> future : inFlight) {
            future.cancel(true);
        }
        inFlight.clear();
    }
    
    private void write(TextMessage frame) {
        if (!socket.isOpen()) {
            return;
        }
        try {
            socket.sendMessage(frame);
        } catch (IOException | IllegalStateException e) {
            log.warn("Write failed, closing connection - connectionId: {}, userId: {}, error: {}", 
                    id, UserIdMasker.mask(getUserId()), e.getMessage());
            close(CloseStatus.SESSION_NOT_RELIABLE);
        }
    }
    
    @Override
    public String toString() {
        return "ClientConnection{id=" + id + ", state=" + getState() + "}";
    }
}
