package com.demoBank.chatbox.connection;

import com.demoBank.chatbox.auth.AuthClaims;
import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.config.ChatboxProperties;
import com.demoBank.chatbox.message.ChatMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HexFormat;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Owns every live client connection on this node.
 * 
 * Responsibilities:
 * - Create and register connections, enforcing the per-user connection cap
 * - Keep the per-user index used for fan-out
 * - Serialize a frame once and queue it on every connection of a user
 * - Close connections, and all of them within a deadline on shutdown
 */
@Slf4j
@Service
public class ConnectionManager {
    
    private static final SecureRandom RANDOM = new SecureRandom();
    
    // userId -> (connectionId -> connection)
    private final Map<String, Map<String, ClientConnection>> connectionsByUser = new HashMap<>();
    private final Map<String, ClientConnection> connectionsById = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    
    private final ObjectMapper objectMapper;
    private final Executor outboundExecutor;
    private final Executor inboundExecutor;
    private final int maxConnectionsPerUser;
    private final int queueCapacity;
    private final Clock clock;
    
    @Autowired
    public ConnectionManager(ObjectMapper objectMapper,
                             ChatboxProperties properties,
                             @Qualifier("outboundExecutor") Executor outboundExecutor,
                             @Qualifier("inboundExecutor") Executor inboundExecutor) {
        this(objectMapper, outboundExecutor, inboundExecutor,
                properties.getWebsocket().getMaxConnectionsPerUser(),
                properties.getWebsocket().getOutboundQueueCapacity(), Clock.systemUTC());
    }
    
    public ConnectionManager(ObjectMapper objectMapper, Executor outboundExecutor, Executor inboundExecutor,
                             int maxConnectionsPerUser, int queueCapacity) {
        this(objectMapper, outboundExecutor, inboundExecutor, maxConnectionsPerUser, queueCapacity, Clock.systemUTC());
    }
    
    public ConnectionManager(ObjectMapper objectMapper, Executor outboundExecutor, Executor inboundExecutor,
                             int maxConnectionsPerUser, int queueCapacity, Clock clock) {
        this.objectMapper = objectMapper;
        this.outboundExecutor = outboundExecutor;
        this.inboundExecutor = inboundExecutor;
        this.maxConnectionsPerUser = maxConnectionsPerUser;
        this.queueCapacity = queueCapacity;
        this.clock = clock;
    }
    
    /**
     * Creates a connection for an upgraded socket. The connection is not registered yet.
     */
    public ClientConnection newConnection(WebSocketSession socket, AuthClaims claims) {
        byte[] random = new byte[8];
        RANDOM.nextBytes(random);
        String connectionId = claims.getUserId() + "-" + System.nanoTime() + "-" + HexFormat.of().formatHex(random);
        return new ClientConnection(connectionId, socket, claims, outboundExecutor, inboundExecutor, queueCapacity, clock);
    }
    
    /**
     * Adds the connection to the indexes and moves it to ACTIVE.
     * 
     * @return false if the user already has the maximum number of connections
     */
    public boolean register(ClientConnection connection) {
        lock.writeLock().lock();
        try {
            Map<String, ClientConnection> userConnections = connectionsByUser.computeIfAbsent(
                    connection.getUserId(), k -> new LinkedHashMap<>());
            if (userConnections.size() >= maxConnectionsPerUser) {
                if (userConnections.isEmpty()) {
                    connectionsByUser.remove(connection.getUserId());
                }
                log.warn("Connection limit reached - userId: {}, connections: {}", 
                        UserIdMasker.mask(connection.getUserId()), userConnections.size());
                return false;
            }
            userConnections.put(connection.getId(), connection);
            connectionsById.put(connection.getId(), connection);
            connection.markActive();
            log.info("Connection registered - userId: {}, connectionId: {}, userConnections: {}", 
                    UserIdMasker.mask(connection.getUserId()), connection.getId(), userConnections.size());
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Removes the connection from every index and marks it CLOSED. Idempotent.
     * 
     * @return The removed connection, if it was registered
     */
    public Optional<ClientConnection> unregister(String connectionId) {
        ClientConnection connection;
        lock.writeLock().lock();
        try {
            connection = connectionsById.remove(connectionId);
            if (connection == null) {
                return Optional.empty();
            }
            Map<String, ClientConnection> userConnections = connectionsByUser.get(connection.getUserId());
            if (userConnections != null) {
                userConnections.remove(connectionId);
                if (userConnections.isEmpty()) {
                    connectionsByUser.remove(connection.getUserId());
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        connection.markClosed();
        log.info("Connection unregistered - userId: {}, connectionId: {}", 
                UserIdMasker.mask(connection.getUserId()), connectionId);
        return Optional.of(connection);
    }
    
    public Optional<ClientConnection> getConnection(String connectionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(connectionsById.get(connectionId));
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public List<ClientConnection> connectionsOf(String userId) {
        lock.readLock().lock();
        try {
            Map<String, ClientConnection> userConnections = connectionsByUser.get(userId);
            return userConnections == null ? List.of() : List.copyOf(userConnections.values());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public int connectionCount(String userId) {
        lock.readLock().lock();
        try {
            Map<String, ClientConnection> userConnections = connectionsByUser.get(userId);
            return userConnections == null ? 0 : userConnections.size();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public boolean hasConnections(String userId) {
        return connectionCount(userId) > 0;
    }
    
    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connectionsById.size();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public int getMaxConnectionsPerUser() {
        return maxConnectionsPerUser;
    }
    
    /**
     * Queues the message on every live connection of the user.
     * A failing connection does not affect the others.
     * 
     * @return Number of connections the frame was queued on
     */
    public int broadcastToUser(String userId, ChatMessage message) {
        return broadcastToUsers(List.of(userId), message);
    }
    
    /**
     * Queues the message once on every live connection of the given users (duplicates ignored).
     */
    public int broadcastToUsers(Collection<String> userIds, ChatMessage message) {
        TextMessage frame = serialize(message);
        if (frame == null) {
            return 0;
        }
        
        List<ClientConnection> targets = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>(userIds);
        lock.readLock().lock();
        try {
            for (String userId : seen) {
                Map<String, ClientConnection> userConnections = connectionsByUser.get(userId);
                if (userConnections != null) {
                    targets.addAll(userConnections.values());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        
        int delivered = 0;
        for (ClientConnection connection : targets) {
            try {
                if (connection.send(frame)) {
                    delivered++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to queue frame - connectionId: {}, error: {}", connection.getId(), e.getMessage());
            }
        }
        if (delivered == 0 && !targets.isEmpty()) {
            log.debug("Broadcast reached no connection - type: {}, targets: {}", message.getType(), targets.size());
        }
        return delivered;
    }
    
    /**
     * Queues the message on a single connection.
     */
    public boolean sendTo(ClientConnection connection, ChatMessage message) {
        TextMessage frame = serialize(message);
        return frame != null && connection.send(frame);
    }
    
    /**
     * Closes the connection with the given status and removes it from every index.
     */
    public void close(ClientConnection connection, CloseStatus status) {
        connection.close(status);
        unregister(connection.getId());
    }
    
    /**
     * Closes every connection concurrently with {@code 1001 going away}.
     * 
     * @param deadline Maximum time to wait for the connections to close
     * @throws ShutdownDeadlineExceededException listing the connections still open when the deadline elapsed
     */
    public void shutdownWithDeadline(Duration deadline) {
        List<ClientConnection> all;
        lock.readLock().lock();
        try {
            all = new ArrayList<>(connectionsById.values());
        } finally {
            lock.readLock().unlock();
        }
        if (all.isEmpty()) {
            log.info("No connections to close on shutdown");
            return;
        }
        
        log.info("Closing connections on shutdown - count: {}, deadline: {}", all.size(), deadline);
        // One thread per socket: a close that blocks on a stalled peer must not hold back the others
        ExecutorService closer = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "ws-shutdown");
            thread.setDaemon(true);
            return thread;
        });
        try {
            List<CompletableFuture<Void>> closes = new ArrayList<>(all.size());
            for (ClientConnection connection : all) {
                closer.execute(() -> close(connection, CloseStatus.GOING_AWAY));
                closes.add(connection.closedFuture());
            }
            
            try {
                CompletableFuture.allOf(closes.toArray(new CompletableFuture[0]))
                        .get(deadline.toMillis(), TimeUnit.MILLISECONDS);
                log.info("All connections closed - count: {}", all.size());
            } catch (TimeoutException e) {
                List<String> stillOpen = all.stream()
                        .filter(connection -> !connection.closedFuture().isDone())
                        .map(ClientConnection::getId)
                        .toList();
                log.warn("Shutdown deadline exceeded - openConnections: {}", stillOpen.size());
                throw new ShutdownDeadlineExceededException(stillOpen);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ShutdownDeadlineExceededException(all.stream()
                        .filter(connection -> !connection.closedFuture().isDone())
                        .map(ClientConnection::getId)
                        .toList());
            } catch (ExecutionException e) {
                log.error("Unexpected failure while closing connections", e);
            }
        } finally {
            // Lets closes already started run on; idle threads exit once their work is done
            closer.shutdown();
        }
    }
    
    private TextMessage serialize(ChatMessage message) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize outbound message - type: {}", message.getType(), e);
            return null;
        }
    }
}
