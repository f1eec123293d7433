package com.demoBank.chatbox.config;

import com.demoBank.chatbox.connection.ConnectionManager;
import com.demoBank.chatbox.connection.ShutdownDeadlineExceededException;
import com.demoBank.chatbox.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Graceful shutdown of the chat node.
 *
 * Order:
 * 1. Stop the session sweep
 * 2. Close every client connection with 1001 within the configured deadline
 * 3. Drain the worker pools
 */
@Slf4j
@Component
public class ShutdownManager {

    private final SessionRegistry sessionRegistry;
    private final ConnectionManager connectionManager;
    private final ThreadPoolTaskExecutor inboundExecutor;
    private final ThreadPoolTaskExecutor outboundExecutor;
    private final ThreadPoolTaskExecutor llmExecutor;
    private final ThreadPoolTaskExecutor notificationExecutor;
    private final Duration shutdownTimeout;

    public ShutdownManager(SessionRegistry sessionRegistry,
                           ConnectionManager connectionManager,
                           @Qualifier("inboundExecutor") ThreadPoolTaskExecutor inboundExecutor,
                           @Qualifier("outboundExecutor") ThreadPoolTaskExecutor outboundExecutor,
                           @Qualifier("llmExecutor") ThreadPoolTaskExecutor llmExecutor,
                           @Qualifier("notificationExecutor") ThreadPoolTaskExecutor notificationExecutor,
                           ChatboxProperties properties) {
        this.sessionRegistry = sessionRegistry;
        this.connectionManager = connectionManager;
        this.inboundExecutor = inboundExecutor;
        this.outboundExecutor = outboundExecutor;
        this.llmExecutor = llmExecutor;
        this.notificationExecutor = notificationExecutor;
        this.shutdownTimeout = properties.getShutdownTimeout();
    }

    @PreDestroy
    public void onShutdown() {
        log.info("Initiating graceful shutdown - timeout: {}", shutdownTimeout);

        sessionRegistry.stop();

        try {
            connectionManager.shutdownWithDeadline(shutdownTimeout);
        } catch (ShutdownDeadlineExceededException e) {
            log.warn("Connections still open after shutdown deadline - count: {}, ids: {}",
                    e.getOpenConnectionIds().size(), e.getOpenConnectionIds());
        }

        shutdownExecutorService(llmExecutor.getThreadPoolExecutor(), "llm");
        shutdownExecutorService(inboundExecutor.getThreadPoolExecutor(), "inbound");
        shutdownExecutorService(outboundExecutor.getThreadPoolExecutor(), "outbound");
        shutdownExecutorService(notificationExecutor.getThreadPoolExecutor(), "notification");

        log.info("Graceful shutdown completed.");
    }

    private void shutdownExecutorService(ExecutorService executorService, String name) {
        if (executorService == null || executorService.isShutdown()) {
            return;
        }
        log.info("Shutting down {} executor...", name);
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("{} executor did not terminate in {}, forcing shutdown", name, shutdownTimeout);
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Shutdown of {} executor was interrupted", name, e);
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
