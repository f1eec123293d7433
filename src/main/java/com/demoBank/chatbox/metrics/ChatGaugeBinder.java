package com.demoBank.chatbox.metrics;

import com.demoBank.chatbox.connection.ConnectionManager;
import com.demoBank.chatbox.session.SessionRegistry;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Gauges that read the live connection and session registries on every scrape.
 */
@Component
@RequiredArgsConstructor
public class ChatGaugeBinder implements MeterBinder {
    
    private final ConnectionManager connectionManager;
    private final SessionRegistry sessionRegistry;
    
    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("chatbox.websocket.connections", connectionManager, manager -> manager.connectionCount())
                .description("Open WebSocket connections")
                .register(registry);
        Gauge.builder("chatbox.active.sessions", sessionRegistry, SessionRegistry::activeCount)
                .description("Sessions in memory that have not ended")
                .register(registry);
        FunctionCounter.builder("chatbox.sessions.created", sessionRegistry, SessionRegistry::createdCount)
                .description("Sessions created")
                .register(registry);
        FunctionCounter.builder("chatbox.sessions.ended", sessionRegistry, SessionRegistry::endedCount)
                .description("Sessions ended")
                .register(registry);
    }
}
