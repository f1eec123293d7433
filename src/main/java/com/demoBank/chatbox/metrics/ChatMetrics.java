package com.demoBank.chatbox.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Event counters and timers for chat traffic, scraped from the Prometheus endpoint.
 * LLM meters are tagged with the provider that served the call.
 * Connection and session gauges live in {@link ChatGaugeBinder}.
 */
@Component
public class ChatMetrics {
    
    static final String PROVIDER_TAG = "provider";
    
    private final MeterRegistry meterRegistry;
    
    private final Counter messagesReceived;
    private final Counter messagesSent;
    private final Counter adminTakeovers;
    
    public ChatMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.messagesReceived = Counter.builder("chatbox.messages.received")
                .description("Inbound chat messages accepted for routing")
                .register(meterRegistry);
        this.messagesSent = Counter.builder("chatbox.messages.sent")
                .description("Replies and relays delivered by the router")
                .register(meterRegistry);
        this.adminTakeovers = Counter.builder("chatbox.admin.takeovers")
                .description("Sessions taken over by an admin")
                .register(meterRegistry);
    }
    
    public void recordMessageReceived() {
        messagesReceived.increment();
    }
    
    public void recordMessageSent() {
        messagesSent.increment();
    }
    
    public void recordAdminTakeover() {
        adminTakeovers.increment();
    }
    
    /**
     * @param code Error code sent to the client
     */
    public void recordMessageError(String code) {
        Counter.builder("chatbox.message.errors")
                .tag("code", code)
                .description("Inbound messages answered with an error frame")
                .register(meterRegistry)
                .increment();
    }
    
    public void recordLlmRequest(String provider) {
        Counter.builder("chatbox.llm.requests")
                .tag(PROVIDER_TAG, provider)
                .description("LLM calls started")
                .register(meterRegistry)
                .increment();
    }
    
    public void recordLlmLatency(String provider, Duration elapsed) {
        Timer.builder("chatbox.llm.latency")
                .tag(PROVIDER_TAG, provider)
                .description("Time from LLM call start to its completion or failure")
                .publishPercentileHistogram()
                .register(meterRegistry)
                .record(elapsed);
    }
    
    public void recordLlmError(String provider) {
        Counter.builder("chatbox.llm.errors")
                .tag(PROVIDER_TAG, provider)
                .description("LLM calls that failed or timed out")
                .register(meterRegistry)
                .increment();
    }
    
    public void recordTokensUsed(String provider, long tokens) {
        if (tokens <= 0) {
            return;
        }
        Counter.builder("chatbox.tokens.used")
                .tag(PROVIDER_TAG, provider)
                .description("Tokens reported by LLM providers")
                .register(meterRegistry)
                .increment(tokens);
    }
}
