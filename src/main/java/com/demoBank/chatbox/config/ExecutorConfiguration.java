package com.demoBank.chatbox.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools shared by all connections.
 * 
 * - inbound: runs message dispatch, one task at a time per connection; never waits on an LLM call
 * - outbound: writes frames to sockets, one task at a time per connection
 * - llm: blocking LLM calls, bounded by the LLM timeout
 * - notification: fire-and-forget admin notifications
 * 
 * A ThreadPoolExecutor only grows past its core size once the queue is full, so every pool runs
 * at its full size with idle threads timing out.
 */
@Configuration
public class ExecutorConfiguration {
    
    static final int QUEUE_CAPACITY = 10_000;
    
    @Bean
    public ThreadPoolTaskExecutor inboundExecutor() {
        return executor("ws-inbound-", 64);
    }
    
    @Bean
    public ThreadPoolTaskExecutor outboundExecutor() {
        return executor("ws-outbound-", 64);
    }
    
    @Bean
    public ThreadPoolTaskExecutor llmExecutor() {
        return executor("llm-", 128);
    }
    
    @Bean
    public ThreadPoolTaskExecutor notificationExecutor() {
        return executor("notify-", 8);
    }
    
    static ThreadPoolTaskExecutor executor(String prefix, int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
