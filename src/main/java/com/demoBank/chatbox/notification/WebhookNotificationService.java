package com.demoBank.chatbox.notification;

import com.demoBank.chatbox.common.util.UserIdMasker;
import com.demoBank.chatbox.config.ChatboxProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Posts notification events to a webhook.
 * 
 * Responsibilities:
 * - Deliver asynchronously so the caller never waits on the webhook
 * - Suppress repeats of the same event for the same session within the dedup window
 * - Only log events when no webhook URL is configured
 */
@Slf4j
@Service
public class WebhookNotificationService implements NotificationService {
    
    private final RestClient restClient;
    private final String webhookUrl;
    private final Executor notificationExecutor;
    private final boolean enabled;
    
    /**
     * Recently sent events. Key: type + sessionId.
     */
    private final Cache<String, Boolean> recentlySent;
    
    @Autowired
    public WebhookNotificationService(ChatboxProperties properties,
                                      @Qualifier("notificationExecutor") Executor notificationExecutor) {
        this(RestClient.builder(), properties.getNotification().getWebhookUrl(),
                properties.getNotification().getDedupWindow(), notificationExecutor);
    }
    
    WebhookNotificationService(RestClient.Builder restClientBuilder, String webhookUrl, Duration dedupWindow,
                               Executor notificationExecutor) {
        this.enabled = webhookUrl != null && !webhookUrl.isBlank();
        this.webhookUrl = webhookUrl;
        this.restClient = enabled 
                ? restClientBuilder
                        .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .build()
                : null;
        this.notificationExecutor = notificationExecutor;
        this.recentlySent = Caffeine.newBuilder()
                .expireAfterWrite(dedupWindow)
                .maximumSize(10_000)
                .build();
        if (!enabled) {
            log.info("Notification webhook not configured, events will only be logged");
        }
    }
    
    @Override
    public void notify(NotificationEvent event) {
        String dedupKey = event.getType() + ":" + event.getSessionId();
        if (recentlySent.asMap().putIfAbsent(dedupKey, Boolean.TRUE) != null) {
            log.debug("Duplicate notification suppressed - type: {}, sessionId: {}", 
                    event.getType(), event.getSessionId());
            return;
        }
        
        if (!enabled) {
            log.info("Notification - type: {}, sessionId: {}, userId: {}", 
                    event.getType(), event.getSessionId(), UserIdMasker.mask(event.getUserId()));
            return;
        }
        
        try {
            notificationExecutor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Notification dropped, executor rejected it - type: {}, sessionId: {}", 
                    event.getType(), event.getSessionId(), e);
        }
    }
    
    private void deliver(NotificationEvent event) {
        try {
            restClient.post()
                    .uri(webhookUrl)
                    .body(event)
                    .retrieve()
                    .toBodilessEntity();
            log.info("Notification delivered - type: {}, sessionId: {}", event.getType(), event.getSessionId());
        } catch (RestClientException e) {
            log.error("Notification delivery failed - type: {}, sessionId: {}", 
                    event.getType(), event.getSessionId(), e);
        }
    }
}
