package com.demoBank.chatbox.config;

import com.demoBank.chatbox.auth.AuthHandshakeInterceptor;
import com.demoBank.chatbox.connection.ChatWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistration;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

/**
 * Registers the chat WebSocket endpoint at {@code <path-prefix><websocket.path>}.
 */
@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfiguration implements WebSocketConfigurer {

    private final ChatWebSocketHandler chatWebSocketHandler;
    private final AuthHandshakeInterceptor authHandshakeInterceptor;
    private final ChatboxProperties properties;

    public WebSocketConfiguration(ChatWebSocketHandler chatWebSocketHandler,
                                  AuthHandshakeInterceptor authHandshakeInterceptor,
                                  ChatboxProperties properties) {
        this.chatWebSocketHandler = chatWebSocketHandler;
        this.authHandshakeInterceptor = authHandshakeInterceptor;
        this.properties = properties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        String path = properties.getPathPrefix() + properties.getWebsocket().getPath();
        WebSocketHandlerRegistration registration = registry.addHandler(chatWebSocketHandler, path)
                .addInterceptors(authHandshakeInterceptor);

        if (properties.getAllowedOrigins().isEmpty()) {
            log.warn("No allowed origins configured, accepting WebSocket connections from any origin");
            registration.setAllowedOriginPatterns("*");
        } else {
            registration.setAllowedOrigins(properties.getAllowedOrigins().toArray(new String[0]));
        }
        log.info("WebSocket endpoint registered - path: {}, allowedOrigins: {}", path, properties.getAllowedOrigins());
    }

    @Bean
    public ServletServerContainerFactoryBean webSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getWebsocket().getMaxMessageSize());
        container.setMaxSessionIdleTimeout(properties.getWebsocket().getIdleTimeout().toMillis());
        container.setAsyncSendTimeout(properties.getWebsocket().getWriteTimeout().toMillis());
        return container;
    }
}
