package com.texteditor.config;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

@Configuration
@ConditionalOnWebApplication
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {
    private final EditorProperties properties;

    @Autowired
    public WebSocketConfig(EditorProperties properties) {
        this.properties = properties;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic", "/queue");
        config.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        EditorProperties.WebSocket websocket = properties.getWebsocket();

        // SockJS for browsers
        registry.addEndpoint(websocket.getEndpoint())
                .setAllowedOriginPatterns(websocket.getAllowedOriginPatterns())
                .withSockJS();

        // Plain WebSocket for native STOMP clients
        registry.addEndpoint(websocket.getEndpoint())
                .setAllowedOriginPatterns(websocket.getAllowedOriginPatterns());
    }
}
