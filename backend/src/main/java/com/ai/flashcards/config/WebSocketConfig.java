package com.ai.flashcards.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * WebSocketConfig configures the STOMP broker used for job progress pushes.
 *
 * Clients connect to {@code /ws/jobs} (SockJS fallback enabled) and subscribe
 * to {@code /topic/jobs/{jobId}}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws/jobs")
                .setAllowedOriginPatterns("*") // tighten in production
                .withSockJS();
    }

    /**
     * /topic → server-to-client broadcasts
     * /app → client-to-server messages (unused so far)
     */
    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }
}
