package com.fleetinsight.telemetry.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP broker for the live event feed (/topic/vehicle-events).
 *
 * The feed is server → client only, so no application destinations are mapped.
 * /ws/events serves native WebSocket clients, /ws/events-sockjs browsers that need the fallback.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/topic");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws/events")
                .setAllowedOriginPatterns("*");
        registry.addEndpoint("/ws/events-sockjs")
                .setAllowedOriginPatterns("*")
                .withSockJS();
    }
}
