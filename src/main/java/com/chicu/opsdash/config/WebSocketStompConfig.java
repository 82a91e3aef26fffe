package com.chicu.opsdash.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.*;

@Slf4j
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketStompConfig implements WebSocketMessageBrokerConfigurer {

    public static final String ENDPOINT = "/ws/ops";

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {

        registry.addEndpoint(ENDPOINT)
                .setAllowedOriginPatterns("*")
                .withSockJS();

        log.info("✅ WebSocket STOMP endpoint {} зарегистрирован", ENDPOINT);
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {

        // панель только слушает, /app не нужен
        config.enableSimpleBroker("/topic");

        log.info("✅ SimpleBroker включён на /topic");
    }
}
