package com.ciphertalk.realtime;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

import com.ciphertalk.config.CipherTalkProperties;

@Configuration
public class WebSocketConfig {

    @Bean
    public HandlerMapping chatWebSocketMapping(ChatWebSocketHandler handler, CipherTalkProperties properties) {
        // ahead of the annotated controllers
        return new SimpleUrlHandlerMapping(Map.of(properties.realtime().path(), handler), -1);
    }
}
