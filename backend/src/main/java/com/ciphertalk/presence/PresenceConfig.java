package com.ciphertalk.presence;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.ciphertalk.config.CipherTalkProperties;

@Configuration
public class PresenceConfig {

    @Bean
    public PresenceRegistry presenceRegistry(CipherTalkProperties properties) {
        return new InMemoryPresenceRegistry(properties.presence().policy(), Clock.systemUTC());
    }
}
