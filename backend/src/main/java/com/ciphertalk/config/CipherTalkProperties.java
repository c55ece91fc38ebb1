package com.ciphertalk.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import com.ciphertalk.presence.ConnectionPolicy;

/**
 * Typed view of the {@code ciphertalk.*} configuration tree.
 */
@ConfigurationProperties(prefix = "ciphertalk")
public record CipherTalkProperties(
        @DefaultValue Realtime realtime,
        @DefaultValue Presence presence,
        @DefaultValue Calls calls,
        @DefaultValue Messages messages
) {

    public record Realtime(
            @DefaultValue("/ws/chat") String path,
            /** Silence after which a connection is treated as dead. */
            @DefaultValue("60s") Duration heartbeatTimeout,
            @DefaultValue("10000") long heartbeatSweepMillis
    ) {}

    public record Presence(
            @DefaultValue("SINGLE_CONNECTION") ConnectionPolicy policy
    ) {}

    public record Calls(
            @DefaultValue("30s") Duration ringTimeout
    ) {}

    public record Messages(
            @DefaultValue("50") int defaultPageSize,
            @DefaultValue("100") int maxPageSize,
            @DefaultValue("20") int defaultConversationLimit
    ) {}
}
