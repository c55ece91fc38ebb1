package com.ciphertalk.realtime;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.ciphertalk.config.CipherTalkProperties;
import com.ciphertalk.presence.PresenceRegistry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Closes connections that went silent. A client that stops sending {@code heartbeat} events for
 * longer than the configured window gets the same cleanup as an explicit disconnect.
 */
@Component
public class HeartbeatMonitor {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final PresenceRegistry presence;
    private final RealtimeGateway gateway;
    private final Duration timeout;

    public HeartbeatMonitor(PresenceRegistry presence, RealtimeGateway gateway, CipherTalkProperties properties) {
        this.presence = presence;
        this.gateway = gateway;
        this.timeout = properties.realtime().heartbeatTimeout();
    }

    @Scheduled(fixedDelayString = "${ciphertalk.realtime.heartbeat-sweep-millis:10000}")
    public void sweep() {
        List<String> stale = presence.expired(timeout);
        if (stale.isEmpty()) {
            return;
        }
        log.info("Closing {} connection(s) silent for more than {}", stale.size(), timeout);
        Flux.fromIterable(stale)
                .concatMap(connectionId -> gateway.expire(connectionId)
                        .onErrorResume(e -> {
                            log.warn("Cleanup of {} failed: {}", connectionId, e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
    }
}
