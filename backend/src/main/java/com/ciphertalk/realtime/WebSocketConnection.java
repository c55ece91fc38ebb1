package com.ciphertalk.realtime;

import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.ciphertalk.realtime.event.ServerEvent;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.util.concurrent.Queues;

/**
 * A {@link ConnectionHandle} over a WebFlux session. Outbound events go through one unicast sink,
 * so everything pushed to this connection leaves in push order. The sink holds at most
 * {@link #OUTBOUND_BUFFER} events; pushes beyond that to a client that stopped reading are dropped.
 */
class WebSocketConnection implements ConnectionHandle {

    static final int OUTBOUND_BUFFER = 256;

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final String connectionId;
    private final String userId;
    private final WebSocketSession session;
    private final Sinks.Many<ServerEvent> outbound = Sinks.many().unicast()
            .onBackpressureBuffer(Queues.<ServerEvent>get(OUTBOUND_BUFFER).get());
    private final AtomicBoolean closed = new AtomicBoolean();

    WebSocketConnection(String connectionId, String userId, WebSocketSession session) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.session = session;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    @Override
    public String userId() {
        return userId;
    }

    @Override
    public boolean push(ServerEvent event) {
        if (closed.get()) {
            return false;
        }
        // several threads may push at once; the sink itself only tolerates one emitter
        Sinks.EmitResult result;
        synchronized (outbound) {
            result = outbound.tryEmitNext(event);
        }
        if (result == Sinks.EmitResult.FAIL_OVERFLOW) {
            log.debug("Outbound buffer full for {}, dropped {}", connectionId, event.getClass().getSimpleName());
        }
        return result.isSuccess();
    }

    @Override
    public void close(String reason) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (outbound) {
            outbound.tryEmitComplete();
        }
        session.close(CloseStatus.NORMAL.withReason(reason)).subscribe();
    }

    Flux<ServerEvent> outbound() {
        return outbound.asFlux();
    }
}
