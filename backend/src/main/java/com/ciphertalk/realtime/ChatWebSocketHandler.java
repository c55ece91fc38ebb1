package com.ciphertalk.realtime;

import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.util.UriComponentsBuilder;

import com.ciphertalk.error.AuthenticationException;
import com.ciphertalk.error.CipherTalkException;
import com.ciphertalk.realtime.event.ClientEvent;
import com.ciphertalk.realtime.event.ServerEvent;

import reactor.core.publisher.Mono;

/**
 * WebSocket endpoint. The handshake must carry a bearer credential, either as the
 * {@code Authorization} header or as a {@code token} query parameter for browsers that cannot
 * set headers. Nothing is joined before the credential checks out.
 */
@Component
public class ChatWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(ChatWebSocketHandler.class);

    private final RealtimeGateway gateway;
    private final EventCodec codec;

    public ChatWebSocketHandler(RealtimeGateway gateway, EventCodec codec) {
        this.gateway = gateway;
        this.codec = codec;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        return gateway.authenticate(credentialOf(session))
                .flatMap(userId -> serve(session, userId))
                .onErrorResume(AuthenticationException.class, e -> {
                    log.debug("Rejected real-time handshake {}: {}", session.getId(), e.getMessage());
                    return session.close(CloseStatus.POLICY_VIOLATION.withReason(e.getMessage()));
                });
    }

    private Mono<Void> serve(WebSocketSession session, String userId) {
        WebSocketConnection connection = new WebSocketConnection(UUID.randomUUID().toString(), userId, session);

        Mono<Void> output = session.send(connection.outbound()
                .map(event -> session.textMessage(codec.encode(event))));

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(frame -> handleFrame(connection, frame))
                .then();

        return gateway.register(connection)
                .then(Mono.when(input.doFinally(signal -> connection.close("Connection closed")), output))
                .doFinally(signal -> gateway.disconnect(connection).subscribe());
    }

    private Mono<Void> handleFrame(WebSocketConnection connection, String frame) {
        ClientEvent event;
        try {
            event = codec.decode(frame);
        } catch (CipherTalkException e) {
            connection.push(new ServerEvent.Failure(e.code().name(), e.getMessage(), null));
            return Mono.empty();
        }
        return gateway.dispatch(connection, event);
    }

    private static String credentialOf(WebSocketSession session) {
        String header = session.getHandshakeInfo().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (header != null && !header.isBlank()) {
            return header;
        }
        return UriComponentsBuilder.fromUri(session.getHandshakeInfo().getUri())
                .build()
                .getQueryParams()
                .getFirst("token");
    }
}
