package com.ciphertalk.realtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.HandshakeInfo;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.ciphertalk.error.AuthenticationException;
import com.ciphertalk.realtime.event.ClientEvent;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

/**
 * Handshake and lifecycle of the WebSocket endpoint against a mocked session. The gateway is
 * mocked; the codec is real.
 */
@ExtendWith(MockitoExtension.class)
class ChatWebSocketHandlerTest {

    @Mock
    private RealtimeGateway gateway;

    @Mock
    private WebSocketSession session;

    @Mock
    private HandshakeInfo handshake;

    private ChatWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ChatWebSocketHandler(gateway, new EventCodec(Jackson2ObjectMapperBuilder.json().build()));
        lenient().when(session.getHandshakeInfo()).thenReturn(handshake);
        lenient().when(session.getId()).thenReturn("ws-1");
        lenient().when(session.close(any(CloseStatus.class))).thenReturn(Mono.empty());
    }

    private void handshake(String uri, HttpHeaders headers) {
        when(handshake.getHeaders()).thenReturn(headers);
        lenient().when(handshake.getUri()).thenReturn(URI.create(uri));
    }

    private void openSessionWith(Flux<WebSocketMessage> inbound) {
        when(session.receive()).thenReturn(inbound);
        when(session.send(any())).thenReturn(Mono.empty());
        when(gateway.register(any())).thenReturn(Mono.empty());
        when(gateway.disconnect(any())).thenReturn(Mono.empty());
    }

    @Test
    void handle_missingCredential_shouldCloseWithPolicyViolationAndNeverRegister() {
        handshake("ws://localhost/ws", new HttpHeaders());
        when(gateway.authenticate(null))
                .thenReturn(Mono.error(new AuthenticationException("Missing bearer credential")));

        StepVerifier.create(handler.handle(session)).verifyComplete();

        verify(session).close(CloseStatus.POLICY_VIOLATION.withReason("Missing bearer credential"));
        verify(gateway, never()).register(any());
        verify(session, never()).receive();
    }

    @Test
    void handle_badBearer_shouldCloseWithPolicyViolation() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer stale");
        handshake("ws://localhost/ws", headers);
        when(gateway.authenticate("Bearer stale"))
                .thenReturn(Mono.error(new AuthenticationException("Unknown or expired credential")));

        StepVerifier.create(handler.handle(session)).verifyComplete();

        verify(session).close(CloseStatus.POLICY_VIOLATION.withReason("Unknown or expired credential"));
        verify(gateway, never()).register(any());
    }

    @Test
    void handle_tokenQueryParameter_shouldRegisterAndCleanUpOnClose() {
        handshake("ws://localhost/ws?token=abc", new HttpHeaders());
        when(gateway.authenticate("abc")).thenReturn(Mono.just("alice"));
        openSessionWith(Flux.empty());

        StepVerifier.create(handler.handle(session)).verifyComplete();

        ArgumentCaptor<ConnectionHandle> registered = ArgumentCaptor.forClass(ConnectionHandle.class);
        verify(gateway).register(registered.capture());
        assertEquals("alice", registered.getValue().userId());
        verify(gateway).disconnect(registered.getValue());
        verify(session).close(CloseStatus.NORMAL.withReason("Connection closed"));
    }

    @Test
    void handle_headerWinsOverQueryParameter() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer from-header");
        handshake("ws://localhost/ws?token=from-query", headers);
        when(gateway.authenticate("Bearer from-header")).thenReturn(Mono.just("alice"));
        openSessionWith(Flux.empty());

        StepVerifier.create(handler.handle(session)).verifyComplete();

        verify(gateway, never()).authenticate("from-query");
    }

    @Test
    void handle_inboundFrames_shouldBeDecodedAndDispatched() {
        handshake("ws://localhost/ws?token=abc", new HttpHeaders());
        when(gateway.authenticate("abc")).thenReturn(Mono.just("alice"));
        WebSocketMessage frame = mock(WebSocketMessage.class);
        when(frame.getPayloadAsText()).thenReturn("{\"type\":\"heartbeat\"}");
        openSessionWith(Flux.just(frame));
        when(gateway.dispatch(any(), any())).thenReturn(Mono.empty());

        StepVerifier.create(handler.handle(session)).verifyComplete();

        ArgumentCaptor<ConnectionHandle> registered = ArgumentCaptor.forClass(ConnectionHandle.class);
        verify(gateway).register(registered.capture());
        ArgumentCaptor<ClientEvent> dispatched = ArgumentCaptor.forClass(ClientEvent.class);
        verify(gateway).dispatch(eq(registered.getValue()), dispatched.capture());
        assertSame(ClientEvent.Heartbeat.class, dispatched.getValue().getClass());
    }
}
