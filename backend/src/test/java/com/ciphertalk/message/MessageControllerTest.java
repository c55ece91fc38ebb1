package com.ciphertalk.message;

import static com.ciphertalk.message.EnvelopeFixtures.envelope;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.ciphertalk.account.CredentialVerifier;
import com.ciphertalk.conversation.ConversationAggregator;
import com.ciphertalk.conversation.ConversationSummary;
import com.ciphertalk.crypto.CryptoFixtures;
import com.ciphertalk.crypto.Digests;
import com.ciphertalk.crypto.Role;
import com.ciphertalk.error.AuthorizationException;
import com.ciphertalk.error.NotFoundException;
import com.ciphertalk.error.ValidationException;
import com.ciphertalk.realtime.RealtimeGateway;
import com.ciphertalk.realtime.SendResult;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP-layer tests for MessageController.
 *
 * Uses @WebFluxTest + WebTestClient against the controller and the error advice only;
 * the store, gateway and aggregator are @MockitoBean fakes, so no Cassandra is needed.
 */
@WebFluxTest(MessageController.class)
class MessageControllerTest {

    private static final String BEARER = "Bearer alice-token";
    private static final String SESSION = Digests.sessionIdFor("alice", "bob");

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private MessageStore store;

    @MockitoBean
    private RealtimeGateway gateway;

    @MockitoBean
    private ConversationAggregator conversations;

    @MockitoBean
    private CredentialVerifier credentials;

    @BeforeEach
    void authenticateAlice() {
        when(credentials.verify(eq(BEARER))).thenReturn(Mono.just("alice"));
    }

    // ── POST /api/messages ────────────────────────────────────────────────────

    @Test
    void sendMessage_shouldReturn201WithEnvelope() {
        EnvelopeEntity stored = envelope("alice", "bob", MessageStatus.SENT);
        when(gateway.send(eq("alice"), any(MessageRequest.class)))
                .thenReturn(Mono.just(new SendResult(EnvelopeView.of(stored), false)));

        webTestClient.post()
                .uri("/api/messages")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .bodyValue(CryptoFixtures.opaqueRequest("bob"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo(stored.getKey().id().toString())
                .jsonPath("$.sessionId").isEqualTo(SESSION)
                .jsonPath("$.status").isEqualTo("SENT");
    }

    @Test
    void sendMessage_toSelf_shouldReturn400() {
        when(gateway.send(eq("alice"), any(MessageRequest.class)))
                .thenReturn(Mono.error(new ValidationException("Cannot send a message to yourself")));

        webTestClient.post()
                .uri("/api/messages")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .bodyValue(CryptoFixtures.opaqueRequest("alice"))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");
    }

    // ── sessions ──────────────────────────────────────────────────────────────

    @Test
    void openSession_shouldReturnSessionId() {
        when(store.openSession("alice", "bob")).thenReturn(Mono.just(
                new SessionView(SESSION, new com.ciphertalk.account.UserProfile("bob", "Bob", null), true)));

        webTestClient.post()
                .uri("/api/messages/sessions")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .bodyValue(new OpenSessionRequest("bob"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.sessionId").isEqualTo(SESSION)
                .jsonPath("$.counterpartHasKeys").isEqualTo(true);
    }

    @Test
    void listConversation_shouldReturnEnvelopes() {
        when(store.listConversation(eq(SESSION), eq("alice"), eq(2), isNull())).thenReturn(Flux.just(
                envelope("bob", "alice", MessageStatus.SENT),
                envelope("alice", "bob", MessageStatus.READ)));

        webTestClient.get()
                .uri("/api/messages/sessions/{id}?limit=2", SESSION)
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(EnvelopeView.class)
                .hasSize(2);
    }

    @Test
    void listConversation_nonParticipant_shouldReturn403() {
        when(store.listConversation(eq(SESSION), eq("alice"), isNull(), isNull()))
                .thenReturn(Flux.error(new AuthorizationException("Not a participant of session " + SESSION)));

        webTestClient.get()
                .uri("/api/messages/sessions/{id}", SESSION)
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.code").isEqualTo("AUTHORIZATION_ERROR");
    }

    @Test
    void markRead_shouldReturnReceipt() {
        when(gateway.markSessionRead(SESSION, "alice")).thenReturn(Mono.just(
                new ReadReceipt(SESSION, "alice", "bob", List.of("m1", "m2"), Instant.now())));

        webTestClient.post()
                .uri("/api/messages/sessions/{id}/read", SESSION)
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.messageIds.length()").isEqualTo(2);
    }

    // ── per-message ───────────────────────────────────────────────────────────

    @Test
    void decryptionMaterial_shouldReturnViewerMaterial() {
        when(store.decryptionMaterial("m1", "alice")).thenReturn(Mono.just(
                new DecryptionMaterial("m1", Role.SENDER, "enc", "iv", "tag", "sender-wrapped", 1, "ab12")));

        webTestClient.get()
                .uri("/api/messages/m1/decryption")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.role").isEqualTo("SENDER")
                .jsonPath("$.wrappedKey").isEqualTo("sender-wrapped");
    }

    @Test
    void deleteMessage_shouldReturn204() {
        when(gateway.deleteMessage("m1", "alice")).thenReturn(Mono.just(envelope("alice", "bob", MessageStatus.READ)));

        webTestClient.delete()
                .uri("/api/messages/m1")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isNoContent();
    }

    @Test
    void deleteMessage_unknown_shouldReturn404() {
        when(gateway.deleteMessage("m404", "alice")).thenReturn(Mono.error(new NotFoundException("Message not found: m404")));

        webTestClient.delete()
                .uri("/api/messages/m404")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isNotFound();
    }

    // ── aggregates ────────────────────────────────────────────────────────────

    @Test
    void recentConversations_shouldReturnSummaries() {
        EnvelopeView last = EnvelopeView.of(envelope("bob", "alice", MessageStatus.SENT));
        when(conversations.recentConversations("alice", null)).thenReturn(Flux.just(new ConversationSummary(
                SESSION, new ConversationSummary.Counterpart("bob", "Bob", true, null), last, 1)));

        webTestClient.get()
                .uri("/api/messages/conversations/recent")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].counterpart.online").isEqualTo(true)
                .jsonPath("$[0].unreadCount").isEqualTo(1);
    }

    @Test
    void unreadCount_shouldReturnCount() {
        when(store.countUnread("alice")).thenReturn(Mono.just(3L));

        webTestClient.get()
                .uri("/api/messages/unread/count")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.unreadCount").isEqualTo(3);
    }

    @Test
    void anyEndpoint_withBadToken_shouldReturn401() {
        when(credentials.verify(eq("Bearer stolen")))
                .thenReturn(Mono.error(new com.ciphertalk.error.AuthenticationException("Unknown or expired credential")));

        webTestClient.get()
                .uri("/api/messages/unread/count")
                .header(HttpHeaders.AUTHORIZATION, "Bearer stolen")
                .exchange()
                .expectStatus().isUnauthorized();
    }
}
