package com.ciphertalk.keys;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.ciphertalk.account.CredentialVerifier;
import com.ciphertalk.error.AuthenticationException;
import com.ciphertalk.error.KeyAlreadyExistsException;
import com.ciphertalk.error.NotFoundException;

import reactor.core.publisher.Mono;

/**
 * HTTP-layer tests for KeyController: status codes and error bodies, with the service mocked.
 */
@WebFluxTest(KeyController.class)
class KeyControllerTest {

    private static final String BEARER = "Bearer alice-token";

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private KeyManagementService keyService;

    @MockitoBean
    private CredentialVerifier credentials;

    private static PublicKeyView view(String userId, int version) {
        return new PublicKeyView(userId, "cHVibGljLWtleQ==", "AB:CD", version, Instant.parse("2026-01-01T00:00:00Z"));
    }

    @Test
    void initKeys_shouldReturn201WithFingerprint() {
        when(credentials.verify(eq(BEARER))).thenReturn(Mono.just("alice"));
        when(keyService.generateKeyPair(eq("alice"), eq("pass phrase"), eq(false))).thenReturn(Mono.just(view("alice", 1)));

        webTestClient.post()
                .uri("/api/keys/init")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .bodyValue(new KeyInitRequest("pass phrase", false))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.fingerprint").isEqualTo("AB:CD")
                .jsonPath("$.version").isEqualTo(1);
    }

    @Test
    void initKeys_existingKey_shouldReturn409() {
        when(credentials.verify(eq(BEARER))).thenReturn(Mono.just("alice"));
        when(keyService.generateKeyPair(eq("alice"), eq("pass phrase"), eq(false)))
                .thenReturn(Mono.error(new KeyAlreadyExistsException("Encryption keys already initialized for alice")));

        webTestClient.post()
                .uri("/api/keys/init")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .bodyValue(new KeyInitRequest("pass phrase", false))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo("KEY_ALREADY_EXISTS");
    }

    @Test
    void initKeys_withoutCredential_shouldReturn401() {
        when(credentials.verify(null)).thenReturn(Mono.error(new AuthenticationException("Missing bearer credential")));

        webTestClient.post()
                .uri("/api/keys/init")
                .bodyValue(new KeyInitRequest("pass phrase", false))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.code").isEqualTo("AUTHENTICATION_ERROR");
        verifyNoInteractions(keyService);
    }

    @Test
    void getPublicKey_unknownUser_shouldReturn404() {
        when(credentials.verify(eq(BEARER))).thenReturn(Mono.just("alice"));
        when(keyService.getPublicKey("ghost")).thenReturn(Mono.error(new NotFoundException("No public key for ghost")));

        webTestClient.get()
                .uri("/api/keys/ghost")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void getPublicKeyVersion_shouldReturnThatVersion() {
        when(credentials.verify(eq(BEARER))).thenReturn(Mono.just("alice"));
        when(keyService.getPublicKey("bob", 2)).thenReturn(Mono.just(view("bob", 2)));

        webTestClient.get()
                .uri("/api/keys/bob/versions/2")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody(PublicKeyView.class)
                .value(body -> assertEquals(2, body.version()));
    }

    @Test
    void getOwnPrivateKey_isBoundToCaller() {
        when(credentials.verify(eq(BEARER))).thenReturn(Mono.just("alice"));
        when(keyService.getSealedPrivateKey("alice", null)).thenReturn(Mono.just(
                new SealedPrivateKeyView("alice", "c2VhbGVk", PrivateKeySealer.KDF, 1, Instant.parse("2026-01-01T00:00:00Z"))));

        webTestClient.get()
                .uri("/api/keys/me/private")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.userId").isEqualTo("alice")
                .jsonPath("$.kdf").isEqualTo("argon2id");
    }
}
