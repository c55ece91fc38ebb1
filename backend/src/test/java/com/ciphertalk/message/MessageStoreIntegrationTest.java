package com.ciphertalk.message;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledIfEnvironmentVariable;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.CassandraContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.ciphertalk.account.AccountService;
import com.ciphertalk.account.UserAccount;
import com.ciphertalk.account.UserDirectory;
import com.ciphertalk.conversation.ConversationAggregator;
import com.ciphertalk.crypto.CryptoFixtures;
import com.ciphertalk.error.AuthorizationException;
import com.ciphertalk.error.KeyAlreadyExistsException;
import com.ciphertalk.keys.KeyManagementService;
import com.ciphertalk.keys.UserKeyEntity;
import com.ciphertalk.keys.UserKeyKey;
import com.ciphertalk.keys.UserKeyRepository;

import reactor.test.StepVerifier;

/**
 * Persistence tests against a real Cassandra container: the logged-batch append, the
 * conditional status transitions and key-version claims.
 *
 * Every test works with fresh user ids so they share one container without interfering.
 * Disabled where Docker is unavailable (CI flag SKIP_DB_TESTS).
 */
@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@DisabledIfEnvironmentVariable(named = "SKIP_DB_TESTS", matches = "true")
class MessageStoreIntegrationTest {

    @SuppressWarnings("resource")
    @Container
    static CassandraContainer<?> cassandra =
            new CassandraContainer<>("cassandra:4.1")
                    .withInitScript("schema.cql");

    @DynamicPropertySource
    static void cassandraProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.cassandra.contact-points",
                () -> cassandra.getHost() + ":" + cassandra.getMappedPort(9042));
        registry.add("spring.cassandra.local-datacenter", () -> "datacenter1");
        registry.add("spring.cassandra.keyspace-name",    () -> "ciphertalk");
    }

    @Autowired
    private MessageStore store;

    @Autowired
    private KeyManagementService keys;

    @Autowired
    private AccountService accounts;

    @Autowired
    private UserKeyRepository userKeys;

    @Autowired
    private ConversationAggregator conversations;

    @Autowired
    private UserDirectory directory;

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String uniqueUser(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    private String registeredWithKeys(String prefix) {
        String userId = uniqueUser(prefix);
        UserAccount account = new UserAccount();
        account.username = userId;
        account.loginHash = "hash-" + userId;
        accounts.signUp(account).block();
        keys.generateKeyPair(userId, "correct horse battery staple", false).block();
        return userId;
    }

    private EnvelopeEntity send(String senderId, String receiverId) {
        return store.append(senderId, CryptoFixtures.opaqueRequest(receiverId)).block();
    }

    // ── Tests ─────────────────────────────────────────────────────────────────

    @Test
    void append_shouldPersistEnvelopeWithKeyVersions() {
        String alice = registeredWithKeys("alice");
        String bob = registeredWithKeys("bob");

        EnvelopeEntity sent = send(alice, bob);

        StepVerifier.create(store.listConversation(sent.getKey().sessionId(), bob, null, null))
                .assertNext(found -> {
                    assertEquals(sent.getKey().id(), found.getKey().id());
                    assertEquals(MessageStatus.SENT, found.getStatus());
                    assertEquals(1, found.getSenderKeyVersion());
                    assertEquals(1, found.getReceiverKeyVersion());
                    assertEquals("receiver-wrapped-base64", found.getReceiverWrappedKey());
                })
                .verifyComplete();
    }

    @Test
    void listConversation_shouldPageNewestFirstWithCursor() {
        String alice = registeredWithKeys("alice");
        String bob = registeredWithKeys("bob");
        EnvelopeEntity first = send(alice, bob);
        EnvelopeEntity second = send(bob, alice);
        EnvelopeEntity third = send(alice, bob);
        String sessionId = first.getKey().sessionId();

        List<EnvelopeEntity> page = store.listConversation(sessionId, alice, 2, null).collectList().block();
        assertEquals(List.of(third.getKey().id(), second.getKey().id()),
                page.stream().map(e -> e.getKey().id()).toList());

        StepVerifier.create(store.listConversation(sessionId, alice, 2, second.getKey().id().toString()))
                .assertNext(older -> assertEquals(first.getKey().id(), older.getKey().id()))
                .verifyComplete();
    }

    @Test
    void listConversation_outsider_shouldBeForbidden() {
        String alice = registeredWithKeys("alice");
        String bob = registeredWithKeys("bob");
        EnvelopeEntity sent = send(alice, bob);

        StepVerifier.create(store.listConversation(sent.getKey().sessionId(), uniqueUser("mallory"), null, null))
                .expectError(AuthorizationException.class)
                .verify();
    }

    @Test
    void recordLastSeen_shouldKeepTheRestOfTheAccount() {
        String alice = registeredWithKeys("alice");
        Instant seen = Instant.parse("2026-03-01T10:00:00Z");

        directory.recordLastSeen(alice, seen).block();

        StepVerifier.create(directory.lookup(alice))
                .assertNext(profile -> {
                    assertEquals(seen, profile.lastSeenAt());
                    assertEquals(alice, profile.displayName());
                })
                .verifyComplete();
        StepVerifier.create(accounts.login(alice, "hash-" + alice))
                .assertNext(response -> assertEquals(alice, response.username))
                .verifyComplete();
    }

    @Test
    void statusTransitions_shouldOnlyMoveForward() {
        String alice = registeredWithKeys("alice");
        String bob = registeredWithKeys("bob");
        EnvelopeEntity sent = send(alice, bob);
        UUID id = sent.getKey().id();

        StepVerifier.create(store.markDelivered(id)).expectNext(true).verifyComplete();
        StepVerifier.create(store.markDelivered(id)).expectNext(false).verifyComplete();

        StepVerifier.create(store.markRead(sent.getKey().sessionId(), bob))
                .assertNext(receipt -> {
                    assertEquals(List.of(id.toString()), receipt.messageIds());
                    assertEquals(alice, receipt.senderId());
                })
                .verifyComplete();
        StepVerifier.create(store.markRead(sent.getKey().sessionId(), bob))
                .assertNext(receipt -> assertTrue(receipt.isEmpty()))
                .verifyComplete();

        // READ never goes back to DELIVERED
        StepVerifier.create(store.markDelivered(id)).expectNext(false).verifyComplete();
        StepVerifier.create(store.listConversation(sent.getKey().sessionId(), alice, null, null))
                .assertNext(found -> {
                    assertEquals(MessageStatus.READ, found.getStatus());
                    assertTrue(found.getReadAt() != null);
                })
                .verifyComplete();
    }

    @Test
    void softDelete_shouldHideFromListingsAndCounts() {
        String alice = registeredWithKeys("alice");
        String bob = registeredWithKeys("bob");
        EnvelopeEntity kept = send(alice, bob);
        EnvelopeEntity removed = send(alice, bob);

        StepVerifier.create(store.countUnread(bob)).expectNext(2L).verifyComplete();

        store.softDelete(removed.getKey().id().toString(), alice).block();

        StepVerifier.create(store.listConversation(kept.getKey().sessionId(), bob, null, null))
                .assertNext(found -> assertEquals(kept.getKey().id(), found.getKey().id()))
                .verifyComplete();
        StepVerifier.create(store.countUnread(bob)).expectNext(1L).verifyComplete();
    }

    @Test
    void recentConversations_shouldSummarizeEachCounterpart() throws InterruptedException {
        String alice = registeredWithKeys("alice");
        String bob = registeredWithKeys("bob");
        String carol = registeredWithKeys("carol");
        send(bob, alice);
        send(bob, alice);
        // sentAt has millisecond precision
        Thread.sleep(5);
        send(alice, carol);

        StepVerifier.create(conversations.recentConversations(alice, null))
                .assertNext(latest -> {
                    assertEquals(carol, latest.counterpart().userId());
                    assertEquals(0, latest.unreadCount());
                })
                .assertNext(older -> {
                    assertEquals(bob, older.counterpart().userId());
                    assertEquals(2, older.unreadCount());
                })
                .verifyComplete();
    }

    @Test
    void insertIfAbsent_secondClaimOfSameVersion_shouldNotApply() {
        String userId = uniqueUser("dave");
        UserKeyEntity first = keyVersion(userId, "pub-a");
        UserKeyEntity second = keyVersion(userId, "pub-b");

        StepVerifier.create(userKeys.insertIfAbsent(first)).expectNext(true).verifyComplete();
        StepVerifier.create(userKeys.insertIfAbsent(second)).expectNext(false).verifyComplete();

        StepVerifier.create(userKeys.findById(new UserKeyKey(userId, 1)))
                .assertNext(stored -> assertEquals("pub-a", stored.getPublicKey()))
                .verifyComplete();
    }

    @Test
    void generateKeyPair_twiceWithoutRotate_shouldConflict() {
        String userId = registeredWithKeys("erin");

        StepVerifier.create(keys.generateKeyPair(userId, "another passphrase", false))
                .expectError(KeyAlreadyExistsException.class)
                .verify();

        StepVerifier.create(keys.generateKeyPair(userId, "another passphrase", true))
                .assertNext(view -> assertEquals(2, view.version()))
                .verifyComplete();
        StepVerifier.create(keys.currentVersion(userId)).expectNext(2).verifyComplete();
        StepVerifier.create(keys.hasKeys(uniqueUser("nobody"))).assertNext(has -> assertFalse(has)).verifyComplete();
    }

    private static UserKeyEntity keyVersion(String userId, String publicKey) {
        UserKeyEntity entity = new UserKeyEntity();
        entity.setKey(new UserKeyKey(userId, 1));
        entity.setPublicKey(publicKey);
        entity.setSealedPrivateKey("sealed");
        entity.setFingerprint("AA:BB");
        entity.setGeneratedAt(Instant.now());
        return entity;
    }
}
