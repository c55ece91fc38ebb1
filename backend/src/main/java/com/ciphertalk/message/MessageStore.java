package com.ciphertalk.message;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ciphertalk.account.UserDirectory;
import com.ciphertalk.config.CipherTalkProperties;
import com.ciphertalk.crypto.Digests;
import com.ciphertalk.crypto.Role;
import com.ciphertalk.error.AuthorizationException;
import com.ciphertalk.error.NotFoundException;
import com.ciphertalk.error.ValidationException;
import com.ciphertalk.keys.KeyManagementService;
import com.datastax.oss.driver.api.core.uuid.Uuids;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistence of encrypted envelopes and their delivery state.
 *
 * <p><strong>Blind carrier:</strong> the store validates shape, membership and ownership but
 * never decrypts. Deleted envelopes are tombstones: they stay in the table and are filtered out
 * of every listing here, and {@link #decryptionMaterial} refuses them.
 */
@Service
public class MessageStore {

    private static final Logger log = LoggerFactory.getLogger(MessageStore.class);

    private final EnvelopeRepository envelopes;
    private final EnvelopeLocatorRepository locators;
    private final SessionMembershipRepository memberships;
    private final KeyManagementService keys;
    private final UserDirectory directory;
    private final CipherTalkProperties.Messages limits;

    public MessageStore(EnvelopeRepository envelopes,
                        EnvelopeLocatorRepository locators,
                        SessionMembershipRepository memberships,
                        KeyManagementService keys,
                        UserDirectory directory,
                        CipherTalkProperties properties) {
        this.envelopes = envelopes;
        this.locators = locators;
        this.memberships = memberships;
        this.keys = keys;
        this.directory = directory;
        this.limits = properties.messages();
    }

    public String sessionIdFor(String userA, String userB) {
        return Digests.sessionIdFor(userA, userB);
    }

    /**
     * Opens (or re-opens) the conversation with {@code counterpartId}. Idempotent: both
     * membership rows are upserts.
     */
    public Mono<SessionView> openSession(String userId, String counterpartId) {
        String sessionId;
        try {
            sessionId = sessionIdFor(userId, counterpartId);
        } catch (ValidationException e) {
            return Mono.error(e);
        }
        Instant now = Instant.now();
        return directory.lookup(counterpartId)
                .switchIfEmpty(Mono.error(new NotFoundException("No such user: " + counterpartId)))
                .flatMap(counterpart -> memberships.saveAll(List.of(
                                new SessionMembership(userId, sessionId, counterpartId, now),
                                new SessionMembership(counterpartId, sessionId, userId, now)))
                        .then(keys.hasKeys(counterpartId))
                        .map(hasKeys -> new SessionView(sessionId, counterpart, hasKeys)));
    }

    /**
     * Stores a new envelope with status SENT. The envelope, its locator and both membership rows
     * go out in one logged batch.
     */
    public Mono<EnvelopeEntity> append(String senderId, MessageRequest request) {
        String problem = validate(senderId, request);
        if (problem != null) {
            return Mono.error(new ValidationException(problem));
        }
        UUID replyTo = isBlank(request.replyTo()) ? null : timeUuid(request.replyTo());
        if (!isBlank(request.replyTo()) && replyTo == null) {
            return Mono.error(new ValidationException("Malformed replyTo id"));
        }
        String receiverId = request.receiverId();
        return directory.exists(receiverId)
                .flatMap(exists -> exists
                        ? Mono.zip(keys.currentVersion(senderId), keys.currentVersion(receiverId))
                        : Mono.error(new ValidationException("Unknown receiver: " + receiverId)))
                .flatMap(versions -> {
                    if (versions.getT1() == 0) {
                        return Mono.error(new ValidationException("Sender has not initialized encryption keys"));
                    }
                    if (versions.getT2() == 0) {
                        return Mono.error(new ValidationException("Receiver has not initialized encryption keys"));
                    }
                    EnvelopeEntity entity = newEnvelope(senderId, request, replyTo, versions.getT1(), versions.getT2());
                    String sessionId = entity.getKey().sessionId();
                    return envelopes.appendBatch(entity,
                                    new EnvelopeLocator(entity.getKey().id(), sessionId),
                                    List.of(new SessionMembership(senderId, sessionId, receiverId, entity.getSentAt()),
                                            new SessionMembership(receiverId, sessionId, senderId, entity.getSentAt())))
                            .thenReturn(entity);
                })
                .doOnNext(entity -> log.debug("Stored envelope {} in session {}", entity.getKey().id(), entity.getKey().sessionId()));
    }

    /**
     * One page of a conversation, newest first. {@code before} is the id of the oldest message
     * the caller already has; null starts from the newest.
     */
    public Flux<EnvelopeEntity> listConversation(String sessionId, String viewerId, Integer limit, String before) {
        int pageSize = limit != null ? limit : limits.defaultPageSize();
        if (pageSize < 1 || pageSize > limits.maxPageSize()) {
            return Flux.error(new ValidationException("limit must be between 1 and " + limits.maxPageSize()));
        }
        UUID cursor = isBlank(before) ? null : timeUuid(before);
        if (!isBlank(before) && cursor == null) {
            return Flux.error(new ValidationException("Malformed cursor: " + before));
        }
        Flux<EnvelopeEntity> rows = Flux.defer(() -> cursor == null
                ? envelopes.findByKeySessionId(sessionId)
                : envelopes.findByKeySessionIdAndKeyIdLessThan(sessionId, cursor));
        return requireParticipant(sessionId, viewerId)
                .thenMany(rows)
                .filter(entity -> !entity.isDeleted())
                .take(pageSize);
    }

    /**
     * Completes when {@code userId} belongs to the session. Errors with {@link NotFoundException}
     * when nothing is known about the session, {@link AuthorizationException} otherwise.
     */
    public Mono<Void> requireParticipant(String sessionId, String userId) {
        return memberships.existsById(new SessionMembershipKey(userId, sessionId))
                .flatMap(member -> {
                    if (member) {
                        return Mono.<Void>empty();
                    }
                    return envelopes.findFirstByKeySessionId(sessionId)
                            .hasElement()
                            .flatMap(known -> Mono.<Void>error(known
                                    ? new AuthorizationException("Not a participant of session " + sessionId)
                                    : new NotFoundException("No such session: " + sessionId)));
                });
    }

    /** Emits false for unknown ids or envelopes that already moved past SENT. */
    public Mono<Boolean> markDelivered(UUID messageId) {
        return locators.findById(messageId)
                .flatMap(locator -> envelopes.markDelivered(new EnvelopeKey(locator.getSessionId(), messageId), Instant.now()))
                .defaultIfEmpty(false);
    }

    /**
     * Moves every unread envelope addressed to {@code viewerId} in the session to READ.
     * Concurrent or repeated calls are safe: each envelope is claimed by exactly one LWT.
     */
    public Mono<ReadReceipt> markRead(String sessionId, String viewerId) {
        Instant now = Instant.now();
        return requireParticipant(sessionId, viewerId)
                .thenMany(Flux.defer(() -> envelopes.findByKeySessionId(sessionId)))
                .filter(entity -> entity.isUnreadFor(viewerId))
                .concatMap(entity -> envelopes.markRead(entity.getKey(), now)
                        .filter(Boolean::booleanValue)
                        .map(applied -> entity))
                .collectList()
                .map(read -> new ReadReceipt(
                        sessionId,
                        viewerId,
                        read.isEmpty() ? null : read.get(0).getSenderId(),
                        read.stream().map(entity -> entity.getKey().id().toString()).toList(),
                        now));
    }

    /**
     * Single-message read acknowledgement. Only the receiver may mark; an already read message
     * yields an empty receipt.
     */
    public Mono<ReadReceipt> markMessageRead(String messageId, String viewerId) {
        Instant now = Instant.now();
        return locate(messageId)
                .flatMap(entity -> {
                    if (!viewerId.equals(entity.getReceiverId())) {
                        return Mono.error(new AuthorizationException("Only the receiver can mark a message read"));
                    }
                    String sessionId = entity.getKey().sessionId();
                    if (!entity.isUnreadFor(viewerId)) {
                        return Mono.just(new ReadReceipt(sessionId, viewerId, entity.getSenderId(), List.of(), now));
                    }
                    return envelopes.markRead(entity.getKey(), now)
                            .map(applied -> new ReadReceipt(sessionId, viewerId, entity.getSenderId(),
                                    applied ? List.of(messageId) : List.of(), now));
                });
    }

    /**
     * Tombstones the envelope. Ciphertext stays in place; only the sender or receiver may delete.
     */
    public Mono<EnvelopeEntity> softDelete(String messageId, String requesterId) {
        Instant now = Instant.now();
        return locate(messageId)
                .flatMap(entity -> {
                    if (!requesterId.equals(entity.getSenderId()) && !requesterId.equals(entity.getReceiverId())) {
                        return Mono.error(new AuthorizationException("Only participants can delete a message"));
                    }
                    if (entity.isDeleted()) {
                        return Mono.just(entity);
                    }
                    return envelopes.markDeleted(entity.getKey(), now)
                            .thenReturn(entity)
                            .doOnNext(deleted -> {
                                deleted.setDeleted(true);
                                deleted.setDeletedAt(now);
                                log.info("Envelope {} deleted by {}", messageId, requesterId);
                            });
                });
    }

    public Mono<DecryptionMaterial> decryptionMaterial(String messageId, String viewerId) {
        return locate(messageId)
                .flatMap(entity -> {
                    if (entity.isDeleted()) {
                        return Mono.error(new NotFoundException("Message not found: " + messageId));
                    }
                    Role role;
                    if (viewerId.equals(entity.getSenderId())) {
                        role = Role.SENDER;
                    } else if (viewerId.equals(entity.getReceiverId())) {
                        role = Role.RECEIVER;
                    } else {
                        return Mono.error(new AuthorizationException("Not a participant of this message"));
                    }
                    return Mono.just(new DecryptionMaterial(
                            messageId,
                            role,
                            entity.getEncryptedContent(),
                            entity.getIv(),
                            entity.getAuthTag(),
                            role == Role.SENDER ? entity.getSenderWrappedKey() : entity.getReceiverWrappedKey(),
                            role == Role.SENDER ? entity.getSenderKeyVersion() : entity.getReceiverKeyVersion(),
                            entity.getContentHash()));
                });
    }

    public Mono<Long> countUnread(String userId) {
        return sessionsOf(userId)
                .flatMap(membership -> visibleEnvelopes(membership.getKey().sessionId()))
                .filter(entity -> entity.isUnreadFor(userId))
                .count();
    }

    public Flux<SessionMembership> sessionsOf(String userId) {
        return memberships.findByKeyUserId(userId);
    }

    /** All non-deleted envelopes of a session, newest first. */
    public Flux<EnvelopeEntity> visibleEnvelopes(String sessionId) {
        return envelopes.findByKeySessionId(sessionId)
                .filter(entity -> !entity.isDeleted());
    }

    private Mono<EnvelopeEntity> locate(String messageId) {
        UUID id;
        try {
            id = UUID.fromString(messageId);
        } catch (IllegalArgumentException e) {
            return Mono.error(new ValidationException("Malformed message id: " + messageId));
        }
        // message ids are time uuids; any other version names nothing
        if (id.version() != 1) {
            return Mono.error(new NotFoundException("Message not found: " + messageId));
        }
        return locators.findById(id)
                .flatMap(locator -> envelopes.findById(new EnvelopeKey(locator.getSessionId(), id)))
                .switchIfEmpty(Mono.error(new NotFoundException("Message not found: " + messageId)));
    }

    private EnvelopeEntity newEnvelope(String senderId, MessageRequest request, UUID replyTo,
                                       int senderKeyVersion, int receiverKeyVersion) {
        UUID id = Uuids.timeBased();
        EnvelopeEntity entity = new EnvelopeEntity();
        entity.setKey(new EnvelopeKey(sessionIdFor(senderId, request.receiverId()), id));
        entity.setSenderId(senderId);
        entity.setReceiverId(request.receiverId());
        entity.setEncryptedContent(request.encryptedContent());
        entity.setIv(request.iv());
        entity.setAuthTag(request.authTag());
        entity.setSenderWrappedKey(request.senderWrappedKey());
        entity.setReceiverWrappedKey(request.receiverWrappedKey());
        entity.setContentHash(request.contentHash());
        entity.setSenderKeyVersion(senderKeyVersion);
        entity.setReceiverKeyVersion(receiverKeyVersion);
        entity.setMessageType(request.messageType() != null ? request.messageType() : MessageType.TEXT);
        entity.setFileMetadata(request.fileMetadata());
        entity.setStatus(MessageStatus.SENT);
        entity.setSentAt(Instant.ofEpochMilli(Uuids.unixTimestamp(id)));
        entity.setDeleted(false);
        entity.setReplyTo(replyTo);
        return entity;
    }

    private static String validate(String senderId, MessageRequest request) {
        if (request == null) {
            return "Message body is required";
        }
        if (request.receiverId() == null || request.receiverId().isBlank()) {
            return "receiverId is required";
        }
        if (request.receiverId().equals(senderId)) {
            return "Cannot send a message to yourself";
        }
        if (isBlank(request.encryptedContent()) || isBlank(request.iv()) || isBlank(request.authTag())) {
            return "encryptedContent, iv and authTag are required";
        }
        if (isBlank(request.senderWrappedKey()) || isBlank(request.receiverWrappedKey())) {
            return "Wrapped content keys for both participants are required";
        }
        if (isBlank(request.contentHash())) {
            return "contentHash is required";
        }
        MessageType type = request.messageType() != null ? request.messageType() : MessageType.TEXT;
        if (type != MessageType.TEXT && request.fileMetadata() == null) {
            return "fileMetadata is required for " + type + " messages";
        }
        return null;
    }

    /** Parses a version-1 (time-based) UUID; null for anything else. */
    private static UUID timeUuid(String value) {
        try {
            UUID uuid = UUID.fromString(value);
            return uuid.version() == 1 ? uuid : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
