package com.ciphertalk.message;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import reactor.core.publisher.Mono;

/**
 * Writes the envelope table needs beyond plain saves. Status changes are lightweight
 * transactions so that concurrent callers can never move a message backwards.
 */
public interface EnvelopeMutations {

    /** Envelope, locator and memberships in one logged batch: all visible or none. */
    Mono<Void> appendBatch(EnvelopeEntity envelope, EnvelopeLocator locator, List<SessionMembership> memberships);

    /** SENT → DELIVERED. Emits false when the envelope already advanced. */
    Mono<Boolean> markDelivered(EnvelopeKey key, Instant at);

    /** SENT or DELIVERED → READ. Emits false when already read. */
    Mono<Boolean> markRead(EnvelopeKey key, Instant at);

    Mono<Boolean> markDeleted(EnvelopeKey key, Instant at);
}
