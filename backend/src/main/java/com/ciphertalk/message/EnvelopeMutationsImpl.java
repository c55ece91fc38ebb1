package com.ciphertalk.message;

import java.time.Instant;
import java.util.List;

import org.springframework.data.cassandra.core.ReactiveCassandraOperations;

import reactor.core.publisher.Mono;

class EnvelopeMutationsImpl implements EnvelopeMutations {

    private static final String MARK_DELIVERED =
            "UPDATE envelopes SET status = 'DELIVERED', delivered_at = ? "
            + "WHERE session_id = ? AND id = ? IF status = 'SENT'";

    private static final String MARK_READ =
            "UPDATE envelopes SET status = 'READ', read_at = ? "
            + "WHERE session_id = ? AND id = ? IF status IN ('SENT', 'DELIVERED')";

    private static final String MARK_DELETED =
            "UPDATE envelopes SET deleted = true, deleted_at = ? "
            + "WHERE session_id = ? AND id = ? IF EXISTS";

    private final ReactiveCassandraOperations operations;

    EnvelopeMutationsImpl(ReactiveCassandraOperations operations) {
        this.operations = operations;
    }

    @Override
    public Mono<Void> appendBatch(EnvelopeEntity envelope, EnvelopeLocator locator, List<SessionMembership> memberships) {
        return operations.batchOps()
                .insert(envelope)
                .insert(locator)
                .insert(memberships)
                .execute()
                .then();
    }

    @Override
    public Mono<Boolean> markDelivered(EnvelopeKey key, Instant at) {
        return conditional(MARK_DELIVERED, key, at);
    }

    @Override
    public Mono<Boolean> markRead(EnvelopeKey key, Instant at) {
        return conditional(MARK_READ, key, at);
    }

    @Override
    public Mono<Boolean> markDeleted(EnvelopeKey key, Instant at) {
        return conditional(MARK_DELETED, key, at);
    }

    private Mono<Boolean> conditional(String cql, EnvelopeKey key, Instant at) {
        return operations.getReactiveCqlOperations().execute(cql, at, key.sessionId(), key.id());
    }
}
