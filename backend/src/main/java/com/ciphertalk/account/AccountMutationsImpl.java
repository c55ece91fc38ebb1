package com.ciphertalk.account;

import java.time.Instant;

import org.springframework.data.cassandra.core.ReactiveCassandraOperations;

import reactor.core.publisher.Mono;

class AccountMutationsImpl implements AccountMutations {

    private static final String UPDATE_LAST_SEEN =
            "UPDATE accounts SET last_seen_at = ? WHERE username = ? IF EXISTS";

    private final ReactiveCassandraOperations operations;

    AccountMutationsImpl(ReactiveCassandraOperations operations) {
        this.operations = operations;
    }

    @Override
    public Mono<Boolean> updateLastSeen(String username, Instant lastSeenAt) {
        return operations.getReactiveCqlOperations().execute(UPDATE_LAST_SEEN, lastSeenAt, username);
    }
}
