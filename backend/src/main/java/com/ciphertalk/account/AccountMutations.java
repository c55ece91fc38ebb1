package com.ciphertalk.account;

import java.time.Instant;

import reactor.core.publisher.Mono;

/** Single-column writes on {@code accounts}. */
public interface AccountMutations {

    /** Emits false when no such account exists. */
    Mono<Boolean> updateLastSeen(String username, Instant lastSeenAt);
}
