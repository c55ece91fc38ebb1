package com.ciphertalk.keys;

import reactor.core.publisher.Mono;

/** Conditional writes the derived repository methods cannot express. */
public interface KeyVersionWrites {

    /** Inserts the row unless that (user, version) already exists; emits whether it was applied. */
    Mono<Boolean> insertIfAbsent(UserKeyEntity entity);
}
