package com.ciphertalk.account;

import java.time.Instant;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The user/profile directory as seen by the messaging subsystem: profile lookup, the friend
 * list used for presence fan-out and the last-seen timestamp written on going offline.
 */
public interface UserDirectory {

    /** Empty when the user does not exist. */
    Mono<UserProfile> lookup(String userId);

    Mono<Boolean> exists(String userId);

    Flux<String> friendIds(String userId);

    Mono<Void> recordLastSeen(String userId, Instant lastSeenAt);
}
