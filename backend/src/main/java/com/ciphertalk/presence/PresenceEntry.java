package com.ciphertalk.presence;

import java.time.Instant;

/** One live connection. {@code lastSeenAt} moves forward on every heartbeat. */
public record PresenceEntry(String userId, String connectionId, Instant connectedAt, Instant lastSeenAt) {

    PresenceEntry touchedAt(Instant now) {
        return new PresenceEntry(userId, connectionId, connectedAt, now);
    }
}
