package com.ciphertalk.presence;

import java.util.List;

/**
 * Result of registering a connection. {@code evictedConnectionIds} lists connections the
 * registry dropped under {@link ConnectionPolicy#SINGLE_CONNECTION}; the caller closes them.
 */
public record ConnectOutcome(PresenceTransition transition, List<String> evictedConnectionIds) {

    public boolean cameOnline() {
        return transition == PresenceTransition.CAME_ONLINE;
    }
}
