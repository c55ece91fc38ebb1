package com.ciphertalk.presence;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Authoritative online/offline state per user, keyed by connection.
 *
 * <p>A user is online while at least one registered connection remains. Implementations must
 * serialize mutations per user so that a connect racing a disconnect never leaves a user
 * marked offline with a live connection, or online with none.
 */
public interface PresenceRegistry {

    ConnectOutcome connect(String userId, String connectionId);

    /**
     * Releases a connection. Returns the offline change only when this was the user's last
     * connection; unknown or already evicted connections yield empty.
     */
    Optional<PresenceChange> disconnect(String connectionId);

    /** Records a heartbeat. False when the connection is not registered. */
    boolean touch(String connectionId);

    /** Connections whose last heartbeat is older than {@code maxSilence}. */
    List<String> expired(Duration maxSilence);

    boolean isOnline(String userId);

    /** Most recently opened connection of the user. */
    Optional<PresenceEntry> lookup(String userId);

    Set<String> onlineUsers();
}
