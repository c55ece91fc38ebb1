package com.ciphertalk.presence;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-process {@link PresenceRegistry}.
 *
 * <p>Per-user state is an immutable list swapped inside {@link ConcurrentHashMap#compute}, which
 * serializes all mutations of one user while different users never contend. A second map indexes
 * connection id to user id for disconnect and heartbeat lookups.
 */
public class InMemoryPresenceRegistry implements PresenceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPresenceRegistry.class);

    private final ConcurrentHashMap<String, List<PresenceEntry>> byUser = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> byConnection = new ConcurrentHashMap<>();
    private final ConnectionPolicy policy;
    private final Clock clock;

    public InMemoryPresenceRegistry(ConnectionPolicy policy, Clock clock) {
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public ConnectOutcome connect(String userId, String connectionId) {
        Instant now = clock.instant();
        PresenceEntry entry = new PresenceEntry(userId, connectionId, now, now);
        List<String> evicted = new ArrayList<>();
        boolean[] cameOnline = new boolean[1];

        byConnection.put(connectionId, userId);
        byUser.compute(userId, (id, existing) -> {
            cameOnline[0] = existing == null || existing.isEmpty();
            if (existing == null || policy == ConnectionPolicy.SINGLE_CONNECTION) {
                if (existing != null) {
                    existing.forEach(e -> evicted.add(e.connectionId()));
                }
                return List.of(entry);
            }
            List<PresenceEntry> next = new ArrayList<>(existing);
            next.add(entry);
            return List.copyOf(next);
        });
        evicted.forEach(byConnection::remove);

        if (!evicted.isEmpty()) {
            log.debug("User {} reconnected on {}, evicting {}", userId, connectionId, evicted);
        }
        return new ConnectOutcome(
                cameOnline[0] ? PresenceTransition.CAME_ONLINE : PresenceTransition.ALREADY_ONLINE,
                List.copyOf(evicted));
    }

    @Override
    public Optional<PresenceChange> disconnect(String connectionId) {
        String userId = byConnection.remove(connectionId);
        if (userId == null) {
            return Optional.empty();
        }
        boolean[] wentOffline = new boolean[1];
        byUser.computeIfPresent(userId, (id, existing) -> {
            List<PresenceEntry> remaining = new ArrayList<>(existing.size());
            for (PresenceEntry e : existing) {
                if (!e.connectionId().equals(connectionId)) {
                    remaining.add(e);
                }
            }
            if (remaining.isEmpty()) {
                wentOffline[0] = true;
                return null;
            }
            return List.copyOf(remaining);
        });
        return wentOffline[0]
                ? Optional.of(new PresenceChange(userId, false, clock.instant()))
                : Optional.empty();
    }

    @Override
    public boolean touch(String connectionId) {
        String userId = byConnection.get(connectionId);
        if (userId == null) {
            return false;
        }
        Instant now = clock.instant();
        boolean[] found = new boolean[1];
        byUser.computeIfPresent(userId, (id, existing) -> {
            List<PresenceEntry> next = new ArrayList<>(existing.size());
            for (PresenceEntry e : existing) {
                if (e.connectionId().equals(connectionId)) {
                    found[0] = true;
                    next.add(e.touchedAt(now));
                } else {
                    next.add(e);
                }
            }
            return List.copyOf(next);
        });
        return found[0];
    }

    @Override
    public List<String> expired(Duration maxSilence) {
        Instant cutoff = clock.instant().minus(maxSilence);
        List<String> stale = new ArrayList<>();
        byUser.values().forEach(entries -> entries.stream()
                .filter(e -> e.lastSeenAt().isBefore(cutoff))
                .forEach(e -> stale.add(e.connectionId())));
        return stale;
    }

    @Override
    public boolean isOnline(String userId) {
        List<PresenceEntry> entries = byUser.get(userId);
        return entries != null && !entries.isEmpty();
    }

    @Override
    public Optional<PresenceEntry> lookup(String userId) {
        List<PresenceEntry> entries = byUser.get(userId);
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(entries.size() - 1));
    }

    @Override
    public Set<String> onlineUsers() {
        return Set.copyOf(byUser.keySet());
    }
}
