package com.ciphertalk.realtime;

import org.springframework.stereotype.Component;

import com.ciphertalk.presence.PresenceRegistry;
import com.ciphertalk.realtime.event.ServerEvent;

/**
 * Best-effort push to a user's private room. An offline user is not an error: the event is
 * dropped and the caller learns it from the return value.
 */
@Component
public class UserChannel {

    private final PresenceRegistry presence;
    private final RoomBroker broker;

    public UserChannel(PresenceRegistry presence, RoomBroker broker) {
        this.presence = presence;
        this.broker = broker;
    }

    public boolean deliver(String userId, ServerEvent event) {
        if (!presence.isOnline(userId)) {
            return false;
        }
        return broker.publish(Rooms.user(userId), event) > 0;
    }

    public boolean isOnline(String userId) {
        return presence.isOnline(userId);
    }
}
