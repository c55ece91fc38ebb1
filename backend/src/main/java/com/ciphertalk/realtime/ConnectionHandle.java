package com.ciphertalk.realtime;

import com.ciphertalk.realtime.event.ServerEvent;

/** One authenticated real-time connection as the gateway and the room broker see it. */
public interface ConnectionHandle {

    String connectionId();

    String userId();

    /** Queues the event for this connection. False when the connection can no longer take it. */
    boolean push(ServerEvent event);

    void close(String reason);
}
