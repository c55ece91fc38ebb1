package com.ciphertalk.realtime;

import com.ciphertalk.realtime.event.ServerEvent;

/**
 * Publish/subscribe over named rooms. The in-process implementation is enough for one node;
 * fanning out across nodes means swapping this for a broker-backed one.
 */
public interface RoomBroker {

    void join(String room, ConnectionHandle connection);

    void leave(String room, ConnectionHandle connection);

    /** Drops the connection from every room it joined. */
    void leaveAll(ConnectionHandle connection);

    /** Pushes to every member; returns how many accepted the event. */
    int publish(String room, ServerEvent event);

    boolean isMember(String room, ConnectionHandle connection);
}
