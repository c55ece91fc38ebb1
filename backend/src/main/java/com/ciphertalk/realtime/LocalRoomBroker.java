package com.ciphertalk.realtime;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

import com.ciphertalk.realtime.event.ServerEvent;

@Component
public class LocalRoomBroker implements RoomBroker {

    private final ConcurrentHashMap<String, Set<ConnectionHandle>> members = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<String>> roomsByConnection = new ConcurrentHashMap<>();

    @Override
    public void join(String room, ConnectionHandle connection) {
        // insert inside compute: a concurrent leave may drop an emptied set from the map
        members.compute(room, (r, set) -> withAdded(set, connection));
        roomsByConnection.compute(connection.connectionId(), (c, rooms) -> withAdded(rooms, room));
    }

    @Override
    public void leave(String room, ConnectionHandle connection) {
        members.computeIfPresent(room, (r, set) -> {
            set.remove(connection);
            return set.isEmpty() ? null : set;
        });
        roomsByConnection.computeIfPresent(connection.connectionId(), (c, rooms) -> {
            rooms.remove(room);
            return rooms.isEmpty() ? null : rooms;
        });
    }

    @Override
    public void leaveAll(ConnectionHandle connection) {
        Set<String> rooms = roomsByConnection.remove(connection.connectionId());
        if (rooms == null) {
            return;
        }
        for (String room : rooms) {
            members.computeIfPresent(room, (r, set) -> {
                set.remove(connection);
                return set.isEmpty() ? null : set;
            });
        }
    }

    @Override
    public int publish(String room, ServerEvent event) {
        Set<ConnectionHandle> set = members.get(room);
        if (set == null) {
            return 0;
        }
        int delivered = 0;
        for (ConnectionHandle connection : set) {
            if (connection.push(event)) {
                delivered++;
            }
        }
        return delivered;
    }

    @Override
    public boolean isMember(String room, ConnectionHandle connection) {
        Set<ConnectionHandle> set = members.get(room);
        return set != null && set.contains(connection);
    }

    private static <T> Set<T> withAdded(Set<T> set, T element) {
        Set<T> target = set != null ? set : ConcurrentHashMap.newKeySet();
        target.add(element);
        return target;
    }
}
