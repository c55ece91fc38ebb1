package com.ciphertalk.realtime;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ciphertalk.account.CredentialVerifier;
import com.ciphertalk.account.UserDirectory;
import com.ciphertalk.crypto.Digests;
import com.ciphertalk.error.CipherTalkException;
import com.ciphertalk.error.ErrorCode;
import com.ciphertalk.message.EnvelopeEntity;
import com.ciphertalk.message.EnvelopeView;
import com.ciphertalk.message.MessageRequest;
import com.ciphertalk.message.MessageStatus;
import com.ciphertalk.message.MessageStore;
import com.ciphertalk.message.ReadReceipt;
import com.ciphertalk.presence.ConnectOutcome;
import com.ciphertalk.presence.PresenceChange;
import com.ciphertalk.presence.PresenceRegistry;
import com.ciphertalk.realtime.event.ClientEvent;
import com.ciphertalk.realtime.event.ServerEvent;

import reactor.core.publisher.Mono;

/**
 * Routes real-time traffic between authenticated connections.
 *
 * <p>Each connection is registered under its user's private room. Message, receipt and typing
 * events reach a user through that room and only while the user is online; an offline receiver
 * simply catches up later through the store. The REST send path goes through {@link #send} too,
 * so both transports push the same way.
 */
@Service
public class RealtimeGateway implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(RealtimeGateway.class);

    private final CredentialVerifier credentials;
    private final PresenceRegistry presence;
    private final RoomBroker broker;
    private final UserChannel channel;
    private final MessageStore store;
    private final UserDirectory directory;
    private final CallRelay calls;
    private final ConcurrentHashMap<String, ConnectionHandle> connections = new ConcurrentHashMap<>();

    public RealtimeGateway(CredentialVerifier credentials,
                           PresenceRegistry presence,
                           RoomBroker broker,
                           UserChannel channel,
                           MessageStore store,
                           UserDirectory directory,
                           CallRelay calls) {
        this.credentials = credentials;
        this.presence = presence;
        this.broker = broker;
        this.channel = channel;
        this.store = store;
        this.directory = directory;
        this.calls = calls;
    }

    public Mono<String> authenticate(String credential) {
        return credentials.verify(credential);
    }

    /**
     * Registers an authenticated connection. Under the single-connection policy the user's
     * previous connection is evicted and closed here.
     */
    public Mono<Void> register(ConnectionHandle connection) {
        String userId = connection.userId();
        connections.put(connection.connectionId(), connection);
        ConnectOutcome outcome = presence.connect(userId, connection.connectionId());
        broker.join(Rooms.user(userId), connection);

        for (String evictedId : outcome.evictedConnectionIds()) {
            ConnectionHandle evicted = connections.remove(evictedId);
            if (evicted != null) {
                broker.leaveAll(evicted);
                evicted.close("Replaced by a newer connection");
            }
        }
        log.info("User {} connected ({})", userId, connection.connectionId());
        return outcome.cameOnline()
                ? fanOutStatus(userId, true, Instant.now())
                : Mono.empty();
    }

    /**
     * Releases rooms and presence first, then records last-seen and tells friends. Safe to call
     * more than once for the same connection.
     */
    public Mono<Void> disconnect(ConnectionHandle connection) {
        return Mono.defer(() -> {
            broker.leaveAll(connection);
            connections.remove(connection.connectionId(), connection);
            return wentOffline(presence.disconnect(connection.connectionId()));
        });
    }

    /** Closes a connection that stopped sending heartbeats and cleans up after it. */
    public Mono<Void> expire(String connectionId) {
        ConnectionHandle connection = connections.get(connectionId);
        if (connection == null) {
            // registry entry without a live handle
            return Mono.defer(() -> wentOffline(presence.disconnect(connectionId)));
        }
        connection.close("Heartbeat timeout");
        return disconnect(connection);
    }

    public boolean deliver(String userId, ServerEvent event) {
        return channel.deliver(userId, event);
    }

    /**
     * Stores the message and pushes it to the receiver when online. A successful push moves the
     * envelope to DELIVERED.
     */
    public Mono<SendResult> send(String senderId, MessageRequest request) {
        return store.append(senderId, request)
                .flatMap(entity -> {
                    EnvelopeView view = EnvelopeView.of(entity);
                    if (!channel.deliver(entity.getReceiverId(), new ServerEvent.NewMessage(view))) {
                        return Mono.just(new SendResult(view, false));
                    }
                    return store.markDelivered(entity.getKey().id())
                            .map(applied -> new SendResult(applied ? delivered(entity) : view, true));
                });
    }

    public Mono<ReadReceipt> markSessionRead(String sessionId, String viewerId) {
        return store.markRead(sessionId, viewerId)
                .doOnNext(this::notifyReadReceipt);
    }

    public Mono<EnvelopeEntity> deleteMessage(String messageId, String requesterId) {
        return store.softDelete(messageId, requesterId)
                .doOnNext(entity -> broker.publish(Rooms.chat(entity.getKey().sessionId()),
                        new ServerEvent.MessageDeleted(messageId, entity.getKey().sessionId(), requesterId)));
    }

    @Override
    public boolean notify(String userId, ServerEvent.Notification notification) {
        int reached = broker.publish(Rooms.notifications(userId), notification);
        return reached > 0 || channel.deliver(userId, notification);
    }

    /**
     * Handles one inbound event. Failures are reported back to the connection as an
     * {@code error} event; they never tear the connection down.
     */
    public Mono<Void> dispatch(ConnectionHandle connection, ClientEvent event) {
        String clientRef = event instanceof ClientEvent.SendMessage send ? send.clientRef() : null;
        return Mono.defer(() -> route(connection, event))
                .onErrorResume(CipherTalkException.class, e -> {
                    connection.push(new ServerEvent.Failure(e.code().name(), e.getMessage(), clientRef));
                    return Mono.empty();
                })
                .onErrorResume(e -> {
                    log.error("Failed to handle {} from {}", event.getClass().getSimpleName(), connection.userId(), e);
                    connection.push(new ServerEvent.Failure(ErrorCode.INTERNAL_ERROR.name(), "Internal error", clientRef));
                    return Mono.empty();
                });
    }

    public Optional<ConnectionHandle> connection(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId));
    }

    private Mono<Void> route(ConnectionHandle connection, ClientEvent event) {
        String userId = connection.userId();

        if (event instanceof ClientEvent.SendMessage send) {
            return send(userId, send.message())
                    .doOnNext(result -> connection.push(new ServerEvent.MessageSent(
                            send.clientRef(),
                            result.envelope().id(),
                            result.envelope().sessionId(),
                            result.envelope().sentAt(),
                            result.delivered())))
                    .then();
        }
        if (event instanceof ClientEvent.MarkMessageRead read) {
            return store.markMessageRead(read.messageId(), userId)
                    .doOnNext(this::notifyReadReceipt)
                    .then();
        }
        if (event instanceof ClientEvent.JoinChat join) {
            return store.requireParticipant(join.sessionId(), userId)
                    .then(Mono.fromRunnable(() -> broker.join(Rooms.chat(join.sessionId()), connection)));
        }
        if (event instanceof ClientEvent.LeaveChat leave) {
            broker.leave(Rooms.chat(leave.sessionId()), connection);
            return Mono.empty();
        }
        if (event instanceof ClientEvent.TypingStart typing) {
            String sessionId = Digests.sessionIdFor(userId, typing.receiverId());
            channel.deliver(typing.receiverId(), new ServerEvent.UserTyping(userId, sessionId));
            return Mono.empty();
        }
        if (event instanceof ClientEvent.TypingStop typing) {
            String sessionId = Digests.sessionIdFor(userId, typing.receiverId());
            channel.deliver(typing.receiverId(), new ServerEvent.UserStoppedTyping(userId, sessionId));
            return Mono.empty();
        }
        if (event instanceof ClientEvent.InitiateCall call) {
            calls.initiate(userId, call.receiverId(), call.callType());
            return Mono.empty();
        }
        if (event instanceof ClientEvent.AcceptCall accept) {
            calls.accept(accept.callId(), userId);
            return Mono.empty();
        }
        if (event instanceof ClientEvent.RejectCall reject) {
            calls.reject(reject.callId(), userId, reject.reason());
            return Mono.empty();
        }
        if (event instanceof ClientEvent.EndCall end) {
            calls.end(end.callId(), userId);
            return Mono.empty();
        }
        if (event instanceof ClientEvent.SubscribeNotifications) {
            broker.join(Rooms.notifications(userId), connection);
            return Mono.empty();
        }
        if (event instanceof ClientEvent.UnsubscribeNotifications) {
            broker.leave(Rooms.notifications(userId), connection);
            return Mono.empty();
        }
        if (event instanceof ClientEvent.Heartbeat) {
            presence.touch(connection.connectionId());
            connection.push(new ServerEvent.HeartbeatAck(Instant.now()));
            return Mono.empty();
        }
        return Mono.error(new IllegalStateException("Unhandled event " + event.getClass().getName()));
    }

    private void notifyReadReceipt(ReadReceipt receipt) {
        if (receipt.isEmpty()) {
            return;
        }
        channel.deliver(receipt.senderId(), new ServerEvent.MessageRead(
                receipt.sessionId(), receipt.messageIds(), receipt.readerId(), receipt.readAt()));
    }

    private Mono<Void> wentOffline(Optional<PresenceChange> change) {
        if (change.isEmpty()) {
            return Mono.empty();
        }
        PresenceChange offline = change.get();
        calls.dropUser(offline.userId());
        log.info("User {} went offline", offline.userId());
        return directory.recordLastSeen(offline.userId(), offline.at())
                .onErrorResume(e -> {
                    log.warn("Could not record last-seen for {}: {}", offline.userId(), e.getMessage());
                    return Mono.empty();
                })
                .then(fanOutStatus(offline.userId(), false, offline.at()));
    }

    private Mono<Void> fanOutStatus(String userId, boolean online, Instant at) {
        ServerEvent.FriendStatusChange change = new ServerEvent.FriendStatusChange(userId, online, at);
        return directory.friendIds(userId)
                .filter(channel::isOnline)
                .doOnNext(friendId -> channel.deliver(friendId, change))
                .then()
                .onErrorResume(e -> {
                    log.warn("Friend status fan-out for {} failed: {}", userId, e.getMessage());
                    return Mono.empty();
                });
    }

    private static EnvelopeView delivered(EnvelopeEntity entity) {
        entity.setStatus(MessageStatus.DELIVERED);
        entity.setDeliveredAt(Instant.now());
        return EnvelopeView.of(entity);
    }
}
