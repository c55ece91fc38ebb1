package com.ciphertalk.realtime.event;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.ciphertalk.message.EnvelopeView;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerEvent.NewMessage.class, name = "new-message"),
    @JsonSubTypes.Type(value = ServerEvent.MessageSent.class, name = "message-sent"),
    @JsonSubTypes.Type(value = ServerEvent.MessageRead.class, name = "message-read"),
    @JsonSubTypes.Type(value = ServerEvent.MessageDeleted.class, name = "message-deleted"),
    @JsonSubTypes.Type(value = ServerEvent.UserTyping.class, name = "user-typing"),
    @JsonSubTypes.Type(value = ServerEvent.UserStoppedTyping.class, name = "user-stopped-typing"),
    @JsonSubTypes.Type(value = ServerEvent.CallInitiated.class, name = "call-initiated"),
    @JsonSubTypes.Type(value = ServerEvent.CallFailed.class, name = "call-failed"),
    @JsonSubTypes.Type(value = ServerEvent.IncomingCall.class, name = "incoming-call"),
    @JsonSubTypes.Type(value = ServerEvent.CallAccepted.class, name = "call-accepted"),
    @JsonSubTypes.Type(value = ServerEvent.CallRejected.class, name = "call-rejected"),
    @JsonSubTypes.Type(value = ServerEvent.CallEnded.class, name = "call-ended"),
    @JsonSubTypes.Type(value = ServerEvent.FriendStatusChange.class, name = "friend-status-change"),
    @JsonSubTypes.Type(value = ServerEvent.Notification.class, name = "notification"),
    @JsonSubTypes.Type(value = ServerEvent.HeartbeatAck.class, name = "heartbeat-ack"),
    @JsonSubTypes.Type(value = ServerEvent.Failure.class, name = "error")
})
public sealed interface ServerEvent {

    /** The full envelope: ciphertext and both wrapped keys, never plaintext. */
    record NewMessage(EnvelopeView message) implements ServerEvent {}

    record MessageSent(String clientRef, String messageId, String sessionId, Instant sentAt, boolean delivered)
            implements ServerEvent {}

    record MessageRead(String sessionId, List<String> messageIds, String readBy, Instant readAt) implements ServerEvent {}

    record MessageDeleted(String messageId, String sessionId, String deletedBy) implements ServerEvent {}

    record UserTyping(String userId, String sessionId) implements ServerEvent {}

    record UserStoppedTyping(String userId, String sessionId) implements ServerEvent {}

    record CallInitiated(String callId, String receiverId, String callType) implements ServerEvent {}

    record CallFailed(String receiverId, String reason) implements ServerEvent {}

    record IncomingCall(String callId, String callerId, String callType, Instant at) implements ServerEvent {}

    record CallAccepted(String callId, String acceptedBy) implements ServerEvent {}

    record CallRejected(String callId, String rejectedBy, String reason) implements ServerEvent {}

    /** {@code endedBy} is null when the server ended the call (ring timeout, disconnect). */
    record CallEnded(String callId, String endedBy, String reason) implements ServerEvent {}

    record FriendStatusChange(String friendId, boolean online, Instant at) implements ServerEvent {}

    record Notification(String kind, String message, Map<String, String> data, Instant at) implements ServerEvent {}

    record HeartbeatAck(Instant at) implements ServerEvent {}

    /** Sent on the wire as {@code error}; {@code code} is an {@link com.ciphertalk.error.ErrorCode} name. */
    record Failure(String code, String message, String clientRef) implements ServerEvent {}
}
