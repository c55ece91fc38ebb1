package com.ciphertalk.realtime.event;

import com.ciphertalk.message.MessageRequest;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Everything a client may send over the real-time connection. The JSON {@code type} field
 * selects the record; anything else is rejected at decode time.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientEvent.JoinChat.class, name = "join-chat"),
    @JsonSubTypes.Type(value = ClientEvent.LeaveChat.class, name = "leave-chat"),
    @JsonSubTypes.Type(value = ClientEvent.SendMessage.class, name = "send-message"),
    @JsonSubTypes.Type(value = ClientEvent.MarkMessageRead.class, name = "mark-message-read"),
    @JsonSubTypes.Type(value = ClientEvent.TypingStart.class, name = "typing-start"),
    @JsonSubTypes.Type(value = ClientEvent.TypingStop.class, name = "typing-stop"),
    @JsonSubTypes.Type(value = ClientEvent.InitiateCall.class, name = "initiate-call"),
    @JsonSubTypes.Type(value = ClientEvent.AcceptCall.class, name = "accept-call"),
    @JsonSubTypes.Type(value = ClientEvent.RejectCall.class, name = "reject-call"),
    @JsonSubTypes.Type(value = ClientEvent.EndCall.class, name = "end-call"),
    @JsonSubTypes.Type(value = ClientEvent.SubscribeNotifications.class, name = "subscribe-notifications"),
    @JsonSubTypes.Type(value = ClientEvent.UnsubscribeNotifications.class, name = "unsubscribe-notifications"),
    @JsonSubTypes.Type(value = ClientEvent.Heartbeat.class, name = "heartbeat")
})
public sealed interface ClientEvent {

    record JoinChat(String sessionId) implements ClientEvent {}

    record LeaveChat(String sessionId) implements ClientEvent {}

    /** {@code clientRef} is echoed back in the matching {@code message-sent} or {@code error}. */
    record SendMessage(String clientRef, MessageRequest message) implements ClientEvent {}

    record MarkMessageRead(String messageId) implements ClientEvent {}

    record TypingStart(String receiverId) implements ClientEvent {}

    record TypingStop(String receiverId) implements ClientEvent {}

    record InitiateCall(String receiverId, String callType) implements ClientEvent {}

    record AcceptCall(String callId) implements ClientEvent {}

    record RejectCall(String callId, String reason) implements ClientEvent {}

    record EndCall(String callId) implements ClientEvent {}

    record SubscribeNotifications() implements ClientEvent {}

    record UnsubscribeNotifications() implements ClientEvent {}

    record Heartbeat() implements ClientEvent {}
}
