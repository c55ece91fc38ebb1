package com.ciphertalk.conversation;

import java.time.Instant;

import com.ciphertalk.message.EnvelopeView;

public record ConversationSummary(
    String sessionId,
    Counterpart counterpart,
    EnvelopeView lastMessage,
    long unreadCount
) {

    public record Counterpart(String userId, String displayName, boolean online, Instant lastSeenAt) {}
}
