package com.ciphertalk.message;

import java.time.Instant;
import java.util.List;

/**
 * Messages a reader newly moved to READ in one session. Empty {@code messageIds} means nothing
 * changed, which is what a repeated mark-read yields.
 */
public record ReadReceipt(String sessionId, String readerId, String senderId, List<String> messageIds, Instant readAt) {

    public boolean isEmpty() {
        return messageIds.isEmpty();
    }
}
