package com.ciphertalk.message;

/**
 * Delivery state of an envelope. Only moves forward; SENT may skip straight to READ when the
 * receiver opens the conversation before a push reached them.
 */
public enum MessageStatus {
    SENT, DELIVERED, READ
}
