package com.ciphertalk.message;

/**
 * A message as it arrives from the sender's client: every content field is already encrypted.
 * The server checks shape and membership, never content.
 */
public record MessageRequest(
    String receiverId,
    String encryptedContent,    // AES-256-GCM(body), Base64
    String iv,                  // 12-byte GCM nonce, Base64
    String authTag,             // 16-byte GCM tag, Base64
    String senderWrappedKey,    // content key wrapped to the sender's X25519 key
    String receiverWrappedKey,  // content key wrapped to the receiver's X25519 key
    String contentHash,         // hex SHA-256 of the plaintext
    MessageType messageType,    // null means TEXT
    FileMetadata fileMetadata,
    String replyTo              // id of the message being answered, optional
) {}
