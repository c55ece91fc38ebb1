package com.ciphertalk.crypto;

/**
 * Output of {@link MessageCodec#encode}: one ciphertext, one content key wrapped twice.
 * All binary fields are Base64; {@code contentHash} is hex SHA-256 of the plaintext.
 */
public record SealedMessage(
        String encryptedContent,
        String iv,
        String authTag,
        String senderWrappedKey,
        String receiverWrappedKey,
        String contentHash
) {

    public String wrappedKeyFor(Role role) {
        return role == Role.SENDER ? senderWrappedKey : receiverWrappedKey;
    }
}
