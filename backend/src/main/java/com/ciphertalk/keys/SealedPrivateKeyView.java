package com.ciphertalk.keys;

import java.time.Instant;

/**
 * The owner's private key as stored: sealed under their passphrase. The client unseals it
 * locally, the server never holds the passphrase beyond the init call.
 */
public record SealedPrivateKeyView(
    String userId,
    String sealedPrivateKey,
    String kdf,
    int version,
    Instant generatedAt
) {
    static SealedPrivateKeyView of(UserKeyEntity entity) {
        return new SealedPrivateKeyView(entity.getKey().userId(), entity.getSealedPrivateKey(),
                PrivateKeySealer.KDF, entity.getKey().version(), entity.getGeneratedAt());
    }
}
