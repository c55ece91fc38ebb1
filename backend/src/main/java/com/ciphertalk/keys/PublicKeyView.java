package com.ciphertalk.keys;

import java.time.Instant;

public record PublicKeyView(
    String userId,
    String publicKey,
    String fingerprint,
    int version,
    Instant generatedAt
) {
    static PublicKeyView of(UserKeyEntity entity) {
        return new PublicKeyView(entity.getKey().userId(), entity.getPublicKey(), entity.getFingerprint(),
                entity.getKey().version(), entity.getGeneratedAt());
    }
}
