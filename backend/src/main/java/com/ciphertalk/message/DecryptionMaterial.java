package com.ciphertalk.message;

import com.ciphertalk.crypto.Role;

/**
 * What one viewer needs to open one message: the shared ciphertext plus only the wrapped key
 * addressed to them, and the key version to unseal for it.
 */
public record DecryptionMaterial(
    String messageId,
    Role role,
    String encryptedContent,
    String iv,
    String authTag,
    String wrappedKey,
    int keyVersion,
    String contentHash
) {}
