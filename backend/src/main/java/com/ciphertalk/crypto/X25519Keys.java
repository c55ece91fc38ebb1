package com.ciphertalk.crypto;

import java.security.SecureRandom;
import java.util.Base64;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.generators.X25519KeyPairGenerator;
import org.bouncycastle.crypto.params.X25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import com.ciphertalk.error.AuthenticationFailedException;
import com.ciphertalk.error.ValidationException;

/**
 * Curve25519 (X25519) key generation, agreement and Base64 serialisation.
 */
public final class X25519Keys {

    private static final SecureRandom RANDOM = new SecureRandom();

    private X25519Keys() {}

    public static AsymmetricCipherKeyPair generate() {
        X25519KeyPairGenerator generator = new X25519KeyPairGenerator();
        generator.init(new X25519KeyGenerationParameters(RANDOM));
        return generator.generateKeyPair();
    }

    public static byte[] agree(X25519PrivateKeyParameters privateKey, X25519PublicKeyParameters publicKey) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(privateKey);
        byte[] secret = new byte[agreement.getAgreementSize()];
        try {
            agreement.calculateAgreement(publicKey, secret, 0);
        } catch (IllegalStateException e) {
            // low-order point: the agreement is all zeros
            throw new AuthenticationFailedException("Key agreement rejected", e);
        }
        return secret;
    }

    public static String encodePublic(X25519PublicKeyParameters publicKey) {
        return Base64.getEncoder().encodeToString(publicKey.getEncoded());
    }

    public static X25519PublicKeyParameters decodePublic(String base64Key) {
        byte[] bytes = decode(base64Key, "public key");
        if (bytes.length != X25519PublicKeyParameters.KEY_SIZE) {
            throw new ValidationException("X25519 public key must be " + X25519PublicKeyParameters.KEY_SIZE + " bytes");
        }
        return new X25519PublicKeyParameters(bytes, 0);
    }

    public static X25519PrivateKeyParameters decodePrivate(byte[] bytes) {
        if (bytes.length != X25519PrivateKeyParameters.KEY_SIZE) {
            throw new ValidationException("X25519 private key must be " + X25519PrivateKeyParameters.KEY_SIZE + " bytes");
        }
        return new X25519PrivateKeyParameters(bytes, 0);
    }

    static byte[] decode(String base64, String what) {
        if (base64 == null || base64.isBlank()) {
            throw new ValidationException("Missing " + what);
        }
        try {
            return Base64.getDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed Base64 " + what);
        }
    }
}
