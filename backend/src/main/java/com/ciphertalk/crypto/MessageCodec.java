package com.ciphertalk.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.springframework.stereotype.Component;

import com.ciphertalk.error.AuthenticationFailedException;
import com.ciphertalk.error.IntegrityMismatchException;

/**
 * Hybrid encryption of a single direct message.
 *
 * <p>The body is encrypted once with a fresh AES-256-GCM content key. That key is then wrapped
 * separately for the sender and for the receiver, so the ciphertext size does not depend on the
 * number of readers and senders can re-read their own history. Wrapping is ECIES-style:
 * <pre>
 *   eph      = fresh X25519 keypair
 *   wrapKey  = HKDF-SHA256(X25519(eph.priv, reader.pub), salt = eph.pub || reader.pub)
 *   wrapped  = eph.pub || iv || AES-GCM(wrapKey, iv, contentKey)
 * </pre>
 *
 * <p>Stateless and thread-safe. Plaintext and content keys are never logged or kept.
 */
@Component
public class MessageCodec {

    private static final byte[] CONTENT_AAD = "ciphertalk/v1".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] WRAP_INFO = "ciphertalk/key-wrap".getBytes(StandardCharsets.US_ASCII);
    private static final int EPHEMERAL_SIZE = X25519PublicKeyParameters.KEY_SIZE;

    public SealedMessage encode(String plaintext, String senderPublicKey, String receiverPublicKey) {
        return encode(plaintext, X25519Keys.decodePublic(senderPublicKey), X25519Keys.decodePublic(receiverPublicKey));
    }

    public SealedMessage encode(String plaintext,
                                X25519PublicKeyParameters senderPublicKey,
                                X25519PublicKeyParameters receiverPublicKey) {
        byte[] contentKey = Aead.randomKey();
        try {
            byte[] iv = Aead.randomIv();
            Aead.Sealed body = Aead.encrypt(contentKey, iv, plaintext.getBytes(StandardCharsets.UTF_8), CONTENT_AAD);
            Base64.Encoder b64 = Base64.getEncoder();
            return new SealedMessage(
                    b64.encodeToString(body.ciphertext()),
                    b64.encodeToString(iv),
                    b64.encodeToString(body.tag()),
                    wrap(contentKey, senderPublicKey),
                    wrap(contentKey, receiverPublicKey),
                    Digests.sha256Hex(plaintext));
        } finally {
            Arrays.fill(contentKey, (byte) 0);
        }
    }

    public String decode(SealedMessage sealed, X25519PrivateKeyParameters viewerPrivateKey, Role role) {
        return open(sealed.encryptedContent(), sealed.iv(), sealed.authTag(),
                sealed.wrappedKeyFor(role), sealed.contentHash(), viewerPrivateKey);
    }

    /**
     * Opens one message given only the wrapped key addressed to the viewer, which is what the
     * per-viewer decryption material endpoint hands out.
     */
    public String open(String encryptedContent, String iv, String authTag, String wrappedKey,
                       String contentHash, X25519PrivateKeyParameters viewerPrivateKey) {
        byte[] contentKey = unwrap(wrappedKey, viewerPrivateKey);
        try {
            byte[] plaintext = Aead.decrypt(contentKey,
                    X25519Keys.decode(iv, "iv"),
                    X25519Keys.decode(encryptedContent, "ciphertext"),
                    X25519Keys.decode(authTag, "authentication tag"),
                    CONTENT_AAD);
            String text = new String(plaintext, StandardCharsets.UTF_8);
            if (!Digests.hexEquals(contentHash, Digests.sha256Hex(text))) {
                throw new IntegrityMismatchException("Decrypted content does not match its recorded hash");
            }
            return text;
        } finally {
            Arrays.fill(contentKey, (byte) 0);
        }
    }

    private String wrap(byte[] contentKey, X25519PublicKeyParameters readerPublicKey) {
        AsymmetricCipherKeyPair ephemeral = X25519Keys.generate();
        X25519PublicKeyParameters ephemeralPublic = (X25519PublicKeyParameters) ephemeral.getPublic();
        byte[] wrapKey = deriveWrapKey(
                X25519Keys.agree((X25519PrivateKeyParameters) ephemeral.getPrivate(), readerPublicKey),
                ephemeralPublic.getEncoded(), readerPublicKey.getEncoded());
        try {
            byte[] iv = Aead.randomIv();
            Aead.Sealed sealed = Aead.encrypt(wrapKey, iv, contentKey, null);

            byte[] bundle = new byte[EPHEMERAL_SIZE + Aead.IV_SIZE + sealed.ciphertext().length + Aead.TAG_SIZE];
            int offset = 0;
            System.arraycopy(ephemeralPublic.getEncoded(), 0, bundle, offset, EPHEMERAL_SIZE);
            offset += EPHEMERAL_SIZE;
            System.arraycopy(iv, 0, bundle, offset, Aead.IV_SIZE);
            offset += Aead.IV_SIZE;
            System.arraycopy(sealed.ciphertext(), 0, bundle, offset, sealed.ciphertext().length);
            offset += sealed.ciphertext().length;
            System.arraycopy(sealed.tag(), 0, bundle, offset, Aead.TAG_SIZE);
            return Base64.getEncoder().encodeToString(bundle);
        } finally {
            Arrays.fill(wrapKey, (byte) 0);
        }
    }

    private byte[] unwrap(String wrappedKey, X25519PrivateKeyParameters viewerPrivateKey) {
        byte[] bundle = X25519Keys.decode(wrappedKey, "wrapped key");
        int bodyLength = bundle.length - EPHEMERAL_SIZE - Aead.IV_SIZE - Aead.TAG_SIZE;
        if (bodyLength <= 0) {
            throw new AuthenticationFailedException("Wrapped key is truncated");
        }
        byte[] ephemeralBytes = Arrays.copyOfRange(bundle, 0, EPHEMERAL_SIZE);
        byte[] iv = Arrays.copyOfRange(bundle, EPHEMERAL_SIZE, EPHEMERAL_SIZE + Aead.IV_SIZE);
        byte[] body = Arrays.copyOfRange(bundle, EPHEMERAL_SIZE + Aead.IV_SIZE, EPHEMERAL_SIZE + Aead.IV_SIZE + bodyLength);
        byte[] tag = Arrays.copyOfRange(bundle, bundle.length - Aead.TAG_SIZE, bundle.length);

        X25519PublicKeyParameters ephemeralPublic = new X25519PublicKeyParameters(ephemeralBytes, 0);
        byte[] wrapKey = deriveWrapKey(
                X25519Keys.agree(viewerPrivateKey, ephemeralPublic),
                ephemeralBytes, viewerPrivateKey.generatePublicKey().getEncoded());
        try {
            return Aead.decrypt(wrapKey, iv, body, tag, null);
        } finally {
            Arrays.fill(wrapKey, (byte) 0);
        }
    }

    private static byte[] deriveWrapKey(byte[] sharedSecret, byte[] ephemeralPublic, byte[] readerPublic) {
        byte[] salt = new byte[ephemeralPublic.length + readerPublic.length];
        System.arraycopy(ephemeralPublic, 0, salt, 0, ephemeralPublic.length);
        System.arraycopy(readerPublic, 0, salt, ephemeralPublic.length, readerPublic.length);

        HKDFBytesGenerator hkdf = new HKDFBytesGenerator(new SHA256Digest());
        hkdf.init(new HKDFParameters(sharedSecret, salt, WRAP_INFO));
        byte[] key = new byte[Aead.KEY_SIZE];
        hkdf.generateBytes(key, 0, key.length);
        Arrays.fill(sharedSecret, (byte) 0);
        return key;
    }
}
