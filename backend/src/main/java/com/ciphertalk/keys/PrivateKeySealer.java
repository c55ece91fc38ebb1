package com.ciphertalk.keys;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Base64;

import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;

import com.ciphertalk.crypto.Aead;
import com.ciphertalk.crypto.X25519Keys;
import com.ciphertalk.error.AuthenticationFailedException;
import com.ciphertalk.error.ValidationException;

/**
 * Seals a private key under a passphrase so it is never stored in the clear.
 *
 * <pre>
 *   masterKey = Argon2id(passphrase, salt)        // t=2, m=19 MiB, p=1
 *   sealed    = salt || iv || AES-GCM(masterKey, iv, privateKey) || tag
 * </pre>
 */
public final class PrivateKeySealer {

    public static final String KDF = "argon2id";

    private static final int SALT_SIZE = 16;
    private static final int ITERATIONS = 2;
    private static final int MEMORY_KB = 19 * 1024;
    private static final int PARALLELISM = 1;
    private static final byte[] AAD = "ciphertalk/private-key".getBytes(StandardCharsets.US_ASCII);

    private PrivateKeySealer() {}

    public static String seal(X25519PrivateKeyParameters privateKey, String passphrase) {
        requirePassphrase(passphrase);
        byte[] salt = Aead.randomBytes(SALT_SIZE);
        byte[] iv = Aead.randomIv();
        byte[] masterKey = deriveMasterKey(passphrase, salt);
        byte[] raw = privateKey.getEncoded();
        try {
            Aead.Sealed sealed = Aead.encrypt(masterKey, iv, raw, AAD);
            byte[] out = new byte[SALT_SIZE + Aead.IV_SIZE + sealed.ciphertext().length + Aead.TAG_SIZE];
            System.arraycopy(salt, 0, out, 0, SALT_SIZE);
            System.arraycopy(iv, 0, out, SALT_SIZE, Aead.IV_SIZE);
            System.arraycopy(sealed.ciphertext(), 0, out, SALT_SIZE + Aead.IV_SIZE, sealed.ciphertext().length);
            System.arraycopy(sealed.tag(), 0, out, out.length - Aead.TAG_SIZE, Aead.TAG_SIZE);
            return Base64.getEncoder().encodeToString(out);
        } finally {
            Arrays.fill(masterKey, (byte) 0);
            Arrays.fill(raw, (byte) 0);
        }
    }

    /**
     * Reverses {@link #seal}. A wrong passphrase surfaces as
     * {@link AuthenticationFailedException} from the GCM tag check.
     */
    public static X25519PrivateKeyParameters unseal(String sealedKey, String passphrase) {
        requirePassphrase(passphrase);
        byte[] in;
        try {
            in = Base64.getDecoder().decode(sealedKey);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Malformed sealed private key");
        }
        int bodyLength = in.length - SALT_SIZE - Aead.IV_SIZE - Aead.TAG_SIZE;
        if (bodyLength <= 0) {
            throw new ValidationException("Sealed private key is truncated");
        }
        byte[] salt = Arrays.copyOfRange(in, 0, SALT_SIZE);
        byte[] iv = Arrays.copyOfRange(in, SALT_SIZE, SALT_SIZE + Aead.IV_SIZE);
        byte[] body = Arrays.copyOfRange(in, SALT_SIZE + Aead.IV_SIZE, SALT_SIZE + Aead.IV_SIZE + bodyLength);
        byte[] tag = Arrays.copyOfRange(in, in.length - Aead.TAG_SIZE, in.length);

        byte[] masterKey = deriveMasterKey(passphrase, salt);
        try {
            byte[] raw = Aead.decrypt(masterKey, iv, body, tag, AAD);
            return X25519Keys.decodePrivate(raw);
        } finally {
            Arrays.fill(masterKey, (byte) 0);
        }
    }

    private static byte[] deriveMasterKey(String passphrase, byte[] salt) {
        Argon2Parameters parameters = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withIterations(ITERATIONS)
                .withMemoryAsKB(MEMORY_KB)
                .withParallelism(PARALLELISM)
                .withSalt(salt)
                .build();
        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(parameters);
        byte[] key = new byte[Aead.KEY_SIZE];
        generator.generateBytes(passphrase.getBytes(StandardCharsets.UTF_8), key);
        return key;
    }

    private static void requirePassphrase(String passphrase) {
        if (passphrase == null || passphrase.isBlank()) {
            throw new ValidationException("A passphrase is required to protect the private key");
        }
    }
}
