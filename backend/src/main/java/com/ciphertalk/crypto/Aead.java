package com.ciphertalk.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Arrays;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;

import com.ciphertalk.error.AuthenticationFailedException;

/**
 * AES-256-GCM through the BouncyCastle JCE provider. The 128-bit tag is kept apart from the
 * ciphertext so it can travel in its own envelope field.
 */
public final class Aead {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    public static final int KEY_SIZE = 32;
    public static final int IV_SIZE = 12;   // 96-bit IV
    public static final int TAG_SIZE = 16;  // 128-bit authentication tag

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final SecureRandom RANDOM = new SecureRandom();

    private Aead() {}

    /** Ciphertext and tag of one GCM operation. */
    public record Sealed(byte[] ciphertext, byte[] tag) {}

    public static byte[] randomKey() {
        return randomBytes(KEY_SIZE);
    }

    public static byte[] randomIv() {
        return randomBytes(IV_SIZE);
    }

    public static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    public static Sealed encrypt(byte[] key, byte[] iv, byte[] plaintext, byte[] aad) {
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE * 8, iv));
            if (aad != null) {
                cipher.updateAAD(aad);
            }
            byte[] output = cipher.doFinal(plaintext);
            int split = output.length - TAG_SIZE;
            return new Sealed(Arrays.copyOfRange(output, 0, split), Arrays.copyOfRange(output, split, output.length));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES-GCM encryption unavailable", e);
        }
    }

    public static byte[] decrypt(byte[] key, byte[] iv, byte[] ciphertext, byte[] tag, byte[] aad) {
        if (iv.length != IV_SIZE || tag.length != TAG_SIZE) {
            throw new AuthenticationFailedException("Malformed IV or authentication tag");
        }
        byte[] input = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, input, 0, ciphertext.length);
        System.arraycopy(tag, 0, input, ciphertext.length, tag.length);
        try {
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(key, "AES"), new GCMParameterSpec(TAG_SIZE * 8, iv));
            if (aad != null) {
                cipher.updateAAD(aad);
            }
            return cipher.doFinal(input);
        } catch (AEADBadTagException e) {
            throw new AuthenticationFailedException("Authentication tag mismatch", e);
        } catch (GeneralSecurityException e) {
            throw new AuthenticationFailedException("Ciphertext could not be authenticated", e);
        }
    }
}
