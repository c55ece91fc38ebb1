package com.ciphertalk.error;

/** The plaintext decrypted cleanly but its SHA-256 does not match the envelope's content hash. */
public class IntegrityMismatchException extends CipherTalkException {

    public IntegrityMismatchException(String message) {
        super(ErrorCode.INTEGRITY_MISMATCH, message);
    }

    public IntegrityMismatchException(String message, Throwable cause) {
        super(ErrorCode.INTEGRITY_MISMATCH, message, cause);
    }
}
