package com.ciphertalk.error;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes shared by the REST and real-time surfaces.
 * Clients branch on the code, never on the message text.
 */
public enum ErrorCode {

    AUTHENTICATION_ERROR(HttpStatus.UNAUTHORIZED),
    AUTHORIZATION_ERROR(HttpStatus.FORBIDDEN),
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    KEY_ALREADY_EXISTS(HttpStatus.CONFLICT),
    /** AEAD tag mismatch: tampered ciphertext or the wrong key. */
    AUTHENTICATION_FAILED(HttpStatus.UNPROCESSABLE_ENTITY),
    /** Decrypted plaintext does not match the recorded content hash. */
    INTEGRITY_MISMATCH(HttpStatus.UNPROCESSABLE_ENTITY),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
