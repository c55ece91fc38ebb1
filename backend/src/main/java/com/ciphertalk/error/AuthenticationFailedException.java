package com.ciphertalk.error;

/** AEAD verification failed. Never retried: a retry cannot repair a tampered ciphertext or a wrong key. */
public class AuthenticationFailedException extends CipherTalkException {

    public AuthenticationFailedException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_FAILED, message, cause);
    }
}
