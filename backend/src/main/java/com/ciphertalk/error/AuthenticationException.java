package com.ciphertalk.error;

/** Missing, malformed or unknown bearer credential. */
public class AuthenticationException extends CipherTalkException {

    public AuthenticationException(String message) {
        super(ErrorCode.AUTHENTICATION_ERROR, message);
    }
}
