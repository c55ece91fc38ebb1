package com.ciphertalk.error;

/** The caller is authenticated but does not own the message, session or key. */
public class AuthorizationException extends CipherTalkException {

    public AuthorizationException(String message) {
        super(ErrorCode.AUTHORIZATION_ERROR, message);
    }
}
