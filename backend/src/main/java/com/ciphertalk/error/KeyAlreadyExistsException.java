package com.ciphertalk.error;

/** Raised when keys are initialized twice without asking for a rotation. */
public class KeyAlreadyExistsException extends CipherTalkException {

    public KeyAlreadyExistsException(String message) {
        super(ErrorCode.KEY_ALREADY_EXISTS, message);
    }
}
