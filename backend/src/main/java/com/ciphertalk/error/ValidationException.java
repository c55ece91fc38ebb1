package com.ciphertalk.error;

/** Malformed input, e.g. self-messaging or an envelope missing crypto fields. */
public class ValidationException extends CipherTalkException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
