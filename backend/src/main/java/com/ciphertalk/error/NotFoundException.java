package com.ciphertalk.error;

public class NotFoundException extends CipherTalkException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
