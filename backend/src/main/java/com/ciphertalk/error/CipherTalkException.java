package com.ciphertalk.error;

/**
 * Base of every domain failure. Carries an {@link ErrorCode} so that the HTTP advice and the
 * real-time gateway can report the same failure the same way.
 */
public class CipherTalkException extends RuntimeException {

    private final ErrorCode code;

    public CipherTalkException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public CipherTalkException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
