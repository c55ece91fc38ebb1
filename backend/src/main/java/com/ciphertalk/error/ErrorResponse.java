package com.ciphertalk.error;

/** Structured error body returned by every failing REST call. */
public record ErrorResponse(String code, String message) {

    public static ErrorResponse of(CipherTalkException ex) {
        return new ErrorResponse(ex.code().name(), ex.getMessage());
    }
}
