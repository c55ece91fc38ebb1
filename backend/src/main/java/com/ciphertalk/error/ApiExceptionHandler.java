package com.ciphertalk.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps domain failures onto {@link ErrorResponse} bodies with the status bound to each
 * {@link ErrorCode}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CipherTalkException.class)
    public ResponseEntity<ErrorResponse> handleDomain(CipherTalkException ex) {
        if (ex.code() == ErrorCode.AUTHENTICATION_FAILED || ex.code() == ErrorCode.INTEGRITY_MISMATCH) {
            log.warn("Crypto verification failed: {}", ex.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", ex.code(), ex.getMessage());
        }
        return ResponseEntity.status(ex.code().status()).body(ErrorResponse.of(ex));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ErrorCode.VALIDATION_ERROR.name(), ex.getReason()));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex) {
        ErrorCode code = ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()
                ? ErrorCode.NOT_FOUND
                : ex.getStatusCode().is4xxClientError() ? ErrorCode.VALIDATION_ERROR : ErrorCode.INTERNAL_ERROR;
        return ResponseEntity.status(ex.getStatusCode()).body(new ErrorResponse(code.name(), ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("Unhandled request failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse(ErrorCode.INTERNAL_ERROR.name(), "Internal error"));
    }
}
