package com.ciphertalk.account;

import reactor.core.publisher.Mono;

/**
 * Resolves a bearer credential to the user id it was issued for.
 * Errors with {@link com.ciphertalk.error.AuthenticationException} when the credential is
 * missing, malformed or unknown.
 */
public interface CredentialVerifier {

    String BEARER_PREFIX = "Bearer ";

    Mono<String> verify(String credential);

    static String stripBearer(String credential) {
        if (credential == null) {
            return null;
        }
        String trimmed = credential.trim();
        return trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())
                ? trimmed.substring(BEARER_PREFIX.length()).trim()
                : trimmed;
    }
}
