package com.ciphertalk.keys;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.ciphertalk.account.CredentialVerifier;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/keys")
public class KeyController {

    private final KeyManagementService keyService;
    private final CredentialVerifier credentials;

    public KeyController(KeyManagementService keyService, CredentialVerifier credentials) {
        this.keyService = keyService;
        this.credentials = credentials;
    }

    @PostMapping("/init")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<PublicKeyView> initKeys(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody KeyInitRequest request) {
        return credentials.verify(authorization)
                .flatMap(userId -> keyService.generateKeyPair(userId, request.passphrase(), request.rotate()));
    }

    /** The caller's own sealed private key; there is no route to anyone else's. */
    @GetMapping("/me/private")
    public Mono<SealedPrivateKeyView> getOwnPrivateKey(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestParam(required = false) Integer version) {
        return credentials.verify(authorization)
                .flatMap(userId -> keyService.getSealedPrivateKey(userId, version));
    }

    @GetMapping("/{userId}")
    public Mono<PublicKeyView> getPublicKey(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String userId) {
        return credentials.verify(authorization)
                .flatMap(caller -> keyService.getPublicKey(userId));
    }

    @GetMapping("/{userId}/versions/{version}")
    public Mono<PublicKeyView> getPublicKeyVersion(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @PathVariable String userId,
            @PathVariable int version) {
        return credentials.verify(authorization)
                .flatMap(caller -> keyService.getPublicKey(userId, version));
    }
}
