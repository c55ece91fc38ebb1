package com.ciphertalk.account;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ciphertalk.error.AuthenticationException;
import com.ciphertalk.error.ValidationException;

import reactor.core.publisher.Mono;

/**
 * Account sign-up and login, and the default {@link CredentialVerifier}.
 *
 * Login philosophy:
 *   - The client sends loginHash = SHA-256(password). We compare hashes.
 *   - On success we hand out an opaque bearer token used by REST calls and the
 *     real-time connection alike.
 */
@Service
public class AccountService implements CredentialVerifier {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private final AccountRepository accountRepository;

    // token -> username. Single-process only, tokens die with the process.
    private final ConcurrentHashMap<String, String> activeSessions = new ConcurrentHashMap<>();

    public AccountService(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    public Mono<Void> signUp(UserAccount account) {
        if (account.username == null || account.username.isBlank()
                || account.loginHash == null || account.loginHash.isBlank()) {
            return Mono.error(new ValidationException("username and loginHash are required"));
        }
        account.createdAt = System.currentTimeMillis();
        if (account.displayName == null || account.displayName.isBlank()) {
            account.displayName = account.username;
        }
        account.friends = new HashSet<>();
        account.lastSeenAt = null;
        return accountRepository.findById(account.username)
                .flatMap(existing -> Mono.<UserAccount>error(
                        new ValidationException("Username already taken: " + account.username)))
                .switchIfEmpty(accountRepository.save(account))
                .doOnNext(saved -> log.info("Account created: {}", saved.username))
                .then();
    }

    public Mono<AuthResponse> login(String username, String providedHash) {
        return accountRepository.findById(username)
                .switchIfEmpty(Mono.error(new AuthenticationException("Invalid credentials")))
                .flatMap(account -> {
                    if (!hashMatches(account.loginHash, providedHash)) {
                        return Mono.error(new AuthenticationException("Invalid credentials"));
                    }
                    String token = UUID.randomUUID().toString();
                    activeSessions.put(token, username);

                    AuthResponse response = new AuthResponse();
                    response.token = token;
                    response.username = account.username;
                    response.displayName = account.displayName;
                    return Mono.just(response);
                });
    }

    public Mono<Void> logout(String credential) {
        return Mono.fromRunnable(() -> {
            String token = CredentialVerifier.stripBearer(credential);
            if (token != null) {
                activeSessions.remove(token);
            }
        });
    }

    @Override
    public Mono<String> verify(String credential) {
        String token = CredentialVerifier.stripBearer(credential);
        if (token == null || token.isEmpty()) {
            return Mono.error(new AuthenticationException("Missing bearer credential"));
        }
        String username = activeSessions.get(token);
        return username != null
                ? Mono.just(username)
                : Mono.error(new AuthenticationException("Unknown or expired credential"));
    }

    private static boolean hashMatches(String stored, String provided) {
        if (stored == null || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(stored.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }
}
