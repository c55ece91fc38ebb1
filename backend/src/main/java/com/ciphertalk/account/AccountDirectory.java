package com.ciphertalk.account;

import java.time.Instant;
import java.util.Set;

import org.springframework.stereotype.Component;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** {@link UserDirectory} backed by the {@code accounts} table. */
@Component
public class AccountDirectory implements UserDirectory {

    private final AccountRepository accountRepository;

    public AccountDirectory(AccountRepository accountRepository) {
        this.accountRepository = accountRepository;
    }

    @Override
    public Mono<UserProfile> lookup(String userId) {
        return accountRepository.findById(userId)
                .map(account -> new UserProfile(
                        account.username,
                        account.displayName != null ? account.displayName : account.username,
                        account.lastSeenAt));
    }

    @Override
    public Mono<Boolean> exists(String userId) {
        return accountRepository.existsById(userId);
    }

    @Override
    public Flux<String> friendIds(String userId) {
        return accountRepository.findById(userId)
                .flatMapIterable(account -> account.friends != null ? account.friends : Set.<String>of());
    }

    @Override
    public Mono<Void> recordLastSeen(String userId, Instant lastSeenAt) {
        return accountRepository.updateLastSeen(userId, lastSeenAt).then();
    }
}
