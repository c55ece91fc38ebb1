package com.ciphertalk.keys;

import java.time.Instant;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.ciphertalk.crypto.Digests;
import com.ciphertalk.crypto.X25519Keys;
import com.ciphertalk.error.KeyAlreadyExistsException;
import com.ciphertalk.error.NotFoundException;
import com.ciphertalk.error.ValidationException;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Per-user X25519 keypairs.
 *
 * <p>Each initialization or rotation writes a new, immutable version row. The private key is
 * sealed with {@link PrivateKeySealer} before it reaches the repository; the public key and its
 * fingerprint are what other users encrypt to.
 */
@Service
public class KeyManagementService {

    private static final Logger log = LoggerFactory.getLogger(KeyManagementService.class);

    private final UserKeyRepository repository;

    public KeyManagementService(UserKeyRepository repository) {
        this.repository = repository;
    }

    /**
     * Generates and stores the next key version for {@code userId}.
     *
     * <p>Fails with {@link KeyAlreadyExistsException} when a key exists and {@code rotate} is
     * false, or when a concurrent call claimed the same version first.
     */
    public Mono<PublicKeyView> generateKeyPair(String userId, String passphrase, boolean rotate) {
        if (userId == null || userId.isBlank()) {
            return Mono.error(new ValidationException("userId is required"));
        }
        if (passphrase == null || passphrase.isBlank()) {
            return Mono.error(new ValidationException("A passphrase is required to protect the private key"));
        }
        return currentVersion(userId)
                .flatMap(current -> {
                    if (current > 0 && !rotate) {
                        return Mono.error(new KeyAlreadyExistsException(
                                "Encryption keys already initialized for " + userId));
                    }
                    // Argon2id blocks for a while; keep it off the event loop
                    return Mono.fromCallable(() -> newVersion(userId, current + 1, passphrase))
                            .subscribeOn(Schedulers.boundedElastic());
                })
                .flatMap(entity -> repository.insertIfAbsent(entity)
                        .flatMap(applied -> applied
                                ? Mono.just(PublicKeyView.of(entity))
                                : Mono.error(new KeyAlreadyExistsException(
                                        "Key version " + entity.getKey().version() + " already exists for " + userId))))
                .doOnNext(view -> log.info("Stored key version {} for {} ({})", view.version(), userId, view.fingerprint()));
    }

    public Mono<PublicKeyView> getPublicKey(String userId) {
        return repository.findFirstByKeyUserId(userId)
                .map(PublicKeyView::of)
                .switchIfEmpty(Mono.error(new NotFoundException("No public key for " + userId)));
    }

    public Mono<PublicKeyView> getPublicKey(String userId, int version) {
        return repository.findById(new UserKeyKey(userId, version))
                .map(PublicKeyView::of)
                .switchIfEmpty(Mono.error(new NotFoundException("No key version " + version + " for " + userId)));
    }

    /**
     * The caller's own sealed private key, latest version when {@code version} is null.
     */
    public Mono<SealedPrivateKeyView> getSealedPrivateKey(String ownerId, Integer version) {
        Mono<UserKeyEntity> row = version == null
                ? repository.findFirstByKeyUserId(ownerId)
                : repository.findById(new UserKeyKey(ownerId, version));
        return row.map(SealedPrivateKeyView::of)
                .switchIfEmpty(Mono.error(new NotFoundException("No private key stored for " + ownerId)));
    }

    public Mono<Boolean> hasKeys(String userId) {
        return repository.findFirstByKeyUserId(userId).hasElement();
    }

    /** Latest key version, 0 when the user has never initialized keys. */
    public Mono<Integer> currentVersion(String userId) {
        return repository.findFirstByKeyUserId(userId)
                .map(entity -> entity.getKey().version())
                .defaultIfEmpty(0);
    }

    private static UserKeyEntity newVersion(String userId, int version, String passphrase) {
        AsymmetricCipherKeyPair pair = X25519Keys.generate();
        X25519PublicKeyParameters publicKey = (X25519PublicKeyParameters) pair.getPublic();

        UserKeyEntity entity = new UserKeyEntity();
        entity.setKey(new UserKeyKey(userId, version));
        entity.setPublicKey(X25519Keys.encodePublic(publicKey));
        entity.setFingerprint(Digests.fingerprint(publicKey.getEncoded()));
        entity.setSealedPrivateKey(PrivateKeySealer.seal((X25519PrivateKeyParameters) pair.getPrivate(), passphrase));
        entity.setGeneratedAt(Instant.now());
        return entity;
    }
}
