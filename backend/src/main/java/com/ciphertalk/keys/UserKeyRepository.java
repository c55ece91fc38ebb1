package com.ciphertalk.keys;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Mono;

@Repository
public interface UserKeyRepository extends ReactiveCassandraRepository<UserKeyEntity, UserKeyKey>, KeyVersionWrites {

    // versions cluster descending, so the first row is the current key
    Mono<UserKeyEntity> findFirstByKeyUserId(String userId);
}
