package com.ciphertalk.message;

import java.util.UUID;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface EnvelopeRepository extends ReactiveCassandraRepository<EnvelopeEntity, EnvelopeKey>, EnvelopeMutations {

    // newest first: id clusters descending
    Flux<EnvelopeEntity> findByKeySessionId(String sessionId);

    // PAGINATION: strictly older than the cursor message
    Flux<EnvelopeEntity> findByKeySessionIdAndKeyIdLessThan(String sessionId, UUID before);

    Mono<EnvelopeEntity> findFirstByKeySessionId(String sessionId);
}
