package com.ciphertalk.message;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface SessionMembershipRepository extends ReactiveCassandraRepository<SessionMembership, SessionMembershipKey> {

    Flux<SessionMembership> findByKeyUserId(String userId);
}
