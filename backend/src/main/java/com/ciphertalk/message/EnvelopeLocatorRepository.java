package com.ciphertalk.message;

import java.util.UUID;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EnvelopeLocatorRepository extends ReactiveCassandraRepository<EnvelopeLocator, UUID> {
}
