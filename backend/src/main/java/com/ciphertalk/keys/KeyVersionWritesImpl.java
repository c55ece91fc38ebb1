package com.ciphertalk.keys;

import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.data.cassandra.core.WriteResult;

import reactor.core.publisher.Mono;

class KeyVersionWritesImpl implements KeyVersionWrites {

    private static final InsertOptions IF_NOT_EXISTS = InsertOptions.builder().withIfNotExists().build();

    private final ReactiveCassandraOperations operations;

    KeyVersionWritesImpl(ReactiveCassandraOperations operations) {
        this.operations = operations;
    }

    @Override
    public Mono<Boolean> insertIfAbsent(UserKeyEntity entity) {
        return operations.insert(entity, IF_NOT_EXISTS).map(WriteResult::wasApplied);
    }
}
