package com.keyhaven.store;

import org.springframework.data.cassandra.repository.ReactiveCassandraRepository;
import org.springframework.stereotype.Repository;

import reactor.core.publisher.Flux;

@Repository
public interface DocumentRepository extends ReactiveCassandraRepository<DocumentEntity, DocumentKey> {

    Flux<DocumentEntity> findAllByKeyCollection(String collection);
}
