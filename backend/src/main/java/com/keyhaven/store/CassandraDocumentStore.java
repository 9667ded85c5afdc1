package com.keyhaven.store;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.cassandra.core.ReactiveCassandraBatchOperations;
import org.springframework.data.cassandra.core.ReactiveCassandraTemplate;
import org.springframework.stereotype.Component;

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyhaven.config.KeyHavenProps;
import com.keyhaven.error.ConnectivityException;
import com.keyhaven.error.NotFoundException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Document store on a single Cassandra table partitioned by collection path.
 *
 * <p>Cassandra has no change feed, so watch streams combine this agent's own writes with a periodic
 * re-read every {@code keyhaven.store.watch-poll-interval}. Merge and update are read-modify-write
 * without a lightweight transaction; concurrent writers to the same document race and the last one wins.
 */
@Component
@ConditionalOnProperty(name = "keyhaven.store.type", havingValue = "cassandra", matchIfMissing = true)
public class CassandraDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(CassandraDocumentStore.class);

    private static final TypeReference<LinkedHashMap<String, Object>> BODY_TYPE = new TypeReference<>() {
    };

    private final DocumentRepository repository;
    private final ReactiveCassandraTemplate template;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration pollInterval;
    private final Sinks.Many<DocumentPath> localChanges = Sinks.many().multicast().directBestEffort();

    public CassandraDocumentStore(DocumentRepository repository, ReactiveCassandraTemplate template,
                                  ObjectMapper objectMapper, Clock clock, KeyHavenProps props) {
        this.repository = repository;
        this.template = template;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pollInterval = props.store().watchPollInterval();
    }

    @Override
    public Mono<DocumentSnapshot> get(DocumentPath path) {
        return repository.findById(DocumentKey.of(path))
                .map(this::toSnapshot)
                .defaultIfEmpty(DocumentSnapshot.missing(path))
                .onErrorMap(CassandraDocumentStore::isConnectivityFailure, e -> connectivity("read " + path, e));
    }

    @Override
    public Mono<Void> set(DocumentPath path, Map<String, Object> data) {
        return save(path, Documents.replace(data));
    }

    @Override
    public Mono<Void> merge(DocumentPath path, Map<String, Object> data) {
        return get(path).flatMap(existing -> save(path, Documents.merge(existing.data(), data)));
    }

    @Override
    public Mono<Void> update(DocumentPath path, Map<String, Object> data) {
        return get(path).flatMap(existing -> {
            if (!existing.exists()) {
                return Mono.error(new NotFoundException("Document not found: " + path));
            }
            return save(path, Documents.merge(existing.data(), data));
        });
    }

    @Override
    public Mono<Void> delete(DocumentPath path) {
        return repository.deleteById(DocumentKey.of(path))
                .onErrorMap(CassandraDocumentStore::isConnectivityFailure, e -> connectivity("delete " + path, e))
                .doOnSuccess(v -> publish(path));
    }

    @Override
    public Flux<DocumentSnapshot> list(String collection) {
        return repository.findAllByKeyCollection(collection)
                .map(this::toSnapshot)
                .onErrorMap(CassandraDocumentStore::isConnectivityFailure, e -> connectivity("list " + collection, e));
    }

    /** Filters client side; a collection is one partition and stays small. */
    @Override
    public Flux<DocumentSnapshot> query(String collection, String field, Object value) {
        return list(collection).filter(doc -> DocumentStore.matches(doc, field, value));
    }

    @Override
    public Mono<Void> commit(WriteBatch batch) {
        if (batch.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(batch.operations())
                .concatMap(this::resolve)
                .collectList()
                .flatMap(resolved -> {
                    ReactiveCassandraBatchOperations ops = template.batchOps();
                    List<DocumentEntity> inserts = new ArrayList<>();
                    List<DocumentEntity> deletes = new ArrayList<>();
                    for (Resolved r : resolved) {
                        if (r.entity().getBody() == null) {
                            deletes.add(r.entity());
                        } else {
                            inserts.add(r.entity());
                        }
                    }
                    if (!inserts.isEmpty()) {
                        ops = ops.insert(inserts);
                    }
                    if (!deletes.isEmpty()) {
                        ops = ops.delete(deletes);
                    }
                    return ops.execute()
                            .doOnNext(result -> log.debug("Committed batch of {} writes (applied={})",
                                    resolved.size(), result.wasApplied()))
                            .then(Mono.fromRunnable(() -> resolved.stream()
                                    .map(r -> r.entity().getKey().toPath())
                                    .distinct()
                                    .forEach(this::publish)));
                })
                .onErrorMap(CassandraDocumentStore::isConnectivityFailure, e -> connectivity("commit batch", e))
                .then();
    }

    @Override
    public Flux<DocumentSnapshot> watch(DocumentPath path) {
        return Flux.merge(
                        Mono.just(path),
                        localChanges.asFlux().filter(path::equals),
                        Flux.interval(pollInterval).map(tick -> path))
                .concatMap(this::get)
                .distinctUntilChanged(snapshot -> Optional.ofNullable(snapshot.data()));
    }

    @Override
    public Flux<List<DocumentSnapshot>> watchQuery(String collection, String field, Object value) {
        return Flux.merge(
                        Mono.just(collection),
                        localChanges.asFlux().map(DocumentPath::collection).filter(collection::equals),
                        Flux.interval(pollInterval).map(tick -> collection))
                .concatMap(c -> query(c, field, value).collectList())
                .distinctUntilChanged(docs -> docs.stream().map(d -> List.of(d.id(), d.data())).toList());
    }

    private Mono<Void> save(DocumentPath path, Map<String, Object> data) {
        return Mono.fromCallable(() -> new DocumentEntity(DocumentKey.of(path), writeBody(data), clock.instant()))
                .flatMap(repository::save)
                .onErrorMap(CassandraDocumentStore::isConnectivityFailure, e -> connectivity("write " + path, e))
                .doOnSuccess(saved -> publish(path))
                .then();
    }

    private record Resolved(DocumentEntity entity) {}

    /** Turns one batch operation into the row to insert, or a body-less row to delete. */
    private Mono<Resolved> resolve(WriteBatch.Operation op) {
        DocumentKey key = DocumentKey.of(op.path());
        return switch (op.kind()) {
            case DELETE -> Mono.just(new Resolved(new DocumentEntity(key, null, null)));
            case SET -> Mono.fromCallable(() ->
                    new Resolved(new DocumentEntity(key, writeBody(Documents.replace(op.data())), clock.instant())));
            case MERGE -> get(op.path()).map(existing -> new Resolved(new DocumentEntity(key,
                    writeBody(Documents.merge(existing.data(), op.data())), clock.instant())));
        };
    }

    private DocumentSnapshot toSnapshot(DocumentEntity entity) {
        try {
            Map<String, Object> data = objectMapper.readValue(entity.getBody(), BODY_TYPE);
            return new DocumentSnapshot(entity.getKey().toPath(), data);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt document body at " + entity.getKey().toPath(), e);
        }
    }

    private String writeBody(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Document is not serializable", e);
        }
    }

    private void publish(DocumentPath path) {
        // a dropped notification is picked up by the next poll
        localChanges.tryEmitNext(path);
    }

    static boolean isConnectivityFailure(Throwable e) {
        return e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException
                || e instanceof AllNodesFailedException
                || e instanceof DriverTimeoutException;
    }

    private static ConnectivityException connectivity(String operation, Throwable cause) {
        log.warn("Document store unreachable during {}: {}", operation, cause.getMessage());
        return new ConnectivityException("Document store unreachable during " + operation, cause);
    }
}
