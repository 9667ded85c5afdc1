package com.keyhaven.store;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.keyhaven.error.NotFoundException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Document store held in memory. Used by the test profile and by agents that run without a cluster.
 * Several device agents in the same JVM can share one instance to act as one account.
 */
public class InMemoryDocumentStore implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDocumentStore.class);

    private final Map<String, Map<String, Map<String, Object>>> collections = new HashMap<>();
    private final Sinks.Many<DocumentPath> changes = Sinks.many().multicast().directBestEffort();
    private final Scheduler notifyScheduler = Schedulers.boundedElastic();
    private final Object lock = new Object();

    @Override
    public Mono<DocumentSnapshot> get(DocumentPath path) {
        return Mono.fromSupplier(() -> read(path));
    }

    @Override
    public Mono<Void> set(DocumentPath path, Map<String, Object> data) {
        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                collection(path.collection()).put(path.id(), Documents.replace(data));
            }
            publish(path);
        });
    }

    @Override
    public Mono<Void> merge(DocumentPath path, Map<String, Object> data) {
        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                Map<String, Map<String, Object>> docs = collection(path.collection());
                docs.put(path.id(), Documents.merge(docs.get(path.id()), data));
            }
            publish(path);
        });
    }

    @Override
    public Mono<Void> update(DocumentPath path, Map<String, Object> data) {
        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                Map<String, Map<String, Object>> docs = collection(path.collection());
                Map<String, Object> existing = docs.get(path.id());
                if (existing == null) {
                    throw new NotFoundException("Document not found: " + path);
                }
                docs.put(path.id(), Documents.merge(existing, data));
            }
            publish(path);
        });
    }

    @Override
    public Mono<Void> delete(DocumentPath path) {
        return Mono.fromRunnable(() -> {
            boolean removed;
            synchronized (lock) {
                removed = collection(path.collection()).remove(path.id()) != null;
            }
            if (removed) {
                publish(path);
            }
        });
    }

    @Override
    public Flux<DocumentSnapshot> list(String collection) {
        return Flux.defer(() -> Flux.fromIterable(snapshotCollection(collection)));
    }

    @Override
    public Flux<DocumentSnapshot> query(String collection, String field, Object value) {
        return list(collection).filter(doc -> DocumentStore.matches(doc, field, value));
    }

    @Override
    public Mono<Void> commit(WriteBatch batch) {
        return Mono.fromRunnable(() -> {
            synchronized (lock) {
                for (WriteBatch.Operation op : batch.operations()) {
                    Map<String, Map<String, Object>> docs = collection(op.path().collection());
                    switch (op.kind()) {
                        case SET -> docs.put(op.path().id(), Documents.replace(op.data()));
                        case MERGE -> docs.put(op.path().id(), Documents.merge(docs.get(op.path().id()), op.data()));
                        case DELETE -> docs.remove(op.path().id());
                    }
                }
            }
            batch.operations().stream().map(WriteBatch.Operation::path).distinct().forEach(this::publish);
        });
    }

    @Override
    public Flux<DocumentSnapshot> watch(DocumentPath path) {
        return Flux.merge(Mono.just(path), changes.asFlux().filter(path::equals))
                .publishOn(notifyScheduler)
                .concatMap(this::get)
                .distinctUntilChanged(snapshot -> Optional.ofNullable(snapshot.data()));
    }

    @Override
    public Flux<List<DocumentSnapshot>> watchQuery(String collection, String field, Object value) {
        return Flux.merge(Mono.just(collection), changes.asFlux().map(DocumentPath::collection).filter(collection::equals))
                .publishOn(notifyScheduler)
                .concatMap(c -> query(c, field, value).collectList())
                .distinctUntilChanged(InMemoryDocumentStore::dataOf);
    }

    /** Drops every document. */
    public void clear() {
        List<DocumentPath> removed = new ArrayList<>();
        synchronized (lock) {
            collections.forEach((name, docs) -> docs.keySet().forEach(id -> removed.add(new DocumentPath(name, id))));
            collections.clear();
        }
        removed.forEach(this::publish);
    }

    private DocumentSnapshot read(DocumentPath path) {
        synchronized (lock) {
            Map<String, Map<String, Object>> docs = collections.get(path.collection());
            Map<String, Object> data = docs == null ? null : docs.get(path.id());
            return new DocumentSnapshot(path, data == null ? null : new LinkedHashMap<>(data));
        }
    }

    private List<DocumentSnapshot> snapshotCollection(String collection) {
        synchronized (lock) {
            Map<String, Map<String, Object>> docs = collections.getOrDefault(collection, Map.of());
            List<DocumentSnapshot> result = new ArrayList<>(docs.size());
            docs.forEach((id, data) ->
                    result.add(new DocumentSnapshot(new DocumentPath(collection, id), new LinkedHashMap<>(data))));
            return result;
        }
    }

    private Map<String, Map<String, Object>> collection(String name) {
        return collections.computeIfAbsent(name, k -> new LinkedHashMap<>());
    }

    private void publish(DocumentPath path) {
        log.trace("Document changed: {}", path);
        changes.emitNext(path, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
    }

    private static List<Object> dataOf(List<DocumentSnapshot> docs) {
        return docs.stream().map(d -> (Object) List.of(d.id(), Objects.requireNonNullElse(d.data(), Map.of()))).toList();
    }
}
