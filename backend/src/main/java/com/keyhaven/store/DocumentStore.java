package com.keyhaven.store;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Remote per-account document store shared by all of a user's devices.
 *
 * <p>Writes are last-writer-wins per document. Implementations surface transport failures as
 * {@link com.keyhaven.error.ConnectivityException}.
 */
public interface DocumentStore {

    /** Always emits a snapshot; check {@link DocumentSnapshot#exists()}. */
    Mono<DocumentSnapshot> get(DocumentPath path);

    Mono<Void> set(DocumentPath path, Map<String, Object> data);

    /** Creates the document if needed and overlays the given fields. */
    Mono<Void> merge(DocumentPath path, Map<String, Object> data);

    /**
     * Overlays the given fields on an existing document.
     *
     * @throws com.keyhaven.error.NotFoundException (as an error signal) if the document is missing
     */
    Mono<Void> update(DocumentPath path, Map<String, Object> data);

    Mono<Void> delete(DocumentPath path);

    Flux<DocumentSnapshot> list(String collection);

    /** Documents of {@code collection} whose {@code field} equals {@code value}. */
    Flux<DocumentSnapshot> query(String collection, String field, Object value);

    Mono<Void> commit(WriteBatch batch);

    /** Emits the current snapshot, then a new one whenever the document changes. */
    Flux<DocumentSnapshot> watch(DocumentPath path);

    /** Emits the current result set of {@link #query}, then the new result set after each change. */
    Flux<List<DocumentSnapshot>> watchQuery(String collection, String field, Object value);

    default Mono<Void> deleteCollection(String collection) {
        return list(collection)
                .reduce(new WriteBatch(), (batch, doc) -> batch.delete(doc.path()))
                .flatMap(this::commit);
    }

    static boolean matches(DocumentSnapshot doc, String field, Object value) {
        return doc.exists() && value != null && value.equals(doc.data().get(field));
    }
}
