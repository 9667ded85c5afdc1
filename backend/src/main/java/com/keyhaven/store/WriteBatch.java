package com.keyhaven.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Writes applied together by {@link DocumentStore#commit}. */
public class WriteBatch {

    public enum Kind { SET, MERGE, DELETE }

    public record Operation(Kind kind, DocumentPath path, Map<String, Object> data) {
    }

    private final List<Operation> operations = new ArrayList<>();

    public WriteBatch set(DocumentPath path, Map<String, Object> data) {
        operations.add(new Operation(Kind.SET, path, data));
        return this;
    }

    public WriteBatch merge(DocumentPath path, Map<String, Object> data) {
        operations.add(new Operation(Kind.MERGE, path, data));
        return this;
    }

    public WriteBatch delete(DocumentPath path) {
        operations.add(new Operation(Kind.DELETE, path, null));
        return this;
    }

    public List<Operation> operations() {
        return Collections.unmodifiableList(operations);
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }
}
