package com.keyhaven.store;

import java.util.LinkedHashMap;
import java.util.Map;

/** Field-level write semantics shared by the store implementations. */
final class Documents {

    private Documents() {
    }

    /** Full replacement. {@link FieldValue#DELETE} entries are dropped. */
    static Map<String, Object> replace(Map<String, Object> data) {
        Map<String, Object> result = new LinkedHashMap<>();
        data.forEach((field, value) -> {
            if (value != FieldValue.DELETE) {
                result.put(field, value);
            }
        });
        return result;
    }

    /** Overlays {@code changes} on {@code existing} (which may be {@code null}). */
    static Map<String, Object> merge(Map<String, Object> existing, Map<String, Object> changes) {
        Map<String, Object> result = existing == null ? new LinkedHashMap<>() : new LinkedHashMap<>(existing);
        changes.forEach((field, value) -> {
            if (value == FieldValue.DELETE) {
                result.remove(field);
            } else {
                result.put(field, value);
            }
        });
        return result;
    }
}
