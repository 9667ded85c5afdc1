package com.keyhaven.store;

import java.util.Map;

/**
 * Point-in-time read of one document. {@code data} is {@code null} when the document does not exist.
 */
public record DocumentSnapshot(DocumentPath path, Map<String, Object> data) {

    public static DocumentSnapshot missing(DocumentPath path) {
        return new DocumentSnapshot(path, null);
    }

    public boolean exists() {
        return data != null;
    }

    public String id() {
        return path.id();
    }

    public String getString(String field) {
        Object value = data == null ? null : data.get(field);
        return value == null ? null : value.toString();
    }

    public boolean getBoolean(String field) {
        Object value = data == null ? null : data.get(field);
        return value instanceof Boolean b ? b : value != null && Boolean.parseBoolean(value.toString());
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> getMap(String field) {
        Object value = data == null ? null : data.get(field);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
    }
}
