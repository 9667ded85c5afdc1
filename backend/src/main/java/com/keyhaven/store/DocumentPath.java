package com.keyhaven.store;

/** Location of one document: the slash separated collection path plus the document id. */
public record DocumentPath(String collection, String id) {

    @Override
    public String toString() {
        return collection + "/" + id;
    }
}
