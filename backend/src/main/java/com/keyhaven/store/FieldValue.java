package com.keyhaven.store;

/** Sentinel values understood by merge and update writes. */
public enum FieldValue {
    /** Removes the field it is assigned to. */
    DELETE
}
