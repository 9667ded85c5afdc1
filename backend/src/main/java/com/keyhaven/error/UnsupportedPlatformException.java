package com.keyhaven.error;

/**
 * The runtime target cannot run the requested operation, e.g. Argon2id on a memory-constrained target.
 * Callers surface this as "use a different device to recover".
 */
public class UnsupportedPlatformException extends KeyCustodyException {

    public UnsupportedPlatformException(String message) {
        super(message);
    }
}
