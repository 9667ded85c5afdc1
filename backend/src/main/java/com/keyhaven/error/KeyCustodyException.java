package com.keyhaven.error;

/**
 * Root of the key-custody error taxonomy.
 * Every failure the trust, recovery and payload layers report to callers is one of its subclasses.
 */
public abstract class KeyCustodyException extends RuntimeException {

    protected KeyCustodyException(String message) {
        super(message);
    }

    protected KeyCustodyException(String message, Throwable cause) {
        super(message, cause);
    }
}
