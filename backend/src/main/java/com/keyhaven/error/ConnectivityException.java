package com.keyhaven.error;

/**
 * Transient failure reaching the remote document store.
 * Never to be interpreted as a revocation or denial.
 */
public class ConnectivityException extends KeyCustodyException {

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
