package com.keyhaven.error;

/** Caller does not hold the UMK, is not the master device, or failed a passphrase check. */
public class NotAuthorizedException extends KeyCustodyException {

    public NotAuthorizedException(String message) {
        super(message);
    }
}
