package com.keyhaven.error;

/** Operation attempted against a device or record that is not in the required status. */
public class InvalidStateException extends KeyCustodyException {

    public InvalidStateException(String message) {
        super(message);
    }
}
