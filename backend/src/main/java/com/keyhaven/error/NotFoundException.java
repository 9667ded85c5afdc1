package com.keyhaven.error;

public class NotFoundException extends KeyCustodyException {

    public NotFoundException(String message) {
        super(message);
    }
}
