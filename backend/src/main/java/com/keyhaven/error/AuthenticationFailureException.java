package com.keyhaven.error;

/**
 * AEAD tag did not verify: wrong key or tampered ciphertext.
 * No partial plaintext is ever returned alongside this error.
 */
public class AuthenticationFailureException extends KeyCustodyException {

    public AuthenticationFailureException(String message) {
        super(message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
