package com.keyhaven.crypto;

/**
 * Output of {@link AuthenticatedCipher#encrypt}: the fresh 24-byte nonce and ciphertext with the
 * 16-byte tag appended.
 */
public record CipherResult(byte[] nonce, byte[] ciphertext) {
}
