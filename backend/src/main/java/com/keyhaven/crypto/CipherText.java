package com.keyhaven.crypto;

/** Base64 form of a {@link CipherResult}, as stored in remote documents. */
public record CipherText(String nonce, String ciphertext) {
}
