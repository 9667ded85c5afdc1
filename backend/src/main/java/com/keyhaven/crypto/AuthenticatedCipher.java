package com.keyhaven.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.bouncycastle.crypto.InvalidCipherTextException;

import com.keyhaven.error.AuthenticationFailureException;

/**
 * Authenticated encryption for everything KeyHaven protects: wrapped UMKs, recovery blobs and note
 * payloads. XChaCha20-Poly1305 with a 256-bit key, a random 192-bit nonce per call and a 128-bit tag.
 */
public final class AuthenticatedCipher {

    public static final int KEY_SIZE = XChaCha20Poly1305.KEY_SIZE;
    public static final int NONCE_SIZE = XChaCha20Poly1305.NONCE_SIZE;
    public static final int TAG_SIZE = XChaCha20Poly1305.TAG_SIZE;

    private AuthenticatedCipher() {
    }

    public static CipherResult encrypt(byte[] plaintext, byte[] key) {
        byte[] nonce = CryptoRandom.nextBytes(NONCE_SIZE);
        return new CipherResult(nonce, XChaCha20Poly1305.seal(key, nonce, plaintext));
    }

    /**
     * Decrypts {@code ciphertext} (tag appended) under {@code key} and {@code nonce}.
     *
     * @throws AuthenticationFailureException if the tag does not verify or the input is malformed
     */
    public static byte[] decrypt(byte[] ciphertext, byte[] nonce, byte[] key) {
        if (nonce.length != NONCE_SIZE) {
            throw new AuthenticationFailureException("Invalid nonce length: " + nonce.length);
        }
        try {
            return XChaCha20Poly1305.open(key, nonce, ciphertext);
        } catch (InvalidCipherTextException e) {
            throw new AuthenticationFailureException("Authentication tag mismatch", e);
        }
    }

    public static CipherText encryptString(String plaintext, byte[] key) {
        CipherResult result = encrypt(plaintext.getBytes(StandardCharsets.UTF_8), key);
        Base64.Encoder encoder = Base64.getEncoder();
        return new CipherText(encoder.encodeToString(result.nonce()), encoder.encodeToString(result.ciphertext()));
    }

    public static String decryptString(String ciphertext, String nonce, byte[] key) {
        byte[] rawCiphertext;
        byte[] rawNonce;
        try {
            rawCiphertext = Base64.getDecoder().decode(ciphertext);
            rawNonce = Base64.getDecoder().decode(nonce);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationFailureException("Malformed Base64 ciphertext", e);
        }
        return new String(decrypt(rawCiphertext, rawNonce, key), StandardCharsets.UTF_8);
    }
}
