package com.keyhaven.crypto;

import java.util.Base64;

import com.keyhaven.error.AuthenticationFailureException;

/**
 * Wrapped UMK format shared by device wraps and recovery records: the AEAD encryption of the UTF-8
 * bytes of {@code base64(UMK)}, stored as Base64 ciphertext and nonce.
 */
public final class MasterKeyWrap {

    private MasterKeyWrap() {
    }

    public static CipherText wrap(byte[] umk, byte[] wrappingKey) {
        return AuthenticatedCipher.encryptString(Base64.getEncoder().encodeToString(umk), wrappingKey);
    }

    /**
     * @throws AuthenticationFailureException if the key is wrong or the wrap was tampered with
     */
    public static byte[] unwrap(String ciphertext, String nonce, byte[] wrappingKey) {
        String encoded = AuthenticatedCipher.decryptString(ciphertext, nonce, wrappingKey);
        try {
            return Base64.getDecoder().decode(encoded);
        } catch (IllegalArgumentException e) {
            throw new AuthenticationFailureException("Wrapped key is not a Base64 UMK", e);
        }
    }

    /** Self-wrap of the first or recovered device: ECDH of the device's own key pair. */
    public static CipherText wrapForSelf(byte[] umk, DeviceKeyPair keyPair) {
        return wrap(umk, KeyExchange.deriveSharedSecret(keyPair.privateKey(), keyPair.publicKey()));
    }
}
