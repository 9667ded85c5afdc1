package com.keyhaven.crypto;

import java.util.Arrays;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.ChaChaEngine;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Pack;

/**
 * XChaCha20-Poly1305 built from BouncyCastle's IETF ChaCha20-Poly1305.
 *
 * The 24-byte nonce is split: the first 16 bytes feed HChaCha20 to derive a sub-key, the last 8 bytes
 * become the IETF nonce {@code 00 00 00 00 || nonce[16..24]}. Output is ciphertext with the 16-byte
 * Poly1305 tag appended, byte-compatible with libsodium's {@code crypto_aead_xchacha20poly1305_ietf}.
 */
final class XChaCha20Poly1305 {

    static final int KEY_SIZE = 32;
    static final int NONCE_SIZE = 24;
    static final int TAG_SIZE = 16;

    // "expand 32-byte k"
    private static final int[] SIGMA = {0x61707865, 0x3320646e, 0x79622d32, 0x6b206574};

    private XChaCha20Poly1305() {
    }

    static byte[] seal(byte[] key, byte[] nonce, byte[] plaintext) {
        try {
            return process(true, key, nonce, plaintext);
        } catch (InvalidCipherTextException e) {
            // never thrown on encrypt
            throw new IllegalStateException("ChaCha20-Poly1305 encryption failed", e);
        }
    }

    static byte[] open(byte[] key, byte[] nonce, byte[] ciphertextAndTag) throws InvalidCipherTextException {
        if (ciphertextAndTag.length < TAG_SIZE) {
            throw new InvalidCipherTextException("ciphertext shorter than authentication tag");
        }
        return process(false, key, nonce, ciphertextAndTag);
    }

    private static byte[] process(boolean encrypt, byte[] key, byte[] nonce, byte[] input)
            throws InvalidCipherTextException {
        if (key.length != KEY_SIZE) {
            throw new IllegalArgumentException("key must be " + KEY_SIZE + " bytes");
        }
        if (nonce.length != NONCE_SIZE) {
            throw new IllegalArgumentException("nonce must be " + NONCE_SIZE + " bytes");
        }

        byte[] subKey = hChaCha20(key, nonce);
        byte[] ietfNonce = new byte[12];
        System.arraycopy(nonce, 16, ietfNonce, 4, 8);

        try {
            ChaCha20Poly1305 aead = new ChaCha20Poly1305();
            aead.init(encrypt, new AEADParameters(new KeyParameter(subKey), TAG_SIZE * 8, ietfNonce));

            byte[] output = new byte[aead.getOutputSize(input.length)];
            int length = aead.processBytes(input, 0, input.length, output, 0);
            length += aead.doFinal(output, length);
            return length == output.length ? output : Arrays.copyOf(output, length);
        } finally {
            Arrays.fill(subKey, (byte) 0);
        }
    }

    /** HChaCha20 over the first 16 bytes of {@code nonce}. */
    static byte[] hChaCha20(byte[] key, byte[] nonce) {
        int[] state = new int[16];
        System.arraycopy(SIGMA, 0, state, 0, 4);
        for (int i = 0; i < 8; i++) {
            state[4 + i] = Pack.littleEndianToInt(key, i * 4);
        }
        for (int i = 0; i < 4; i++) {
            state[12 + i] = Pack.littleEndianToInt(nonce, i * 4);
        }

        int[] mixed = new int[16];
        ChaChaEngine.chachaCore(20, state, mixed);

        // chachaCore adds the input back in; HChaCha20 keeps the raw permutation of rows 0 and 3
        int[] subKey = new int[8];
        for (int i = 0; i < 4; i++) {
            subKey[i] = mixed[i] - state[i];
            subKey[4 + i] = mixed[12 + i] - state[12 + i];
        }
        return Pack.intToLittleEndian(subKey);
    }
}
