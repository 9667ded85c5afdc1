package com.keyhaven.crypto;

/**
 * Self-contained encrypted blobs for attachments: {@code nonce (24) || ciphertext || tag (16)}.
 */
public final class FileEnvelope {

    public static final int OVERHEAD = AuthenticatedCipher.NONCE_SIZE + AuthenticatedCipher.TAG_SIZE;

    private FileEnvelope() {
    }

    public static byte[] encryptBytes(byte[] plaintext, byte[] key) {
        CipherResult result = AuthenticatedCipher.encrypt(plaintext, key);
        byte[] output = new byte[result.nonce().length + result.ciphertext().length];
        System.arraycopy(result.nonce(), 0, output, 0, result.nonce().length);
        System.arraycopy(result.ciphertext(), 0, output, result.nonce().length, result.ciphertext().length);
        return output;
    }

    /**
     * @throws IllegalArgumentException if the buffer cannot even hold a nonce and a tag
     * @throws com.keyhaven.error.AuthenticationFailureException if the tag does not verify
     */
    public static byte[] decryptBytes(byte[] encrypted, byte[] key) {
        if (encrypted.length < OVERHEAD) {
            throw new IllegalArgumentException("Encrypted data too short");
        }
        byte[] nonce = new byte[AuthenticatedCipher.NONCE_SIZE];
        byte[] ciphertext = new byte[encrypted.length - nonce.length];
        System.arraycopy(encrypted, 0, nonce, 0, nonce.length);
        System.arraycopy(encrypted, nonce.length, ciphertext, 0, ciphertext.length);
        return AuthenticatedCipher.decrypt(ciphertext, nonce, key);
    }

    /**
     * Heuristic: true when the buffer is long enough to be an envelope and does not start with a known
     * plaintext media signature (JPEG, PNG, GIF, RIFF/WebP/WAV, MP3, MP4/M4A).
     */
    public static boolean looksEncrypted(byte[] data) {
        if (data.length < OVERHEAD) {
            return false;
        }
        return !(startsWith(data, 0xFF, 0xD8, 0xFF)           // JPEG
                || startsWith(data, 0x89, 0x50, 0x4E, 0x47)   // PNG
                || startsWith(data, 0x47, 0x49, 0x46, 0x38)   // GIF
                || startsWith(data, 0x52, 0x49, 0x46, 0x46)   // RIFF: WebP, WAV
                || startsWith(data, 0xFF, 0xFB)               // MP3 frame
                || startsWith(data, 0x49, 0x44, 0x33)         // MP3 ID3
                || (data[4] == 0x66 && data[5] == 0x74 && data[6] == 0x79 && data[7] == 0x70)); // ftyp
    }

    public static int encryptedSize(int plaintextSize) {
        return plaintextSize + OVERHEAD;
    }

    public static int plaintextSize(int encryptedSize) {
        return encryptedSize - OVERHEAD;
    }

    private static boolean startsWith(byte[] data, int... signature) {
        for (int i = 0; i < signature.length; i++) {
            if ((data[i] & 0xFF) != signature[i]) {
                return false;
            }
        }
        return true;
    }
}
