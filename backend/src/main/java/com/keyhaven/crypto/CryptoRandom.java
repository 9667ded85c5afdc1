package com.keyhaven.crypto;

import java.security.SecureRandom;

public final class CryptoRandom {

    /** Size of the User Master Key. */
    public static final int UMK_SIZE = 32;

    private static final SecureRandom RANDOM = new SecureRandom();

    private CryptoRandom() {
    }

    public static byte[] nextBytes(int length) {
        byte[] bytes = new byte[length];
        RANDOM.nextBytes(bytes);
        return bytes;
    }

    public static byte[] generateUserMasterKey() {
        return nextBytes(UMK_SIZE);
    }
}
