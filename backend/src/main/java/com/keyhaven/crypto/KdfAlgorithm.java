package com.keyhaven.crypto;

import java.util.Locale;

/** Passphrase KDFs a recovery record may name in its {@code kdf_algorithm} field. */
public enum KdfAlgorithm {

    PBKDF2("pbkdf2"),
    ARGON2ID("argon2id");

    private final String wireName;

    KdfAlgorithm(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Unknown names resolve to Argon2id, the algorithm of the oldest records. */
    public static KdfAlgorithm fromWireName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (KdfAlgorithm algorithm : values()) {
            if (algorithm.wireName.equals(normalized)) {
                return algorithm;
            }
        }
        return ARGON2ID;
    }
}
