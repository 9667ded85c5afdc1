package com.keyhaven.recovery;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.keyhaven.crypto.KdfAlgorithm;
import com.keyhaven.store.DocumentSnapshot;
import com.keyhaven.store.Timestamps;

/**
 * The account's passphrase-wrapped UMK, stored at {@code users/{accountId}/e2ee/recovery_key}.
 * A {@code null} {@code kdfAlgorithm} marks a legacy record whose KDF has to be found by trial.
 */
public record RecoveryKeyRecord(
        String encryptedUmk,
        String nonce,
        String salt,
        String hint,
        Instant createdAt,
        KdfAlgorithm kdfAlgorithm,
        boolean imported
) {

    static final String ENCRYPTED_UMK = "encrypted_umk";
    static final String NONCE = "nonce";
    static final String SALT = "salt";
    static final String HINT = "hint";
    static final String CREATED_AT = "created_at";
    static final String KDF_ALGORITHM = "kdf_algorithm";
    static final String IMPORTED = "imported";

    public static RecoveryKeyRecord fromSnapshot(DocumentSnapshot doc) {
        return new RecoveryKeyRecord(
                doc.getString(ENCRYPTED_UMK),
                doc.getString(NONCE),
                doc.getString(SALT),
                doc.getString(HINT),
                Timestamps.parse(doc.getString(CREATED_AT)),
                KdfAlgorithm.fromWireName(doc.getString(KDF_ALGORITHM)),
                doc.getBoolean(IMPORTED));
    }

    public Map<String, Object> toDocument() {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(ENCRYPTED_UMK, encryptedUmk);
        doc.put(NONCE, nonce);
        doc.put(SALT, salt);
        if (hint != null) {
            doc.put(HINT, hint);
        }
        doc.put(CREATED_AT, createdAt.toString());
        if (kdfAlgorithm != null) {
            doc.put(KDF_ALGORITHM, kdfAlgorithm.wireName());
        }
        if (imported) {
            doc.put(IMPORTED, true);
        }
        return doc;
    }
}
