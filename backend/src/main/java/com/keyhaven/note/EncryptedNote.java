package com.keyhaven.note;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encrypted note payload. {@code ciphertext} holds the JSON {@code {"title","content"}}; the title is
 * also encrypted on its own when present.
 */
public record EncryptedNote(
        String ciphertext,
        String nonce,
        String titleCiphertext,
        String titleNonce,
        int version
) {

    public static final int CURRENT_VERSION = 1;

    static final String CIPHERTEXT = "e2ee_ciphertext";
    static final String NONCE = "e2ee_nonce";
    static final String TITLE_CIPHERTEXT = "e2ee_title_ciphertext";
    static final String TITLE_NONCE = "e2ee_title_nonce";
    static final String VERSION = "e2ee_version";

    /** True if the stored note map carries an encrypted payload. */
    public static boolean isEncrypted(Map<String, ?> fields) {
        return fields.containsKey(CIPHERTEXT) && fields.containsKey(NONCE);
    }

    public static EncryptedNote fromFields(Map<String, ?> fields) {
        Object version = fields.get(VERSION);
        return new EncryptedNote(
                asString(fields.get(CIPHERTEXT)),
                asString(fields.get(NONCE)),
                asString(fields.get(TITLE_CIPHERTEXT)),
                asString(fields.get(TITLE_NONCE)),
                version instanceof Number n ? n.intValue() : CURRENT_VERSION);
    }

    public Map<String, Object> toFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(CIPHERTEXT, ciphertext);
        fields.put(NONCE, nonce);
        if (titleCiphertext != null) {
            fields.put(TITLE_CIPHERTEXT, titleCiphertext);
        }
        if (titleNonce != null) {
            fields.put(TITLE_NONCE, titleNonce);
        }
        fields.put(VERSION, version);
        return fields;
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
