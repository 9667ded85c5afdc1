package com.keyhaven.note;

/** Plaintext note. {@code preview} is the plain text extracted from the rich-text body. */
public record DecryptedNote(String title, String content, String preview) {

    static final String LOCKED_TITLE = "[Encrypted Note]";
    static final String LOCKED_PREVIEW = "This note is encrypted. Please authorize this device to view it.";
    static final String FAILED_TITLE = "[Decryption Failed]";
    static final String FAILED_PREVIEW = "Failed to decrypt this note.";

    /** Placeholder shown while this device holds no UMK. */
    public static DecryptedNote locked() {
        return new DecryptedNote(LOCKED_TITLE, null, LOCKED_PREVIEW);
    }

    /** Placeholder for a payload that does not authenticate under the UMK. */
    public static DecryptedNote failed() {
        return new DecryptedNote(FAILED_TITLE, null, FAILED_PREVIEW);
    }
}
