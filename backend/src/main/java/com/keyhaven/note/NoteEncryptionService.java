package com.keyhaven.note;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyhaven.crypto.AuthenticatedCipher;
import com.keyhaven.crypto.CipherText;
import com.keyhaven.device.DeviceTrustManager;
import com.keyhaven.error.AuthenticationFailureException;

/**
 * Encrypts and decrypts note payloads under the UMK held by this device.
 */
@Service
public class NoteEncryptionService {

    private static final Logger log = LoggerFactory.getLogger(NoteEncryptionService.class);

    static final String TITLE = "title";
    static final String CONTENT = "content";
    static final String PLAIN_TEXT = "plain_text";
    static final String E2EE_ENABLED = "e2ee_enabled";

    private final DeviceTrustManager trustManager;
    private final ObjectMapper objectMapper;

    public NoteEncryptionService(DeviceTrustManager trustManager, ObjectMapper objectMapper) {
        this.trustManager = trustManager;
        this.objectMapper = objectMapper;
    }

    public boolean isAvailable() {
        return trustManager.hasUmk();
    }

    /** Empty when this device holds no UMK. */
    public Optional<EncryptedNote> encrypt(String title, String content) {
        Optional<byte[]> umk = trustManager.getUmk();
        if (umk.isEmpty()) {
            log.debug("Cannot encrypt note, UMK not available");
            return Optional.empty();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TITLE, title);
        payload.put(CONTENT, content);

        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize note payload", e);
        }
        CipherText body = AuthenticatedCipher.encryptString(json, umk.get());

        CipherText encryptedTitle = title != null && !title.isEmpty()
                ? AuthenticatedCipher.encryptString(title, umk.get())
                : null;
        return Optional.of(new EncryptedNote(body.ciphertext(), body.nonce(),
                encryptedTitle == null ? null : encryptedTitle.ciphertext(),
                encryptedTitle == null ? null : encryptedTitle.nonce(),
                EncryptedNote.CURRENT_VERSION));
    }

    /** Empty when this device holds no UMK or the payload does not decrypt. */
    public Optional<DecryptedNote> decrypt(EncryptedNote note) {
        Optional<byte[]> umk = trustManager.getUmk();
        if (umk.isEmpty()) {
            log.debug("Cannot decrypt note, UMK not available");
            return Optional.empty();
        }
        if (note.ciphertext() == null || note.nonce() == null) {
            log.warn("Encrypted note has no ciphertext or nonce");
            return Optional.empty();
        }
        try {
            String json = AuthenticatedCipher.decryptString(note.ciphertext(), note.nonce(), umk.get());
            JsonNode payload = objectMapper.readTree(json);
            String title = textOrNull(payload.get(TITLE));
            String content = textOrNull(payload.get(CONTENT));
            return Optional.of(new DecryptedNote(title, content, DeltaPreview.extract(content, objectMapper)));
        } catch (AuthenticationFailureException | JsonProcessingException e) {
            log.error("Failed to decrypt note", e);
            return Optional.empty();
        }
    }

    /** Like {@link #decrypt} but renders the locked and failed cases as placeholder notes. */
    public DecryptedNote decryptForDisplay(EncryptedNote note) {
        if (!isAvailable()) {
            return DecryptedNote.locked();
        }
        return decrypt(note).orElseGet(DecryptedNote::failed);
    }

    /**
     * Replaces {@code title}, {@code content} and {@code plain_text} of a note map with the encrypted
     * fields and sets {@code e2ee_enabled}. Without a UMK the map is returned unchanged.
     */
    public Map<String, Object> prepareNoteForUpload(Map<String, Object> note) {
        Optional<EncryptedNote> encrypted = encrypt(asString(note.get(TITLE)), asString(note.get(CONTENT)));
        if (encrypted.isEmpty()) {
            return note;
        }
        Map<String, Object> upload = new LinkedHashMap<>(note);
        upload.remove(TITLE);
        upload.remove(CONTENT);
        upload.remove(PLAIN_TEXT);
        upload.putAll(encrypted.get().toFields());
        upload.put(E2EE_ENABLED, true);
        return upload;
    }

    /**
     * Fills {@code title}, {@code content} and {@code plain_text} of a downloaded note map. Unencrypted
     * maps pass through; locked and undecryptable notes get placeholder text.
     */
    public Map<String, Object> processNoteFromDownload(Map<String, Object> note) {
        if (!EncryptedNote.isEncrypted(note)) {
            return note;
        }
        if (!isAvailable()) {
            log.debug("Received encrypted note but UMK not available");
        }
        DecryptedNote decrypted = decryptForDisplay(EncryptedNote.fromFields(note));
        Map<String, Object> processed = new LinkedHashMap<>(note);
        processed.put(TITLE, decrypted.title());
        processed.put(CONTENT, decrypted.content());
        processed.put(PLAIN_TEXT, decrypted.preview());
        return processed;
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
