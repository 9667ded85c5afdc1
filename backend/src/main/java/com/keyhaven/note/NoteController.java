package com.keyhaven.note;

import java.util.Map;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Mono;

/**
 * Encrypts note maps before the client uploads them and decrypts them after download. Maps pass
 * through unchanged when this device holds no UMK or the note is not encrypted.
 */
@RestController
@RequestMapping("/api/notes")
public class NoteController {

    private final NoteEncryptionService noteEncryption;

    public NoteController(NoteEncryptionService noteEncryption) {
        this.noteEncryption = noteEncryption;
    }

    @PostMapping("/encrypt")
    public Mono<Map<String, Object>> encrypt(@RequestBody Map<String, Object> note) {
        return Mono.fromSupplier(() -> noteEncryption.prepareNoteForUpload(note));
    }

    @PostMapping("/decrypt")
    public Mono<Map<String, Object>> decrypt(@RequestBody Map<String, Object> note) {
        return Mono.fromSupplier(() -> noteEncryption.processNoteFromDownload(note));
    }
}
