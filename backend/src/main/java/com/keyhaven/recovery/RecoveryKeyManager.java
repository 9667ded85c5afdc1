package com.keyhaven.recovery;

import java.time.Clock;
import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyhaven.account.AccountSession;
import com.keyhaven.crypto.CipherText;
import com.keyhaven.crypto.KdfAlgorithm;
import com.keyhaven.crypto.KeyDerivation;
import com.keyhaven.crypto.MasterKeyWrap;
import com.keyhaven.device.DeviceTrustManager;
import com.keyhaven.error.AuthenticationFailureException;
import com.keyhaven.error.ConnectivityException;
import com.keyhaven.error.InvalidStateException;
import com.keyhaven.error.NotAuthorizedException;
import com.keyhaven.error.UnsupportedPlatformException;
import com.keyhaven.store.AccountDocuments;
import com.keyhaven.store.DocumentSnapshot;
import com.keyhaven.store.DocumentStore;
import com.keyhaven.store.Timestamps;

import reactor.core.publisher.Mono;

/**
 * Passphrase backup of the UMK, independent of any device.
 *
 * <p>New records are derived with {@link KeyDerivation#currentDefaultAlgorithm()} and name their KDF.
 * Legacy records without {@code kdf_algorithm} are opened by trying PBKDF2, then Argon2id.
 * Replacing or removing a record requires the current passphrase.
 */
@Service
public class RecoveryKeyManager {

    private static final Logger log = LoggerFactory.getLogger(RecoveryKeyManager.class);

    static final int EXPORT_VERSION = 1;

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final DocumentStore store;
    private final DeviceTrustManager trustManager;
    private final AccountSession session;
    private final KeyDerivation keyDerivation;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RecoveryKeyManager(DocumentStore store, DeviceTrustManager trustManager, AccountSession session,
                              KeyDerivation keyDerivation, ObjectMapper objectMapper, Clock clock) {
        this.store = store;
        this.trustManager = trustManager;
        this.session = session;
        this.keyDerivation = keyDerivation;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Mono<Boolean> hasRecoveryKey() {
        return fetch().hasElement();
    }

    public Mono<String> getHint() {
        return fetch().mapNotNull(RecoveryKeyRecord::hint);
    }

    /**
     * Wraps the current UMK under a key derived from {@code passphrase} and stores it, replacing any
     * existing record.
     *
     * @throws NotAuthorizedException (as an error signal) if this device holds no UMK
     */
    public Mono<Void> create(String passphrase, String hint) {
        return requireAccount().flatMap(accountId -> {
            byte[] umk = trustManager.getUmk().orElse(null);
            if (umk == null) {
                return Mono.error(new NotAuthorizedException("UMK not available"));
            }
            KdfAlgorithm algorithm = keyDerivation.currentDefaultAlgorithm();
            byte[] salt = KeyDerivation.generateSalt();
            log.info("Creating recovery key with {}", algorithm.wireName());
            return keyDerivation.deriveKey(passphrase, salt, algorithm)
                    .map(key -> {
                        CipherText wrapped = MasterKeyWrap.wrap(umk, key);
                        return new RecoveryKeyRecord(wrapped.ciphertext(), wrapped.nonce(),
                                Base64.getEncoder().encodeToString(salt), hint, clock.instant(), algorithm, false);
                    })
                    .flatMap(record -> store.set(AccountDocuments.recoveryKey(accountId), record.toDocument()))
                    .doOnSuccess(v -> log.info("Recovery key created"));
        });
    }

    /** True if {@code passphrase} opens the stored record. False when there is no record or it is unreadable. */
    public Mono<Boolean> verify(String passphrase) {
        return fetch()
                .flatMap(record -> open(passphrase, record)
                        .onErrorResume(InvalidStateException.class, e -> {
                            log.warn("Recovery record cannot be verified: {}", e.getMessage());
                            return Mono.empty();
                        }))
                .hasElement();
    }

    /**
     * @throws NotAuthorizedException (as an error signal) if {@code currentPassphrase} is wrong
     */
    public Mono<Void> update(String currentPassphrase, String newPassphrase, String hint) {
        return requireCurrentPassphrase(currentPassphrase)
                .then(create(newPassphrase, hint))
                .doOnSuccess(v -> log.info("Recovery key updated"));
    }

    /**
     * Deletes the recovery record. Afterwards the UMK cannot be recovered if every device is lost.
     *
     * @throws NotAuthorizedException (as an error signal) if {@code currentPassphrase} is wrong
     */
    public Mono<Void> remove(String currentPassphrase) {
        return requireAccount().flatMap(accountId -> requireCurrentPassphrase(currentPassphrase)
                .then(store.delete(AccountDocuments.recoveryKey(accountId)))
                .doOnSuccess(v -> log.info("Recovery key removed")));
    }

    /**
     * Opens the recovery record and registers this device as approved with the recovered UMK.
     * Knowing the passphrase is the authorization, so no approval step is involved.
     *
     * @return false when there is no record or the passphrase is wrong
     * @throws UnsupportedPlatformException (as an error signal) if the record needs Argon2id here
     */
    public Mono<Boolean> recover(String passphrase) {
        return requireAccount().flatMap(accountId -> {
            log.info("Attempting recovery with passphrase");
            return fetch()
                    .switchIfEmpty(Mono.fromRunnable(() -> log.info("No recovery key found")))
                    .flatMap(record -> open(passphrase, record)
                            .switchIfEmpty(Mono.fromRunnable(() -> log.info("Recovery failed: incorrect passphrase"))))
                    .flatMap(umk -> trustManager.registerRecoveredDevice(umk).thenReturn(true))
                    .doOnNext(ok -> log.info("Recovery successful"))
                    .onErrorResume(e -> !(e instanceof UnsupportedPlatformException || e instanceof ConnectivityException),
                            e -> {
                                log.error("Recovery failed", e);
                                return Mono.just(false);
                            })
                    .defaultIfEmpty(false);
        });
    }

    /**
     * The record as a JSON string for offline backup:
     * {@code {"version":1,"encrypted_umk","nonce","salt","created_at"}}. Empty when there is no record.
     */
    public Mono<String> exportRecoveryData() {
        return fetchSnapshot().map(doc -> {
            Map<String, Object> export = new LinkedHashMap<>();
            export.put("version", EXPORT_VERSION);
            export.put(RecoveryKeyRecord.ENCRYPTED_UMK, doc.getString(RecoveryKeyRecord.ENCRYPTED_UMK));
            export.put(RecoveryKeyRecord.NONCE, doc.getString(RecoveryKeyRecord.NONCE));
            export.put(RecoveryKeyRecord.SALT, doc.getString(RecoveryKeyRecord.SALT));
            export.put(RecoveryKeyRecord.CREATED_AT, doc.getString(RecoveryKeyRecord.CREATED_AT));
            try {
                return objectMapper.writeValueAsString(export);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Could not serialize recovery export", e);
            }
        });
    }

    /**
     * Overwrites the account's recovery record with an exported backup. The stored record is marked
     * {@code imported} and carries no KDF name, so it is opened like a legacy record.
     *
     * @return false if {@code exported} is not valid JSON or lacks a required field
     */
    public Mono<Boolean> importRecoveryData(String exported) {
        return requireAccount().flatMap(accountId -> {
            Map<String, Object> data;
            try {
                data = objectMapper.readValue(exported, JSON_OBJECT);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                log.warn("Invalid recovery data: {}", e.getMessage());
                return Mono.just(false);
            }
            if (data == null || !data.containsKey(RecoveryKeyRecord.ENCRYPTED_UMK)
                    || !data.containsKey(RecoveryKeyRecord.NONCE) || !data.containsKey(RecoveryKeyRecord.SALT)) {
                log.warn("Invalid recovery data format");
                return Mono.just(false);
            }
            if (!(data.get(RecoveryKeyRecord.ENCRYPTED_UMK) instanceof String)
                    || !(data.get(RecoveryKeyRecord.NONCE) instanceof String)
                    || !(data.get(RecoveryKeyRecord.SALT) instanceof String)) {
                log.warn("Invalid recovery data: key fields must be strings");
                return Mono.just(false);
            }
            Object createdAt = data.get(RecoveryKeyRecord.CREATED_AT);
            Instant created = createdAt == null ? clock.instant()
                    : createdAt instanceof String text ? Timestamps.parse(text) : null;
            if (created == null) {
                log.warn("Invalid recovery data: unreadable created_at");
                return Mono.just(false);
            }
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put(RecoveryKeyRecord.ENCRYPTED_UMK, data.get(RecoveryKeyRecord.ENCRYPTED_UMK));
            doc.put(RecoveryKeyRecord.NONCE, data.get(RecoveryKeyRecord.NONCE));
            doc.put(RecoveryKeyRecord.SALT, data.get(RecoveryKeyRecord.SALT));
            doc.put(RecoveryKeyRecord.CREATED_AT, created.toString());
            doc.put(RecoveryKeyRecord.IMPORTED, true);
            return store.set(AccountDocuments.recoveryKey(accountId), doc)
                    .doOnSuccess(v -> log.info("Recovery data imported"))
                    .thenReturn(true);
        });
    }

    /**
     * Derives the wrap key and opens the record. Completes empty when the passphrase is wrong.
     * Errors with {@link UnsupportedPlatformException} when only Argon2id remains and cannot run here.
     */
    Mono<byte[]> open(String passphrase, RecoveryKeyRecord record) {
        if (record.salt() == null || record.encryptedUmk() == null || record.nonce() == null) {
            return Mono.error(new InvalidStateException("Recovery record is incomplete"));
        }
        byte[] salt;
        try {
            salt = Base64.getDecoder().decode(record.salt());
        } catch (IllegalArgumentException e) {
            return Mono.error(new InvalidStateException("Recovery record has a malformed salt"));
        }
        if (record.kdfAlgorithm() != null) {
            log.debug("Using stored KDF algorithm {}", record.kdfAlgorithm().wireName());
            return attempt(passphrase, salt, record, record.kdfAlgorithm());
        }
        log.debug("Legacy recovery key, trying PBKDF2 first");
        return attempt(passphrase, salt, record, KdfAlgorithm.PBKDF2)
                .switchIfEmpty(Mono.defer(() -> {
                    log.debug("PBKDF2 failed, trying Argon2id");
                    return attempt(passphrase, salt, record, KdfAlgorithm.ARGON2ID);
                }));
    }

    private Mono<byte[]> attempt(String passphrase, byte[] salt, RecoveryKeyRecord record, KdfAlgorithm algorithm) {
        return keyDerivation.deriveKey(passphrase, salt, algorithm)
                .flatMap(key -> Mono.fromCallable(() -> MasterKeyWrap.unwrap(record.encryptedUmk(), record.nonce(), key))
                        .onErrorResume(AuthenticationFailureException.class, e -> {
                            log.debug("Decryption failed with {}", algorithm.wireName());
                            return Mono.empty();
                        }));
    }

    private Mono<Void> requireCurrentPassphrase(String passphrase) {
        return verify(passphrase).flatMap(valid -> valid
                ? Mono.<Void>empty()
                : Mono.<Void>error(new NotAuthorizedException("Current passphrase is incorrect")));
    }

    private Mono<RecoveryKeyRecord> fetch() {
        return fetchSnapshot().map(RecoveryKeyRecord::fromSnapshot);
    }

    private Mono<DocumentSnapshot> fetchSnapshot() {
        return Mono.defer(() -> Mono.justOrEmpty(session.currentAccountId()))
                .map(AccountDocuments::recoveryKey)
                .flatMap(store::get)
                .filter(DocumentSnapshot::exists);
    }

    private Mono<String> requireAccount() {
        return Mono.defer(() -> Mono.justOrEmpty(session.currentAccountId()))
                .switchIfEmpty(Mono.error(new InvalidStateException("No account signed in")));
    }
}
