package com.keyhaven.device;

import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.keyhaven.account.AccountSession;
import com.keyhaven.crypto.CipherText;
import com.keyhaven.crypto.CryptoRandom;
import com.keyhaven.crypto.DeviceKeyPair;
import com.keyhaven.crypto.KeyExchange;
import com.keyhaven.crypto.MasterKeyWrap;
import com.keyhaven.error.AuthenticationFailureException;
import com.keyhaven.error.ConnectivityException;
import com.keyhaven.error.InvalidStateException;
import com.keyhaven.error.NotAuthorizedException;
import com.keyhaven.error.NotFoundException;
import com.keyhaven.storage.DeviceKeyStorage;
import com.keyhaven.store.AccountDocuments;
import com.keyhaven.store.DocumentPath;
import com.keyhaven.store.DocumentSnapshot;
import com.keyhaven.store.DocumentStore;
import com.keyhaven.store.FieldValue;
import com.keyhaven.store.WriteBatch;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.util.retry.Retry;

/**
 * Device registration, approval and revocation, and per-device wrapping of the User Master Key.
 *
 * <p>Every device holds an X25519 key pair. An approved device wraps the UMK for a pending one under
 * ECDH(approver private, pending public) and records its own public key in
 * {@code approved_by_public_key}, so the pending device can derive the same secret. The first device
 * (and a recovered one) wraps the UMK for itself under ECDH of its own key pair.
 *
 * <p>Device record mutations are read-modify-write with no lock. Two approvers acting on the same
 * record at once race, and the last write wins.
 *
 * <p>The plaintext UMK is held in memory once unwrapped and mirrored in the local secure store. It is
 * cleared on revocation, deletion and sign-out.
 */
@Service
public class DeviceTrustManager {

    private static final Logger log = LoggerFactory.getLogger(DeviceTrustManager.class);

    private static final Comparator<DeviceRecord> AUTHORITY_ORDER = Comparator.comparing(
            DeviceRecord::authorityTimestamp, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Sinks.EmitFailureHandler EMIT_RETRY =
            Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1));

    private final DocumentStore store;
    private final DeviceKeyStorage keyStorage;
    private final AccountSession session;
    private final DeviceIdentity identity;
    private final Clock clock;

    private final AtomicReference<byte[]> cachedUmk = new AtomicReference<>();
    private final AtomicBoolean wasRevoked = new AtomicBoolean();

    private final Sinks.Many<Boolean> umkAvailability = Sinks.many().replay().latest();
    private final Sinks.Many<List<DeviceApprovalRequest>> pendingApprovals = Sinks.many().replay().latest();
    private final Sinks.Many<DeviceStatusChange> statusChanges = Sinks.many().multicast().directBestEffort();

    private final AtomicReference<Disposable> currentDeviceStatusSubscription = new AtomicReference<>();
    private final AtomicReference<Disposable> approvalSubscription = new AtomicReference<>();
    private final AtomicReference<Disposable> pendingApprovalsSubscription = new AtomicReference<>();

    public DeviceTrustManager(DocumentStore store, DeviceKeyStorage keyStorage, AccountSession session,
                              DeviceIdentity identity, Clock clock) {
        this.store = store;
        this.keyStorage = keyStorage;
        this.session = session;
        this.identity = identity;
        this.clock = clock;
        umkAvailability.emitNext(false, EMIT_RETRY);
        pendingApprovals.emitNext(List.of(), EMIT_RETRY);
    }

    // ── Session start ────────────────────────────────────────────────

    /**
     * Restores state for the signed-in account: loads the cached UMK, drops local keys whose server
     * record vanished, clears the UMK of a revoked device, unwraps it for an approved device that has
     * no cached copy, and starts the listeners of an approved device.
     */
    public Mono<Void> init() {
        return account().flatMap(accountId -> keyStorage.getCachedUmk()
                .doOnNext(this::setCachedUmk)
                .then(keyStorage.getDeviceId())
                .switchIfEmpty(Mono.fromRunnable(() -> log.info("Device not registered for account {}", accountId)))
                .flatMap(deviceId -> store.get(AccountDocuments.device(accountId, deviceId))
                        .flatMap(doc -> restore(accountId, deviceId, doc))));
    }

    private Mono<Void> restore(String accountId, String deviceId, DocumentSnapshot doc) {
        if (!doc.exists()) {
            log.info("Device {} was removed from the server, clearing local keys", deviceId);
            return keyStorage.clearAll().then(Mono.<Void>fromRunnable(this::forgetUmk));
        }
        DeviceRecord device = DeviceRecord.fromSnapshot(doc);
        if (device.isRevoked()) {
            log.info("Device {} was revoked, clearing cached UMK", deviceId);
            return clearUmk();
        }
        Mono<Void> unwrap = device.isApproved() && device.hasWrappedUmk() && !hasUmk()
                ? unwrapAndCacheUmk(device).then()
                : Mono.empty();
        return unwrap.then(Mono.<Void>fromRunnable(() -> {
            if (device.isApproved()) {
                listenForPendingApprovals(accountId);
                listenForCurrentDeviceStatus(accountId, deviceId);
            }
        }));
    }

    /** Starts the status and pending-approval listeners for this device, e.g. after recovery. */
    public Mono<Void> startListeningForCurrentDevice() {
        return account().flatMap(accountId -> keyStorage.getDeviceId()
                .switchIfEmpty(Mono.fromRunnable(() -> log.warn("Cannot start listening, no device id stored")))
                .doOnNext(deviceId -> {
                    log.info("Starting listeners for device {}", deviceId);
                    listenForCurrentDeviceStatus(accountId, deviceId);
                    listenForPendingApprovals(accountId);
                }))
                .then();
    }

    // ── Queries ──────────────────────────────────────────────────────

    /** True when the account has no device records at all. */
    public Mono<Boolean> isFirstDevice() {
        return account()
                .flatMap(accountId -> store.list(AccountDocuments.devices(accountId)).hasElements())
                .map(hasDevices -> !hasDevices)
                .defaultIfEmpty(false);
    }

    public Mono<Boolean> hasApprovedDevices() {
        return account()
                .flatMap(this::fetchAll)
                .map(devices -> devices.stream().anyMatch(DeviceRecord::isApproved))
                .defaultIfEmpty(false);
    }

    /** The master device: the approved device with the earliest approval (else creation) time. */
    public Mono<DeviceRecord> getPrimaryDevice() {
        return account()
                .flatMap(this::fetchAll)
                .flatMap(devices -> Mono.justOrEmpty(
                        devices.stream().filter(DeviceRecord::isApproved).min(AUTHORITY_ORDER)));
    }

    /**
     * Whether this machine carries the primary device's name (case-insensitive). A match means the
     * same physical device lost its keys, so recovery is offered instead of an approval request.
     */
    public Mono<Boolean> currentDeviceMatchesPrimaryName() {
        return getPrimaryDevice()
                .map(primary -> {
                    log.debug("Comparing device names: current '{}', primary '{}'", identity.name(), primary.name());
                    return primary.name().equalsIgnoreCase(identity.name());
                })
                .defaultIfEmpty(false);
    }

    /** This device's server record; empty when unregistered or deleted. */
    public Mono<DeviceRecord> fetchCurrentDevice() {
        return account().flatMap(accountId -> keyStorage.getDeviceId()
                .flatMap(deviceId -> fetch(accountId, deviceId)));
    }

    public Mono<Boolean> isDeviceApproved() {
        return fetchCurrentDevice().map(DeviceRecord::isApproved).defaultIfEmpty(false);
    }

    public Mono<Boolean> isDevicePending() {
        return fetchCurrentDevice().map(DeviceRecord::isPending).defaultIfEmpty(false);
    }

    public Mono<Boolean> deviceExistsOnServer() {
        return fetchCurrentDevice().hasElement();
    }

    /**
     * True when the current device is the master. An account without approved devices counts every
     * device as master.
     */
    public Mono<Boolean> isMasterDevice() {
        return account().flatMap(accountId -> keyStorage.getDeviceId()
                        .flatMap(currentId -> fetchAll(accountId).map(devices -> devices.stream()
                                .filter(DeviceRecord::isApproved)
                                .min(AUTHORITY_ORDER)
                                .map(master -> master.id().equals(currentId))
                                .orElse(true))))
                .defaultIfEmpty(false);
    }

    /** All devices of the account: the current device first, then newest first. */
    public Mono<List<DeviceRecord>> getDevices() {
        return requireAccount().flatMap(accountId -> keyStorage.getDeviceId().defaultIfEmpty("")
                .flatMap(currentId -> fetchAll(accountId).map(devices -> devices.stream()
                        .sorted(currentFirstThenNewest(currentId))
                        .toList())));
    }

    public Mono<List<DeviceApprovalRequest>> getPendingApprovals() {
        return requireAccount().flatMap(this::fetchPending);
    }

    /**
     * Unwraps the UMK if this device is approved and none is cached yet.
     *
     * @return true if a UMK is available afterwards
     */
    public Mono<Boolean> tryRetrieveUmk() {
        if (hasUmk()) {
            return Mono.just(true);
        }
        return fetchCurrentDevice()
                .filter(device -> device.isApproved() && device.hasWrappedUmk())
                .flatMap(device -> unwrapAndCacheUmk(device)
                        .thenReturn(true)
                        .onErrorResume(e -> e instanceof AuthenticationFailureException || e instanceof InvalidStateException,
                                e -> {
                                    log.error("Failed to retrieve UMK for device {}", device.id(), e);
                                    return Mono.just(false);
                                }))
                .defaultIfEmpty(false);
    }

    /**
     * Re-reads this device's record and fires the revocation feed if it was revoked or deleted.
     * A connectivity failure counts as still authorized.
     */
    public Mono<Boolean> checkCurrentDeviceAuthorization() {
        return account().flatMap(accountId -> keyStorage.getDeviceId()
                        .flatMap(deviceId -> store.get(AccountDocuments.device(accountId, deviceId))
                                .flatMap(doc -> {
                                    if (!doc.exists()) {
                                        log.info("Device {} no longer exists on the server", deviceId);
                                        notifyStatusChange(DeviceStatusChange.deleted(deviceId));
                                        return Mono.just(false);
                                    }
                                    DeviceRecord device = DeviceRecord.fromSnapshot(doc);
                                    if (device.isRevoked()) {
                                        log.info("Device {} was revoked", deviceId);
                                        return clearUmk()
                                                .then(Mono.<Void>fromRunnable(() -> notifyStatusChange(
                                                        new DeviceStatusChange(deviceId, DeviceStatus.REVOKED))))
                                                .thenReturn(false);
                                    }
                                    return Mono.just(device.isApproved());
                                })
                                .onErrorResume(ConnectivityException.class, e -> {
                                    log.warn("Could not verify device {}, assuming still authorized: {}",
                                            deviceId, e.getMessage());
                                    return Mono.just(true);
                                })))
                .defaultIfEmpty(false);
    }

    // ── Registration ─────────────────────────────────────────────────

    /**
     * Creates the account's UMK and registers this device as approved with a self-wrap. The server
     * record is written before any local secret is kept.
     */
    public Mono<Void> registerFirstDevice() {
        return requireAccount().flatMap(accountId -> Mono.defer(() -> {
            log.info("Registering first device for account {}", accountId);
            DeviceKeyPair keyPair = KeyExchange.generateKeyPair();
            String deviceId = UUID.randomUUID().toString();
            byte[] umk = CryptoRandom.generateUserMasterKey();
            String now = now();

            Map<String, Object> doc = approvedDocument(keyPair, MasterKeyWrap.wrapForSelf(umk, keyPair), now);
            doc.put(DeviceRecord.DEVICE_DETAILS, identity.details());

            return store.set(AccountDocuments.device(accountId, deviceId), doc)
                    .then(persistLocally(keyPair, deviceId, umk))
                    .then(Mono.<Void>fromRunnable(() -> {
                        setCachedUmk(umk);
                        log.info("First device {} registered", deviceId);
                        listenForPendingApprovals(accountId);
                        listenForCurrentDeviceStatus(accountId, deviceId);
                    }));
        }));
    }

    /**
     * Registers this device as pending and listens for approval. An already pending registration of
     * this device, or a pending record with the same name and platform left by an interrupted attempt,
     * is reused instead of creating a duplicate.
     */
    public Mono<Void> registerNewDevice() {
        return requireAccount().flatMap(accountId -> keyStorage.getDeviceId()
                .flatMap(existingId -> fetch(accountId, existingId))
                .filter(existing -> {
                    if (existing.isPending()) {
                        log.info("Device {} already pending, listening for approval", existing.id());
                        listenForApproval(accountId, existing.id());
                        return true;
                    }
                    log.info("Device {} exists with status {}, registering again",
                            existing.id(), existing.status().wireName());
                    return false;
                })
                .switchIfEmpty(Mono.defer(() -> registerPending(accountId).then(Mono.<DeviceRecord>empty())))
                .then());
    }

    private Mono<Void> registerPending(String accountId) {
        String name = identity.name();
        String platform = identity.platform();
        return store.query(AccountDocuments.devices(accountId), DeviceRecord.NAME, name)
                .map(DeviceRecord::fromSnapshot)
                .filter(device -> device.isPending() && platform.equals(device.platform()))
                .next()
                .onErrorResume(ConnectivityException.class, e -> {
                    log.warn("Could not check for an existing pending registration: {}", e.getMessage());
                    return Mono.empty();
                })
                .flatMap(existing -> reusePending(accountId, existing).thenReturn(true))
                .switchIfEmpty(Mono.defer(() -> createPending(accountId, name, platform).thenReturn(true)))
                .then();
    }

    private Mono<Void> reusePending(String accountId, DeviceRecord existing) {
        log.info("Reusing pending device {} with the same name", existing.id());
        DeviceKeyPair keyPair = KeyExchange.generateKeyPair();
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(DeviceRecord.PUBLIC_KEY, keyPair.publicKeyBase64());
        changes.put(DeviceRecord.CREATED_AT, now());
        changes.put(DeviceRecord.DEVICE_DETAILS, identity.details());
        return store.update(AccountDocuments.device(accountId, existing.id()), changes)
                .then(persistLocally(keyPair, existing.id(), null))
                .then(Mono.<Void>fromRunnable(() -> listenForApproval(accountId, existing.id())));
    }

    private Mono<Void> createPending(String accountId, String name, String platform) {
        DeviceKeyPair keyPair = KeyExchange.generateKeyPair();
        String deviceId = UUID.randomUUID().toString();
        log.info("Registering new device {} (pending approval)", deviceId);

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(DeviceRecord.NAME, name);
        doc.put(DeviceRecord.PLATFORM, platform);
        doc.put(DeviceRecord.PUBLIC_KEY, keyPair.publicKeyBase64());
        doc.put(DeviceRecord.STATUS, DeviceStatus.PENDING.wireName());
        doc.put(DeviceRecord.CREATED_AT, now());
        doc.put(DeviceRecord.DEVICE_DETAILS, identity.details());

        return store.set(AccountDocuments.device(accountId, deviceId), doc)
                .then(persistLocally(keyPair, deviceId, null))
                .then(Mono.<Void>fromRunnable(() -> listenForApproval(accountId, deviceId)));
    }

    /**
     * Registers this device as approved with a UMK obtained through the recovery passphrase. Any
     * stale record of this device is deleted first, after its approval listener is stopped; the new
     * record is marked {@code recovered}.
     */
    public Mono<Void> registerRecoveredDevice(byte[] umk) {
        return requireAccount().flatMap(accountId -> Mono.<Void>fromRunnable(() -> cancel(approvalSubscription))
                .then(keyStorage.getDeviceId())
                .flatMap(staleId -> store.delete(AccountDocuments.device(accountId, staleId))
                        .doOnSuccess(v -> log.info("Deleted stale device {} before recovery", staleId))
                        .onErrorResume(e -> {
                            log.warn("Could not delete stale device {}: {}", staleId, e.getMessage());
                            return Mono.empty();
                        })
                        .then(keyStorage.clearAll()))
                .then(Mono.defer(() -> {
                    DeviceKeyPair keyPair = KeyExchange.generateKeyPair();
                    String deviceId = UUID.randomUUID().toString();
                    Map<String, Object> doc = approvedDocument(keyPair, MasterKeyWrap.wrapForSelf(umk, keyPair), now());
                    doc.put(DeviceRecord.DEVICE_DETAILS, identity.details());
                    doc.put(DeviceRecord.RECOVERED, true);

                    return store.set(AccountDocuments.device(accountId, deviceId), doc)
                            .then(persistLocally(keyPair, deviceId, umk))
                            .then(Mono.<Void>fromRunnable(() -> {
                                setCachedUmk(umk);
                                wasRevoked.set(false);
                                log.info("Device {} registered with recovered UMK", deviceId);
                            }));
                }))
                .then(startListeningForCurrentDevice()));
    }

    // ── Approval and revocation ──────────────────────────────────────

    /**
     * Wraps the UMK for a pending device under ECDH(own private key, its public key) and marks it approved.
     *
     * @throws NotAuthorizedException if this device holds no UMK
     * @throws InvalidStateException if the target is this device or not pending
     * @throws NotFoundException if the target does not exist
     */
    public Mono<Void> approveDevice(String pendingDeviceId) {
        return requireAccount().flatMap(accountId -> {
            byte[] umk = cachedUmk.get();
            if (umk == null) {
                return Mono.error(new NotAuthorizedException("Cannot approve device: UMK not available"));
            }
            DocumentPath path = AccountDocuments.device(accountId, pendingDeviceId);
            return rejectSelf(pendingDeviceId, "approve")
                    .then(store.get(path))
                    .flatMap(doc -> {
                        if (!doc.exists()) {
                            return Mono.error(new NotFoundException("Device not found: " + pendingDeviceId));
                        }
                        DeviceRecord pending = DeviceRecord.fromSnapshot(doc);
                        if (!pending.isPending()) {
                            return Mono.error(new InvalidStateException("Device is not pending approval"));
                        }
                        return keyStorage.getKeyPair()
                                .switchIfEmpty(Mono.error(new InvalidStateException("Local device keys not found")))
                                .flatMap(own -> store.update(path, approvalChanges(umk, own, pending)));
                    })
                    .then(Mono.<Void>fromRunnable(() -> log.info("Device {} approved", pendingDeviceId)))
                    .then(refreshPendingApprovals(accountId));
        });
    }

    private Map<String, Object> approvalChanges(byte[] umk, DeviceKeyPair own, DeviceRecord pending) {
        byte[] theirPublicKey = new byte[0];
        if (pending.publicKey() != null) {
            try {
                theirPublicKey = Base64.getDecoder().decode(pending.publicKey());
            } catch (IllegalArgumentException e) {
                throw new InvalidStateException("Device " + pending.id() + " has a malformed public key");
            }
        }
        if (theirPublicKey.length != 32) {
            throw new InvalidStateException("Device " + pending.id() + " has no valid public key");
        }
        CipherText wrapped = MasterKeyWrap.wrap(umk, KeyExchange.deriveSharedSecret(own.privateKey(), theirPublicKey));

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(DeviceRecord.WRAPPED_UMK, wrapped.ciphertext());
        changes.put(DeviceRecord.WRAPPED_UMK_NONCE, wrapped.nonce());
        changes.put(DeviceRecord.STATUS, DeviceStatus.APPROVED.wireName());
        changes.put(DeviceRecord.APPROVED_AT, now());
        changes.put(DeviceRecord.APPROVED_BY_PUBLIC_KEY, own.publicKeyBase64());
        return changes;
    }

    /**
     * Hard-revokes another device by deleting its record.
     *
     * @throws NotAuthorizedException if this device holds no UMK
     * @throws InvalidStateException if {@code deviceId} is this device
     */
    public Mono<Void> revokeDevice(String deviceId) {
        return requireAccount().flatMap(accountId -> {
            if (!hasUmk()) {
                return Mono.error(new NotAuthorizedException("Only an approved device can revoke devices"));
            }
            DocumentPath path = AccountDocuments.device(accountId, deviceId);
            return rejectSelf(deviceId, "revoke")
                    .then(store.get(path))
                    .flatMap(doc -> doc.exists()
                            ? store.delete(path)
                            : Mono.<Void>error(new NotFoundException("Device not found: " + deviceId)))
                    .then(Mono.<Void>fromRunnable(() -> log.info("Device {} revoked and deleted", deviceId)))
                    .then(refreshPendingApprovals(accountId));
        });
    }

    /** Clears another device's wrap fields and puts it back to pending. */
    public Mono<Void> resetDeviceToPending(String deviceId) {
        return requireAccount().flatMap(accountId -> {
            if (!hasUmk()) {
                return Mono.error(new NotAuthorizedException("Only an approved device can reset devices"));
            }
            return rejectSelf(deviceId, "reset")
                    .then(store.update(AccountDocuments.device(accountId, deviceId), pendingResetChanges()))
                    .then(Mono.<Void>fromRunnable(() -> log.info("Device {} reset to pending", deviceId)))
                    .then(refreshPendingApprovals(accountId));
        });
    }

    /**
     * Puts this device back to pending after revocation. Falls back to a fresh registration when
     * no local id exists or its record was deleted.
     */
    public Mono<Void> requestReapproval() {
        return requireAccount().flatMap(accountId -> clearUmk()
                .then(keyStorage.getDeviceId())
                .flatMap(deviceId -> store.get(AccountDocuments.device(accountId, deviceId))
                        .flatMap(doc -> {
                            if (!doc.exists()) {
                                log.info("Device {} not found on server, registering again", deviceId);
                                return keyStorage.clearAll().then(registerNewDevice()).thenReturn(true);
                            }
                            log.info("Requesting re-approval for device {}", deviceId);
                            return store.update(doc.path(), pendingResetChanges())
                                    .then(Mono.<Void>fromRunnable(() -> {
                                        wasRevoked.set(false);
                                        listenForApproval(accountId, deviceId);
                                    }))
                                    .thenReturn(true);
                        }))
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("No device id stored, registering as a new device");
                    return registerNewDevice().thenReturn(true);
                }))
                .then());
    }

    private static Map<String, Object> pendingResetChanges() {
        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(DeviceRecord.STATUS, DeviceStatus.PENDING.wireName());
        changes.put(DeviceRecord.WRAPPED_UMK, FieldValue.DELETE);
        changes.put(DeviceRecord.WRAPPED_UMK_NONCE, FieldValue.DELETE);
        changes.put(DeviceRecord.APPROVED_AT, FieldValue.DELETE);
        changes.put(DeviceRecord.APPROVED_BY_PUBLIC_KEY, FieldValue.DELETE);
        changes.put(DeviceRecord.REVOKED_AT, FieldValue.DELETE);
        return changes;
    }

    /**
     * Makes this device the only trust anchor: every other approved device is revoked and every
     * other pending device deleted, in one batch.
     */
    public Mono<Void> setCurrentDeviceAsPrimary() {
        return requireAccount().flatMap(accountId -> keyStorage.getDeviceId()
                .switchIfEmpty(Mono.error(new InvalidStateException("Current device not registered")))
                .flatMap(currentId -> fetchAll(accountId).flatMap(devices -> {
                    WriteBatch batch = new WriteBatch();
                    int revoked = 0;
                    int deleted = 0;
                    String now = now();
                    for (DeviceRecord device : devices) {
                        if (device.id().equals(currentId)) {
                            continue;
                        }
                        if (device.isApproved()) {
                            batch.merge(AccountDocuments.device(accountId, device.id()), Map.of(
                                    DeviceRecord.STATUS, DeviceStatus.REVOKED.wireName(),
                                    DeviceRecord.REVOKED_AT, now,
                                    DeviceRecord.WRAPPED_UMK, FieldValue.DELETE,
                                    DeviceRecord.WRAPPED_UMK_NONCE, FieldValue.DELETE,
                                    DeviceRecord.APPROVED_BY_PUBLIC_KEY, FieldValue.DELETE));
                            revoked++;
                        } else if (device.isPending()) {
                            batch.delete(AccountDocuments.device(accountId, device.id()));
                            deleted++;
                        }
                    }
                    if (batch.isEmpty()) {
                        log.info("No other devices to revoke or delete");
                        return Mono.<Void>empty();
                    }
                    int revokedCount = revoked;
                    int deletedCount = deleted;
                    return store.commit(batch).then(Mono.<Void>fromRunnable(() -> log.info(
                            "Device {} is now primary (revoked {} approved, deleted {} pending)",
                            currentId, revokedCount, deletedCount)));
                })));
    }

    // ── UMK ──────────────────────────────────────────────────────────

    /**
     * Recomputes the wrap secret and decrypts the device's UMK: against {@code approved_by_public_key}
     * when present, otherwise against this device's own public key. The result is cached.
     *
     * @throws InvalidStateException (as an error signal) unless the record is approved and carries a wrap
     */
    public Mono<byte[]> unwrapAndCacheUmk(DeviceRecord device) {
        if (!device.isApproved()) {
            return Mono.error(new InvalidStateException("Device " + device.id() + " is not approved"));
        }
        if (!device.hasWrappedUmk()) {
            return Mono.error(new InvalidStateException("Device does not have a wrapped UMK"));
        }
        return keyStorage.getKeyPair()
                .switchIfEmpty(Mono.error(new InvalidStateException("Local device keys not found")))
                .map(own -> {
                    byte[] peerPublicKey = device.approvedByPublicKey() != null
                            ? Base64.getDecoder().decode(device.approvedByPublicKey())
                            : own.publicKey();
                    byte[] secret = KeyExchange.deriveSharedSecret(own.privateKey(), peerPublicKey);
                    return MasterKeyWrap.unwrap(device.wrappedUmk(), device.wrappedUmkNonce(), secret);
                })
                .flatMap(umk -> keyStorage.cacheUmk(umk).thenReturn(umk))
                .doOnNext(umk -> {
                    setCachedUmk(umk);
                    log.info("UMK unwrapped and cached for device {}", device.id());
                });
    }

    /** Copy of the unwrapped UMK, if this device holds one. */
    public Optional<byte[]> getUmk() {
        byte[] umk = cachedUmk.get();
        return umk == null ? Optional.empty() : Optional.of(umk.clone());
    }

    public boolean hasUmk() {
        return cachedUmk.get() != null;
    }

    public void setCachedUmk(byte[] umk) {
        cachedUmk.set(umk.clone());
        umkAvailability.emitNext(true, EMIT_RETRY);
    }

    public Mono<Void> clearUmk() {
        return Mono.fromRunnable(this::forgetUmk).then(keyStorage.clearCachedUmk());
    }

    private void forgetUmk() {
        if (cachedUmk.getAndSet(null) != null) {
            umkAvailability.emitNext(false, EMIT_RETRY);
        }
    }

    // ── Teardown ─────────────────────────────────────────────────────

    /** Wipes every local secret of this device. */
    public Mono<Void> clearLocalData() {
        return keyStorage.clearAll().then(Mono.<Void>fromRunnable(() -> {
            forgetUmk();
            wasRevoked.set(false);
            log.info("Cleared all local key custody data");
        }));
    }

    /**
     * Deletes every device record of the account. Notes encrypted under the old UMK stay on the
     * server, unreadable until the old recovery passphrase is used.
     */
    public Mono<Void> clearAllDevices() {
        return requireAccount().flatMap(accountId -> {
            log.info("Clearing all devices of account {}", accountId);
            return store.deleteCollection(AccountDocuments.devices(accountId));
        });
    }

    /** Best-effort removal of this device's record on sign-out. Failures are logged, not raised. */
    public Mono<Void> deleteCurrentDevice() {
        return account().flatMap(accountId -> keyStorage.getDeviceId()
                .switchIfEmpty(Mono.fromRunnable(() -> log.info("No device id stored, skipping device deletion")))
                .flatMap(deviceId -> store.delete(AccountDocuments.device(accountId, deviceId))
                        .then(Mono.<Void>fromRunnable(() -> log.info("Device {} deleted", deviceId)))
                        .onErrorResume(e -> {
                            log.error("Error deleting device {}", deviceId, e);
                            return Mono.empty();
                        })))
                .then();
    }

    /** Cancels every listener. Safe to call more than once. */
    public void dispose() {
        cancel(currentDeviceStatusSubscription);
        cancel(approvalSubscription);
        cancel(pendingApprovalsSubscription);
        publishPending(List.of());
    }

    // ── Feeds ────────────────────────────────────────────────────────

    /** Replays the latest value; true while a UMK is held. */
    public Flux<Boolean> umkAvailability() {
        return umkAvailability.asFlux();
    }

    /** Replays the latest pending-approval list. */
    public Flux<List<DeviceApprovalRequest>> pendingApprovals() {
        return pendingApprovals.asFlux();
    }

    /** Changes to this device's own record: approval, revocation and deletion. Hot, no replay. */
    public Flux<DeviceStatusChange> currentDeviceStatusChanges() {
        return statusChanges.asFlux();
    }

    public boolean wasRevoked() {
        return wasRevoked.get();
    }

    public void clearRevokedFlag() {
        wasRevoked.set(false);
    }

    // ── Listeners ────────────────────────────────────────────────────

    private void listenForCurrentDeviceStatus(String accountId, String deviceId) {
        replace(currentDeviceStatusSubscription, watch(AccountDocuments.device(accountId, deviceId))
                .concatMap(doc -> {
                    if (!doc.exists()) {
                        log.info("Current device {} was deleted", deviceId);
                        return clearUmk().then(Mono.<Void>fromRunnable(
                                () -> notifyStatusChange(DeviceStatusChange.deleted(deviceId))));
                    }
                    DeviceRecord device = DeviceRecord.fromSnapshot(doc);
                    if (device.isRevoked()) {
                        log.info("Current device {} was revoked", deviceId);
                        return clearUmk().then(Mono.<Void>fromRunnable(
                                () -> notifyStatusChange(new DeviceStatusChange(deviceId, DeviceStatus.REVOKED))));
                    }
                    return Mono.empty();
                })
                .subscribe(v -> { }, e -> log.error("Device status listener for {} stopped", deviceId, e)));
    }

    private void listenForApproval(String accountId, String deviceId) {
        replace(approvalSubscription, watch(AccountDocuments.device(accountId, deviceId))
                .concatMap(doc -> {
                    if (!doc.exists()) {
                        log.info("Device {} was deleted (denied)", deviceId);
                        return keyStorage.clearAll()
                                .then(Mono.<Void>fromRunnable(() -> {
                                    forgetUmk();
                                    notifyStatusChange(DeviceStatusChange.deleted(deviceId));
                                }));
                    }
                    DeviceRecord device = DeviceRecord.fromSnapshot(doc);
                    if (device.isApproved() && device.hasWrappedUmk()) {
                        if (hasUmk()) {
                            return Mono.empty();
                        }
                        log.info("Device {} approved, unwrapping UMK", deviceId);
                        return unwrapAndCacheUmk(device).then(Mono.<Void>fromRunnable(() -> {
                            listenForPendingApprovals(accountId);
                            notifyStatusChange(new DeviceStatusChange(deviceId, DeviceStatus.APPROVED));
                        }));
                    }
                    if (device.isRevoked()) {
                        log.info("Device {} was revoked", deviceId);
                        return clearUmk().then(Mono.<Void>fromRunnable(
                                () -> notifyStatusChange(new DeviceStatusChange(deviceId, DeviceStatus.REVOKED))));
                    }
                    return Mono.empty();
                })
                .subscribe(v -> { }, e -> log.error("Approval listener for {} stopped", deviceId, e)));
    }

    private void listenForPendingApprovals(String accountId) {
        replace(pendingApprovalsSubscription, store
                .watchQuery(AccountDocuments.devices(accountId), DeviceRecord.STATUS, DeviceStatus.PENDING.wireName())
                .retryWhen(connectivityRetry())
                .map(DeviceTrustManager::toRequests)
                .subscribe(this::publishPending, e -> log.error("Pending approvals listener stopped", e)));
    }

    private Flux<DocumentSnapshot> watch(DocumentPath path) {
        return store.watch(path).retryWhen(connectivityRetry());
    }

    private static Retry connectivityRetry() {
        return Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1))
                .maxBackoff(Duration.ofSeconds(30))
                .filter(ConnectivityException.class::isInstance);
    }

    private Mono<Void> refreshPendingApprovals(String accountId) {
        return fetchPending(accountId).doOnNext(this::publishPending).then();
    }

    private Mono<List<DeviceApprovalRequest>> fetchPending(String accountId) {
        return store.query(AccountDocuments.devices(accountId), DeviceRecord.STATUS, DeviceStatus.PENDING.wireName())
                .collectList()
                .map(DeviceTrustManager::toRequests);
    }

    private static List<DeviceApprovalRequest> toRequests(List<DocumentSnapshot> docs) {
        return docs.stream()
                .map(DeviceRecord::fromSnapshot)
                .map(DeviceApprovalRequest::fromRecord)
                .sorted(Comparator.comparing(DeviceApprovalRequest::requestedAt,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private void publishPending(List<DeviceApprovalRequest> requests) {
        pendingApprovals.emitNext(requests, EMIT_RETRY);
    }

    private void notifyStatusChange(DeviceStatusChange change) {
        if (change.isRevokedOrDeleted()) {
            wasRevoked.set(true);
        }
        statusChanges.emitNext(change, EMIT_RETRY);
    }

    private static void replace(AtomicReference<Disposable> slot, Disposable next) {
        Disposable previous = slot.getAndSet(next);
        if (previous != null) {
            previous.dispose();
        }
    }

    private static void cancel(AtomicReference<Disposable> slot) {
        Disposable previous = slot.getAndSet(null);
        if (previous != null) {
            previous.dispose();
        }
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private Mono<String> account() {
        return Mono.defer(() -> Mono.justOrEmpty(session.currentAccountId()));
    }

    private Mono<String> requireAccount() {
        return account().switchIfEmpty(Mono.error(new InvalidStateException("No account signed in")));
    }

    private Mono<Void> rejectSelf(String targetId, String action) {
        return keyStorage.getDeviceId()
                .filter(targetId::equals)
                .flatMap(self -> Mono.<Void>error(new InvalidStateException("Cannot " + action + " the current device")));
    }

    private Mono<DeviceRecord> fetch(String accountId, String deviceId) {
        return store.get(AccountDocuments.device(accountId, deviceId))
                .filter(DocumentSnapshot::exists)
                .map(DeviceRecord::fromSnapshot);
    }

    private Mono<List<DeviceRecord>> fetchAll(String accountId) {
        return store.list(AccountDocuments.devices(accountId)).map(DeviceRecord::fromSnapshot).collectList();
    }

    private Mono<Void> persistLocally(DeviceKeyPair keyPair, String deviceId, byte[] umk) {
        return keyStorage.storeKeyPair(keyPair)
                .then(keyStorage.storeDeviceId(deviceId))
                .then(umk != null ? keyStorage.cacheUmk(umk) : Mono.empty());
    }

    private Map<String, Object> approvedDocument(DeviceKeyPair keyPair, CipherText wrapped, String now) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put(DeviceRecord.NAME, identity.name());
        doc.put(DeviceRecord.PLATFORM, identity.platform());
        doc.put(DeviceRecord.PUBLIC_KEY, keyPair.publicKeyBase64());
        doc.put(DeviceRecord.WRAPPED_UMK, wrapped.ciphertext());
        doc.put(DeviceRecord.WRAPPED_UMK_NONCE, wrapped.nonce());
        doc.put(DeviceRecord.STATUS, DeviceStatus.APPROVED.wireName());
        doc.put(DeviceRecord.CREATED_AT, now);
        doc.put(DeviceRecord.APPROVED_AT, now);
        return doc;
    }

    private static Comparator<DeviceRecord> currentFirstThenNewest(String currentId) {
        Comparator<DeviceRecord> current = Comparator.comparing(d -> !d.id().equals(currentId));
        return current.thenComparing(DeviceRecord::createdAt, Comparator.nullsLast(Comparator.reverseOrder()));
    }

    private String now() {
        return clock.instant().toString();
    }
}
