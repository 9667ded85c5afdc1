package com.keyhaven.storage;

import java.util.Base64;
import java.util.List;

import org.springframework.stereotype.Component;

import com.keyhaven.crypto.DeviceKeyPair;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Typed view over the {@link SecureKeyStore}: this device's key pair and id, the cached UMK and
 * the small set of startup flags. Binary values are stored Base64 encoded.
 */
@Component
public class DeviceKeyStorage {

    static final String DEVICE_PRIVATE_KEY = "e2ee_device_private_key";
    static final String DEVICE_PUBLIC_KEY = "e2ee_device_public_key";
    static final String DEVICE_ID = "e2ee_device_id";
    static final String UMK_CACHE = "e2ee_umk_cache";
    static final String REMEMBER_DEVICE = "e2ee_remember_device";
    static final String DEVICE_STATUS = "e2ee_device_status";
    static final String SIGN_IN_PROGRESS = "e2ee_sign_in_progress";

    private static final List<String> ALL_KEYS = List.of(
            DEVICE_PRIVATE_KEY, DEVICE_PUBLIC_KEY, DEVICE_ID, UMK_CACHE,
            REMEMBER_DEVICE, DEVICE_STATUS, SIGN_IN_PROGRESS);

    private final SecureKeyStore store;

    public DeviceKeyStorage(SecureKeyStore store) {
        this.store = store;
    }

    // ── Device identity ──────────────────────────────────────────────

    public Mono<Void> storeKeyPair(DeviceKeyPair keyPair) {
        Base64.Encoder encoder = Base64.getEncoder();
        return store.write(DEVICE_PRIVATE_KEY, encoder.encodeToString(keyPair.privateKey()))
                .then(store.write(DEVICE_PUBLIC_KEY, encoder.encodeToString(keyPair.publicKey())));
    }

    /** Completes empty unless both halves are present. */
    public Mono<DeviceKeyPair> getKeyPair() {
        return Mono.zip(store.read(DEVICE_PUBLIC_KEY), store.read(DEVICE_PRIVATE_KEY))
                .map(t -> DeviceKeyPair.fromBase64(t.getT1(), t.getT2()));
    }

    public Mono<Void> storeDeviceId(String deviceId) {
        return store.write(DEVICE_ID, deviceId);
    }

    public Mono<String> getDeviceId() {
        return store.read(DEVICE_ID);
    }

    public Mono<Boolean> hasDeviceKeys() {
        return Mono.zip(
                        store.read(DEVICE_PRIVATE_KEY).hasElement(),
                        store.read(DEVICE_PUBLIC_KEY).hasElement(),
                        store.read(DEVICE_ID).hasElement())
                .map(t -> t.getT1() && t.getT2() && t.getT3());
    }

    // ── UMK cache ────────────────────────────────────────────────────

    public Mono<Void> cacheUmk(byte[] umk) {
        return store.write(UMK_CACHE, Base64.getEncoder().encodeToString(umk));
    }

    public Mono<byte[]> getCachedUmk() {
        return store.read(UMK_CACHE).map(Base64.getDecoder()::decode);
    }

    public Mono<Void> clearCachedUmk() {
        return store.delete(UMK_CACHE);
    }

    // ── Flags ────────────────────────────────────────────────────────

    public Mono<Void> setRememberDevice(boolean remember) {
        return store.write(REMEMBER_DEVICE, Boolean.toString(remember));
    }

    /** Defaults to {@code true} when never set. */
    public Mono<Boolean> getRememberDevice() {
        return store.read(REMEMBER_DEVICE)
                .map(v -> v.equalsIgnoreCase("true"))
                .defaultIfEmpty(true);
    }

    public Mono<Void> cacheDeviceStatus(CachedStatus status) {
        return store.write(DEVICE_STATUS, status.wireName());
    }

    public Mono<CachedStatus> getCachedDeviceStatus() {
        return store.read(DEVICE_STATUS).mapNotNull(CachedStatus::fromWireName);
    }

    public Mono<Void> clearDeviceStatus() {
        return store.delete(DEVICE_STATUS);
    }

    public Mono<Void> setSignInProgress(boolean inProgress) {
        return inProgress ? store.write(SIGN_IN_PROGRESS, "true") : store.delete(SIGN_IN_PROGRESS);
    }

    public Mono<Boolean> wasSignInInterrupted() {
        return store.read(SIGN_IN_PROGRESS).map("true"::equals).defaultIfEmpty(false);
    }

    /** Removes every KeyHaven entry from the secure store. */
    public Mono<Void> clearAll() {
        return Flux.fromIterable(ALL_KEYS).concatMap(store::delete).then();
    }
}
