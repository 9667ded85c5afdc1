package com.keyhaven.device;

import java.time.Clock;
import java.util.Map;

import com.keyhaven.account.LocalAccountSession;
import com.keyhaven.storage.DeviceKeyStorage;
import com.keyhaven.storage.InMemorySecureKeyStore;
import com.keyhaven.store.DocumentStore;

/**
 * One device agent of an account: its own secure store and session around a shared document store.
 */
public class SimulatedDevice {

    public final InMemorySecureKeyStore secureStore;
    public final DeviceKeyStorage keyStorage;
    public final LocalAccountSession session = new LocalAccountSession();
    public final DeviceTrustManager trustManager;

    private final DocumentStore store;
    private final String accountId;
    private final String name;
    private final Clock clock;

    public SimulatedDevice(DocumentStore store, String accountId, String name, Clock clock) {
        this(store, new InMemorySecureKeyStore(), accountId, name, clock);
    }

    private SimulatedDevice(DocumentStore store, InMemorySecureKeyStore secureStore, String accountId,
                            String name, Clock clock) {
        this.store = store;
        this.secureStore = secureStore;
        this.accountId = accountId;
        this.name = name;
        this.clock = clock;
        this.keyStorage = new DeviceKeyStorage(secureStore);
        this.trustManager = new DeviceTrustManager(store, keyStorage, session,
                new FixedIdentity(name, "linux"), clock);
        session.signIn(accountId).block();
    }

    /** The same local secrets in a new process: listeners stopped, nothing held in memory. */
    public SimulatedDevice restart() {
        trustManager.dispose();
        return new SimulatedDevice(store, secureStore, accountId, name, clock);
    }

    public String deviceId() {
        return keyStorage.getDeviceId().block();
    }

    public byte[] umk() {
        return trustManager.getUmk().orElseThrow();
    }

    record FixedIdentity(String name, String platform) implements DeviceIdentity {
        @Override
        public Map<String, String> details() {
            return Map.of("os", "Test OS", "host_name", name);
        }
    }
}
