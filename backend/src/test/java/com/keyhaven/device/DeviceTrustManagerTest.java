package com.keyhaven.device;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.keyhaven.crypto.KeyExchange;
import com.keyhaven.crypto.MasterKeyWrap;
import com.keyhaven.error.InvalidStateException;
import com.keyhaven.error.NotAuthorizedException;
import com.keyhaven.error.NotFoundException;
import com.keyhaven.store.AccountDocuments;
import com.keyhaven.store.InMemoryDocumentStore;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Several device agents of one account sharing a document store.
 */
class DeviceTrustManagerTest {

    private static final String ACCOUNT = "acct-42";
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryDocumentStore store;
    private SteppingClock clock;
    private final List<SimulatedDevice> devices = new ArrayList<>();

    @BeforeEach
    void setup() {
        store = new InMemoryDocumentStore();
        clock = new SteppingClock(Instant.parse("2026-01-01T00:00:00Z"));
    }

    @AfterEach
    void teardown() {
        devices.forEach(d -> d.trustManager.dispose());
    }

    private SimulatedDevice device(String name) {
        SimulatedDevice device = new SimulatedDevice(store, ACCOUNT, name, clock);
        devices.add(device);
        return device;
    }

    private DeviceRecord serverRecord(String deviceId) {
        return DeviceRecord.fromSnapshot(store.get(AccountDocuments.device(ACCOUNT, deviceId)).block());
    }

    /** Registers {@code pending} and has {@code approver} approve it, waiting until the UMK arrives. */
    private void approve(SimulatedDevice approver, SimulatedDevice pending) {
        pending.trustManager.registerNewDevice().block();
        String pendingId = pending.deviceId();
        StepVerifier.create(pending.trustManager.umkAvailability().filter(Boolean::booleanValue).next())
                .then(() -> approver.trustManager.approveDevice(pendingId).block())
                .expectNext(true)
                .expectComplete()
                .verify(TIMEOUT);
    }

    // ── First device ─────────────────────────────────────────────────

    @Test
    void firstDeviceCreatesUmkAndWrapsItForItself() {
        SimulatedDevice laptop = device("Laptop");
        assertTrue(laptop.trustManager.isFirstDevice().block(), "Empty account should report first device");

        laptop.trustManager.registerFirstDevice().block();

        assertTrue(laptop.trustManager.hasUmk());
        assertFalse(laptop.trustManager.isFirstDevice().block());
        assertTrue(laptop.trustManager.isDeviceApproved().block());
        assertTrue(laptop.trustManager.isMasterDevice().block());

        DeviceRecord record = serverRecord(laptop.deviceId());
        assertEquals(DeviceStatus.APPROVED, record.status());
        assertEquals("Laptop", record.name());
        assertTrue(record.hasWrappedUmk(), "First device must carry a self-wrapped UMK");
        assertNull(record.approvedByPublicKey());
        assertEquals(record.createdAt(), record.approvedAt());

        var keyPair = laptop.keyStorage.getKeyPair().block();
        byte[] unwrapped = MasterKeyWrap.unwrap(record.wrappedUmk(), record.wrappedUmkNonce(),
                KeyExchange.deriveSharedSecret(keyPair.privateKey(), keyPair.publicKey()));
        assertArrayEquals(laptop.umk(), unwrapped);
        assertArrayEquals(laptop.umk(), laptop.keyStorage.getCachedUmk().block(), "UMK should be cached locally");
    }

    @Test
    void initRestoresUmkFromTheLocalCache() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        byte[] umk = laptop.umk();

        SimulatedDevice restarted = laptop.restart();
        devices.add(restarted);
        assertFalse(restarted.trustManager.hasUmk());

        restarted.trustManager.init().block();

        assertArrayEquals(umk, restarted.umk());
    }

    @Test
    void initClearsLocalKeysWhenTheServerRecordVanished() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        laptop.trustManager.dispose();
        store.delete(AccountDocuments.device(ACCOUNT, laptop.deviceId())).block();

        laptop.trustManager.init().block();

        assertFalse(laptop.trustManager.hasUmk());
        assertFalse(laptop.keyStorage.hasDeviceKeys().block());
        assertNull(laptop.keyStorage.getDeviceId().block());
    }

    // ── Pending registration and approval ────────────────────────────

    @Test
    void newDeviceRegistersAsPendingWithoutWrappedUmk() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");

        phone.trustManager.registerNewDevice().block();

        DeviceRecord record = serverRecord(phone.deviceId());
        assertEquals(DeviceStatus.PENDING, record.status());
        assertFalse(record.hasWrappedUmk());
        assertNotNull(record.publicKey());
        assertTrue(phone.trustManager.isDevicePending().block());
        assertFalse(phone.trustManager.hasUmk());

        List<DeviceApprovalRequest> pending = laptop.trustManager.getPendingApprovals().block();
        assertEquals(1, pending.size());
        assertEquals(phone.deviceId(), pending.get(0).deviceId());
        assertEquals("Phone", pending.get(0).deviceName());
    }

    @Test
    void approvalDeliversTheSameUmkToTheNewDevice() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");

        approve(laptop, phone);

        assertArrayEquals(laptop.umk(), phone.umk(), "Approved device must hold the account UMK");
        DeviceRecord record = serverRecord(phone.deviceId());
        assertEquals(DeviceStatus.APPROVED, record.status());
        assertEquals(laptop.keyStorage.getKeyPair().block().publicKeyBase64(), record.approvedByPublicKey());
        assertNotNull(record.approvedAt());
        assertTrue(laptop.trustManager.getPendingApprovals().block().isEmpty());
    }

    @Test
    void approvedDeviceCanUnwrapAfterRestartWithoutCache() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);
        phone.keyStorage.clearCachedUmk().block();

        SimulatedDevice restarted = phone.restart();
        devices.add(restarted);

        assertTrue(restarted.trustManager.tryRetrieveUmk().block());
        assertArrayEquals(laptop.umk(), restarted.umk());
    }

    @Test
    void registeringTwiceReusesThePendingRecord() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");

        phone.trustManager.registerNewDevice().block();
        String firstId = phone.deviceId();
        phone.trustManager.registerNewDevice().block();

        assertEquals(firstId, phone.deviceId());
        assertEquals(2, store.list(AccountDocuments.devices(ACCOUNT)).count().block());
    }

    @Test
    void interruptedRegistrationWithTheSameNameIsReused() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        phone.trustManager.registerNewDevice().block();
        String abandonedId = phone.deviceId();
        String abandonedKey = serverRecord(abandonedId).publicKey();

        // same machine, local keys lost
        SimulatedDevice phoneAgain = device("Phone");
        phoneAgain.trustManager.registerNewDevice().block();

        assertEquals(abandonedId, phoneAgain.deviceId());
        assertNotEquals(abandonedKey, serverRecord(abandonedId).publicKey(), "Reused record should get the new key");
        assertEquals(2, store.list(AccountDocuments.devices(ACCOUNT)).count().block());
    }

    @Test
    void approveRequiresUmk() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        phone.trustManager.registerNewDevice().block();
        SimulatedDevice tablet = device("Tablet");
        tablet.trustManager.registerNewDevice().block();

        StepVerifier.create(tablet.trustManager.approveDevice(phone.deviceId()))
                .expectError(NotAuthorizedException.class)
                .verify();
    }

    @Test
    void approveRejectsSelfUnknownAndNonPendingTargets() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);

        StepVerifier.create(laptop.trustManager.approveDevice(laptop.deviceId()))
                .expectError(InvalidStateException.class)
                .verify();
        StepVerifier.create(laptop.trustManager.approveDevice("no-such-device"))
                .expectError(NotFoundException.class)
                .verify();
        StepVerifier.create(laptop.trustManager.approveDevice(phone.deviceId()))
                .expectErrorMatches(e -> e instanceof InvalidStateException
                        && e.getMessage().contains("not pending"))
                .verify();
    }

    // ── Revocation ───────────────────────────────────────────────────

    @Test
    void revokedDeviceLosesItsUmkAndIsNotified() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);
        String phoneId = phone.deviceId();

        StepVerifier.create(phone.trustManager.currentDeviceStatusChanges()
                        .filter(DeviceStatusChange::isRevokedOrDeleted)
                        .next())
                .then(() -> laptop.trustManager.revokeDevice(phoneId).block())
                .assertNext(change -> {
                    assertEquals(phoneId, change.deviceId());
                    assertTrue(change.isDeleted(), "Hard revocation deletes the record");
                })
                .expectComplete()
                .verify(TIMEOUT);

        assertFalse(phone.trustManager.hasUmk());
        assertTrue(phone.trustManager.wasRevoked());
        assertFalse(phone.trustManager.deviceExistsOnServer().block());
        assertTrue(laptop.trustManager.hasUmk(), "Revoking another device must not affect the approver");
    }

    @Test
    void revokeRejectsSelfAndRequiresUmk() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        phone.trustManager.registerNewDevice().block();

        StepVerifier.create(laptop.trustManager.revokeDevice(laptop.deviceId()))
                .expectError(InvalidStateException.class)
                .verify();
        StepVerifier.create(phone.trustManager.revokeDevice(laptop.deviceId()))
                .expectError(NotAuthorizedException.class)
                .verify();
    }

    @Test
    void checkAuthorizationReportsRevokedRecords() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);
        phone.trustManager.dispose();

        store.update(AccountDocuments.device(ACCOUNT, phone.deviceId()),
                Map.of(DeviceRecord.STATUS, DeviceStatus.REVOKED.wireName())).block();

        assertFalse(phone.trustManager.checkCurrentDeviceAuthorization().block());
        assertFalse(phone.trustManager.hasUmk());
        assertTrue(phone.trustManager.wasRevoked());
        assertTrue(laptop.trustManager.checkCurrentDeviceAuthorization().block());
    }

    @Test
    void resetPutsDeviceBackToPending() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);

        laptop.trustManager.resetDeviceToPending(phone.deviceId()).block();

        DeviceRecord record = serverRecord(phone.deviceId());
        assertEquals(DeviceStatus.PENDING, record.status());
        assertFalse(record.hasWrappedUmk());
        assertNull(record.approvedAt());
        assertNull(record.approvedByPublicKey());
    }

    @Test
    void reapprovalAfterDeletionRegistersAgain() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);
        String oldId = phone.deviceId();
        StepVerifier.create(phone.trustManager.currentDeviceStatusChanges().filter(DeviceStatusChange::isDeleted).next())
                .then(() -> laptop.trustManager.revokeDevice(oldId).block())
                .expectNextCount(1)
                .expectComplete()
                .verify(TIMEOUT);

        phone.trustManager.requestReapproval().block();

        assertFalse(phone.trustManager.hasUmk());
        assertTrue(phone.trustManager.isDevicePending().block());
        assertNotEquals(oldId, phone.deviceId());
    }

    // ── Master device ────────────────────────────────────────────────

    @Test
    void earliestApprovedDeviceIsMaster() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);

        assertTrue(laptop.trustManager.isMasterDevice().block());
        assertFalse(phone.trustManager.isMasterDevice().block());
        assertEquals(laptop.deviceId(), phone.trustManager.getPrimaryDevice().block().id());
    }

    @Test
    void deviceWithThePrimaryNameIsRecognized() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();

        assertTrue(device("LAPTOP").trustManager.currentDeviceMatchesPrimaryName().block());
        assertFalse(device("Phone").trustManager.currentDeviceMatchesPrimaryName().block());
    }

    @Test
    void becomingPrimaryRevokesApprovedAndDeletesPendingDevices() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        approve(laptop, phone);
        SimulatedDevice tablet = device("Tablet");
        tablet.trustManager.registerNewDevice().block();
        String laptopId = laptop.deviceId();
        String tabletId = tablet.deviceId();

        StepVerifier.create(laptop.trustManager.currentDeviceStatusChanges().next())
                .then(() -> phone.trustManager.setCurrentDeviceAsPrimary().block())
                .assertNext(change -> assertEquals(DeviceStatus.REVOKED, change.status()))
                .expectComplete()
                .verify(TIMEOUT);

        assertFalse(laptop.trustManager.hasUmk(), "Revoked device must drop its UMK");
        DeviceRecord revoked = serverRecord(laptopId);
        assertEquals(DeviceStatus.REVOKED, revoked.status());
        assertNotNull(revoked.revokedAt());
        assertFalse(revoked.hasWrappedUmk(), "Revoked record must not keep its wrapped UMK");
        assertNull(revoked.wrappedUmkNonce());
        assertNull(revoked.approvedByPublicKey());
        assertFalse(store.get(AccountDocuments.device(ACCOUNT, tabletId)).block().exists());
        assertTrue(phone.trustManager.isMasterDevice().block());

        SimulatedDevice restartedLaptop = laptop.restart();
        devices.add(restartedLaptop);
        StepVerifier.create(restartedLaptop.trustManager.unwrapAndCacheUmk(serverRecord(laptopId)))
                .expectError(InvalidStateException.class)
                .verify(TIMEOUT);
        assertFalse(restartedLaptop.trustManager.hasUmk());
    }

    @Test
    void unwrapRejectsARevokedRecordEvenIfItStillCarriesAWrap() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        String laptopId = laptop.deviceId();
        store.update(AccountDocuments.device(ACCOUNT, laptopId),
                Map.of(DeviceRecord.STATUS, DeviceStatus.REVOKED.wireName())).block();
        DeviceRecord stale = serverRecord(laptopId);
        assertTrue(stale.hasWrappedUmk());

        SimulatedDevice restarted = laptop.restart();
        devices.add(restarted);

        StepVerifier.create(restarted.trustManager.unwrapAndCacheUmk(stale))
                .expectError(InvalidStateException.class)
                .verify(TIMEOUT);
        assertFalse(restarted.trustManager.hasUmk());
    }

    @Test
    void devicesAreListedCurrentFirstThenNewest() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        phone.trustManager.registerNewDevice().block();
        SimulatedDevice tablet = device("Tablet");
        tablet.trustManager.registerNewDevice().block();

        List<String> names = laptop.trustManager.getDevices().block().stream().map(DeviceRecord::name).toList();

        assertEquals(List.of("Laptop", "Tablet", "Phone"), names);
    }

    // ── Recovery and teardown ────────────────────────────────────────

    @Test
    void recoveredDeviceReplacesItsStaleRecord() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        SimulatedDevice phone = device("Phone");
        phone.trustManager.registerNewDevice().block();
        String staleId = phone.deviceId();

        phone.trustManager.registerRecoveredDevice(laptop.umk()).block();

        assertNotEquals(staleId, phone.deviceId());
        assertFalse(store.get(AccountDocuments.device(ACCOUNT, staleId)).block().exists());
        DeviceRecord record = serverRecord(phone.deviceId());
        assertTrue(record.recovered());
        assertEquals(DeviceStatus.APPROVED, record.status());
        assertArrayEquals(laptop.umk(), phone.umk());
    }

    @Test
    void clearAllDevicesEmptiesTheAccount() {
        SimulatedDevice laptop = device("Laptop");
        laptop.trustManager.registerFirstDevice().block();
        device("Phone").trustManager.registerNewDevice().block();

        laptop.trustManager.clearAllDevices().block();

        assertTrue(laptop.trustManager.isFirstDevice().block());
        assertFalse(laptop.trustManager.hasApprovedDevices().block());
    }

    @Test
    void operationsWithoutAccountFail() {
        SimulatedDevice laptop = device("Laptop");
        laptop.session.signOut().block();

        StepVerifier.create(laptop.trustManager.registerFirstDevice())
                .expectError(InvalidStateException.class)
                .verify();
        assertFalse(laptop.trustManager.isFirstDevice().block(), "No account means no first-device decision");
    }
}
