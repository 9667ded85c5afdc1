package com.keyhaven.device;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.keyhaven.store.InMemoryDocumentStore;

import reactor.core.Disposable;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class DeviceApprovalNotifierTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryDocumentStore store;
    private SteppingClock clock;
    private SimulatedDevice laptop;

    @BeforeEach
    void setup() {
        store = new InMemoryDocumentStore();
        clock = new SteppingClock(Instant.parse("2026-02-01T00:00:00Z"));
        laptop = new SimulatedDevice(store, "acct-9", "Laptop", clock);
        laptop.trustManager.registerFirstDevice().block();
    }

    @AfterEach
    void teardown() {
        laptop.trustManager.dispose();
    }

    private static DeviceApprovalRequest request(String id) {
        return new DeviceApprovalRequest(id, "Phone " + id, "android", "pk-" + id, Instant.now());
    }

    @Test
    void announcesEachRequestOnce() {
        DeviceApprovalNotifier notifier = new DeviceApprovalNotifier(laptop.trustManager);
        DeviceApprovalRequest first = request("a");
        DeviceApprovalRequest second = request("b");

        StepVerifier.create(notifier.newRequests().take(2))
                .then(() -> {
                    notifier.onPendingChanged(List.of(first)).block();
                    notifier.onPendingChanged(List.of(first)).block();
                    notifier.onPendingChanged(List.of(first, second)).block();
                })
                .expectNext(first)
                .expectNext(second)
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void requestThatReappearsIsAnnouncedAgain() {
        DeviceApprovalNotifier notifier = new DeviceApprovalNotifier(laptop.trustManager);
        DeviceApprovalRequest phone = request("a");

        StepVerifier.create(notifier.newRequests().take(2))
                .then(() -> {
                    notifier.onPendingChanged(List.of(phone)).block();
                    notifier.onPendingChanged(List.of()).block();
                    notifier.onPendingChanged(List.of(phone)).block();
                })
                .expectNext(phone, phone)
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void nonMasterDevicesStayQuiet() {
        SimulatedDevice phone = new SimulatedDevice(store, "acct-9", "Phone", clock);
        phone.trustManager.registerNewDevice().block();
        StepVerifier.create(phone.trustManager.umkAvailability().filter(Boolean::booleanValue).next())
                .then(() -> laptop.trustManager.approveDevice(phone.deviceId()).block())
                .expectNext(true)
                .expectComplete()
                .verify(TIMEOUT);

        DeviceApprovalNotifier notifier = new DeviceApprovalNotifier(phone.trustManager);
        List<DeviceApprovalRequest> seen = new CopyOnWriteArrayList<>();
        Disposable subscription = notifier.newRequests().subscribe(seen::add);
        try {
            notifier.onPendingChanged(List.of(request("c"))).block();
            assertTrue(seen.isEmpty(), "Only the master device announces requests");
        } finally {
            subscription.dispose();
            phone.trustManager.dispose();
        }
    }

    @Test
    void listensToThePendingFeedOnceStarted() {
        DeviceApprovalNotifier notifier = new DeviceApprovalNotifier(laptop.trustManager);
        notifier.start();
        try {
            StepVerifier.create(notifier.newRequests().next())
                    .then(() -> new SimulatedDevice(store, "acct-9", "Tablet", clock)
                            .trustManager.registerNewDevice().block())
                    .assertNext(request -> assertEquals("Tablet", request.deviceName()))
                    .expectComplete()
                    .verify(TIMEOUT);
        } finally {
            notifier.stop();
        }
    }
}
