package com.keyhaven.device;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Announces approval requests that newly appeared while this device is the master. Each request is
 * announced once; a request that leaves the pending list and comes back is announced again.
 */
@Component
public class DeviceApprovalNotifier {

    private static final Logger log = LoggerFactory.getLogger(DeviceApprovalNotifier.class);

    private final DeviceTrustManager trustManager;
    private final Set<String> announced = ConcurrentHashMap.newKeySet();
    private final Sinks.Many<DeviceApprovalRequest> requests = Sinks.many().multicast().directBestEffort();
    private final AtomicReference<Disposable> subscription = new AtomicReference<>();

    public DeviceApprovalNotifier(DeviceTrustManager trustManager) {
        this.trustManager = trustManager;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        Disposable previous = subscription.getAndSet(trustManager.pendingApprovals()
                .concatMap(this::onPendingChanged)
                .subscribe(v -> { }, e -> log.error("Approval notifier stopped", e)));
        if (previous != null) {
            previous.dispose();
        }
    }

    @PreDestroy
    public void stop() {
        Disposable current = subscription.getAndSet(null);
        if (current != null) {
            current.dispose();
        }
    }

    /** New approval requests, for the master device only. Hot, no replay. */
    public Flux<DeviceApprovalRequest> newRequests() {
        return requests.asFlux();
    }

    Mono<Void> onPendingChanged(List<DeviceApprovalRequest> pending) {
        Set<String> current = ConcurrentHashMap.newKeySet();
        pending.forEach(r -> current.add(r.deviceId()));
        announced.retainAll(current);

        List<DeviceApprovalRequest> fresh = pending.stream().filter(r -> !announced.contains(r.deviceId())).toList();
        if (fresh.isEmpty()) {
            return Mono.empty();
        }
        return trustManager.isMasterDevice()
                .filter(Boolean::booleanValue)
                .doOnNext(master -> fresh.forEach(request -> {
                    if (announced.add(request.deviceId())) {
                        log.info("New device approval request from {} ({})", request.deviceName(), request.platform());
                        requests.emitNext(request, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
                    }
                }))
                .onErrorResume(e -> {
                    log.warn("Could not determine master device for approval notification: {}", e.getMessage());
                    return Mono.empty();
                })
                .then();
    }
}
