package com.keyhaven.device;

import java.util.List;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.keyhaven.config.KeyHavenProps;
import com.keyhaven.error.NotAuthorizedException;
import com.keyhaven.status.E2eeService;
import com.keyhaven.storage.DeviceKeyStorage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Device management for the client. Approving, revoking and resetting other devices is reserved to
 * the master device unless {@code keyhaven.approval.require-master} is off.
 */
@RestController
@RequestMapping("/api/devices")
public class DeviceController {

    private final DeviceTrustManager trustManager;
    private final DeviceApprovalNotifier notifier;
    private final E2eeService e2eeService;
    private final DeviceKeyStorage keyStorage;
    private final boolean requireMaster;

    public DeviceController(DeviceTrustManager trustManager, DeviceApprovalNotifier notifier,
                            E2eeService e2eeService, DeviceKeyStorage keyStorage, KeyHavenProps props) {
        this.trustManager = trustManager;
        this.notifier = notifier;
        this.e2eeService = e2eeService;
        this.keyStorage = keyStorage;
        this.requireMaster = props.approval().requireMaster();
    }

    public record MasterDeviceResponse(boolean master) {}

    public record RememberDevice(boolean remember) {}

    @GetMapping
    public Mono<List<DeviceRecord>> getDevices() {
        return trustManager.getDevices();
    }

    @GetMapping("/master")
    public Mono<MasterDeviceResponse> isMaster() {
        return trustManager.isMasterDevice().map(MasterDeviceResponse::new);
    }

    @GetMapping("/pending")
    public Mono<List<DeviceApprovalRequest>> getPending() {
        return trustManager.getPendingApprovals();
    }

    /** Server-sent events: the pending list each time it changes. */
    @GetMapping(value = "/pending/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<List<DeviceApprovalRequest>> pendingStream() {
        return trustManager.pendingApprovals();
    }

    /** Server-sent events: one event per newly arrived request, on the master device only. */
    @GetMapping(value = "/pending/notifications", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<DeviceApprovalRequest> pendingNotifications() {
        return notifier.newRequests();
    }

    @PostMapping("/{id}/approve")
    public Mono<Void> approve(@PathVariable String id) {
        return requireMaster().then(trustManager.approveDevice(id));
    }

    @DeleteMapping("/{id}")
    public Mono<Void> revoke(@PathVariable String id) {
        return requireMaster().then(trustManager.revokeDevice(id));
    }

    @PostMapping("/{id}/reset")
    public Mono<Void> reset(@PathVariable String id) {
        return requireMaster().then(trustManager.resetDeviceToPending(id));
    }

    @PostMapping("/current/reapproval")
    public Mono<Void> requestReapproval() {
        return e2eeService.requestReapproval();
    }

    /** The "remember this device" preference the client shows while waiting for approval. */
    @GetMapping("/current/remember")
    public Mono<RememberDevice> getRememberDevice() {
        return keyStorage.getRememberDevice().map(RememberDevice::new);
    }

    @PutMapping("/current/remember")
    public Mono<RememberDevice> setRememberDevice(@RequestBody RememberDevice request) {
        return keyStorage.setRememberDevice(request.remember())
                .then(keyStorage.getRememberDevice())
                .map(RememberDevice::new);
    }

    /** Demotes every other device. Any device holding the UMK may do this, e.g. right after recovery. */
    @PostMapping("/current/primary")
    public Mono<Void> makePrimary() {
        if (!trustManager.hasUmk()) {
            return Mono.error(new NotAuthorizedException("Only an approved device can become primary"));
        }
        return trustManager.setCurrentDeviceAsPrimary();
    }

    private Mono<Void> requireMaster() {
        if (!requireMaster) {
            return Mono.empty();
        }
        return trustManager.isMasterDevice().flatMap(master -> master
                ? Mono.<Void>empty()
                : Mono.<Void>error(new NotAuthorizedException("Only the master device can manage other devices")));
    }
}
