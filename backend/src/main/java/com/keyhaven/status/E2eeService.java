package com.keyhaven.status;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.keyhaven.config.KeyHavenProps;
import com.keyhaven.device.DeviceRecord;
import com.keyhaven.device.DeviceStatusChange;
import com.keyhaven.device.DeviceTrustManager;
import com.keyhaven.error.ConnectivityException;
import com.keyhaven.recovery.RecoveryKeyManager;
import com.keyhaven.storage.CachedStatus;
import com.keyhaven.storage.DeviceKeyStorage;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Drives the key custody lifecycle of this device for the signed-in account and publishes it as an
 * {@link E2eeStatus} feed.
 *
 * <p>A returning device whose cached status is {@code approved} goes straight to
 * {@link E2eeStatus#VERIFYING_IN_BACKGROUND} and is re-checked asynchronously. Only a missing,
 * revoked or unapproved server record downgrades it; connectivity failures keep it usable and the
 * check is retried after {@code keyhaven.approval.verification-retry-delay}.
 */
@Service
public class E2eeService {

    private static final Logger log = LoggerFactory.getLogger(E2eeService.class);

    private static final Sinks.EmitFailureHandler EMIT_RETRY =
            Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1));

    private final DeviceTrustManager trustManager;
    private final DeviceKeyStorage keyStorage;
    private final RecoveryKeyManager recoveryKeyManager;
    private final Duration pollInterval;
    private final Duration verificationRetryDelay;

    private final AtomicReference<E2eeStatus> status = new AtomicReference<>(E2eeStatus.NOT_INITIALIZED);
    private final AtomicReference<String> statusMessage = new AtomicReference<>("");
    private final AtomicBoolean needsRecoveryKeySetup = new AtomicBoolean();
    private final AtomicBoolean verifyingInBackground = new AtomicBoolean();
    private final Sinks.Many<E2eeStatus> statusFeed = Sinks.many().replay().latest();

    private final AtomicBoolean listenersRegistered = new AtomicBoolean();
    private final AtomicReference<Disposable> statusListener = new AtomicReference<>();
    private final AtomicReference<Disposable> approvalPoll = new AtomicReference<>();
    private final AtomicReference<Disposable> backgroundVerification = new AtomicReference<>();

    public E2eeService(DeviceTrustManager trustManager, DeviceKeyStorage keyStorage,
                       RecoveryKeyManager recoveryKeyManager, KeyHavenProps props) {
        this.trustManager = trustManager;
        this.keyStorage = keyStorage;
        this.recoveryKeyManager = recoveryKeyManager;
        this.pollInterval = props.approval().pollInterval();
        this.verificationRetryDelay = props.approval().verificationRetryDelay();
        statusFeed.emitNext(E2eeStatus.NOT_INITIALIZED, EMIT_RETRY);
    }

    // ── State ────────────────────────────────────────────────────────

    public E2eeStatus status() {
        return status.get();
    }

    /** Replays the current status, then every transition. */
    public Flux<E2eeStatus> statusChanges() {
        return statusFeed.asFlux();
    }

    public String statusMessage() {
        return statusMessage.get();
    }

    public boolean isReady() {
        return status.get().isReady();
    }

    public boolean isAvailable() {
        return trustManager.hasUmk();
    }

    /** Set after first-device setup until a recovery key is created. */
    public boolean needsRecoveryKeySetup() {
        return needsRecoveryKeySetup.get();
    }

    public void recoveryKeySetUp() {
        needsRecoveryKeySetup.set(false);
    }

    public boolean isVerifyingInBackground() {
        return verifyingInBackground.get();
    }

    public E2eeStatusView view() {
        return new E2eeStatusView(status(), statusMessage(), isReady(), isAvailable(),
                needsRecoveryKeySetup(), isVerifyingInBackground());
    }

    // ── Startup ──────────────────────────────────────────────────────

    /**
     * Enters {@link E2eeStatus#VERIFYING_IN_BACKGROUND} right away when this device has keys and a
     * cached approval.
     *
     * @return true if the fast path was taken
     */
    public Mono<Boolean> preloadCachedStatus() {
        return keyStorage.hasDeviceKeys()
                .flatMap(hasKeys -> {
                    if (!hasKeys) {
                        log.info("No device keys, full initialization needed");
                        return Mono.just(false);
                    }
                    return keyStorage.getCachedDeviceStatus()
                            .map(cached -> {
                                if (cached == CachedStatus.APPROVED) {
                                    log.info("Cached approved status, enabling fast startup");
                                    enterVerifyingInBackground();
                                    return true;
                                }
                                log.info("Cached status is {}, full initialization needed", cached.wireName());
                                return false;
                            })
                            .defaultIfEmpty(false);
                })
                .onErrorResume(e -> {
                    log.error("Error preloading cached status", e);
                    return Mono.just(false);
                });
    }

    /**
     * Runs once per session after sign-in and settles on a status. Failures end in
     * {@link E2eeStatus#ERROR}; they are not propagated.
     */
    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            log.info("Initializing key custody");
            if (status.get() == E2eeStatus.VERIFYING_IN_BACKGROUND) {
                log.info("Status already verifying in background, continuing background init");
                return continueInBackground();
            }
            message("Getting ready...");
            return clearInterruptedSignIn()
                    .then(keyStorage.setSignInProgress(true))
                    .then(keyStorage.hasDeviceKeys())
                    .flatMap(hasKeys -> hasKeys ? initializeWithKeys() : initializeWithoutKeys())
                    .then(keyStorage.setSignInProgress(false));
        }).onErrorResume(e -> {
            log.error("Initialization error", e);
            return transition(E2eeStatus.ERROR);
        });
    }

    private Mono<Void> clearInterruptedSignIn() {
        return keyStorage.wasSignInInterrupted().flatMap(interrupted -> {
            if (!interrupted) {
                return Mono.<Void>empty();
            }
            log.info("Detected interrupted sign-in, discarding cached status");
            message("Resuming setup...");
            return keyStorage.setSignInProgress(false).then(keyStorage.clearDeviceStatus());
        });
    }

    private Mono<Void> initializeWithoutKeys() {
        message("Connecting...");
        return trustManager.init().then(Mono.defer(() -> {
            log.info("New device, checking whether the account is set up");
            message("Preparing your account...");
            return registerOrRecover();
        }));
    }

    private Mono<Void> initializeWithKeys() {
        message("Checking your account...");
        return keyStorage.getCachedDeviceStatus()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(cached -> {
                    if (cached.isPresent()) {
                        log.info("Using cached status {}", cached.get().wireName());
                        switch (cached.get()) {
                            case APPROVED -> {
                                enterVerifyingInBackground();
                                return continueInBackground();
                            }
                            case PENDING -> setStatus(E2eeStatus.PENDING_APPROVAL);
                            case REVOKED -> setStatus(E2eeStatus.REVOKED);
                            default -> { }
                        }
                    }
                    message("Connecting...");
                    return trustManager.init().then(Mono.defer(this::verifyRegisteredDevice));
                });
    }

    /** This device has no keys (or lost them): set up, request approval or ask for recovery. */
    private Mono<Void> registerOrRecover() {
        return trustManager.isFirstDevice().flatMap(first -> {
            if (first) {
                log.info("First device, setting up key custody");
                message("Securing your account...");
                return setupE2ee().then();
            }
            return trustManager.hasApprovedDevices().flatMap(hasApproved -> {
                if (!hasApproved) {
                    log.info("No approved devices exist, recovery or a fresh start is needed");
                    return transition(E2eeStatus.NEEDS_RECOVERY);
                }
                return trustManager.currentDeviceMatchesPrimaryName().flatMap(matchesPrimary -> {
                    if (matchesPrimary) {
                        log.info("Device name matches the primary device, offering recovery");
                        return transition(E2eeStatus.NEEDS_RECOVERY);
                    }
                    log.info("Registering new device");
                    message("Adding this device...");
                    return trustManager.registerNewDevice()
                            .then(transition(E2eeStatus.PENDING_APPROVAL))
                            .then(Mono.<Void>fromRunnable(this::awaitApproval));
                });
            });
        });
    }

    private Mono<Void> verifyRegisteredDevice() {
        message("Verifying...");
        return currentDevice().flatMap(current -> {
            if (current.isEmpty()) {
                log.info("Device not found on server, clearing local data");
                message("Updating account...");
                return trustManager.clearLocalData().then(Mono.defer(this::registerOrRecover));
            }
            message("Almost there...");
            DeviceRecord device = current.get();
            if (device.isRevoked()) {
                log.info("Device {} is revoked", device.id());
                return transition(E2eeStatus.REVOKED);
            }
            if (device.isPending()) {
                log.info("Device {} is pending approval", device.id());
                return transition(E2eeStatus.PENDING_APPROVAL).then(Mono.<Void>fromRunnable(this::awaitApproval));
            }
            if (!device.isApproved()) {
                log.error("Device {} is in an unknown state", device.id());
                return transition(E2eeStatus.ERROR);
            }
            return trustManager.tryRetrieveUmk().flatMap(unlocked -> {
                if (!unlocked) {
                    log.error("Could not unlock the UMK for device {}", device.id());
                    return transition(E2eeStatus.ERROR);
                }
                log.info("UMK available, ready");
                return transition(E2eeStatus.READY).then(Mono.<Void>fromRunnable(this::listenForStatusChanges));
            });
        });
    }

    /**
     * Creates the UMK and registers this device as the first approved device.
     *
     * @return false if setup failed; the status is then {@link E2eeStatus#ERROR}
     */
    public Mono<Boolean> setupE2ee() {
        return Mono.defer(() -> {
            log.info("Setting up key custody for the first device");
            return trustManager.registerFirstDevice()
                    .then(transition(E2eeStatus.READY))
                    .then(Mono.fromCallable(() -> {
                        needsRecoveryKeySetup.set(true);
                        listenForStatusChanges();
                        log.info("Setup complete");
                        return true;
                    }));
        }).onErrorResume(e -> {
            log.error("Setup error", e);
            return transition(E2eeStatus.ERROR).thenReturn(false);
        });
    }

    // ── Background verification ──────────────────────────────────────

    private void enterVerifyingInBackground() {
        setStatus(E2eeStatus.VERIFYING_IN_BACKGROUND);
        verifyingInBackground.set(true);
        message("Verifying encryption...");
    }

    /** Restores the trust manager and verifies the cached approval. The cached UMK stays usable offline. */
    private Mono<Void> continueInBackground() {
        return trustManager.init()
                .onErrorResume(ConnectivityException.class, e -> {
                    log.warn("Store unreachable during startup, continuing with cached state: {}", e.getMessage());
                    return Mono.empty();
                })
                .then(Mono.<Void>fromRunnable(this::verifyInBackground));
    }

    private void verifyInBackground() {
        log.info("Starting background verification");
        verifyingInBackground.set(true);
        replace(backgroundVerification, performBackgroundVerification()
                .subscribe(v -> { }, e -> {
                    verifyingInBackground.set(false);
                    log.error("Background verification error", e);
                }));
    }

    Mono<Void> performBackgroundVerification() {
        return currentDevice()
                .flatMap(current -> {
                    if (current.isEmpty()) {
                        log.info("Device not found on server during background verification");
                        return transition(E2eeStatus.NEEDS_RECOVERY);
                    }
                    DeviceRecord device = current.get();
                    if (device.isRevoked()) {
                        log.info("Device {} was revoked (detected in background)", device.id());
                        return transition(E2eeStatus.REVOKED);
                    }
                    if (!device.isApproved()) {
                        log.info("Device {} is no longer approved (detected in background)", device.id());
                        return transition(E2eeStatus.NEEDS_RECOVERY);
                    }
                    log.info("Background verification successful, device {} approved", device.id());
                    return transition(E2eeStatus.READY).then(Mono.<Void>fromRunnable(this::listenForStatusChanges));
                })
                .doOnSuccess(v -> verifyingInBackground.set(false))
                .onErrorResume(ConnectivityException.class, e -> {
                    log.warn("Background verification could not reach the store, retrying in {}: {}",
                            verificationRetryDelay, e.getMessage());
                    verifyingInBackground.set(false);
                    return keepUsable()
                            .then(Mono.delay(verificationRetryDelay))
                            .then(Mono.defer(this::performBackgroundVerification));
                })
                .onErrorResume(e -> !(e instanceof ConnectivityException), e -> {
                    log.error("Background verification failed, keeping cached approval", e);
                    verifyingInBackground.set(false);
                    return keepUsable();
                });
    }

    private Mono<Void> keepUsable() {
        Mono<Void> ready = status.get() == E2eeStatus.VERIFYING_IN_BACKGROUND
                ? transition(E2eeStatus.READY)
                : Mono.empty();
        return ready.then(Mono.<Void>fromRunnable(this::listenForStatusChanges));
    }

    // ── Approval and revocation ──────────────────────────────────────

    /**
     * Follows the device trust feeds: a UMK arriving while pending means approval, a revoked or
     * deleted record means revocation. Registers at most once per session.
     */
    private void listenForStatusChanges() {
        if (!listenersRegistered.compareAndSet(false, true)) {
            return;
        }
        Flux<Void> approvals = trustManager.umkAvailability()
                .filter(available -> available && status.get() == E2eeStatus.PENDING_APPROVAL)
                .concatMap(available -> {
                    log.info("UMK received, device approved");
                    cancel(approvalPoll);
                    return transition(E2eeStatus.READY);
                });
        Flux<Void> revocations = trustManager.currentDeviceStatusChanges()
                .filter(DeviceStatusChange::isRevokedOrDeleted)
                .concatMap(change -> {
                    log.info("Device {} was {}", change.deviceId(), change.isDeleted() ? "deleted" : "revoked");
                    trustManager.clearRevokedFlag();
                    cancel(approvalPoll);
                    return transition(E2eeStatus.REVOKED);
                });
        replace(statusListener, Flux.merge(approvals, revocations)
                .subscribe(v -> { }, e -> log.error("Status listener stopped", e)));
    }

    /** Listens for approval, with a low-frequency poll alongside the push feed. */
    private void awaitApproval() {
        listenForStatusChanges();
        replace(approvalPoll, Flux.interval(pollInterval)
                .takeWhile(tick -> status.get() == E2eeStatus.PENDING_APPROVAL)
                .concatMap(tick -> trustManager.tryRetrieveUmk()
                        .onErrorResume(e -> {
                            log.warn("Approval poll failed: {}", e.getMessage());
                            return Mono.just(false);
                        }))
                .filter(Boolean::booleanValue)
                .next()
                .flatMap(approved -> status.get() == E2eeStatus.PENDING_APPROVAL
                        ? transition(E2eeStatus.READY)
                        : Mono.<Void>empty())
                .subscribe(v -> { }, e -> log.error("Approval poll stopped", e)));
    }

    /** Puts a revoked or deleted device back into the approval queue. */
    public Mono<Void> requestReapproval() {
        return trustManager.requestReapproval()
                .then(transition(E2eeStatus.PENDING_APPROVAL))
                .then(Mono.<Void>fromRunnable(this::awaitApproval));
    }

    /** Re-checks the device, e.g. when the client returns to the foreground. */
    public Mono<Void> refreshStatus() {
        return Mono.defer(() -> {
            E2eeStatus current = status.get();
            if (current == E2eeStatus.PENDING_APPROVAL) {
                return trustManager.isDeviceApproved()
                        .filter(Boolean::booleanValue)
                        .flatMap(approved -> trustManager.tryRetrieveUmk())
                        .filter(Boolean::booleanValue)
                        .flatMap(unlocked -> {
                            log.info("Device now approved and ready");
                            cancel(approvalPoll);
                            return transition(E2eeStatus.READY);
                        });
            }
            if (current.isReady()) {
                return trustManager.checkCurrentDeviceAuthorization().then();
            }
            return Mono.<Void>empty();
        });
    }

    // ── Recovery and reset ───────────────────────────────────────────

    /**
     * Recovers the UMK with the passphrase. With {@code makePrimary} every other device is demoted so
     * this one becomes the only trust anchor.
     *
     * @return false when there is no recovery key or the passphrase is wrong
     */
    public Mono<Boolean> recoverWithPassphrase(String passphrase, boolean makePrimary) {
        return recoveryKeyManager.recover(passphrase).flatMap(recovered -> {
            if (!recovered) {
                return Mono.just(false);
            }
            Mono<Void> primary = makePrimary ? trustManager.setCurrentDeviceAsPrimary() : Mono.empty();
            return primary
                    .then(Mono.<Void>fromRunnable(() -> cancel(approvalPoll)))
                    .then(transition(E2eeStatus.READY))
                    .then(Mono.<Void>fromRunnable(this::listenForStatusChanges))
                    .thenReturn(true);
        });
    }

    /**
     * Deletes every device record and local secret and sets up a new UMK. Content encrypted under the
     * previous UMK stays unreadable unless the old recovery passphrase is used.
     */
    public Mono<Void> startFresh() {
        return Mono.defer(() -> {
            log.info("Starting fresh, clearing all devices");
            cancelListeners();
            return trustManager.clearAllDevices()
                    .then(trustManager.clearLocalData())
                    .then(Mono.<Void>fromRunnable(() -> {
                        setStatus(E2eeStatus.NOT_INITIALIZED);
                        message("");
                    }))
                    .then(initialize())
                    .doOnSuccess(v -> log.info("Fresh start complete"));
        });
    }

    /** Sign-out teardown: removes this device's record and every local secret. */
    public Mono<Void> dispose() {
        return Mono.defer(() -> {
            cancelListeners();
            return trustManager.deleteCurrentDevice()
                    .then(trustManager.clearUmk())
                    .then(Mono.<Void>fromRunnable(trustManager::dispose))
                    .then(keyStorage.clearAll())
                    .then(Mono.<Void>fromRunnable(() -> {
                        needsRecoveryKeySetup.set(false);
                        verifyingInBackground.set(false);
                        message("");
                        setStatus(E2eeStatus.NOT_INITIALIZED);
                        log.info("Key custody disposed");
                    }));
        });
    }

    private void cancelListeners() {
        cancel(statusListener);
        cancel(approvalPoll);
        cancel(backgroundVerification);
        listenersRegistered.set(false);
    }

    // ── Helpers ──────────────────────────────────────────────────────

    private Mono<Optional<DeviceRecord>> currentDevice() {
        return trustManager.fetchCurrentDevice()
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    /** Sets the status and remembers it locally when it is worth caching. */
    private Mono<Void> transition(E2eeStatus next) {
        return Mono.defer(() -> {
            setStatus(next);
            return next.cached()
                    .map(keyStorage::cacheDeviceStatus)
                    .orElse(Mono.empty());
        });
    }

    private void setStatus(E2eeStatus next) {
        E2eeStatus previous = status.getAndSet(next);
        if (previous != next) {
            log.info("Status {} -> {}", previous, next);
            statusFeed.emitNext(next, EMIT_RETRY);
        }
    }

    private void message(String message) {
        statusMessage.set(message);
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
}
