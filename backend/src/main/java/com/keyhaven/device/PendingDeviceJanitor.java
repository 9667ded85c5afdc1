package com.keyhaven.device;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.keyhaven.account.AccountSession;
import com.keyhaven.config.KeyHavenProps;
import com.keyhaven.store.AccountDocuments;
import com.keyhaven.store.DocumentStore;
import com.keyhaven.store.WriteBatch;

import reactor.core.publisher.Mono;

/**
 * Deletes abandoned approval requests: pending records older than
 * {@code keyhaven.pending-cleanup.max-age}, or without a creation time. Runs for the signed-in
 * account and only on an approved device.
 */
@Component
@ConditionalOnProperty(name = "keyhaven.pending-cleanup.enabled", havingValue = "true", matchIfMissing = true)
public class PendingDeviceJanitor {

    private static final Logger log = LoggerFactory.getLogger(PendingDeviceJanitor.class);

    private final DocumentStore store;
    private final AccountSession session;
    private final DeviceTrustManager trustManager;
    private final Clock clock;
    private final Duration maxAge;

    public PendingDeviceJanitor(DocumentStore store, AccountSession session, DeviceTrustManager trustManager,
                                Clock clock, KeyHavenProps props) {
        this.store = store;
        this.session = session;
        this.trustManager = trustManager;
        this.clock = clock;
        this.maxAge = props.pendingCleanup().maxAge();
    }

    @Scheduled(cron = "${keyhaven.pending-cleanup.cron:0 0 3 * * *}", zone = "UTC")
    public Mono<Void> scheduledCleanup() {
        return cleanupExpiredPendingDevices()
                .onErrorResume(e -> {
                    log.error("Error during pending device cleanup", e);
                    return Mono.empty();
                })
                .then();
    }

    /** @return the number of deleted pending records */
    public Mono<Integer> cleanupExpiredPendingDevices() {
        return Mono.justOrEmpty(session.currentAccountId())
                .filterWhen(accountId -> trustManager.isDeviceApproved())
                .flatMap(this::cleanup)
                .defaultIfEmpty(0);
    }

    private Mono<Integer> cleanup(String accountId) {
        Instant threshold = clock.instant().minus(maxAge);
        log.info("Cleaning up pending devices of account {} created before {}", accountId, threshold);
        return store.query(AccountDocuments.devices(accountId), DeviceRecord.STATUS, DeviceStatus.PENDING.wireName())
                .map(DeviceRecord::fromSnapshot)
                .filter(device -> device.createdAt() == null || device.createdAt().isBefore(threshold))
                .collectList()
                .flatMap(expired -> {
                    if (expired.isEmpty()) {
                        return Mono.just(0);
                    }
                    WriteBatch batch = new WriteBatch();
                    expired.forEach(device -> batch.delete(AccountDocuments.device(accountId, device.id())));
                    return store.commit(batch)
                            .doOnSuccess(v -> log.info("Deleted {} expired pending devices of account {}",
                                    expired.size(), accountId))
                            .thenReturn(expired.size());
                });
    }
}
