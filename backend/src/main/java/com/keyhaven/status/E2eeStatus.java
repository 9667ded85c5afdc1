package com.keyhaven.status;

import java.util.Optional;

import com.keyhaven.storage.CachedStatus;

/** Lifecycle of key custody on this device for the signed-in account. */
public enum E2eeStatus {
    NOT_INITIALIZED(null),
    /** First device, the UMK has not been created yet. */
    NOT_SET_UP(null),
    PENDING_APPROVAL(CachedStatus.PENDING),
    REVOKED(CachedStatus.REVOKED),
    /** No usable approval path: recover with the passphrase or start fresh. */
    NEEDS_RECOVERY(CachedStatus.NEEDS_RECOVERY),
    READY(CachedStatus.APPROVED),
    /** Usable like {@link #READY} while the cached approval is re-checked against the server. */
    VERIFYING_IN_BACKGROUND(null),
    ERROR(null);

    private final CachedStatus cached;

    E2eeStatus(CachedStatus cached) {
        this.cached = cached;
    }

    /** Payloads can be encrypted and decrypted. */
    public boolean isReady() {
        return this == READY || this == VERIFYING_IN_BACKGROUND;
    }

    /** The value persisted locally for fast startup, if this status is worth remembering. */
    Optional<CachedStatus> cached() {
        return Optional.ofNullable(cached);
    }
}
