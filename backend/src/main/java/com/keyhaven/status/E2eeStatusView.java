package com.keyhaven.status;

/** Snapshot of the orchestrator state returned to clients. */
public record E2eeStatusView(
        E2eeStatus status,
        String message,
        boolean ready,
        boolean umkAvailable,
        boolean needsRecoveryKeySetup,
        boolean verifyingInBackground
) {}
