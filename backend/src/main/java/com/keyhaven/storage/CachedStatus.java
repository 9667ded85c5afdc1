package com.keyhaven.storage;

import java.util.Arrays;

/** Last known approval outcome of this device, cached locally for fast startup. */
public enum CachedStatus {
    APPROVED("approved"),
    PENDING("pending"),
    REVOKED("revoked"),
    NEEDS_RECOVERY("needs_recovery");

    private final String wireName;

    CachedStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static CachedStatus fromWireName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(name))
                .findFirst()
                .orElse(null);
    }
}
