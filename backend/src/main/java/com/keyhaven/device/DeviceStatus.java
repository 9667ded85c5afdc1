package com.keyhaven.device;

import java.util.Arrays;

public enum DeviceStatus {
    /** Waiting for an approved device to wrap the UMK for it. */
    PENDING("pending"),
    APPROVED("approved"),
    REVOKED("revoked");

    private final String wireName;

    DeviceStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Unknown or missing values read as {@link #PENDING}. */
    public static DeviceStatus fromWireName(String name) {
        return Arrays.stream(values())
                .filter(s -> s.wireName.equals(name))
                .findFirst()
                .orElse(PENDING);
    }
}
