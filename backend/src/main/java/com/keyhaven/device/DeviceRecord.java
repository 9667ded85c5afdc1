package com.keyhaven.device;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.keyhaven.store.DocumentSnapshot;
import com.keyhaven.store.Timestamps;

/**
 * One registered device of an account, as stored under {@code users/{accountId}/devices/{id}}.
 * {@code wrappedUmk} is present only while the device is approved.
 */
public record DeviceRecord(
        String id,
        String name,
        String platform,
        String publicKey,
        String wrappedUmk,
        String wrappedUmkNonce,
        String approvedByPublicKey,
        DeviceStatus status,
        Instant createdAt,
        Instant approvedAt,
        Instant revokedAt,
        Map<String, String> deviceDetails,
        boolean recovered
) {

    public static final String NAME = "name";
    public static final String PLATFORM = "platform";
    public static final String PUBLIC_KEY = "public_key";
    public static final String WRAPPED_UMK = "wrapped_umk";
    public static final String WRAPPED_UMK_NONCE = "wrapped_umk_nonce";
    public static final String APPROVED_BY_PUBLIC_KEY = "approved_by_public_key";
    public static final String STATUS = "status";
    public static final String CREATED_AT = "created_at";
    public static final String APPROVED_AT = "approved_at";
    public static final String REVOKED_AT = "revoked_at";
    public static final String DEVICE_DETAILS = "device_details";
    public static final String RECOVERED = "recovered";

    @JsonIgnore
    public boolean isApproved() {
        return status == DeviceStatus.APPROVED;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == DeviceStatus.PENDING;
    }

    @JsonIgnore
    public boolean isRevoked() {
        return status == DeviceStatus.REVOKED;
    }

    @JsonIgnore
    public boolean hasWrappedUmk() {
        return wrappedUmk != null && wrappedUmkNonce != null;
    }

    /** Ordering key for master election: approval time, else creation time. */
    @JsonIgnore
    public Instant authorityTimestamp() {
        return approvedAt != null ? approvedAt : createdAt;
    }

    public static DeviceRecord fromSnapshot(DocumentSnapshot doc) {
        Map<String, String> details = null;
        Map<String, Object> rawDetails = doc.getMap(DEVICE_DETAILS);
        if (rawDetails != null) {
            details = new LinkedHashMap<>();
            for (Map.Entry<String, Object> e : rawDetails.entrySet()) {
                details.put(e.getKey(), e.getValue() == null ? null : e.getValue().toString());
            }
        }
        String name = doc.getString(NAME);
        String platform = doc.getString(PLATFORM);
        return new DeviceRecord(
                doc.id(),
                name != null ? name : "Unknown Device",
                platform != null ? platform : "unknown",
                doc.getString(PUBLIC_KEY),
                doc.getString(WRAPPED_UMK),
                doc.getString(WRAPPED_UMK_NONCE),
                emptyToNull(doc.getString(APPROVED_BY_PUBLIC_KEY)),
                DeviceStatus.fromWireName(doc.getString(STATUS)),
                Timestamps.parse(doc.getString(CREATED_AT)),
                Timestamps.parse(doc.getString(APPROVED_AT)),
                Timestamps.parse(doc.getString(REVOKED_AT)),
                details,
                doc.getBoolean(RECOVERED));
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
