package com.keyhaven.device;

/**
 * A change observed on this device's own record. {@code status} is {@code null} when the record was deleted.
 */
public record DeviceStatusChange(String deviceId, DeviceStatus status) {

    public static DeviceStatusChange deleted(String deviceId) {
        return new DeviceStatusChange(deviceId, null);
    }

    public boolean isDeleted() {
        return status == null;
    }

    /** Deletion is treated exactly like revocation. */
    public boolean isRevokedOrDeleted() {
        return status == null || status == DeviceStatus.REVOKED;
    }
}
