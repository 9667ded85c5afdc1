package com.keyhaven.device;

import java.time.Instant;

/** Read-only projection of a pending device, shown to approved devices. */
public record DeviceApprovalRequest(
        String deviceId,
        String deviceName,
        String platform,
        String publicKey,
        Instant requestedAt
) {

    public static DeviceApprovalRequest fromRecord(DeviceRecord record) {
        return new DeviceApprovalRequest(record.id(), record.name(), record.platform(),
                record.publicKey(), record.createdAt());
    }
}
