package com.keyhaven.crypto;

import java.util.Base64;

/** X25519 key pair of one device. The private half never leaves the device's secure store. */
public record DeviceKeyPair(byte[] publicKey, byte[] privateKey) {

    public String publicKeyBase64() {
        return Base64.getEncoder().encodeToString(publicKey);
    }

    public static DeviceKeyPair fromBase64(String publicKey, String privateKey) {
        return new DeviceKeyPair(Base64.getDecoder().decode(publicKey), Base64.getDecoder().decode(privateKey));
    }
}
