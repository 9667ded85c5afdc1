package com.keyhaven.crypto;

import java.security.SecureRandom;

import org.bouncycastle.crypto.AsymmetricCipherKeyPair;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.generators.X25519KeyPairGenerator;
import org.bouncycastle.crypto.params.X25519KeyGenerationParameters;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

/**
 * Curve25519 (X25519) key generation and raw ECDH.
 *
 * The shared secret is used directly as an AEAD key with no HKDF step. Every device already in the
 * field derives wrap keys this way, so changing it would need a versioned wrap format.
 */
public final class KeyExchange {

    private KeyExchange() {
    }

    public static DeviceKeyPair generateKeyPair() {
        X25519KeyPairGenerator generator = new X25519KeyPairGenerator();
        generator.init(new X25519KeyGenerationParameters(new SecureRandom()));
        AsymmetricCipherKeyPair keyPair = generator.generateKeyPair();
        return new DeviceKeyPair(
                ((X25519PublicKeyParameters) keyPair.getPublic()).getEncoded(),
                ((X25519PrivateKeyParameters) keyPair.getPrivate()).getEncoded());
    }

    /** ECDH(privateKey, remotePublicKey), 32 bytes. */
    public static byte[] deriveSharedSecret(byte[] privateKey, byte[] remotePublicKey) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(new X25519PrivateKeyParameters(privateKey, 0));
        byte[] secret = new byte[agreement.getAgreementSize()];
        agreement.calculateAgreement(new X25519PublicKeyParameters(remotePublicKey, 0), secret, 0);
        return secret;
    }
}
