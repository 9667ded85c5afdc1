package com.keyhaven.crypto;

import java.util.Base64;

import org.junit.jupiter.api.Test;

import com.keyhaven.error.AuthenticationFailureException;

import static org.junit.jupiter.api.Assertions.*;

class KeyExchangeTest {

    @Test
    void keyPairHas32ByteHalves() {
        DeviceKeyPair keyPair = KeyExchange.generateKeyPair();

        assertEquals(32, keyPair.publicKey().length);
        assertEquals(32, keyPair.privateKey().length);
        assertEquals(keyPair.publicKeyBase64(), Base64.getEncoder().encodeToString(keyPair.publicKey()));
    }

    @Test
    void sharedSecretIsCommutative() {
        DeviceKeyPair alice = KeyExchange.generateKeyPair();
        DeviceKeyPair bob = KeyExchange.generateKeyPair();

        byte[] aliceSide = KeyExchange.deriveSharedSecret(alice.privateKey(), bob.publicKey());
        byte[] bobSide = KeyExchange.deriveSharedSecret(bob.privateKey(), alice.publicKey());

        assertArrayEquals(aliceSide, bobSide, "ECDH(a, B) must equal ECDH(b, A)");
        assertEquals(32, aliceSide.length);
    }

    @Test
    void differentPeersGiveDifferentSecrets() {
        DeviceKeyPair alice = KeyExchange.generateKeyPair();
        DeviceKeyPair bob = KeyExchange.generateKeyPair();
        DeviceKeyPair carol = KeyExchange.generateKeyPair();

        assertFalse(java.util.Arrays.equals(
                KeyExchange.deriveSharedSecret(alice.privateKey(), bob.publicKey()),
                KeyExchange.deriveSharedSecret(alice.privateKey(), carol.publicKey())));
    }

    // ─── UMK wraps ───────────────────────────────────────────────────────────

    @Test
    void crossDeviceWrapOpensOnlyForTheIntendedDevice() {
        byte[] umk = CryptoRandom.generateUserMasterKey();
        DeviceKeyPair approver = KeyExchange.generateKeyPair();
        DeviceKeyPair pending = KeyExchange.generateKeyPair();
        DeviceKeyPair outsider = KeyExchange.generateKeyPair();

        CipherText wrapped = MasterKeyWrap.wrap(umk,
                KeyExchange.deriveSharedSecret(approver.privateKey(), pending.publicKey()));

        byte[] unwrapped = MasterKeyWrap.unwrap(wrapped.ciphertext(), wrapped.nonce(),
                KeyExchange.deriveSharedSecret(pending.privateKey(), approver.publicKey()));
        assertArrayEquals(umk, unwrapped);

        assertThrows(AuthenticationFailureException.class, () -> MasterKeyWrap.unwrap(
                wrapped.ciphertext(), wrapped.nonce(),
                KeyExchange.deriveSharedSecret(outsider.privateKey(), approver.publicKey())));
    }

    @Test
    void selfWrapOpensWithOwnKeyPair() {
        byte[] umk = CryptoRandom.generateUserMasterKey();
        DeviceKeyPair device = KeyExchange.generateKeyPair();

        CipherText wrapped = MasterKeyWrap.wrapForSelf(umk, device);

        byte[] secret = KeyExchange.deriveSharedSecret(device.privateKey(), device.publicKey());
        assertArrayEquals(umk, MasterKeyWrap.unwrap(wrapped.ciphertext(), wrapped.nonce(), secret));
    }

    @Test
    void wrappedPlaintextIsBase64OfTheUmk() {
        byte[] umk = CryptoRandom.generateUserMasterKey();
        byte[] key = CryptoRandom.nextBytes(32);

        CipherText wrapped = MasterKeyWrap.wrap(umk, key);

        String inner = AuthenticatedCipher.decryptString(wrapped.ciphertext(), wrapped.nonce(), key);
        assertEquals(Base64.getEncoder().encodeToString(umk), inner,
                "Wrap format: AEAD over the UTF-8 bytes of base64(UMK)");
    }
}
