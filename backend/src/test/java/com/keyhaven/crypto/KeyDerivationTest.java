package com.keyhaven.crypto;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;

import org.junit.jupiter.api.Test;

import com.keyhaven.error.UnsupportedPlatformException;

import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class KeyDerivationTest {

    private static final byte[] SALT = "0123456789abcdef".getBytes();

    @Test
    void newKeysUsePbkdf2() {
        assertEquals(KdfAlgorithm.PBKDF2, new KeyDerivation(true).currentDefaultAlgorithm());
        assertEquals(KdfAlgorithm.PBKDF2, new KeyDerivation(false).currentDefaultAlgorithm());
    }

    @Test
    void pbkdf2MatchesTheJdkImplementation() throws Exception {
        SecretKeyFactory factory = SecretKeyFactory.getInstance("PBKDF2WithHmacSHA256");
        byte[] expected = factory.generateSecret(
                new PBEKeySpec("correct horse".toCharArray(), SALT, 310_000, 256)).getEncoded();

        StepVerifier.create(new KeyDerivation(true).deriveKey("correct horse", SALT, KdfAlgorithm.PBKDF2))
                .assertNext(key -> assertArrayEquals(expected, key,
                        "PBKDF2-HMAC-SHA256 with 310,000 iterations and a 256-bit output is a compatibility contract"))
                .verifyComplete();
    }

    @Test
    void argon2idIsDeterministicAndSaltDependent() {
        byte[] first = KeyDerivation.argon2id("passphrase", SALT);
        byte[] second = KeyDerivation.argon2id("passphrase", SALT);
        byte[] otherSalt = KeyDerivation.argon2id("passphrase", "fedcba9876543210".getBytes());

        assertEquals(32, first.length);
        assertArrayEquals(first, second);
        assertFalse(java.util.Arrays.equals(first, otherSalt));
    }

    @Test
    void algorithmsProduceDifferentKeys() {
        assertFalse(java.util.Arrays.equals(
                KeyDerivation.pbkdf2("passphrase", SALT),
                KeyDerivation.argon2id("passphrase", SALT)));
    }

    @Test
    void argon2idIsRefusedOnConstrainedTargets() {
        KeyDerivation constrained = new KeyDerivation(false);

        assertFalse(constrained.supports(KdfAlgorithm.ARGON2ID));
        assertTrue(constrained.supports(KdfAlgorithm.PBKDF2));
        StepVerifier.create(constrained.deriveKey("passphrase", SALT, KdfAlgorithm.ARGON2ID))
                .expectError(UnsupportedPlatformException.class)
                .verify();
    }

    @Test
    void saltsAreRandom16Bytes() {
        byte[] a = KeyDerivation.generateSalt();
        byte[] b = KeyDerivation.generateSalt();

        assertEquals(16, a.length);
        assertFalse(java.util.Arrays.equals(a, b));
    }

    @Test
    void unknownAlgorithmNamesResolveToArgon2id() {
        assertEquals(KdfAlgorithm.PBKDF2, KdfAlgorithm.fromWireName("PBKDF2"));
        assertEquals(KdfAlgorithm.ARGON2ID, KdfAlgorithm.fromWireName("argon2id"));
        assertEquals(KdfAlgorithm.ARGON2ID, KdfAlgorithm.fromWireName("scrypt"));
        assertNull(KdfAlgorithm.fromWireName(null));
    }
}
