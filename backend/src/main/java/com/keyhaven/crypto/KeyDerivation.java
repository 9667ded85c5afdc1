package com.keyhaven.crypto;

import java.nio.charset.StandardCharsets;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.Argon2BytesGenerator;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.Argon2Parameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.keyhaven.error.UnsupportedPlatformException;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Passphrase key derivation for recovery keys.
 *
 * <p>All parameters below are a compatibility contract: every recovery record ever written was derived
 * with them, and changing any of them makes those records unrecoverable.
 *
 * <p>Derivation runs on a worker scheduler, never on the caller's thread. Argon2id needs 64 MiB and is
 * refused outright on targets configured as memory-constrained.
 */
public class KeyDerivation {

    private static final Logger log = LoggerFactory.getLogger(KeyDerivation.class);

    public static final int KEY_SIZE = 32;
    public static final int SALT_SIZE = 16;

    public static final int PBKDF2_ITERATIONS = 310_000;

    public static final int ARGON2_ITERATIONS = 3;
    public static final int ARGON2_MEMORY_KIB = 65_536;
    public static final int ARGON2_PARALLELISM = 4;

    private final boolean argon2Supported;
    private final Scheduler scheduler;

    public KeyDerivation(boolean argon2Supported, Scheduler scheduler) {
        this.argon2Supported = argon2Supported;
        this.scheduler = scheduler;
    }

    public KeyDerivation(boolean argon2Supported) {
        this(argon2Supported, Schedulers.boundedElastic());
    }

    /** Algorithm used for every newly created recovery key. */
    public KdfAlgorithm currentDefaultAlgorithm() {
        return KdfAlgorithm.PBKDF2;
    }

    public boolean supports(KdfAlgorithm algorithm) {
        return algorithm != KdfAlgorithm.ARGON2ID || argon2Supported;
    }

    public Mono<byte[]> deriveKey(String passphrase, byte[] salt, KdfAlgorithm algorithm) {
        if (!supports(algorithm)) {
            return Mono.error(new UnsupportedPlatformException(
                    "Argon2id recovery is not supported on this device. Use a different device to recover."));
        }
        return Mono.fromCallable(() -> {
                    long started = System.nanoTime();
                    byte[] key = algorithm == KdfAlgorithm.PBKDF2 ? pbkdf2(passphrase, salt) : argon2id(passphrase, salt);
                    log.debug("Derived key with {} in {} ms", algorithm, (System.nanoTime() - started) / 1_000_000);
                    return key;
                })
                .subscribeOn(scheduler);
    }

    public static byte[] generateSalt() {
        return CryptoRandom.nextBytes(SALT_SIZE);
    }

    // --- PBKDF2-HMAC-SHA256 ---

    static byte[] pbkdf2(String passphrase, byte[] salt) {
        PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
        generator.init(passphrase.getBytes(StandardCharsets.UTF_8), salt, PBKDF2_ITERATIONS);
        return ((KeyParameter) generator.generateDerivedParameters(KEY_SIZE * 8)).getKey();
    }

    // --- Argon2id ---

    static byte[] argon2id(String passphrase, byte[] salt) {
        Argon2Parameters parameters = new Argon2Parameters.Builder(Argon2Parameters.ARGON2_id)
                .withVersion(Argon2Parameters.ARGON2_VERSION_13)
                .withIterations(ARGON2_ITERATIONS)
                .withMemoryAsKB(ARGON2_MEMORY_KIB)
                .withParallelism(ARGON2_PARALLELISM)
                .withSalt(salt)
                .build();

        Argon2BytesGenerator generator = new Argon2BytesGenerator();
        generator.init(parameters);
        byte[] key = new byte[KEY_SIZE];
        generator.generateBytes(passphrase.getBytes(StandardCharsets.UTF_8), key);
        return key;
    }
}
