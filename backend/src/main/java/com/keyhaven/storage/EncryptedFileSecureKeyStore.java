package com.keyhaven.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.Security;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;

import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Secure store for targets without a native keychain: a JSON file in ordinary storage where every
 * value is itself AES-256-GCM wrapped under an application-provisioned key.
 *
 * <p>Stored value format: Base64({@code iv (12) || ciphertext || tag (16)}).
 * Values that fail to unwrap (other provisioning key, legacy plaintext) read as absent.
 */
public class EncryptedFileSecureKeyStore implements SecureKeyStore {

    static {
        if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
            Security.addProvider(new BouncyCastleProvider());
        }
    }

    private static final Logger log = LoggerFactory.getLogger(EncryptedFileSecureKeyStore.class);

    private static final String AES_ALGO = "AES/GCM/NoPadding";
    private static final int IV_SIZE = 12;
    private static final int TAG_SIZE = 128;
    private static final TypeReference<LinkedHashMap<String, String>> FILE_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final byte[] wrappingKey;
    private final ObjectMapper objectMapper;
    private final SecureRandom random = new SecureRandom();
    private final Object lock = new Object();

    public EncryptedFileSecureKeyStore(Path file, String wrappingKeyHex, ObjectMapper objectMapper) {
        this.file = file;
        this.wrappingKey = parseWrappingKey(wrappingKeyHex);
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<String> read(String key) {
        return Mono.fromCallable(() -> {
            String wrapped;
            synchronized (lock) {
                wrapped = load().get(key);
            }
            return wrapped == null ? null : unwrap(key, wrapped);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> write(String key, String value) {
        return Mono.<Void>fromRunnable(() -> {
            String wrapped = wrap(value);
            synchronized (lock) {
                Map<String, String> values = load();
                values.put(key, wrapped);
                save(values);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.<Void>fromRunnable(() -> {
            synchronized (lock) {
                Map<String, String> values = load();
                if (values.remove(key) != null) {
                    save(values);
                }
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private String wrap(String value) {
        try {
            byte[] iv = new byte[IV_SIZE];
            random.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(wrappingKey, "AES"), new GCMParameterSpec(TAG_SIZE, iv));
            byte[] ciphertext = cipher.doFinal(value.getBytes(StandardCharsets.UTF_8));

            byte[] result = new byte[IV_SIZE + ciphertext.length];
            System.arraycopy(iv, 0, result, 0, IV_SIZE);
            System.arraycopy(ciphertext, 0, result, IV_SIZE, ciphertext.length);
            return Base64.getEncoder().encodeToString(result);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to wrap secure store value", e);
        }
    }

    private String unwrap(String key, String wrapped) {
        try {
            byte[] decoded = Base64.getDecoder().decode(wrapped);
            if (decoded.length < IV_SIZE + TAG_SIZE / 8) {
                log.warn("Secure store value for {} is too short, treating as absent", key);
                return null;
            }
            Cipher cipher = Cipher.getInstance(AES_ALGO, BouncyCastleProvider.PROVIDER_NAME);
            cipher.init(Cipher.DECRYPT_MODE, new SecretKeySpec(wrappingKey, "AES"),
                    new GCMParameterSpec(TAG_SIZE, decoded, 0, IV_SIZE));
            byte[] plaintext = cipher.doFinal(decoded, IV_SIZE, decoded.length - IV_SIZE);
            return new String(plaintext, StandardCharsets.UTF_8);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("Secure store value for {} could not be unwrapped, treating as absent: {}", key, e.toString());
            return null;
        }
    }

    private Map<String, String> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(file.toFile(), FILE_TYPE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read secure store " + file, e);
        }
    }

    private void save(Map<String, String> values) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            objectMapper.writeValue(temp.toFile(), values);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write secure store " + file, e);
        }
    }

    private static byte[] parseWrappingKey(String hex) {
        if (hex == null || hex.length() != 64) {
            throw new IllegalStateException(
                    "keyhaven.secure-storage.wrapping-key must be a 64-character hex string (256 bits)");
        }
        try {
            return Hex.decode(hex);
        } catch (DecoderException e) {
            throw new IllegalStateException("keyhaven.secure-storage.wrapping-key is not valid hex", e);
        }
    }
}
