package com.keyhaven.config;

import java.nio.file.Path;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keyhaven.crypto.KeyDerivation;
import com.keyhaven.device.DeviceIdentity;
import com.keyhaven.device.SystemDeviceIdentity;
import com.keyhaven.storage.EncryptedFileSecureKeyStore;
import com.keyhaven.storage.InMemorySecureKeyStore;
import com.keyhaven.storage.SecureKeyStore;
import com.keyhaven.store.DocumentStore;
import com.keyhaven.store.InMemoryDocumentStore;

/**
 * Wires the pluggable pieces selected by {@code keyhaven.*}. The Cassandra document store registers
 * itself when {@code keyhaven.store.type} is {@code cassandra}.
 */
@Configuration
public class KeyHavenConfig {

    private static final Logger log = LoggerFactory.getLogger(KeyHavenConfig.class);

    @Bean
    @ConditionalOnProperty(name = "keyhaven.store.type", havingValue = "memory")
    public DocumentStore inMemoryDocumentStore() {
        log.info("Using in-memory document store");
        return new InMemoryDocumentStore();
    }

    @Bean
    @ConditionalOnProperty(name = "keyhaven.secure-storage.type", havingValue = "memory")
    public SecureKeyStore inMemorySecureKeyStore() {
        log.warn("Using in-memory secure storage, device keys are lost on restart");
        return new InMemorySecureKeyStore();
    }

    @Bean
    @ConditionalOnProperty(name = "keyhaven.secure-storage.type", havingValue = "file", matchIfMissing = true)
    public SecureKeyStore fileSecureKeyStore(KeyHavenProps props, ObjectMapper objectMapper) {
        KeyHavenProps.SecureStorage storage = props.secureStorage();
        log.info("Using encrypted file secure storage at {}", storage.path());
        return new EncryptedFileSecureKeyStore(Path.of(storage.path()), storage.wrappingKey(), objectMapper);
    }

    @Bean
    public KeyDerivation keyDerivation(KeyHavenProps props) {
        return new KeyDerivation(props.kdf().argon2Supported());
    }

    @Bean
    public DeviceIdentity deviceIdentity(KeyHavenProps props) {
        return new SystemDeviceIdentity(props.device().name(), props.device().platform());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
