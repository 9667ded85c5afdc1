package com.keyhaven.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Agent configuration under {@code keyhaven.*}. Missing sections fall back to the defaults below.
 */
@ConfigurationProperties(prefix = "keyhaven")
public record KeyHavenProps(
        Store store,
        SecureStorage secureStorage,
        Kdf kdf,
        Device device,
        Approval approval,
        PendingCleanup pendingCleanup
) {

    public KeyHavenProps {
        store = store == null ? new Store(null, null) : store;
        secureStorage = secureStorage == null ? new SecureStorage(null, null, null) : secureStorage;
        kdf = kdf == null ? new Kdf(null) : kdf;
        device = device == null ? new Device(null, null) : device;
        approval = approval == null ? new Approval(null, null, null) : approval;
        pendingCleanup = pendingCleanup == null ? new PendingCleanup(null, null, null) : pendingCleanup;
    }

    public static KeyHavenProps defaults() {
        return new KeyHavenProps(null, null, null, null, null, null);
    }

    /** Remote document store adapter: {@code cassandra} or {@code memory}. */
    public record Store(String type, Duration watchPollInterval) {
        public Store {
            type = type == null ? "cassandra" : type;
            watchPollInterval = watchPollInterval == null ? Duration.ofSeconds(5) : watchPollInterval;
        }
    }

    /** Local secure store: {@code file} (wrapped values) or {@code memory}. */
    public record SecureStorage(String type, String path, String wrappingKey) {
        public SecureStorage {
            type = type == null ? "file" : type;
            path = path == null ? System.getProperty("user.home") + "/.keyhaven/secure-store.json" : path;
        }
    }

    public record Kdf(Boolean argon2Supported) {
        public Kdf {
            argon2Supported = argon2Supported == null ? Boolean.TRUE : argon2Supported;
        }
    }

    /** Overrides for the detected device name and platform. */
    public record Device(String name, String platform) {}

    public record Approval(Duration pollInterval, Duration verificationRetryDelay, Boolean requireMaster) {
        public Approval {
            pollInterval = pollInterval == null ? Duration.ofSeconds(3) : pollInterval;
            verificationRetryDelay = verificationRetryDelay == null ? Duration.ofSeconds(30) : verificationRetryDelay;
            requireMaster = requireMaster == null ? Boolean.TRUE : requireMaster;
        }
    }

    public record PendingCleanup(Boolean enabled, Duration maxAge, String cron) {
        public PendingCleanup {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            maxAge = maxAge == null ? Duration.ofHours(24) : maxAge;
            cron = cron == null ? "0 0 3 * * *" : cron;
        }
    }
}
