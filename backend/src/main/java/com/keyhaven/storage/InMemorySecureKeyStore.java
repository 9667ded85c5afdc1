package com.keyhaven.storage;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import reactor.core.publisher.Mono;

/** Process-local store; stands in for a native keychain in tests and throwaway agents. */
public class InMemorySecureKeyStore implements SecureKeyStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public Mono<String> read(String key) {
        return Mono.fromSupplier(() -> values.get(key));
    }

    @Override
    public Mono<Void> write(String key, String value) {
        return Mono.fromRunnable(() -> values.put(key, value));
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromRunnable(() -> values.remove(key));
    }
}
