package com.keyhaven.storage;

import reactor.core.publisher.Mono;

/**
 * Platform secure-storage capability: an opaque string key/value store local to one device.
 * {@link #read} completes empty when the key is absent.
 */
public interface SecureKeyStore {

    Mono<String> read(String key);

    Mono<Void> write(String key, String value);

    Mono<Void> delete(String key);
}
