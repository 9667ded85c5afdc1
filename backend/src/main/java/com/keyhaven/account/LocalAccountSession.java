package com.keyhaven.account;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import reactor.core.publisher.Mono;

/**
 * Holds the account id handed over by the client after it authenticated with the identity provider.
 */
@Component
public class LocalAccountSession implements AccountSession {

    private static final Logger log = LoggerFactory.getLogger(LocalAccountSession.class);

    private final AtomicReference<String> accountId = new AtomicReference<>();

    public Mono<Void> signIn(String id) {
        return Mono.fromRunnable(() -> {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Account id is required");
            }
            String previous = accountId.getAndSet(id);
            if (previous != null && !previous.equals(id)) {
                log.info("Switched account session from {} to {}", previous, id);
            } else {
                log.info("Signed in account {}", id);
            }
        });
    }

    @Override
    public Optional<String> currentAccountId() {
        return Optional.ofNullable(accountId.get());
    }

    @Override
    public Mono<Void> signOut() {
        return Mono.fromRunnable(() -> {
            String previous = accountId.getAndSet(null);
            if (previous != null) {
                log.info("Signed out account {}", previous);
            }
        });
    }
}
