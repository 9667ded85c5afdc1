package com.keyhaven.account;

import java.util.Optional;

import reactor.core.publisher.Mono;

/**
 * The signed-in account as seen by key custody. Authentication itself happens elsewhere.
 */
public interface AccountSession {

    Optional<String> currentAccountId();

    Mono<Void> signOut();
}
