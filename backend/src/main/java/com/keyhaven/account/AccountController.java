package com.keyhaven.account;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.keyhaven.status.E2eeService;
import com.keyhaven.status.E2eeStatusView;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/account")
public class AccountController {

    private final LocalAccountSession session;
    private final E2eeService e2eeService;

    public AccountController(LocalAccountSession session, E2eeService e2eeService) {
        this.session = session;
        this.e2eeService = e2eeService;
    }

    /**
     * Starts a session and initializes key custody. Signing in to a different account first tears
     * down the previous one, as on sign-out.
     */
    @PostMapping("/sign-in")
    public Mono<E2eeStatusView> signIn(@RequestBody SignInRequest request) {
        if (request.accountId() == null || request.accountId().isBlank()) {
            return Mono.error(new IllegalArgumentException("Account id is required"));
        }
        Mono<Void> switchAccount = Mono.justOrEmpty(session.currentAccountId())
                .filter(current -> !current.equals(request.accountId()))
                .flatMap(current -> e2eeService.dispose());
        return switchAccount
                .then(session.signIn(request.accountId()))
                .then(e2eeService.preloadCachedStatus())
                .then(e2eeService.initialize())
                .then(Mono.fromSupplier(e2eeService::view));
    }

    /** Removes this device's record and local secrets, then ends the session. */
    @PostMapping("/sign-out")
    public Mono<Void> signOut() {
        return e2eeService.dispose().then(session.signOut());
    }
}
