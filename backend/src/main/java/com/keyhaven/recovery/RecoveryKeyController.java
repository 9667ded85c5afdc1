package com.keyhaven.recovery;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.keyhaven.error.NotFoundException;
import com.keyhaven.status.E2eeService;
import com.keyhaven.status.E2eeStatus;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/recovery-key")
public class RecoveryKeyController {

    private final RecoveryKeyManager recoveryKeyManager;
    private final E2eeService e2eeService;

    public RecoveryKeyController(RecoveryKeyManager recoveryKeyManager, E2eeService e2eeService) {
        this.recoveryKeyManager = recoveryKeyManager;
        this.e2eeService = e2eeService;
    }

    public record RecoveryKeyInfo(boolean exists, String hint) {}

    public record CreateRequest(String passphrase, String hint) {}

    public record UpdateRequest(String currentPassphrase, String newPassphrase, String hint) {}

    public record PassphraseRequest(String passphrase) {}

    public record RecoverRequest(String passphrase, boolean makePrimary) {}

    public record VerifyResponse(boolean valid) {}

    public record RecoverResponse(boolean recovered, E2eeStatus status) {}

    /** The exported record as an opaque string; see {@link RecoveryKeyManager#exportRecoveryData()}. */
    public record RecoveryData(String data) {}

    public record ImportResponse(boolean imported) {}

    @GetMapping
    public Mono<RecoveryKeyInfo> info() {
        return recoveryKeyManager.hasRecoveryKey()
                .flatMap(exists -> recoveryKeyManager.getHint()
                        .map(hint -> new RecoveryKeyInfo(exists, hint))
                        .defaultIfEmpty(new RecoveryKeyInfo(exists, null)));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Void> create(@RequestBody CreateRequest request) {
        return requirePassphrase(request.passphrase())
                .then(recoveryKeyManager.create(request.passphrase(), request.hint()))
                .then(Mono.<Void>fromRunnable(e2eeService::recoveryKeySetUp));
    }

    @PutMapping
    public Mono<Void> update(@RequestBody UpdateRequest request) {
        return requirePassphrase(request.newPassphrase())
                .then(recoveryKeyManager.update(request.currentPassphrase(), request.newPassphrase(), request.hint()));
    }

    @PostMapping("/remove")
    public Mono<Void> remove(@RequestBody PassphraseRequest request) {
        return recoveryKeyManager.remove(request.passphrase());
    }

    @PostMapping("/verify")
    public Mono<VerifyResponse> verify(@RequestBody PassphraseRequest request) {
        return recoveryKeyManager.verify(request.passphrase()).map(VerifyResponse::new);
    }

    @PostMapping("/recover")
    public Mono<RecoverResponse> recover(@RequestBody RecoverRequest request) {
        return requirePassphrase(request.passphrase())
                .then(e2eeService.recoverWithPassphrase(request.passphrase(), request.makePrimary()))
                .map(recovered -> new RecoverResponse(recovered, e2eeService.status()));
    }

    @GetMapping("/export")
    public Mono<RecoveryData> export() {
        return recoveryKeyManager.exportRecoveryData()
                .map(RecoveryData::new)
                .switchIfEmpty(Mono.error(new NotFoundException("No recovery key")));
    }

    @PostMapping("/import")
    public Mono<ImportResponse> importData(@RequestBody RecoveryData request) {
        return recoveryKeyManager.importRecoveryData(request.data()).map(ImportResponse::new);
    }

    private static Mono<Void> requirePassphrase(String passphrase) {
        return passphrase == null || passphrase.isEmpty()
                ? Mono.error(new IllegalArgumentException("Passphrase is required"))
                : Mono.empty();
    }
}
