package com.keyhaven.status;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/e2ee")
public class StatusController {

    private final E2eeService e2eeService;

    public StatusController(E2eeService e2eeService) {
        this.e2eeService = e2eeService;
    }

    @GetMapping("/status")
    public Mono<E2eeStatusView> status() {
        return Mono.fromSupplier(e2eeService::view);
    }

    /** Server-sent events: the current status, then one event per transition. */
    @GetMapping(value = "/status/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<E2eeStatusView> statusStream() {
        return e2eeService.statusChanges().map(status -> e2eeService.view());
    }

    @PostMapping("/initialize")
    public Mono<E2eeStatusView> initialize() {
        return e2eeService.initialize().then(Mono.fromSupplier(e2eeService::view));
    }

    @PostMapping("/refresh")
    public Mono<E2eeStatusView> refresh() {
        return e2eeService.refreshStatus().then(Mono.fromSupplier(e2eeService::view));
    }

    /** Discards every device and the current UMK. Existing encrypted content becomes unreadable. */
    @PostMapping("/start-fresh")
    public Mono<E2eeStatusView> startFresh() {
        return e2eeService.startFresh().then(Mono.fromSupplier(e2eeService::view));
    }
}
