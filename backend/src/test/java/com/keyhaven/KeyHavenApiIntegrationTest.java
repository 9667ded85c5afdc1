package com.keyhaven;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HTTP-layer tests of the agent API against the in-memory store.
 *
 * Uses @SpringBootTest(webEnvironment = RANDOM_PORT) + WebTestClient. Every test signs in to its own
 * account, so the device it creates is always the first device of that account.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
class KeyHavenApiIntegrationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<Map<String, Object>>> JSON_ARRAY = new ParameterizedTypeReference<>() {
    };

    @Autowired
    private WebTestClient webTestClient;

    // ── Helpers ───────────────────────────────────────────────────────────────

    private String signInToNewAccount() {
        String accountId = "user-" + UUID.randomUUID();
        webTestClient.post()
                .uri("/api/account/sign-in")
                .bodyValue(Map.of("accountId", accountId))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("READY");
        return accountId;
    }

    private String currentDeviceId() {
        List<Map<String, Object>> devices = webTestClient.get()
                .uri("/api/devices")
                .exchange()
                .expectStatus().isOk()
                .expectBody(JSON_ARRAY)
                .returnResult().getResponseBody();
        assertNotNull(devices);
        return (String) devices.get(0).get("id");
    }

    @AfterEach
    void signOut() {
        webTestClient.post()
                .uri("/api/account/sign-out")
                .exchange()
                .expectStatus().isOk();
    }

    // ── Account and status ────────────────────────────────────────────────────

    @Test
    void signIn_firstDevice_shouldBeReadyAndAskForRecoveryKey() {
        webTestClient.post()
                .uri("/api/account/sign-in")
                .bodyValue(Map.of("accountId", "user-" + UUID.randomUUID()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("READY")
                .jsonPath("$.ready").isEqualTo(true)
                .jsonPath("$.umkAvailable").isEqualTo(true)
                .jsonPath("$.needsRecoveryKeySetup").isEqualTo(true);

        webTestClient.get()
                .uri("/api/e2ee/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("READY");
    }

    @Test
    void signIn_blankAccount_shouldReturn400() {
        webTestClient.post()
                .uri("/api/account/sign-in")
                .bodyValue(Map.of("accountId", " "))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    void signOut_shouldResetStatus() {
        signInToNewAccount();

        webTestClient.post()
                .uri("/api/account/sign-out")
                .exchange()
                .expectStatus().isOk();

        webTestClient.get()
                .uri("/api/e2ee/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("NOT_INITIALIZED")
                .jsonPath("$.umkAvailable").isEqualTo(false);

        webTestClient.get()
                .uri("/api/devices")
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.CONFLICT)
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_state");
    }

    // ── Devices ───────────────────────────────────────────────────────────────

    @Test
    void devices_firstDevice_isListedAsMaster() {
        signInToNewAccount();

        webTestClient.get()
                .uri("/api/devices")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(1)
                .jsonPath("$[0].name").isEqualTo("Test Agent")
                .jsonPath("$[0].status").isEqualTo("APPROVED")
                .jsonPath("$[0].wrappedUmk").exists();

        webTestClient.get()
                .uri("/api/devices/master")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.master").isEqualTo(true);

        webTestClient.get()
                .uri("/api/devices/pending")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(0);
    }

    @Test
    void approve_self_shouldReturn409() {
        signInToNewAccount();
        String deviceId = currentDeviceId();

        webTestClient.post()
                .uri("/api/devices/{id}/approve", deviceId)
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.CONFLICT)
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_state");
    }

    @Test
    void approve_unknownDevice_shouldReturn404() {
        signInToNewAccount();

        webTestClient.post()
                .uri("/api/devices/{id}/approve", "no-such-device")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_found");
    }

    @Test
    void rememberDevice_defaultsToTrueAndCanBeTurnedOff() {
        signInToNewAccount();

        webTestClient.get()
                .uri("/api/devices/current/remember")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.remember").isEqualTo(true);

        webTestClient.put()
                .uri("/api/devices/current/remember")
                .bodyValue(Map.of("remember", false))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.remember").isEqualTo(false);

        webTestClient.get()
                .uri("/api/devices/current/remember")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.remember").isEqualTo(false);
    }

    // ── Notes ─────────────────────────────────────────────────────────────────

    @Test
    void notes_encryptThenDecrypt_shouldRestorePlaintext() {
        signInToNewAccount();

        Map<String, Object> encrypted = webTestClient.post()
                .uri("/api/notes/encrypt")
                .bodyValue(Map.of("id", "note-1", "title", "Groceries", "content", "[{\"insert\":\"Buy milk\\n\"}]"))
                .exchange()
                .expectStatus().isOk()
                .expectBody(JSON_OBJECT)
                .returnResult().getResponseBody();

        assertNotNull(encrypted);
        assertFalse(encrypted.containsKey("title"), "Plaintext title must not leave the agent");
        assertEquals(true, encrypted.get("e2ee_enabled"));
        assertNotNull(encrypted.get("e2ee_ciphertext"));

        webTestClient.post()
                .uri("/api/notes/decrypt")
                .bodyValue(encrypted)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.id").isEqualTo("note-1")
                .jsonPath("$.title").isEqualTo("Groceries")
                .jsonPath("$.plain_text").isEqualTo("Buy milk");
    }

    // ── Recovery key ──────────────────────────────────────────────────────────

    @Test
    void recoveryKey_lifecycle() {
        signInToNewAccount();

        webTestClient.post()
                .uri("/api/recovery-key")
                .bodyValue(Map.of("passphrase", "horse-battery-123", "hint", "the stable"))
                .exchange()
                .expectStatus().isCreated();

        webTestClient.get()
                .uri("/api/recovery-key")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.exists").isEqualTo(true)
                .jsonPath("$.hint").isEqualTo("the stable");

        webTestClient.post()
                .uri("/api/recovery-key/verify")
                .bodyValue(Map.of("passphrase", "horse-battery-123"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.valid").isEqualTo(true);

        webTestClient.post()
                .uri("/api/recovery-key/verify")
                .bodyValue(Map.of("passphrase", "wrong"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.valid").isEqualTo(false);

        webTestClient.get()
                .uri("/api/e2ee/status")
                .exchange()
                .expectBody()
                .jsonPath("$.needsRecoveryKeySetup").isEqualTo(false);

        webTestClient.get()
                .uri("/api/recovery-key/export")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.data").isNotEmpty();

        webTestClient.post()
                .uri("/api/recovery-key/remove")
                .bodyValue(Map.of("passphrase", "wrong"))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.error").isEqualTo("not_authorized");
    }

    @Test
    void recoveryKey_missingPassphrase_shouldReturn400() {
        signInToNewAccount();

        webTestClient.post()
                .uri("/api/recovery-key")
                .bodyValue(Map.of("hint", "no passphrase"))
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void recoveryKey_exportWithoutKey_shouldReturn404() {
        signInToNewAccount();

        webTestClient.get()
                .uri("/api/recovery-key/export")
                .exchange()
                .expectStatus().isNotFound();
    }
}
