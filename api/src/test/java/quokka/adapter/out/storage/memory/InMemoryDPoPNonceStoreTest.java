package quokka.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryDPoPNonceStore")
class InMemoryDPoPNonceStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryDPoPNonceStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryDPoPNonceStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("should accept a proof id only once while it is remembered")
    void shouldMarkProofOnce() {
        assertTrue(store.tryMarkAsUsed("jti-1", Duration.ofMinutes(1)).await().atMost(TIMEOUT));
        assertFalse(store.tryMarkAsUsed("jti-1", Duration.ofMinutes(1)).await().atMost(TIMEOUT));
        assertTrue(store.tryMarkAsUsed("jti-2", Duration.ofMinutes(1)).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should accept a proof id again once its entry has lapsed")
    void shouldForgetLapsedProofs() {
        assertTrue(store.tryMarkAsUsed("jti-1", Duration.ZERO).await().atMost(TIMEOUT));
        assertTrue(store.tryMarkAsUsed("jti-1", Duration.ofMinutes(1)).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should consume issued nonces once")
    void shouldConsumeNonceOnce() {
        final var nonce = store.issueNonce(Duration.ofMinutes(5)).await().atMost(TIMEOUT);

        assertTrue(store.consumeNonce(nonce).await().atMost(TIMEOUT));
        assertFalse(store.consumeNonce(nonce).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should reject unknown, null and expired nonces")
    void shouldRejectInvalidNonces() {
        final var expired = store.issueNonce(Duration.ZERO).await().atMost(TIMEOUT);

        assertFalse(store.consumeNonce("made-up").await().atMost(TIMEOUT));
        assertFalse(store.consumeNonce(null).await().atMost(TIMEOUT));
        assertFalse(store.consumeNonce(expired).await().atMost(TIMEOUT));
    }

    @Test
    @DisplayName("should issue distinct nonces")
    void shouldIssueDistinctNonces() {
        final var first = store.issueNonce(Duration.ofMinutes(5)).await().atMost(TIMEOUT);
        final var second = store.issueNonce(Duration.ofMinutes(5)).await().atMost(TIMEOUT);

        assertNotEquals(first, second);
    }

    @Test
    @DisplayName("should purge lapsed entries")
    void shouldPurge() {
        store.tryMarkAsUsed("jti-1", Duration.ZERO).await().atMost(TIMEOUT);
        store.tryMarkAsUsed("jti-2", Duration.ofMinutes(1)).await().atMost(TIMEOUT);
        store.issueNonce(Duration.ZERO).await().atMost(TIMEOUT);

        assertEquals(2, store.purgeExpired());
    }
}
