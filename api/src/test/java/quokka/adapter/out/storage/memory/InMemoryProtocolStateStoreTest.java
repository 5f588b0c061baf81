package quokka.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryProtocolStateStore")
class InMemoryProtocolStateStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryProtocolStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryProtocolStateStore(Clock.fixed(NOW, ZoneOffset.UTC), Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("should return stored state under its correlation id")
    void shouldStoreAndGet() {
        final var correlationId = store.store("ciba", Map.of("auth_req_id", "req-1"), null)
                .await()
                .atMost(TIMEOUT);

        final var state = store.get(correlationId).await().atMost(TIMEOUT).orElseThrow();

        assertEquals("ciba", state.protocol());
        assertEquals("req-1", state.payload().get("auth_req_id"));
        assertEquals(NOW.plus(Duration.ofMinutes(10)), state.expiresAt());
    }

    @Test
    @DisplayName("should honour an explicit lifetime")
    void shouldHonourExplicitLifetime() {
        final var correlationId = store.store("ciba", Map.of(), Duration.ofSeconds(30)).await().atMost(TIMEOUT);

        assertEquals(
                NOW.plusSeconds(30),
                store.get(correlationId).await().atMost(TIMEOUT).orElseThrow().expiresAt());
    }

    @Test
    @DisplayName("should hide expired state")
    void shouldHideExpiredState() {
        final var correlationId = store.store("ciba", Map.of(), Duration.ZERO).await().atMost(TIMEOUT);

        assertTrue(store.get(correlationId).await().atMost(TIMEOUT).isEmpty());
        assertEquals(1, store.purgeExpired());
    }

    @Test
    @DisplayName("should forget removed state")
    void shouldRemove() {
        final var correlationId = store.store("ciba", Map.of(), null).await().atMost(TIMEOUT);

        store.remove(correlationId).await().atMost(TIMEOUT);

        assertTrue(store.get(correlationId).await().atMost(TIMEOUT).isEmpty());
    }
}
