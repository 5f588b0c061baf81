package quokka.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import quokka.core.model.token.RefreshToken;

@DisplayName("InMemoryRefreshTokenStore")
class InMemoryRefreshTokenStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private InMemoryRefreshTokenStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRefreshTokenStore(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static RefreshToken token(String handle, String sessionId, Instant expiresAt) {
        return new RefreshToken(
                handle, "web", "user-1", Set.of("openid"), sessionId, Map.of(), NOW, List.of(), null, null, null,
                NOW, expiresAt, expiresAt);
    }

    private void store(RefreshToken token) {
        store.store(token).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("consume()")
    class ConsumeTests {

        @Test
        @DisplayName("should hand a token out exactly once")
        void shouldConsumeOnce() {
            store(token("rt-1", "s1", NOW.plusSeconds(60)));

            assertTrue(store.consume("rt-1").await().atMost(TIMEOUT).isPresent());
            assertTrue(store.consume("rt-1").await().atMost(TIMEOUT).isEmpty());
            assertTrue(store.find("rt-1").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should remember consumed tokens for replay detection")
        void shouldKeepTombstone() {
            store(token("rt-1", "s1", NOW.plusSeconds(60)));
            store.consume("rt-1").await().atMost(TIMEOUT);

            final var consumed = store.findConsumed("rt-1").await().atMost(TIMEOUT);

            assertEquals("s1", consumed.orElseThrow().sessionId());
        }

        @Test
        @DisplayName("should forget tombstones of expired tokens")
        void shouldIgnoreExpiredTombstones() {
            store(token("rt-1", "s1", NOW));
            store.consume("rt-1").await().atMost(TIMEOUT);

            assertTrue(store.findConsumed("rt-1").await().atMost(TIMEOUT).isEmpty());
        }
    }

    @Nested
    @DisplayName("revokeSession()")
    class RevokeSessionTests {

        @Test
        @DisplayName("should revoke only the tokens of the given session")
        void shouldRevokeSession() {
            store(token("rt-1", "s1", NOW.plusSeconds(60)));
            store(token("rt-2", "s1", NOW.plusSeconds(60)));
            store(token("rt-3", "s2", NOW.plusSeconds(60)));

            final var revoked = store.revokeSession("s1").await().atMost(TIMEOUT);

            assertEquals(2, revoked);
            assertEquals(1, store.size());
            assertTrue(store.find("rt-3").await().atMost(TIMEOUT).isPresent());
        }

        @Test
        @DisplayName("should revoke nothing for a null session")
        void shouldIgnoreNullSession() {
            store(token("rt-1", null, NOW.plusSeconds(60)));

            assertEquals(0, store.revokeSession(null).await().atMost(TIMEOUT));
            assertEquals(1, store.size());
        }
    }

    @Test
    @DisplayName("should purge expired tokens and tombstones")
    void shouldPurgeExpired() {
        store(token("live", "s1", NOW.plusSeconds(60)));
        store(token("dead", "s1", NOW));
        store(token("dead-consumed", "s1", NOW));
        store.consume("dead-consumed").await().atMost(TIMEOUT);

        assertEquals(2, store.purgeExpired());
        assertEquals(1, store.size());
    }
}
