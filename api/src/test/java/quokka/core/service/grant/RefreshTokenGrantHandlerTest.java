package quokka.core.service.grant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import quokka.adapter.out.storage.memory.InMemoryRefreshTokenStore;
import quokka.core.model.client.Client;
import quokka.core.model.client.RefreshTokenExpiration;
import quokka.core.model.client.RefreshTokenUsage;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.TokenRequest;
import quokka.core.model.token.RefreshToken;

@DisplayName("RefreshTokenGrantHandler")
class RefreshTokenGrantHandlerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    private InMemoryRefreshTokenStore store;
    private RefreshTokenGrantHandler handler;

    private final Client oneTimeClient = Client.builder("web")
            .secret("secret")
            .allowedGrantTypes(Set.of(GrantTypes.REFRESH_TOKEN))
            .allowedScopes(Set.of("openid", "profile", "api.read"))
            .build();

    @BeforeEach
    void setUp() {
        store = new InMemoryRefreshTokenStore(clock);
        handler = new RefreshTokenGrantHandler(store, clock);
    }

    private RefreshToken token(String handle, String sessionId, String thumbprint, Instant expiresAt) {
        return new RefreshToken(
                handle,
                "web",
                "user-1",
                Set.of("openid", "profile", "api.read"),
                sessionId,
                Map.of("tenant_role", "reader"),
                NOW.minusSeconds(600),
                List.of("pwd"),
                null,
                null,
                thumbprint,
                NOW.minusSeconds(600),
                NOW.plusSeconds(86_400),
                expiresAt);
    }

    private void save(RefreshToken token) {
        store.store(token).await().atMost(TIMEOUT);
    }

    private TokenRequest request(String handle, String scope, String thumbprint) {
        final var parameters = new HashMap<String, String>();
        parameters.put("refresh_token", handle);
        if (scope != null) {
            parameters.put("scope", scope);
        }
        return new TokenRequest(
                GrantTypes.REFRESH_TOKEN, "web", null, parameters, null, "POST", "https://t/token", thumbprint);
    }

    private GrantResult refresh(TokenRequest request, Client client) {
        return handler.handle(request, client).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("one-time tokens")
    class OneTimeTests {

        @Test
        @DisplayName("should consume the token and request a replacement")
        void shouldConsumeAndRotate() {
            final var token = token("rt-1", "s-1", null, NOW.plusSeconds(3600));
            save(token);

            final var result = refresh(request("rt-1", null, null), oneTimeClient);

            assertTrue(result.success());
            assertTrue(result.issueRefreshToken());
            assertSame(token, result.presentedRefreshToken());
            assertEquals(Map.of("tenant_role", "reader"), result.claims());
            assertTrue(store.find("rt-1").await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should reject a second use and revoke the session")
        void shouldRejectReuseAndRevokeSession() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));
            save(token("rt-2", "s-1", null, NOW.plusSeconds(3600)));
            save(token("rt-3", "s-other", null, NOW.plusSeconds(3600)));

            assertTrue(refresh(request("rt-1", null, null), oneTimeClient).success());
            final var replay = refresh(request("rt-1", null, null), oneTimeClient);

            assertEquals(OAuthError.INVALID_GRANT, replay.error());
            assertTrue(store.find("rt-2").await().atMost(TIMEOUT).isEmpty());
            assertTrue(store.find("rt-3").await().atMost(TIMEOUT).isPresent());
        }

        @Test
        @DisplayName("should keep the token usable after a request with a widened scope")
        void shouldKeepTokenAfterScopeRejection() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));
            save(token("rt-2", "s-1", null, NOW.plusSeconds(3600)));

            final var rejected = refresh(request("rt-1", "openid api.write", null), oneTimeClient);
            final var retry = refresh(request("rt-1", null, null), oneTimeClient);

            assertEquals(OAuthError.INVALID_SCOPE, rejected.error());
            assertTrue(retry.success());
            assertTrue(store.find("rt-2").await().atMost(TIMEOUT).isPresent());
        }

        @Test
        @DisplayName("should keep the token usable after a request with the wrong DPoP key")
        void shouldKeepTokenAfterDpopRejection() {
            save(token("rt-1", "s-1", "thumb-a", NOW.plusSeconds(3600)));

            assertEquals(OAuthError.INVALID_GRANT, refresh(request("rt-1", null, "thumb-b"), oneTimeClient).error());
            assertTrue(refresh(request("rt-1", null, "thumb-a"), oneTimeClient).success());
        }

        @Test
        @DisplayName("should keep the token usable after another client presents it")
        void shouldKeepTokenAfterClientMismatch() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));
            final var other = Client.builder("other")
                    .secret("s")
                    .allowedGrantTypes(Set.of(GrantTypes.REFRESH_TOKEN))
                    .build();

            assertEquals(OAuthError.INVALID_GRANT, refresh(request("rt-1", null, null), other).error());
            assertTrue(refresh(request("rt-1", null, null), oneTimeClient).success());
        }

        @Test
        @DisplayName("should let exactly one of many concurrent refreshes succeed")
        void shouldRedeemOnceUnderConcurrency() throws Exception {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));
            final var threads = 8;
            final var start = new CountDownLatch(1);
            final var executor = Executors.newFixedThreadPool(threads);
            try {
                final var futures = new ArrayList<Future<GrantResult>>();
                for (int i = 0; i < threads; i++) {
                    final Callable<GrantResult> attempt = () -> {
                        start.await();
                        return refresh(request("rt-1", null, null), oneTimeClient);
                    };
                    futures.add(executor.submit(attempt));
                }
                start.countDown();

                var successes = 0;
                for (final var future : futures) {
                    final var result = future.get();
                    if (result.success()) {
                        successes++;
                    } else {
                        assertEquals(OAuthError.INVALID_GRANT, result.error());
                    }
                }
                assertEquals(1, successes);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("reusable tokens")
    class ReusableTests {

        private final Client reuseClient = oneTimeClient.toBuilder()
                .refreshTokenUsage(RefreshTokenUsage.REUSE)
                .build();

        @Test
        @DisplayName("should accept the same token repeatedly without rotating it")
        void shouldAllowReuse() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));

            final var first = refresh(request("rt-1", null, null), reuseClient);
            final var second = refresh(request("rt-1", null, null), reuseClient);

            assertTrue(first.success());
            assertTrue(second.success());
            assertFalse(second.issueRefreshToken());
        }

        @Test
        @DisplayName("should rotate when expiry is sliding")
        void shouldRotateWhenSliding() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));
            final var sliding = reuseClient.toBuilder()
                    .refreshTokenExpiration(RefreshTokenExpiration.SLIDING)
                    .build();

            assertTrue(refresh(request("rt-1", null, null), sliding).issueRefreshToken());
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("should require refresh_token")
        void shouldRequireToken() {
            final var request = new TokenRequest(
                    GrantTypes.REFRESH_TOKEN, "web", null, Map.of(), null, "POST", "https://t/token", null);

            assertEquals(OAuthError.INVALID_REQUEST, refresh(request, oneTimeClient).error());
        }

        @Test
        @DisplayName("should reject expired tokens")
        void shouldRejectExpired() {
            save(token("rt-1", "s-1", null, NOW.minusSeconds(1)));

            assertEquals(OAuthError.INVALID_GRANT, refresh(request("rt-1", null, null), oneTimeClient).error());
        }

        @Test
        @DisplayName("should allow narrowing scopes")
        void shouldNarrowScopes() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));

            final var result = refresh(request("rt-1", "openid api.read", null), oneTimeClient);

            assertEquals(Set.of("openid", "api.read"), result.scopes());
        }

        @Test
        @DisplayName("should reject widening scopes")
        void shouldRejectWidening() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));

            final var result = refresh(request("rt-1", "openid api.write", null), oneTimeClient);

            assertEquals(OAuthError.INVALID_SCOPE, result.error());
        }

        @Test
        @DisplayName("should reject tokens of another client")
        void shouldRejectOtherClient() {
            save(token("rt-1", "s-1", null, NOW.plusSeconds(3600)));
            final var other = Client.builder("other")
                    .secret("s")
                    .allowedGrantTypes(Set.of(GrantTypes.REFRESH_TOKEN))
                    .build();

            assertEquals(OAuthError.INVALID_GRANT, refresh(request("rt-1", null, null), other).error());
        }

        @Test
        @DisplayName("should require the bound DPoP key")
        void shouldEnforceDpopBinding() {
            save(token("rt-1", "s-1", "thumb-a", NOW.plusSeconds(3600)));
            save(token("rt-2", "s-2", "thumb-a", NOW.plusSeconds(3600)));

            assertEquals(OAuthError.INVALID_GRANT, refresh(request("rt-1", null, "thumb-b"), oneTimeClient).error());
            final var bound = refresh(request("rt-2", null, "thumb-a"), oneTimeClient);
            assertTrue(bound.success());
            assertEquals("thumb-a", bound.dpopKeyThumbprint());
        }
    }
}
