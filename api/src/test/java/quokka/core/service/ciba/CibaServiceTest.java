package quokka.core.service.ciba;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.Set;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import quokka.adapter.out.storage.memory.InMemoryCibaRequestStore;
import quokka.adapter.out.storage.memory.InMemoryProtocolStateStore;
import quokka.core.config.CibaConfig;
import quokka.core.model.ciba.CibaAuthenticationRequest;
import quokka.core.model.ciba.CibaPollOutcome;
import quokka.core.model.ciba.CibaResult;
import quokka.core.model.ciba.CibaStatus;
import quokka.core.model.client.CibaDeliveryMode;
import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.user.UserAccount;
import quokka.core.port.out.CibaUserNotificationService;
import quokka.core.port.out.ClientNotificationSender;
import quokka.core.port.out.ClientStore;
import quokka.core.port.out.TokenMetrics;
import quokka.core.port.out.UserDirectory;
import quokka.core.service.token.IssuedTokenPersistence;
import quokka.core.service.token.IssuedTokenVerifier;
import quokka.core.service.token.TokenService;

@DisplayName("CibaService")
@ExtendWith(MockitoExtension.class)
class CibaServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final UserAccount ALICE =
            new UserAccount("user-alice", "alice", "alice@example.com", true, false, false);

    @Mock
    private UserDirectory users;

    @Mock
    private ClientStore clients;

    @Mock
    private IssuedTokenVerifier tokenVerifier;

    @Mock
    private CibaUserNotificationService userNotifications;

    @Mock
    private ClientNotificationSender clientNotifications;

    @Mock
    private TokenService tokenService;

    @Mock
    private IssuedTokenPersistence tokenPersistence;

    @Mock
    private TokenMetrics metrics;

    @Mock
    private CibaConfig config;

    private InMemoryCibaRequestStore requests;
    private InMemoryProtocolStateStore protocolStates;
    private CibaService service;

    private final Client client = Client.builder("ciba-app")
            .secret("secret")
            .allowedGrantTypes(Set.of(GrantTypes.CIBA))
            .allowedScopes(Set.of("openid", "profile"))
            .cibaEnabled(true)
            .cibaRequestLifetime(300)
            .cibaPollingInterval(5)
            .build();

    @BeforeEach
    void setUp() {
        final var clock = Clock.fixed(NOW, ZoneOffset.UTC);
        requests = new InMemoryCibaRequestStore(clock);
        protocolStates = new InMemoryProtocolStateStore(clock, Duration.ofMinutes(10));
        service = serviceAt(NOW);

        lenient().when(config.bindingMessageMaxLength()).thenReturn(20);
        lenient().when(userNotifications.notifyUser(any(), anyString())).thenReturn(Uni.createFrom().voidItem());
        lenient()
                .when(users.findByLoginHint("alice@example.com"))
                .thenReturn(Uni.createFrom().item(Optional.of(ALICE)));
        lenient().when(users.findByLoginHint("nobody")).thenReturn(Uni.createFrom().item(Optional.empty()));
    }

    private CibaService serviceAt(Instant now) {
        return new CibaService(
                requests,
                protocolStates,
                users,
                clients,
                tokenVerifier,
                userNotifications,
                clientNotifications,
                tokenService,
                tokenPersistence,
                metrics,
                config,
                Clock.fixed(now, ZoneOffset.UTC));
    }

    private static CibaAuthenticationRequest loginHint(String hint) {
        return new CibaAuthenticationRequest("openid profile", hint, null, null, null, null, null, null, null, null);
    }

    private CibaResult.Accepted accept(CibaAuthenticationRequest request, Client as) {
        final var result = service.authenticate(request, as).await().atMost(TIMEOUT);
        return assertInstanceOf(CibaResult.Accepted.class, result);
    }

    private OAuthError reject(CibaAuthenticationRequest request, Client as) {
        final var result = service.authenticate(request, as).await().atMost(TIMEOUT);
        return assertInstanceOf(CibaResult.Rejected.class, result).error();
    }

    @Nested
    @DisplayName("authenticate()")
    class AuthenticateTests {

        @Test
        @DisplayName("should start a pending request and notify the user")
        void shouldStartRequest() {
            final var accepted = accept(loginHint("alice@example.com"), client);

            assertEquals(300, accepted.response().expiresIn());
            assertEquals(5, accepted.response().interval());
            final var stored = requests.find(accepted.response().authReqId())
                    .await()
                    .atMost(TIMEOUT)
                    .orElseThrow();
            assertEquals(CibaStatus.PENDING, stored.status());
            assertEquals("user-alice", stored.hintSubjectId());
            assertEquals(Set.of("openid", "profile"), stored.scopes());
            verify(userNotifications).notifyUser(any(), eq(stored.correlationId()));
            verify(metrics).recordCibaRequest("accepted");
        }

        @Test
        @DisplayName("should cap requested_expiry at the client's lifetime")
        void shouldHonorShorterRequestedExpiry() {
            final var request = new CibaAuthenticationRequest(
                    "openid", "alice@example.com", null, null, null, null, 60, null, null, null);

            assertEquals(60, accept(request, client).response().expiresIn());
        }

        @Test
        @DisplayName("should reject more than one hint")
        void shouldRejectTwoHints() {
            final var request = new CibaAuthenticationRequest(
                    "openid", "alice@example.com", null, "eyJ.id.token", null, null, null, null, null, null);

            assertEquals(OAuthError.INVALID_REQUEST, reject(request, client));
        }

        @Test
        @DisplayName("should reject a request without any hint")
        void shouldRejectNoHint() {
            assertEquals(OAuthError.INVALID_REQUEST, reject(loginHint(null), client));
        }

        @Test
        @DisplayName("should require the openid scope")
        void shouldRequireOpenid() {
            final var request = new CibaAuthenticationRequest(
                    "profile", "alice@example.com", null, null, null, null, null, null, null, null);

            assertEquals(OAuthError.INVALID_SCOPE, reject(request, client));
        }

        @Test
        @DisplayName("should reject unknown users")
        void shouldRejectUnknownUser() {
            assertEquals(OAuthError.UNKNOWN_USER_ID, reject(loginHint("nobody"), client));
        }

        @Test
        @DisplayName("should reject long binding messages")
        void shouldRejectLongBindingMessage() {
            final var request = new CibaAuthenticationRequest(
                    "openid", "alice@example.com", null, null, "this message is far too long", null, null, null,
                    null, null);

            assertEquals(OAuthError.INVALID_BINDING_MESSAGE, reject(request, client));
        }

        @Test
        @DisplayName("should reject clients without CIBA enabled")
        void shouldRejectDisabledClient() {
            final var disabled = client.toBuilder().cibaEnabled(false).build();

            assertEquals(OAuthError.UNAUTHORIZED_CLIENT, reject(loginHint("alice@example.com"), disabled));
        }

        @Test
        @DisplayName("should require a user code when the client demands one")
        void shouldRequireUserCode() {
            final var strict = client.toBuilder().cibaRequireUserCode(true).build();

            assertEquals(OAuthError.MISSING_USER_CODE, reject(loginHint("alice@example.com"), strict));
        }

        @Test
        @DisplayName("should require a notification token in ping mode")
        void shouldRequireNotificationToken() {
            final var ping = client.toBuilder()
                    .cibaDeliveryMode(CibaDeliveryMode.PING)
                    .cibaNotificationEndpoint(URI.create("https://client.test/cb"))
                    .build();

            assertEquals(OAuthError.INVALID_REQUEST, reject(loginHint("alice@example.com"), ping));
        }

        @Test
        @DisplayName("should accept the request when user notification fails")
        void shouldSurviveNotificationFailure() {
            when(userNotifications.notifyUser(any(), anyString()))
                    .thenReturn(Uni.createFrom().failure(new IllegalStateException("sms gateway down")));

            accept(loginHint("alice@example.com"), client);
        }
    }

    @Nested
    @DisplayName("pollStatus()")
    class PollTests {

        @Test
        @DisplayName("should report pending then slow_down within the interval")
        void shouldEnforceInterval() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            assertEquals(CibaPollOutcome.PENDING, poll(authReqId, NOW.plusSeconds(1)));
            assertEquals(CibaPollOutcome.SLOW_DOWN, poll(authReqId, NOW.plusSeconds(4)));
            assertEquals(CibaPollOutcome.PENDING, poll(authReqId, NOW.plusSeconds(6)));
        }

        @Test
        @DisplayName("should expire requests lazily")
        void shouldExpireLazily() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            assertEquals(CibaPollOutcome.EXPIRED, poll(authReqId, NOW.plusSeconds(300)));
            assertEquals(
                    CibaStatus.EXPIRED,
                    requests.find(authReqId).await().atMost(TIMEOUT).orElseThrow().status());
        }

        @Test
        @DisplayName("should refuse polls from another client")
        void shouldRejectOtherClient() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            final var outcome = service.pollStatus(authReqId, "other").await().atMost(TIMEOUT).outcome();

            assertEquals(CibaPollOutcome.CLIENT_MISMATCH, outcome);
        }

        @Test
        @DisplayName("should report unknown ids")
        void shouldReportUnknown() {
            assertEquals(CibaPollOutcome.UNKNOWN, poll("missing", NOW));
        }

        private CibaPollOutcome poll(String authReqId, Instant at) {
            return serviceAt(at).pollStatus(authReqId, "ciba-app").await().atMost(TIMEOUT).outcome();
        }
    }

    @Nested
    @DisplayName("approve() and deny()")
    class DecisionTests {

        @Test
        @DisplayName("should approve once and let the grant redeem it once")
        void shouldApproveAndRedeemOnce() {
            final var accepted = accept(loginHint("alice@example.com"), client);
            final var authReqId = accepted.response().authReqId();

            assertEquals(CibaStatus.APPROVED, service.approve(authReqId, "user-alice", "s-1").await().atMost(TIMEOUT));

            final var poll = service.pollStatus(authReqId, "ciba-app").await().atMost(TIMEOUT);
            assertEquals(CibaPollOutcome.APPROVED, poll.outcome());
            assertEquals("user-alice", poll.request().subjectId());
            assertTrue(service.complete(authReqId).await().atMost(TIMEOUT));
            assertEquals(false, service.complete(authReqId).await().atMost(TIMEOUT));
            assertTrue(protocolStates.get(accepted.request().correlationId()).await().atMost(TIMEOUT).isEmpty());
        }

        @Test
        @DisplayName("should keep answering decisions after the grant redeemed the request")
        void shouldAnswerDecisionsAfterRedemption() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            service.approve(authReqId, "user-alice", "s-1").await().atMost(TIMEOUT);
            assertTrue(service.complete(authReqId).await().atMost(TIMEOUT));

            assertEquals(CibaStatus.APPROVED, service.approve(authReqId, "user-alice", "s-1").await().atMost(TIMEOUT));
            assertEquals(CibaStatus.APPROVED, service.deny(authReqId).await().atMost(TIMEOUT));
            final var stored = requests.find(authReqId).await().atMost(TIMEOUT).orElseThrow();
            assertTrue(stored.isRedeemed());
            assertEquals(NOW, stored.redeemedAt());
        }

        @Test
        @DisplayName("should report a denial on every poll")
        void shouldReportDenialRepeatedly() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();
            service.deny(authReqId).await().atMost(TIMEOUT);

            assertEquals(CibaPollOutcome.DENIED, pollOutcome(authReqId, NOW.plusSeconds(6)));
            assertEquals(CibaPollOutcome.DENIED, pollOutcome(authReqId, NOW.plusSeconds(12)));
            assertEquals(CibaStatus.DENIED, service.deny(authReqId).await().atMost(TIMEOUT));
        }

        private CibaPollOutcome pollOutcome(String authReqId, Instant at) {
            return serviceAt(at).pollStatus(authReqId, "ciba-app").await().atMost(TIMEOUT).outcome();
        }

        @Test
        @DisplayName("should not let a denied request be approved")
        void shouldKeepDenial() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            assertEquals(CibaStatus.DENIED, service.deny(authReqId).await().atMost(TIMEOUT));
            assertEquals(CibaStatus.DENIED, service.approve(authReqId, "user-alice", null).await().atMost(TIMEOUT));
            assertEquals(CibaStatus.DENIED, service.deny(authReqId).await().atMost(TIMEOUT));
            verify(metrics).recordCibaRequest("denied");
        }

        @Test
        @DisplayName("should not let an approved request be denied")
        void shouldKeepApproval() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            service.approve(authReqId, "user-alice", null).await().atMost(TIMEOUT);

            assertEquals(CibaStatus.APPROVED, service.deny(authReqId).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should expire instead of approving after the deadline")
        void shouldExpireOnLateApproval() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            final var status = serviceAt(NOW.plusSeconds(301))
                    .approve(authReqId, "user-alice", null)
                    .await()
                    .atMost(TIMEOUT);

            assertEquals(CibaStatus.EXPIRED, status);
        }

        @Test
        @DisplayName("should reject approval by a different user")
        void shouldRejectOtherSubject() {
            final var authReqId = accept(loginHint("alice@example.com"), client).response().authReqId();

            assertThrows(
                    IllegalArgumentException.class,
                    () -> service.approve(authReqId, "user-mallory", null).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should fail for unknown requests")
        void shouldFailForUnknown() {
            assertThrows(
                    CibaRequestNotFoundException.class,
                    () -> service.deny("missing").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should ping ping-mode clients on approval")
        void shouldPingOnApproval() {
            final var ping = client.toBuilder()
                    .cibaDeliveryMode(CibaDeliveryMode.PING)
                    .cibaNotificationEndpoint(URI.create("https://client.test/cb"))
                    .build();
            when(clients.findClient("ciba-app")).thenReturn(Uni.createFrom().item(Optional.of(ping)));
            when(clientNotifications.ping(any(), any())).thenReturn(Uni.createFrom().voidItem());
            final var request = new CibaAuthenticationRequest(
                    "openid", "alice@example.com", null, null, null, null, null, "notify-me", null, null);
            final var authReqId = accept(request, ping).response().authReqId();

            service.approve(authReqId, "user-alice", null).await().atMost(TIMEOUT);

            verify(clientNotifications).ping(eq(ping), any());
            verify(clientNotifications, never()).push(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("findByCorrelation()")
    class CorrelationTests {

        @Test
        @DisplayName("should resolve the pending request from its correlation id")
        void shouldResolveCorrelation() {
            final var accepted = accept(loginHint("alice@example.com"), client);

            final var found = service.findByCorrelation(accepted.request().correlationId())
                    .await()
                    .atMost(TIMEOUT)
                    .orElseThrow();

            assertEquals(accepted.response().authReqId(), found.authReqId());
            assertNull(found.subjectId());
        }

        @Test
        @DisplayName("should return empty for unknown correlation ids")
        void shouldIgnoreUnknown() {
            assertTrue(service.findByCorrelation("nope").await().atMost(TIMEOUT).isEmpty());
        }
    }
}
