package quokka.core.service.ciba;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;

import quokka.core.config.CibaConfig;
import quokka.core.model.ciba.CibaAuthenticationRequest;
import quokka.core.model.ciba.CibaAuthenticationResponse;
import quokka.core.model.ciba.CibaPollOutcome;
import quokka.core.model.ciba.CibaPollResult;
import quokka.core.model.ciba.CibaRequest;
import quokka.core.model.ciba.CibaResult;
import quokka.core.model.ciba.CibaStatus;
import quokka.core.model.client.CibaDeliveryMode;
import quokka.core.model.client.Client;
import quokka.core.model.grant.GrantResult;
import quokka.core.model.grant.GrantTypes;
import quokka.core.model.grant.OAuthError;
import quokka.core.model.grant.Scopes;
import quokka.core.model.token.TokenIssueContext;
import quokka.core.model.user.UserAccount;
import quokka.core.port.in.BackchannelAuthentication;
import quokka.core.port.out.CibaRequestStore;
import quokka.core.port.out.CibaUserNotificationService;
import quokka.core.port.out.ClientNotificationSender;
import quokka.core.port.out.ClientStore;
import quokka.core.port.out.ProtocolStateStore;
import quokka.core.port.out.TokenMetrics;
import quokka.core.port.out.UserDirectory;
import quokka.core.service.grant.GrantScopes;
import quokka.core.service.token.IssuedTokenPersistence;
import quokka.core.service.token.IssuedTokenVerifier;
import quokka.core.service.token.TokenService;
import quokka.core.util.RandomValues;
import quokka.core.util.SecureHash;

/**
 * Client-Initiated Backchannel Authentication (OpenID Connect CIBA Core 1.0).
 *
 * <h2>State machine</h2>
 * <pre>
 * PENDING -&gt; APPROVED
 * PENDING -&gt; DENIED
 * PENDING -&gt; EXPIRED   (applied lazily whenever the request is read)
 * </pre>
 *
 * <p>Every transition is a conditional replace against the stored request,
 * so a denied request can never be approved and vice versa. Approved
 * requests are removed when their tokens are redeemed.
 */
@ApplicationScoped
public class CibaService implements BackchannelAuthentication {

    private static final Logger LOG = Logger.getLogger(CibaService.class);

    static final String PROTOCOL = "ciba";
    static final String AUTH_REQ_ID_KEY = "auth_req_id";

    private final CibaRequestStore requests;
    private final ProtocolStateStore protocolStates;
    private final UserDirectory users;
    private final ClientStore clients;
    private final IssuedTokenVerifier tokenVerifier;
    private final CibaUserNotificationService userNotifications;
    private final ClientNotificationSender clientNotifications;
    private final TokenService tokenService;
    private final IssuedTokenPersistence tokenPersistence;
    private final TokenMetrics metrics;
    private final CibaConfig config;
    private final Clock clock;

    @Inject
    public CibaService(
            CibaRequestStore requests,
            ProtocolStateStore protocolStates,
            UserDirectory users,
            ClientStore clients,
            IssuedTokenVerifier tokenVerifier,
            CibaUserNotificationService userNotifications,
            ClientNotificationSender clientNotifications,
            TokenService tokenService,
            IssuedTokenPersistence tokenPersistence,
            TokenMetrics metrics,
            CibaConfig config,
            Clock clock) {
        this.requests = requests;
        this.protocolStates = protocolStates;
        this.users = users;
        this.clients = clients;
        this.tokenVerifier = tokenVerifier;
        this.userNotifications = userNotifications;
        this.clientNotifications = clientNotifications;
        this.tokenService = tokenService;
        this.tokenPersistence = tokenPersistence;
        this.metrics = metrics;
        this.config = config;
        this.clock = clock;
    }

    // -------------------------------------------------------------------------
    // Initiation
    // -------------------------------------------------------------------------

    @Override
    public Uni<CibaResult> authenticate(CibaAuthenticationRequest request, Client client) {
        final var rejection = validate(request, client);
        if (rejection.isPresent()) {
            metrics.recordCibaRequest("rejected");
            return Uni.createFrom().item(rejection.get());
        }

        return resolveHint(request, client).flatMap(resolved -> {
            if (resolved instanceof HintResolution.Rejected rejected) {
                metrics.recordCibaRequest("rejected");
                return Uni.createFrom().item(rejected.result());
            }
            final var user = ((HintResolution.Resolved) resolved).user();
            return start(request, client, user);
        });
    }

    private Optional<CibaResult> validate(CibaAuthenticationRequest request, Client client) {
        if (!client.cibaEnabled()) {
            return reject(OAuthError.UNAUTHORIZED_CLIENT, "Client is not enabled for CIBA");
        }

        final var scopes = Scopes.parse(request.scope());
        if (!scopes.contains(Scopes.OPENID)) {
            return reject(OAuthError.INVALID_SCOPE, "scope must include openid");
        }
        final var scopeError = GrantScopes.checkAllowed(scopes, client);
        if (scopeError.isPresent()) {
            return reject(OAuthError.INVALID_SCOPE, scopeError.get());
        }

        if (request.hintCount() != 1) {
            return reject(
                    OAuthError.INVALID_REQUEST,
                    "Exactly one of login_hint, login_hint_token or id_token_hint is required");
        }
        if (request.bindingMessage() != null && request.bindingMessage().length() > config.bindingMessageMaxLength()) {
            return reject(OAuthError.INVALID_BINDING_MESSAGE, "binding_message is too long");
        }
        if (client.cibaRequireUserCode() && (request.userCode() == null || request.userCode().isBlank())) {
            return reject(OAuthError.MISSING_USER_CODE, "user_code is required");
        }
        if (request.requestedExpiry() != null && request.requestedExpiry() <= 0) {
            return reject(OAuthError.INVALID_REQUEST, "requested_expiry must be a positive integer");
        }
        if (client.cibaDeliveryMode().notifiesClient()) {
            if (request.clientNotificationToken() == null || request.clientNotificationToken().isBlank()) {
                return reject(OAuthError.INVALID_REQUEST, "client_notification_token is required");
            }
            if (client.notificationEndpoint().isEmpty()) {
                return reject(OAuthError.INVALID_REQUEST, "Client has no notification endpoint registered");
            }
        }
        return Optional.empty();
    }

    private sealed interface HintResolution {

        record Resolved(UserAccount user) implements HintResolution {}

        record Rejected(CibaResult result) implements HintResolution {}
    }

    private Uni<HintResolution> resolveHint(CibaAuthenticationRequest request, Client client) {
        final Uni<Optional<UserAccount>> lookup;
        if (present(request.loginHint())) {
            lookup = users.findByLoginHint(request.loginHint());
        } else if (present(request.idTokenHint())) {
            lookup = tokenVerifier
                    .verify(request.idTokenHint(), false, client.clientId())
                    .flatMap(this::userFromClaims);
        } else {
            return tokenVerifier.verify(request.loginHintToken()).flatMap(claims -> {
                if (claims.isPresent()) {
                    return userFromClaims(claims).map(this::toResolution);
                }
                return tokenVerifier.verify(request.loginHintToken(), false, null).map(expired -> expired.isPresent()
                        ? rejected(OAuthError.EXPIRED_LOGIN_HINT_TOKEN, "login_hint_token has expired")
                        : rejected(OAuthError.UNKNOWN_USER_ID, "login_hint_token is not valid"));
            });
        }
        return lookup.map(this::toResolution);
    }

    private HintResolution toResolution(Optional<UserAccount> user) {
        if (user.isEmpty()) {
            return rejected(OAuthError.UNKNOWN_USER_ID, "The user could not be identified");
        }
        if (!user.get().canSignIn()) {
            return rejected(OAuthError.ACCESS_DENIED, "The user cannot sign in");
        }
        return new HintResolution.Resolved(user.get());
    }

    private Uni<Optional<UserAccount>> userFromClaims(Optional<JwtClaims> claims) {
        if (claims.isEmpty()) {
            return Uni.createFrom().item(Optional.empty());
        }
        try {
            return users.findBySubject(claims.get().getSubject());
        } catch (MalformedClaimException e) {
            LOG.debugf("Hint token has a malformed sub claim: %s", e.getMessage());
            return Uni.createFrom().item(Optional.empty());
        }
    }

    private Uni<CibaResult> start(CibaAuthenticationRequest request, Client client, UserAccount user) {
        final var now = clock.instant();
        final var lifetime = request.requestedExpiry() == null
                ? client.cibaRequestLifetime()
                : Math.min(request.requestedExpiry(), client.cibaRequestLifetime());
        final var authReqId = RandomValues.handle();

        return protocolStates
                .store(
                        PROTOCOL,
                        Map.of(AUTH_REQ_ID_KEY, authReqId, "client_id", client.clientId()),
                        Duration.ofSeconds(lifetime))
                .flatMap(correlationId -> {
                    final var stored = new CibaRequest(
                            authReqId,
                            client.clientId(),
                            request.tenantId(),
                            Scopes.parse(request.scope()),
                            request.bindingMessage(),
                            request.userCode(),
                            firstPresent(request.loginHint(), request.loginHintToken(), request.idTokenHint()),
                            user.subjectId(),
                            request.acrValues(),
                            CibaStatus.PENDING,
                            now,
                            now.plusSeconds(lifetime),
                            client.cibaPollingInterval(),
                            null,
                            null,
                            null,
                            null,
                            client.cibaDeliveryMode(),
                            request.clientNotificationToken(),
                            correlationId,
                            null);
                    return requests.store(stored).replaceWith(stored);
                })
                .flatMap(stored -> notifyUser(stored).replaceWith(stored))
                .map(stored -> {
                    metrics.recordCibaRequest("accepted");
                    LOG.infof(
                            "CIBA request %s started for client %s (mode=%s, expires_in=%d)",
                            SecureHash.fingerprint(authReqId),
                            client.clientId(),
                            stored.deliveryMode().wireValue(),
                            lifetime);
                    return new CibaResult.Accepted(
                            new CibaAuthenticationResponse(authReqId, lifetime, stored.interval()), stored);
                });
    }

    private Uni<Void> notifyUser(CibaRequest request) {
        final Uni<Void> notification;
        try {
            notification = userNotifications.notifyUser(request, request.correlationId());
        } catch (RuntimeException e) {
            LOG.warnf(e, "User notification failed for CIBA request %s", SecureHash.fingerprint(request.authReqId()));
            return Uni.createFrom().voidItem();
        }
        return notification.onFailure().recoverWithItem(e -> {
            LOG.warnf(e, "User notification failed for CIBA request %s", SecureHash.fingerprint(request.authReqId()));
            return null;
        });
    }

    // -------------------------------------------------------------------------
    // Polling
    // -------------------------------------------------------------------------

    /**
     * Read a request on behalf of the polling client.
     *
     * <p>Applies lazy expiry and the polling interval. A pending poll records
     * its time with a conditional replace; losing that race counts as
     * polling too fast.
     */
    public Uni<CibaPollResult> pollStatus(String authReqId, String clientId) {
        return requests.find(authReqId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(CibaPollResult.of(CibaPollOutcome.UNKNOWN));
            }
            final var request = found.get();
            if (!request.clientId().equals(clientId)) {
                LOG.warnf("Client %s polled a CIBA request of another client", clientId);
                return Uni.createFrom().item(CibaPollResult.of(CibaPollOutcome.CLIENT_MISMATCH));
            }

            final var now = clock.instant();
            if (request.status() == CibaStatus.PENDING && request.isExpired(now)) {
                return transition(authReqId, CibaRequest::expire)
                        .replaceWith(new CibaPollResult(CibaPollOutcome.EXPIRED, request));
            }

            return switch (request.status()) {
                case APPROVED -> Uni.createFrom().item(new CibaPollResult(CibaPollOutcome.APPROVED, request));
                case DENIED -> Uni.createFrom().item(new CibaPollResult(CibaPollOutcome.DENIED, request));
                case EXPIRED -> Uni.createFrom().item(new CibaPollResult(CibaPollOutcome.EXPIRED, request));
                case PENDING -> recordPoll(request);
            };
        });
    }

    private Uni<CibaPollResult> recordPoll(CibaRequest request) {
        final var now = clock.instant();
        if (request.isPolledTooSoon(now)) {
            return Uni.createFrom().item(new CibaPollResult(CibaPollOutcome.SLOW_DOWN, request));
        }
        return requests.compareAndSet(request, request.withLastPolledAt(now))
                .map(updated -> new CibaPollResult(
                        updated ? CibaPollOutcome.PENDING : CibaPollOutcome.SLOW_DOWN, request));
    }

    /**
     * Mark an approved request as redeemed once its tokens are issued.
     *
     * <p>The record stays until it is purged after expiry, so later decisions
     * still see its terminal status.
     *
     * @return Uni with true if this call redeemed it
     */
    public Uni<Boolean> complete(String authReqId) {
        return requests.find(authReqId).flatMap(found -> {
            if (found.isEmpty() || found.get().status() != CibaStatus.APPROVED || found.get().isRedeemed()) {
                return Uni.createFrom().item(false);
            }
            final var current = found.get();
            return requests.compareAndSet(current, current.redeem(clock.instant()))
                    .flatMap(applied -> applied ? Uni.createFrom().item(true) : complete(authReqId));
        });
    }

    // -------------------------------------------------------------------------
    // Decisions
    // -------------------------------------------------------------------------

    @Override
    public Uni<CibaStatus> approve(String authReqId, String subjectId, String sessionId) {
        return requests.find(authReqId).flatMap(found -> {
            final var request = found.orElseThrow(() -> new CibaRequestNotFoundException("Unknown auth_req_id"));
            if (request.hintSubjectId() != null && !request.hintSubjectId().equals(subjectId)) {
                throw new IllegalArgumentException("Approving subject does not match the requested user");
            }
            final var effectiveSession = sessionId != null ? sessionId : RandomValues.base64Url(16);
            return transition(authReqId, r -> r.approve(subjectId, effectiveSession, clock.instant()))
                    .call(change -> change.appliedAs(CibaStatus.APPROVED)
                            ? afterApproval(authReqId)
                            : Uni.createFrom().voidItem())
                    .map(Transition::status);
        });
    }

    @Override
    public Uni<CibaStatus> deny(String authReqId) {
        return requests.find(authReqId).flatMap(found -> {
            if (found.isEmpty()) {
                throw new CibaRequestNotFoundException("Unknown auth_req_id");
            }
            return transition(authReqId, CibaRequest::deny)
                    .call(change -> {
                        if (!change.appliedAs(CibaStatus.DENIED)) {
                            return Uni.createFrom().voidItem();
                        }
                        metrics.recordCibaRequest("denied");
                        return removeCorrelation(found.get())
                                .flatMap(ignored -> notifyClientOfDecision(found.get()));
                    })
                    .map(Transition::status);
        });
    }

    /**
     * Status a request ended up in, and whether this call moved it there.
     */
    private record Transition(CibaStatus status, boolean applied) {

        boolean appliedAs(CibaStatus expected) {
            return applied && status == expected;
        }
    }

    /**
     * Move a pending request through {@code change}, re-reading on a lost race.
     *
     * <p>Expired pending requests become EXPIRED instead. Terminal requests
     * are left as they are.
     */
    private Uni<Transition> transition(String authReqId, UnaryOperator<CibaRequest> change) {
        return requests.find(authReqId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().failure(new CibaRequestNotFoundException("Unknown auth_req_id"));
            }
            final var current = found.get();
            if (current.status().isTerminal()) {
                return Uni.createFrom().item(new Transition(current.status(), false));
            }
            final var updated = current.isExpired(clock.instant()) ? current.expire() : change.apply(current);
            return requests.compareAndSet(current, updated).flatMap(applied -> {
                if (!applied) {
                    return transition(authReqId, change);
                }
                if (updated.status() == CibaStatus.EXPIRED) {
                    metrics.recordCibaRequest("expired");
                }
                return Uni.createFrom().item(new Transition(updated.status(), true));
            });
        });
    }

    private Uni<Void> afterApproval(String authReqId) {
        metrics.recordCibaRequest("approved");
        return requests.find(authReqId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            final var request = found.get();
            LOG.infof("CIBA request %s approved", SecureHash.fingerprint(authReqId));
            return removeCorrelation(request).flatMap(ignored -> switch (request.deliveryMode()) {
                case POLL -> Uni.createFrom().voidItem();
                case PING -> notifyClientOfDecision(request);
                case PUSH -> pushTokens(request);
            });
        });
    }

    private Uni<Void> removeCorrelation(CibaRequest request) {
        if (request.correlationId() == null) {
            return Uni.createFrom().voidItem();
        }
        return protocolStates.remove(request.correlationId());
    }

    private Uni<Void> notifyClientOfDecision(CibaRequest request) {
        if (request.deliveryMode() == CibaDeliveryMode.POLL) {
            return Uni.createFrom().voidItem();
        }
        // Push mode has no error delivery, so a denial is sent as a ping.
        return clients.findClient(request.clientId())
                .flatMap(client -> client.map(c -> clientNotifications.ping(c, request))
                        .orElseGet(() -> Uni.createFrom().voidItem()))
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf("Ping for CIBA request %s failed: %s", SecureHash.fingerprint(request.authReqId()),
                            e.getMessage());
                    return null;
                });
    }

    private Uni<Void> pushTokens(CibaRequest request) {
        return clients.findClient(request.clientId())
                .flatMap(found -> {
                    if (found.isEmpty()) {
                        return Uni.createFrom().voidItem();
                    }
                    final var client = found.get();
                    final var grant = GrantResult.success(GrantTypes.CIBA, client.clientId())
                            .subjectId(request.subjectId())
                            .scopes(request.scopes())
                            .sessionId(request.sessionId())
                            .authTime(request.authTime())
                            .acr(request.acrValues())
                            .build();
                    return tokenService
                            .createTokenResponse(grant, new TokenIssueContext(client, request.tenantId(), null))
                            .flatMap(tokenPersistence::persist)
                            .flatMap(tokens -> clientNotifications.push(client, request, tokens.response()))
                            .flatMap(ignored -> complete(request.authReqId()))
                            .invoke(() -> metrics.recordTokensIssued(GrantTypes.CIBA))
                            .replaceWithVoid();
                })
                .onFailure()
                .recoverWithItem(e -> {
                    LOG.warnf(e, "Push delivery for CIBA request %s failed", SecureHash.fingerprint(request.authReqId()));
                    return null;
                });
    }

    // -------------------------------------------------------------------------
    // Lookup
    // -------------------------------------------------------------------------

    @Override
    public Uni<Optional<CibaRequest>> findByCorrelation(String correlationId) {
        return protocolStates.get(correlationId).flatMap(state -> {
            final var authReqId = state.filter(s -> PROTOCOL.equals(s.protocol()))
                    .map(s -> s.payload().get(AUTH_REQ_ID_KEY));
            if (authReqId.isEmpty()) {
                return Uni.createFrom().item(Optional.<CibaRequest>empty());
            }
            return requests.find(authReqId.get());
        });
    }

    private static Optional<CibaResult> reject(OAuthError error, String description) {
        return Optional.of(new CibaResult.Rejected(error, description));
    }

    private static HintResolution rejected(OAuthError error, String description) {
        return new HintResolution.Rejected(new CibaResult.Rejected(error, description));
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }

    private static String firstPresent(String... values) {
        for (final var value : values) {
            if (present(value)) {
                return value;
            }
        }
        return null;
    }
}
