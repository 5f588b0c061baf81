package quokka.core.service.key;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.quarkus.scheduler.Scheduled;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;
import org.jose4j.jwk.JsonWebKey.OutputControlLevel;
import org.jose4j.jwk.PublicJsonWebKey;
import org.jose4j.lang.JoseException;

import quokka.core.cache.CaffeineLocalCache;
import quokka.core.cache.LocalCache;
import quokka.core.config.KeysConfig;
import quokka.core.model.key.KeyGenerationParams;
import quokka.core.model.key.KeyGenerationRequest;
import quokka.core.model.key.KeyRotationSummary;
import quokka.core.model.key.KeyStatus;
import quokka.core.model.key.KeyType;
import quokka.core.model.key.KeyUse;
import quokka.core.model.key.SigningAlgorithm;
import quokka.core.model.key.SigningKey;
import quokka.core.port.in.SigningKeyManagement;
import quokka.core.port.out.SigningKeyStore;
import quokka.core.port.out.TokenMetrics;
import quokka.core.util.RandomValues;
import quokka.core.util.SecureHash;
import quokka.spi.JwsSigner;
import quokka.spi.KeyMaterialProvider;

/**
 * Orchestrates signing keys across key-material providers.
 *
 * <p>This service owns the key lifecycle:
 * <ul>
 *   <li>Selecting the key that signs for a (tenant, client) scope</li>
 *   <li>Publishing the JWKS</li>
 *   <li>Manual rotation and revocation</li>
 *   <li>The scheduled sweep that activates, expires, succeeds and archives keys</li>
 * </ul>
 *
 * <h2>Selection</h2>
 * Client-scoped keys are preferred over tenant-wide keys. Within a scope the
 * ACTIVE, unexpired key with the highest priority signs; ties go to the
 * latest activation. Several keys may verify at once.
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * PENDING -&gt; ACTIVE -&gt; EXPIRED -&gt; ARCHIVED
 *    |          |          |
 *    +----------+----------+--&gt; REVOKED
 * </pre>
 */
@ApplicationScoped
public class SigningKeyService implements SigningKeyManagement {

    private static final Logger LOG = Logger.getLogger(SigningKeyService.class);

    private static final String DEFAULT_TENANT = "";
    private static final int MIN_RSA_KEY_SIZE = 2048;
    private static final int USAGE_UPDATE_ATTEMPTS = 3;

    private static final Comparator<SigningKey> SIGNING_ORDER =
            Comparator.comparingInt(SigningKey::priority).thenComparing(SigningKey::activateAt);

    private final SigningKeyStore store;
    private final KeyMaterialProviderRegistry providers;
    private final KeysConfig config;
    private final TokenMetrics metrics;
    private final Clock clock;
    private final LocalCache<String, Map<String, Object>> jwksCache;
    private final LocalCache<String, PublicJsonWebKey> verificationKeyCache;
    private final Map<String, Uni<SigningKey>> inFlightGeneration = new ConcurrentHashMap<>();

    @Inject
    public SigningKeyService(
            SigningKeyStore store,
            KeyMaterialProviderRegistry providers,
            KeysConfig config,
            TokenMetrics metrics,
            Clock clock) {
        this.store = store;
        this.providers = providers;
        this.config = config;
        this.metrics = metrics;
        this.clock = clock;
        this.jwksCache = new CaffeineLocalCache<>(config.jwksCacheDuration(), 1_000);
        this.verificationKeyCache = new CaffeineLocalCache<>(config.jwksCacheDuration(), 10_000);
    }

    // -------------------------------------------------------------------------
    // Signing
    // -------------------------------------------------------------------------

    /**
     * Resolve the key that signs for a scope, with a signer for it.
     *
     * <p>Due pending keys are activated first. When no key can sign and
     * auto-generation is enabled, a tenant-wide key is generated and
     * activated; concurrent callers share that one generation.
     *
     * @param tenantId tenant, or null for the default tenant
     * @param clientId client, or null for tenant-wide keys only
     * @return Uni with the credentials. Fails with
     *     {@link SigningKeyNotFoundException} when no key exists and
     *     auto-generation is off, or {@link KeyProviderUnavailableException}
     *     when the owning provider cannot be reached.
     */
    public Uni<SigningCredentials> getSigningCredentials(String tenantId, String clientId) {
        return selectSigningKey(tenantId, clientId).flatMap(this::credentialsFor);
    }

    private Uni<SigningKey> selectSigningKey(String tenantId, String clientId) {
        return activeKeyInScope(tenantId, clientId).flatMap(found -> {
            if (found.isPresent()) {
                return Uni.createFrom().item(found.get());
            }
            if (clientId == null) {
                return autoGenerate(tenantId);
            }
            return activeKeyInScope(tenantId, null)
                    .flatMap(tenantWide -> tenantWide
                            .map(key -> Uni.createFrom().item(key))
                            .orElseGet(() -> autoGenerate(tenantId)));
        });
    }

    private Uni<Optional<SigningKey>> activeKeyInScope(String tenantId, String clientId) {
        return store.findByScope(tenantId, clientId).flatMap(keys -> {
            final var now = clock.instant();
            return activateDue(keys, now)
                    .map(current ->
                            current.stream().filter(k -> k.canSign(now)).max(SIGNING_ORDER));
        });
    }

    private Uni<List<SigningKey>> activateDue(List<SigningKey> keys, Instant now) {
        final var due = keys.stream().filter(k -> k.isDueForActivation(now)).toList();
        if (due.isEmpty()) {
            return Uni.createFrom().item(keys);
        }

        return Uni.join()
                .all(due.stream().map(this::activate).toList())
                .andFailFast()
                .map(activated -> {
                    final var byId = new LinkedHashMap<String, SigningKey>();
                    keys.forEach(k -> byId.put(k.keyId(), k));
                    activated.forEach(k -> byId.put(k.keyId(), k));
                    return List.copyOf(byId.values());
                });
    }

    private Uni<SigningKey> activate(SigningKey key) {
        final var activated = key.activate();
        return store.replace(key, activated).flatMap(replaced -> {
            if (replaced) {
                LOG.infov("Activated signing key {0}", key.keyId());
                return Uni.createFrom().item(activated);
            }
            // Another instance changed it first; use whatever it wrote.
            return store.findById(key.keyId()).map(current -> current.orElse(key));
        });
    }

    private Uni<SigningKey> autoGenerate(String tenantId) {
        if (!config.autoGenerate()) {
            return Uni.createFrom()
                    .failure(new SigningKeyNotFoundException("No active signing key for tenant "
                            + (tenantId == null ? "<default>" : tenantId)));
        }

        final var scope = tenantId == null ? DEFAULT_TENANT : tenantId;
        return inFlightGeneration.computeIfAbsent(scope, s -> {
            LOG.infof("No active signing key for tenant %s, generating one", s.isEmpty() ? "<default>" : s);
            return generateKey(KeyGenerationRequest.forScope(tenantId, null))
                    .onTermination()
                    .invoke(() -> inFlightGeneration.remove(s))
                    .memoize()
                    .indefinitely();
        });
    }

    private Uni<SigningCredentials> credentialsFor(SigningKey key) {
        return Uni.createFrom()
                .item(() -> providers.require(key.providerName()))
                .flatMap(provider -> provider.signer(key)
                        .map(signer -> new SigningCredentials(key, new UsageRecordingSigner(signer, provider.name()))));
    }

    private Uni<Void> recordUsage(String keyId) {
        return store.findById(keyId)
                .flatMap(current -> current.isEmpty()
                        ? Uni.createFrom().item(Boolean.TRUE)
                        : store.replace(current.get(), current.get().recordUsage(clock.instant())))
                .flatMap(replaced -> replaced
                        ? Uni.createFrom().voidItem()
                        : Uni.createFrom().<Void>failure(new UsageUpdateConflict(keyId)))
                .onFailure(UsageUpdateConflict.class)
                .retry()
                .atMost(USAGE_UPDATE_ATTEMPTS - 1)
                .onFailure()
                .recoverWithUni(e -> {
                    LOG.debugf("Could not record usage of signing key %s: %s", keyId, e.getMessage());
                    return Uni.createFrom().voidItem();
                });
    }

    // -------------------------------------------------------------------------
    // Publication and verification
    // -------------------------------------------------------------------------

    /**
     * The public JWKS document for a tenant.
     *
     * <p>Contains PENDING, ACTIVE and expired-within-grace asymmetric keys.
     * Revoked, archived and symmetric keys are never published.
     *
     * @param tenantId tenant, or null for the default tenant
     * @return Uni with a {@code {"keys": [...]}} document
     */
    public Uni<Map<String, Object>> getJwks(String tenantId) {
        final var cacheKey = tenantId == null ? DEFAULT_TENANT : tenantId;
        final var cached = jwksCache.get(cacheKey);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached.get());
        }

        return store.findAll().map(keys -> {
            final var now = clock.instant();
            final List<Map<String, Object>> jwks = keys.stream()
                    .filter(k -> Objects.equals(k.tenantId(), tenantId))
                    .filter(k -> k.isPublishable(now, config.gracePeriod()))
                    .sorted(Comparator.comparing(SigningKey::createdAt).reversed())
                    .map(SigningKeyService::toPublicJwkParams)
                    .toList();
            final Map<String, Object> document = Map.of("keys", jwks);
            jwksCache.put(cacheKey, document);
            return document;
        });
    }

    /**
     * The public key that verifies signatures made with {@code keyId}.
     *
     * <p>Signatures of revoked keys verify only when
     * {@code quokka.keys.honor-revoked-signatures} is enabled.
     *
     * @param keyId the {@code kid} from a JWS header
     * @return Uni with the key, or empty if unknown, symmetric or not honoured
     */
    public Uni<Optional<PublicJsonWebKey>> verificationKey(String keyId) {
        if (keyId == null) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var cached = verificationKeyCache.get(keyId);
        if (cached.isPresent()) {
            return Uni.createFrom().item(cached);
        }

        return store.findById(keyId).map(found -> {
            final var key = found.filter(this::isVerifiable);
            if (key.isEmpty()) {
                return Optional.<PublicJsonWebKey>empty();
            }
            final var publicKey =
                    providers.find(key.get().providerName()).flatMap(p -> p.publicKey(key.get()));
            publicKey.ifPresent(jwk -> verificationKeyCache.put(keyId, jwk));
            return publicKey;
        });
    }

    private boolean isVerifiable(SigningKey key) {
        if (key.keyType() == KeyType.SYMMETRIC) {
            return false;
        }
        return key.status() != KeyStatus.REVOKED || config.honorRevokedSignatures();
    }

    private static Map<String, Object> toPublicJwkParams(SigningKey key) {
        try {
            final var jwk = PublicJsonWebKey.Factory.newPublicJwk(key.publicJwk());
            jwk.setKeyId(key.keyId());
            jwk.setUse(key.use().jwkValue());
            jwk.setAlgorithm(key.algorithm().name());
            return jwk.toParams(OutputControlLevel.PUBLIC_ONLY);
        } catch (JoseException e) {
            throw new IllegalStateException("Stored public JWK is unreadable for key " + key.keyId(), e);
        }
    }

    private void invalidateCaches() {
        jwksCache.invalidateAll();
        verificationKeyCache.invalidateAll();
    }

    // -------------------------------------------------------------------------
    // Administration
    // -------------------------------------------------------------------------

    @Override
    public Uni<SigningKey> generateKey(KeyGenerationRequest request) {
        return generate(request, RandomValues.base64Url(16), null);
    }

    private Uni<SigningKey> generate(KeyGenerationRequest request, String keyId, String rotationWindow) {
        final var algorithm = request.algorithm() != null ? request.algorithm() : config.algorithm();
        final int keySize;
        try {
            keySize = resolveKeySize(algorithm, request.keySize());
        } catch (IllegalArgumentException e) {
            return Uni.createFrom().failure(e);
        }
        final var lifetime = request.lifetime() != null ? request.lifetime() : config.lifetime();
        final int priority = request.priority() != null ? request.priority() : SigningKey.DEFAULT_PRIORITY;
        final var now = clock.instant();
        final var activateAt =
                request.activateAt() != null && request.activateAt().isAfter(now) ? request.activateAt() : now;
        final var status = activateAt.isAfter(now) ? KeyStatus.PENDING : KeyStatus.ACTIVE;

        return Uni.createFrom()
                .item(() -> providers.select(request.providerName()))
                .flatMap(provider -> provider.generate(new KeyGenerationParams(keyId, algorithm, keySize, KeyUse.SIGNING))
                        .map(material -> new SigningKey(
                                keyId,
                                request.tenantId(),
                                request.clientId(),
                                algorithm.keyType(),
                                algorithm,
                                keySize,
                                KeyUse.SIGNING,
                                status,
                                now,
                                activateAt,
                                activateAt.plus(lifetime),
                                priority,
                                0,
                                null,
                                provider.name(),
                                material.publicJwk(),
                                material.protectedMaterial(),
                                rotationWindow,
                                null,
                                null)))
                .flatMap(store::insert)
                .invoke(key -> {
                    invalidateCaches();
                    LOG.infof(
                            "Generated %s signing key %s (provider: %s, status: %s, tenant: %s, client: %s)",
                            key.algorithm(),
                            key.keyId(),
                            key.providerName(),
                            key.status(),
                            key.tenantId(),
                            key.clientId());
                });
    }

    private static int resolveKeySize(SigningAlgorithm algorithm, Integer requested) {
        if (requested == null) {
            return algorithm.defaultKeySize();
        }
        return switch (algorithm.keyType()) {
            case RSA -> {
                if (requested < MIN_RSA_KEY_SIZE) {
                    throw new IllegalArgumentException(
                            "RSA keys must be at least " + MIN_RSA_KEY_SIZE + " bits, got " + requested);
                }
                yield requested;
            }
            case EC -> {
                if (requested != algorithm.defaultKeySize()) {
                    throw new IllegalArgumentException(
                            algorithm + " requires a " + algorithm.defaultKeySize() + "-bit curve, got " + requested);
                }
                yield requested;
            }
            case SYMMETRIC -> {
                if (requested < algorithm.defaultKeySize()) {
                    throw new IllegalArgumentException(
                            algorithm + " requires at least " + algorithm.defaultKeySize() + " bits, got " + requested);
                }
                yield requested;
            }
        };
    }

    @Override
    public Uni<SigningKey> rotateKeys(String tenantId, String clientId, String reason) {
        return store.findByScope(tenantId, clientId).flatMap(existing -> {
            final var now = clock.instant();
            final var current = existing.stream().filter(k -> k.canSign(now)).max(SIGNING_ORDER);
            final var request = new KeyGenerationRequest(
                    tenantId,
                    clientId,
                    current.map(SigningKey::algorithm).orElse(null),
                    current.map(SigningKey::keySize).orElse(null),
                    null,
                    null,
                    null,
                    SigningKey.ROTATED_IN_PRIORITY);

            return generateKey(request)
                    .call(newKey -> demote(existing, newKey))
                    .invoke(newKey -> LOG.infof(
                            "Rotated signing keys for tenant %s client %s: new key %s (reason: %s)",
                            tenantId, clientId, newKey.keyId(), reason));
        });
    }

    private Uni<Void> demote(List<SigningKey> existing, SigningKey replacement) {
        final var toDemote = existing.stream()
                .filter(k -> k.status() == KeyStatus.ACTIVE)
                .filter(k -> !k.keyId().equals(replacement.keyId()))
                .filter(k -> k.priority() > SigningKey.DEMOTED_PRIORITY)
                .toList();
        if (toDemote.isEmpty()) {
            return Uni.createFrom().voidItem();
        }

        return Uni.join()
                .all(toDemote.stream()
                        .map(k -> store.replace(k, k.withPriority(SigningKey.DEMOTED_PRIORITY))
                                .invoke(replaced -> {
                                    if (replaced) {
                                        LOG.infov("Demoted signing key {0} after rotation", k.keyId());
                                    }
                                }))
                        .toList())
                .andFailFast()
                .replaceWithVoid();
    }

    @Override
    public Uni<SigningKey> revokeKey(String keyId, String reason) {
        return store.findById(keyId).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().failure(new SigningKeyNotFoundException("Signing key not found: " + keyId));
            }
            final var key = found.get();
            if (key.status() == KeyStatus.REVOKED) {
                return Uni.createFrom().item(key);
            }

            final SigningKey revoked;
            try {
                revoked = key.revoke(reason, clock.instant());
            } catch (IllegalStateException e) {
                return Uni.createFrom().failure(e);
            }
            return store.replace(key, revoked).flatMap(replaced -> {
                if (!replaced) {
                    return revokeKey(keyId, reason);
                }
                invalidateCaches();
                LOG.infof("Revoked signing key %s (reason: %s)", keyId, reason);
                return Uni.createFrom().item(revoked);
            });
        });
    }

    @Override
    public Uni<List<SigningKey>> listKeys(String tenantId, String clientId) {
        return store.findAll()
                .map(keys -> keys.stream()
                        .filter(k -> tenantId == null || tenantId.equals(k.tenantId()))
                        .filter(k -> clientId == null || clientId.equals(k.clientId()))
                        .sorted(Comparator.comparing(SigningKey::createdAt).reversed())
                        .toList());
    }

    @Override
    public Uni<Optional<SigningKey>> getKey(String keyId) {
        return store.findById(keyId);
    }

    // -------------------------------------------------------------------------
    // Scheduled lifecycle
    // -------------------------------------------------------------------------

    @Scheduled(
            every = "${quokka.keys.schedule:1h}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public Uni<Void> scheduledRotation() {
        return processScheduledRotations()
                .invoke(summary -> {
                    if (summary.hasChanges()) {
                        LOG.infof(
                                "Key lifecycle sweep: %d activated, %d expired, %d generated, %d archived, %d deleted",
                                summary.activated(),
                                summary.expired(),
                                summary.generated(),
                                summary.archived(),
                                summary.deleted());
                    }
                })
                .replaceWithVoid()
                .onFailure()
                .invoke(e -> LOG.error("Key lifecycle sweep failed", e));
    }

    /**
     * Run one lifecycle sweep over every key.
     *
     * <ol>
     *   <li>Activate due PENDING keys</li>
     *   <li>Expire ACTIVE keys past their expiry</li>
     *   <li>Generate a successor for a signing key within the rotation lead
     *       of its expiry, unless one exists</li>
     *   <li>Archive EXPIRED keys past the grace period</li>
     *   <li>Enforce the per-scope key limit</li>
     * </ol>
     *
     * <p>Every transition is a conditional replace, and successor ids are
     * derived from the scope and day, so sweeps running concurrently on
     * several instances do not duplicate work.
     */
    public Uni<KeyRotationSummary> processScheduledRotations() {
        final var now = clock.instant();
        return transitionAll(k -> k.isDueForActivation(now), SigningKey::activate, "activated")
                .flatMap(activated -> transitionAll(
                                k -> k.status() == KeyStatus.ACTIVE && k.isPastExpiry(now), SigningKey::expire, "expired")
                        .flatMap(expired -> generateSuccessors(now)
                                .flatMap(generated -> transitionAll(
                                                k -> k.status() == KeyStatus.EXPIRED
                                                        && !k.expiresAt().plus(config.gracePeriod()).isAfter(now),
                                                SigningKey::archive,
                                                "archived")
                                        .flatMap(archived -> enforceMaxKeys()
                                                .map(retention -> new KeyRotationSummary(
                                                        activated,
                                                        expired,
                                                        generated,
                                                        archived + retention.archived(),
                                                        retention.deleted()))))))
                .invoke(summary -> {
                    if (summary.hasChanges()) {
                        invalidateCaches();
                    }
                });
    }

    private Uni<Integer> transitionAll(
            Predicate<SigningKey> selector, UnaryOperator<SigningKey> transition, String action) {
        return store.findAll().flatMap(keys -> {
            final var selected = keys.stream().filter(selector).toList();
            return replaceEach(selected, transition, action);
        });
    }

    private Uni<Integer> replaceEach(List<SigningKey> keys, UnaryOperator<SigningKey> transition, String action) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(0);
        }

        return Uni.join()
                .all(keys.stream()
                        .map(key -> store.replace(key, transition.apply(key)).invoke(replaced -> {
                            if (replaced) {
                                LOG.infov("Signing key {0} {1}", key.keyId(), action);
                            }
                        }))
                        .toList())
                .andFailFast()
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count());
    }

    private Uni<Integer> generateSuccessors(Instant now) {
        return store.findAll().flatMap(keys -> {
            final var successors = new ArrayList<Uni<Boolean>>();
            for (final var scope : groupByScope(keys).values()) {
                final var current = scope.stream().filter(k -> k.canSign(now)).max(SIGNING_ORDER);
                if (current.isEmpty() || !needsSuccessor(current.get(), scope, now)) {
                    continue;
                }
                successors.add(generateSuccessor(current.get(), now));
            }
            if (successors.isEmpty()) {
                return Uni.createFrom().item(0);
            }
            return Uni.join()
                    .all(successors)
                    .andFailFast()
                    .map(results -> (int) results.stream().filter(Boolean::booleanValue).count());
        });
    }

    private boolean needsSuccessor(SigningKey current, List<SigningKey> scope, Instant now) {
        if (current.expiresAt().minus(config.rotationLead()).isAfter(now)) {
            return false;
        }
        return scope.stream()
                .filter(k -> !k.keyId().equals(current.keyId()))
                .filter(k -> k.status() == KeyStatus.PENDING || k.status() == KeyStatus.ACTIVE)
                .noneMatch(k -> k.expiresAt().isAfter(current.expiresAt()));
    }

    private Uni<Boolean> generateSuccessor(SigningKey current, Instant now) {
        final var window = "%s|%s|%s"
                .formatted(current.tenantId(), current.clientId(), LocalDate.ofInstant(now, ZoneOffset.UTC));
        final var keyId = SecureHash.truncatedSha256("rotation|" + window, 32);

        // Publish ahead of activation so cached JWKS copies already hold it.
        var activateAt = now.plus(config.jwksCacheDuration());
        if (activateAt.isAfter(current.expiresAt())) {
            activateAt = current.expiresAt();
        }
        final var provider = providers.find(current.providerName())
                .filter(KeyMaterialProvider::isAvailable)
                .map(KeyMaterialProvider::name)
                .orElse(null);
        final var request = new KeyGenerationRequest(
                current.tenantId(),
                current.clientId(),
                current.algorithm(),
                current.keySize(),
                provider,
                null,
                activateAt,
                null);

        return store.findById(keyId).flatMap(existing -> {
            if (existing.isPresent()) {
                LOG.debugf("Successor %s for window %s already exists", keyId, window);
                return Uni.createFrom().item(Boolean.FALSE);
            }
            return generate(request, keyId, window)
                    .map(key -> {
                        LOG.infof("Generated successor %s for expiring signing key %s", key.keyId(), current.keyId());
                        return Boolean.TRUE;
                    })
                    .onFailure(IllegalStateException.class)
                    .recoverWithUni(e -> {
                        LOG.debugf("Successor %s was generated concurrently: %s", keyId, e.getMessage());
                        return Uni.createFrom().item(Boolean.FALSE);
                    });
        });
    }

    private Uni<RetentionOutcome> enforceMaxKeys() {
        return store.findAll().flatMap(keys -> {
            final var toArchive = new ArrayList<SigningKey>();
            final var toDelete = new ArrayList<SigningKey>();
            for (final var scope : groupByScope(keys).values()) {
                var surplus = scope.size() - config.maxKeys();
                if (surplus <= 0) {
                    continue;
                }
                final var oldestFirst = Comparator.comparing(SigningKey::createdAt);
                for (final var archived : scope.stream()
                        .filter(k -> k.status() == KeyStatus.ARCHIVED)
                        .sorted(oldestFirst)
                        .toList()) {
                    if (surplus-- <= 0) {
                        break;
                    }
                    toDelete.add(archived);
                }
                for (final var expired : scope.stream()
                        .filter(k -> k.status() == KeyStatus.EXPIRED)
                        .sorted(oldestFirst)
                        .toList()) {
                    if (surplus-- <= 0) {
                        break;
                    }
                    toArchive.add(expired);
                }
            }

            return replaceEach(toArchive, SigningKey::archive, "archived (key limit)")
                    .flatMap(archived -> deleteEach(toDelete).map(deleted -> new RetentionOutcome(archived, deleted)));
        });
    }

    private Uni<Integer> deleteEach(List<SigningKey> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(0);
        }

        return Uni.join()
                .all(keys.stream().map(this::destroy).toList())
                .andFailFast()
                .map(results -> (int) results.stream().filter(Boolean::booleanValue).count());
    }

    private Uni<Boolean> destroy(SigningKey key) {
        final var provider = providers.find(key.providerName()).filter(KeyMaterialProvider::isAvailable);
        if (provider.isEmpty()) {
            LOG.warnf("Keeping archived key %s: provider %s unavailable", key.keyId(), key.providerName());
            return Uni.createFrom().item(Boolean.FALSE);
        }
        return provider.get()
                .destroy(key)
                .flatMap(ignored -> store.delete(key.keyId()))
                .invoke(deleted -> {
                    if (deleted) {
                        LOG.infov("Deleted archived signing key {0}", key.keyId());
                    }
                });
    }

    private static Map<String, List<SigningKey>> groupByScope(List<SigningKey> keys) {
        return keys.stream()
                .filter(k -> k.use() == KeyUse.SIGNING)
                .collect(Collectors.groupingBy(k -> k.tenantId() + "|" + k.clientId()));
    }

    private record RetentionOutcome(int archived, int deleted) {}

    /**
     * Signer wrapper that counts signatures against the key record.
     */
    private final class UsageRecordingSigner implements JwsSigner {

        private final JwsSigner delegate;
        private final String providerName;

        UsageRecordingSigner(JwsSigner delegate, String providerName) {
            this.delegate = delegate;
            this.providerName = providerName;
        }

        @Override
        public String keyId() {
            return delegate.keyId();
        }

        @Override
        public String algorithm() {
            return delegate.algorithm();
        }

        @Override
        public Uni<String> sign(String payloadJson, Map<String, Object> headers) {
            return delegate.sign(payloadJson, headers)
                    .invoke(() -> metrics.recordSignature(providerName))
                    .call(() -> recordUsage(delegate.keyId()));
        }
    }

    private static final class UsageUpdateConflict extends RuntimeException {

        UsageUpdateConflict(String keyId) {
            super("Concurrent update of signing key " + keyId, null, false, false);
        }
    }
}
