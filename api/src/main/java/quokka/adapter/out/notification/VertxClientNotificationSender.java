package quokka.adapter.out.notification;

import java.net.URI;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import quokka.core.config.CibaConfig;
import quokka.core.model.ciba.CibaRequest;
import quokka.core.model.client.Client;
import quokka.core.model.token.TokenResponse;
import quokka.core.port.out.ClientNotificationSender;
import quokka.core.util.SecureHash;

/**
 * Delivers CIBA ping and push notifications to the client notification endpoint.
 *
 * <p>Every call carries {@code Authorization: Bearer <client_notification_token>}.
 * Non-2xx responses and connection errors are retried with exponential
 * backoff. The returned {@code Uni} fails once retries are exhausted; callers
 * decide whether that matters.
 */
@ApplicationScoped
public class VertxClientNotificationSender implements ClientNotificationSender {

    private static final Logger LOG = Logger.getLogger(VertxClientNotificationSender.class);

    private final WebClient webClient;
    private final CibaConfig.NotificationConfig config;

    @Inject
    public VertxClientNotificationSender(Vertx vertx, CibaConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config.notification();
    }

    @Override
    public Uni<Void> ping(Client client, CibaRequest request) {
        return deliver(client, request, new JsonObject().put("auth_req_id", request.authReqId()), "ping");
    }

    @Override
    public Uni<Void> push(Client client, CibaRequest request, TokenResponse tokens) {
        final var body = JsonObject.mapFrom(tokens).put("auth_req_id", request.authReqId());
        return deliver(client, request, body, "push");
    }

    private Uni<Void> deliver(Client client, CibaRequest request, JsonObject body, String mode) {
        final var endpoint = client.notificationEndpoint().map(URI::toString).orElse(null);
        if (endpoint == null || request.clientNotificationToken() == null) {
            return Uni.createFrom()
                    .failure(new IllegalStateException("Client " + client.clientId() + " has no notification target"));
        }

        final Uni<Void> attempt = Uni.createFrom().deferred(() -> webClient
                .postAbs(endpoint)
                .timeout(config.timeout().toMillis())
                .putHeader("Content-Type", "application/json")
                .putHeader("Authorization", "Bearer " + request.clientNotificationToken())
                .sendJsonObject(body)
                .map(response -> {
                    if (response.statusCode() < 200 || response.statusCode() >= 300) {
                        throw new ClientNotificationException(
                                "Notification endpoint returned status " + response.statusCode());
                    }
                    return response;
                })
                .replaceWithVoid());

        final Uni<Void> withRetry = config.retries() > 0
                ? attempt.onFailure()
                        .retry()
                        .withBackOff(config.backoff())
                        .atMost(config.retries())
                : attempt;

        return withRetry
                .invoke(() -> LOG.debugf(
                        "Delivered CIBA %s notification for request %s to client %s",
                        mode, SecureHash.fingerprint(request.authReqId()), client.clientId()))
                .onFailure()
                .invoke(e -> LOG.warnf(
                        "CIBA %s notification to client %s failed: %s", mode, client.clientId(), e.getMessage()));
    }

    /**
     * Raised when a notification endpoint rejects a delivery.
     */
    public static class ClientNotificationException extends RuntimeException {

        public ClientNotificationException(String message) {
            super(message);
        }
    }
}
