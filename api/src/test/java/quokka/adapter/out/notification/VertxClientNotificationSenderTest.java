package quokka.adapter.out.notification;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.lenient;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.vertx.mutiny.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import quokka.adapter.out.notification.VertxClientNotificationSender.ClientNotificationException;
import quokka.core.config.CibaConfig;
import quokka.core.model.ciba.CibaRequest;
import quokka.core.model.ciba.CibaStatus;
import quokka.core.model.client.CibaDeliveryMode;
import quokka.core.model.client.Client;
import quokka.core.model.token.TokenResponse;

@DisplayName("VertxClientNotificationSender")
@ExtendWith(MockitoExtension.class)
class VertxClientNotificationSenderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String CALLBACK_PATH = "/ciba/callback";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private CibaConfig config;

    @Mock
    private CibaConfig.NotificationConfig notificationConfig;

    private WireMockServer wireMockServer;
    private Vertx vertx;
    private VertxClientNotificationSender sender;
    private Client client;

    @BeforeEach
    void setUp() {
        vertx = Vertx.vertx();
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        lenient().when(config.notification()).thenReturn(notificationConfig);
        lenient().when(notificationConfig.retries()).thenReturn(2);
        lenient().when(notificationConfig.backoff()).thenReturn(Duration.ofMillis(10));
        lenient().when(notificationConfig.timeout()).thenReturn(Duration.ofSeconds(2));
        sender = new VertxClientNotificationSender(vertx, config);
        client = Client.builder("ciba-app")
                .secret("secret")
                .cibaEnabled(true)
                .cibaDeliveryMode(CibaDeliveryMode.PING)
                .cibaNotificationEndpoint(URI.create(wireMockServer.baseUrl() + CALLBACK_PATH))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (wireMockServer != null) {
            wireMockServer.stop();
        }
        if (vertx != null) {
            vertx.close().await().indefinitely();
        }
    }

    private static CibaRequest request(String notificationToken) {
        return new CibaRequest(
                "req-1",
                "ciba-app",
                null,
                Set.of("openid"),
                null,
                null,
                "alice@example.com",
                "user-alice",
                null,
                CibaStatus.APPROVED,
                NOW,
                NOW.plusSeconds(300),
                5,
                null,
                "user-alice",
                "session-1",
                NOW,
                CibaDeliveryMode.PING,
                notificationToken,
                "corr-1",
                null);
    }

    @Test
    @DisplayName("should ping with the client notification token as bearer")
    void shouldPing() {
        wireMockServer.stubFor(post(urlEqualTo(CALLBACK_PATH)).willReturn(aResponse().withStatus(204)));

        sender.ping(client, request("notify-token")).await().atMost(TIMEOUT);

        wireMockServer.verify(postRequestedFor(urlEqualTo(CALLBACK_PATH))
                .withHeader("Authorization", equalTo("Bearer notify-token"))
                .withRequestBody(equalToJson("{\"auth_req_id\":\"req-1\"}")));
    }

    @Test
    @DisplayName("should push the token response with the request id")
    void shouldPush() {
        wireMockServer.stubFor(post(urlEqualTo(CALLBACK_PATH)).willReturn(aResponse().withStatus(200)));
        final var tokens = new TokenResponse("access", "Bearer", 3600, null, "id-token", "openid", null);

        sender.push(client, request("notify-token"), tokens).await().atMost(TIMEOUT);

        wireMockServer.verify(postRequestedFor(urlEqualTo(CALLBACK_PATH))
                .withRequestBody(matchingJsonPath("$.auth_req_id", equalTo("req-1")))
                .withRequestBody(matchingJsonPath("$.access_token", equalTo("access")))
                .withRequestBody(matchingJsonPath("$.id_token", equalTo("id-token"))));
    }

    @Test
    @DisplayName("should retry a failed delivery")
    void shouldRetry() {
        wireMockServer.stubFor(post(urlEqualTo(CALLBACK_PATH))
                .inScenario("flaky")
                .whenScenarioStateIs(STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("recovered"));
        wireMockServer.stubFor(post(urlEqualTo(CALLBACK_PATH))
                .inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(aResponse().withStatus(204)));

        sender.ping(client, request("notify-token")).await().atMost(TIMEOUT);

        wireMockServer.verify(2, postRequestedFor(urlEqualTo(CALLBACK_PATH)));
    }

    @Test
    @DisplayName("should fail once retries are exhausted")
    void shouldFailAfterRetries() {
        wireMockServer.stubFor(post(urlEqualTo(CALLBACK_PATH)).willReturn(aResponse().withStatus(500)));

        assertThrows(
                ClientNotificationException.class,
                () -> sender.ping(client, request("notify-token")).await().atMost(TIMEOUT));
        wireMockServer.verify(3, postRequestedFor(urlEqualTo(CALLBACK_PATH)));
    }

    @Test
    @DisplayName("should fail without a notification token")
    void shouldRequireNotificationToken() {
        assertThrows(
                IllegalStateException.class,
                () -> sender.ping(client, request(null)).await().atMost(TIMEOUT));
        wireMockServer.verify(0, postRequestedFor(urlEqualTo(CALLBACK_PATH)));
    }
}
