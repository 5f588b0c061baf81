package quokka.core.service.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import quokka.core.model.client.Client;
import quokka.core.model.client.ClientCredentials;
import quokka.core.model.client.ClientCredentials.Method;
import quokka.core.port.out.ClientStore;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClientAuthenticator")
class ClientAuthenticatorTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(1);

    @Mock
    private ClientStore clients;

    @InjectMocks
    private ClientAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        lenient().when(clients.findClient(anyString())).thenReturn(Uni.createFrom().item(Optional.empty()));
        register(Client.builder("web").secret("s3cret").build());
        register(Client.builder("spa").publicClient(true).build());
        register(Client.builder("retired").secret("s3cret").enabled(false).build());
    }

    private void register(Client client) {
        lenient().when(clients.findClient(client.clientId())).thenReturn(Uni.createFrom().item(Optional.of(client)));
    }

    private Optional<Client> authenticate(String clientId, String secret, Method method) {
        return authenticator.authenticate(new ClientCredentials(clientId, secret, method))
                .await()
                .atMost(TIMEOUT);
    }

    @Test
    @DisplayName("should authenticate a confidential client with its secret")
    void shouldAuthenticateWithSecret() {
        assertEquals("web", authenticate("web", "s3cret", Method.CLIENT_SECRET_BASIC).orElseThrow().clientId());
        assertTrue(authenticate("web", "s3cret", Method.CLIENT_SECRET_POST).isPresent());
    }

    @Test
    @DisplayName("should reject a wrong secret")
    void shouldRejectWrongSecret() {
        assertTrue(authenticate("web", "guess", Method.CLIENT_SECRET_BASIC).isEmpty());
    }

    @Test
    @DisplayName("should not let a confidential client skip its secret")
    void shouldRejectMissingSecret() {
        assertTrue(authenticate("web", null, Method.NONE).isEmpty());
    }

    @Test
    @DisplayName("should accept a public client by id alone")
    void shouldAcceptPublicClient() {
        assertTrue(authenticate("spa", null, Method.NONE).isPresent());
    }

    @Test
    @DisplayName("should reject a secret presented for a public client")
    void shouldRejectSecretForPublicClient() {
        assertTrue(authenticate("spa", "anything", Method.CLIENT_SECRET_POST).isEmpty());
    }

    @Test
    @DisplayName("should reject unknown and disabled clients")
    void shouldRejectUnknownAndDisabled() {
        assertTrue(authenticate("ghost", "s3cret", Method.CLIENT_SECRET_BASIC).isEmpty());
        assertTrue(authenticate("retired", "s3cret", Method.CLIENT_SECRET_BASIC).isEmpty());
    }
}
