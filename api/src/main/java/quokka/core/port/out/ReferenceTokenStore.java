package quokka.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.token.ReferenceToken;

/**
 * Storage backing opaque reference access tokens, read by introspection.
 */
public interface ReferenceTokenStore {

    Uni<Void> store(ReferenceToken token);

    Uni<Optional<ReferenceToken>> find(String handle);
}
