package quokka.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import quokka.core.model.user.UserAccount;

/**
 * Read access to end-user accounts.
 */
public interface UserDirectory {

    Uni<Optional<UserAccount>> findBySubject(String subjectId);

    /**
     * Resolve a login hint, matching email, username or subject id.
     */
    Uni<Optional<UserAccount>> findByLoginHint(String loginHint);
}
