package quokka.core.model.user;

import java.util.Objects;

/**
 * End-user account data needed by the token engine.
 *
 * @param subjectId   stable subject identifier
 * @param username    login name
 * @param email       email address, or null
 * @param active      whether the account is active
 * @param locked      whether the account is locked out
 * @param mfaRequired whether interactive MFA is required to sign in
 */
public record UserAccount(
        String subjectId, String username, String email, boolean active, boolean locked, boolean mfaRequired) {

    public UserAccount {
        Objects.requireNonNull(subjectId, "subjectId cannot be null");
        Objects.requireNonNull(username, "username cannot be null");
    }

    public boolean canSignIn() {
        return active && !locked;
    }
}
