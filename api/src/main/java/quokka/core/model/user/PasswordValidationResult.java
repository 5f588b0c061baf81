package quokka.core.model.user;

/**
 * Result of validating resource-owner credentials.
 */
public sealed interface PasswordValidationResult {

    record Valid(UserAccount account) implements PasswordValidationResult {}

    record Invalid(Reason reason) implements PasswordValidationResult {}

    enum Reason {
        INVALID_CREDENTIALS,
        LOCKED_OUT,
        INACTIVE,
        MFA_REQUIRED
    }
}
