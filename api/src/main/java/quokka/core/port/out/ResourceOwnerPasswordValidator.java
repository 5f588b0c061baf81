package quokka.core.port.out;

import io.smallrye.mutiny.Uni;

import quokka.core.model.client.Client;
import quokka.core.model.user.PasswordValidationResult;

/**
 * Validates resource-owner credentials for the password grant.
 */
public interface ResourceOwnerPasswordValidator {

    Uni<PasswordValidationResult> validate(String username, String password, Client client);
}
