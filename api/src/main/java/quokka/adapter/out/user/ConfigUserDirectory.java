package quokka.adapter.out.user;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import quokka.core.config.RegistryConfig;
import quokka.core.config.RegistryConfig.UserEntry;
import quokka.core.model.client.Client;
import quokka.core.model.user.PasswordValidationResult;
import quokka.core.model.user.PasswordValidationResult.Reason;
import quokka.core.model.user.UserAccount;
import quokka.core.port.out.ResourceOwnerPasswordValidator;
import quokka.core.port.out.UserDirectory;
import quokka.core.util.SecureHash;

/**
 * Development user directory backed by {@code quokka.registry.users.*}.
 *
 * <p>Passwords are held in configuration as plain text, so this adapter is
 * only suitable for local development and tests.
 */
@ApplicationScoped
public class ConfigUserDirectory implements UserDirectory, ResourceOwnerPasswordValidator {

    private static final Logger LOG = Logger.getLogger(ConfigUserDirectory.class);

    private final Map<String, UserRecord> bySubject;
    private final Map<String, UserRecord> byUsername;

    @Inject
    public ConfigUserDirectory(RegistryConfig config) {
        final var subjects = new HashMap<String, UserRecord>();
        final var usernames = new HashMap<String, UserRecord>();
        config.users().forEach((username, entry) -> {
            final var record = toRecord(username, entry);
            subjects.put(record.account().subjectId(), record);
            usernames.put(username, record);
        });
        this.bySubject = Map.copyOf(subjects);
        this.byUsername = Map.copyOf(usernames);
        if (!byUsername.isEmpty()) {
            LOG.warnf("Loaded %d users from configuration; do not use configured users in production",
                    byUsername.size());
        }
    }

    @Override
    public Uni<Optional<UserAccount>> findBySubject(String subjectId) {
        return Uni.createFrom()
                .item(Optional.ofNullable(subjectId).map(bySubject::get).map(UserRecord::account));
    }

    /**
     * Resolves a login hint as an email address, then a username, then a subject id.
     */
    @Override
    public Uni<Optional<UserAccount>> findByLoginHint(String loginHint) {
        if (loginHint == null || loginHint.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var byEmail = byUsername.values().stream()
                .map(UserRecord::account)
                .filter(account -> loginHint.equalsIgnoreCase(account.email()))
                .findFirst();
        if (byEmail.isPresent()) {
            return Uni.createFrom().item(byEmail);
        }
        final var record = Optional.ofNullable(byUsername.get(loginHint))
                .or(() -> Optional.ofNullable(bySubject.get(loginHint)));
        return Uni.createFrom().item(record.map(UserRecord::account));
    }

    @Override
    public Uni<PasswordValidationResult> validate(String username, String password, Client client) {
        final var record = username == null ? null : byUsername.get(username);
        if (record == null || password == null || !matches(record.password(), password)) {
            LOG.debugf("Password validation failed for user %s", SecureHash.fingerprint(username));
            return Uni.createFrom().item(new PasswordValidationResult.Invalid(Reason.INVALID_CREDENTIALS));
        }

        final var account = record.account();
        if (account.locked()) {
            return Uni.createFrom().item(new PasswordValidationResult.Invalid(Reason.LOCKED_OUT));
        }
        if (!account.active()) {
            return Uni.createFrom().item(new PasswordValidationResult.Invalid(Reason.INACTIVE));
        }
        if (account.mfaRequired()) {
            return Uni.createFrom().item(new PasswordValidationResult.Invalid(Reason.MFA_REQUIRED));
        }
        return Uni.createFrom().item(new PasswordValidationResult.Valid(account));
    }

    private static boolean matches(String expected, String presented) {
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
    }

    private static UserRecord toRecord(String username, UserEntry entry) {
        final var account = new UserAccount(
                entry.subject().orElse(username),
                username,
                entry.email().orElse(null),
                entry.active(),
                entry.locked(),
                entry.mfaRequired());
        return new UserRecord(account, entry.password());
    }

    private record UserRecord(UserAccount account, String password) {}
}
