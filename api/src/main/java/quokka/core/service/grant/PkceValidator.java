package quokka.core.service.grant;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.regex.Pattern;

import quokka.core.model.client.Client;
import quokka.core.model.token.AuthorizationCode;
import quokka.core.util.SecureHash;

/**
 * Proof Key for Code Exchange (RFC 7636) verification.
 */
final class PkceValidator {

    static final String S256 = "S256";
    static final String PLAIN = "plain";

    private static final Pattern VERIFIER_FORMAT = Pattern.compile("^[A-Za-z0-9\\-._~]{43,128}$");

    private PkceValidator() {}

    /**
     * Check a code verifier against the challenge bound to a code.
     *
     * @return a description of the violation, or empty when the exchange is valid
     */
    static Optional<String> validate(AuthorizationCode code, String verifier, Client client) {
        if (!code.hasChallenge()) {
            return client.requirePkce() ? Optional.of("PKCE is required for this client") : Optional.empty();
        }
        if (verifier == null || verifier.isEmpty()) {
            return Optional.of("code_verifier is required");
        }
        if (!VERIFIER_FORMAT.matcher(verifier).matches()) {
            return Optional.of("code_verifier is malformed");
        }

        final var method = code.codeChallengeMethod() == null ? PLAIN : code.codeChallengeMethod();
        final String computed;
        switch (method) {
            case S256 -> computed = SecureHash.sha256Base64Url(verifier);
            case PLAIN -> {
                if (!client.allowPlainTextPkce()) {
                    return Optional.of("Plain PKCE is not allowed for this client");
                }
                computed = verifier;
            }
            default -> {
                return Optional.of("Unsupported code_challenge_method");
            }
        }

        final var matches = MessageDigest.isEqual(
                computed.getBytes(StandardCharsets.US_ASCII), code.codeChallenge().getBytes(StandardCharsets.US_ASCII));
        return matches ? Optional.empty() : Optional.of("code_verifier does not match code_challenge");
    }
}
