package quokka.core.util;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Base64;
import java.util.HexFormat;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

/**
 * Hashing helpers for token protocol values and log-safe identifiers.
 */
public final class SecureHash {

    private static final int MAX_HEX_CHARS = 64;
    private static final Base64.Encoder BASE64_URL = Base64.getUrlEncoder().withoutPadding();

    private SecureHash() {}

    /**
     * Return a truncated SHA-256 hex digest of the input string.
     *
     * <p>Used to log codes, handles and request ids without exposing them.
     *
     * @param input    the string to hash
     * @param hexChars number of hex characters to return (1-64)
     * @return truncated hex digest
     * @throws IllegalArgumentException if hexChars is out of range
     */
    public static String truncatedSha256(String input, int hexChars) {
        if (hexChars < 1 || hexChars > MAX_HEX_CHARS) {
            throw new IllegalArgumentException("hexChars must be between 1 and " + MAX_HEX_CHARS + ", got " + hexChars);
        }
        final var fullHex = HexFormat.of().formatHex(digest("SHA-256", input));
        return fullHex.substring(0, hexChars);
    }

    /**
     * Short log-safe fingerprint of a secret value.
     */
    public static String fingerprint(String value) {
        return value == null ? "null" : truncatedSha256(value, 12);
    }

    /**
     * BASE64URL(SHA-256(ASCII(input))), as used by PKCE S256 and the DPoP
     * {@code ath} claim.
     */
    public static String sha256Base64Url(String input) {
        return BASE64_URL.encodeToString(digest("SHA-256", input));
    }

    /**
     * OIDC left-half hash: base64url of the left-most half of the digest of
     * the ASCII value, as used by {@code at_hash} and {@code c_hash}.
     *
     * @param value           the token value
     * @param digestAlgorithm digest matching the signing algorithm, e.g. SHA-256
     */
    public static String leftHalfHash(String value, String digestAlgorithm) {
        final var hash = digest(digestAlgorithm, value);
        return BASE64_URL.encodeToString(Arrays.copyOf(hash, hash.length / 2));
    }

    /**
     * Base64url HMAC-SHA256 of {@code data} keyed with {@code key}.
     */
    public static String hmacSha256Base64Url(String key, String data) {
        try {
            final var mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(key.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return BASE64_URL.encodeToString(mac.doFinal(data.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static byte[] digest(String algorithm, String input) {
        try {
            return MessageDigest.getInstance(algorithm).digest(input.getBytes(StandardCharsets.US_ASCII));
        } catch (NoSuchAlgorithmException e) {
            throw new AssertionError(algorithm + " is required on every Java platform", e);
        }
    }
}
