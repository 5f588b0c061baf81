package quokka.core.util;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Cryptographically random identifiers.
 */
public final class RandomValues {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder BASE64_URL = Base64.getUrlEncoder().withoutPadding();

    // No vowels or lookalikes, so user codes never spell words or get misread.
    private static final char[] USER_CODE_ALPHABET = "BCDFGHJKLMNPQRSTVWXZ".toCharArray();

    private RandomValues() {}

    /**
     * Random bytes, base64url-encoded without padding.
     *
     * @param byteCount number of random bytes
     */
    public static String base64Url(int byteCount) {
        final var bytes = new byte[byteCount];
        RANDOM.nextBytes(bytes);
        return BASE64_URL.encodeToString(bytes);
    }

    /**
     * Opaque handle for codes, refresh tokens and reference tokens.
     */
    public static String handle() {
        return base64Url(32);
    }

    /**
     * An eight character user code formatted as {@code XXXX-XXXX}.
     */
    public static String userCode() {
        final var code = new StringBuilder(9);
        for (int i = 0; i < 8; i++) {
            if (i == 4) {
                code.append('-');
            }
            code.append(USER_CODE_ALPHABET[RANDOM.nextInt(USER_CODE_ALPHABET.length)]);
        }
        return code.toString();
    }
}
