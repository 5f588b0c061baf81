package quokka.core.model.grant;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Helpers for space-delimited OAuth scope strings.
 */
public final class Scopes {

    public static final String OPENID = "openid";
    public static final String OFFLINE_ACCESS = "offline_access";

    /**
     * Scopes that describe the end user and are meaningless without one.
     */
    public static final Set<String> IDENTITY_SCOPES =
            Set.of(OPENID, "profile", "email", "address", "phone", OFFLINE_ACCESS);

    private Scopes() {}

    /**
     * Parse a scope parameter, preserving order and dropping duplicates.
     *
     * @param scope the raw parameter, may be null
     * @return an unmodifiable ordered set, empty if the parameter is blank
     */
    public static Set<String> parse(String scope) {
        if (scope == null || scope.isBlank()) {
            return Set.of();
        }
        final var result = new LinkedHashSet<String>();
        Arrays.stream(scope.trim().split("\\s+")).filter(s -> !s.isEmpty()).forEach(result::add);
        return Collections.unmodifiableSet(result);
    }

    public static String join(Collection<String> scopes) {
        return scopes == null ? "" : String.join(" ", scopes);
    }

    /**
     * Copy a scope collection into an unmodifiable ordered set.
     */
    public static Set<String> ordered(Collection<String> scopes) {
        if (scopes == null || scopes.isEmpty()) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(scopes));
    }

    public static boolean isIdentityScope(String scope) {
        return IDENTITY_SCOPES.contains(scope);
    }
}
