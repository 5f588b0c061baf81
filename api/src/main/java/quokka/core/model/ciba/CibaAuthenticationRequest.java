package quokka.core.model.ciba;

/**
 * Parameters of a backchannel authentication request, as received.
 *
 * @param scope                   space-delimited scopes
 * @param loginHint               login hint, or null
 * @param loginHintToken          login hint token, or null
 * @param idTokenHint             ID token hint, or null
 * @param bindingMessage          binding message, or null
 * @param userCode                user code, or null
 * @param requestedExpiry         requested expiry in seconds, or null
 * @param clientNotificationToken client notification token, or null
 * @param acrValues               requested ACR values, or null
 * @param tenantId                resolved tenant, or null
 */
public record CibaAuthenticationRequest(
        String scope,
        String loginHint,
        String loginHintToken,
        String idTokenHint,
        String bindingMessage,
        String userCode,
        Integer requestedExpiry,
        String clientNotificationToken,
        String acrValues,
        String tenantId) {

    /**
     * Number of user hints supplied. Exactly one is permitted.
     */
    public int hintCount() {
        int count = 0;
        if (isPresent(loginHint)) {
            count++;
        }
        if (isPresent(loginHintToken)) {
            count++;
        }
        if (isPresent(idTokenHint)) {
            count++;
        }
        return count;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
