package quokka.core.model.key;

/**
 * Intended use of a key, published as the JWK {@code use} member.
 */
public enum KeyUse {
    SIGNING("sig"),
    ENCRYPTION("enc");

    private final String jwkValue;

    KeyUse(String jwkValue) {
        this.jwkValue = jwkValue;
    }

    public String jwkValue() {
        return jwkValue;
    }
}
