package quokka.spi;

import java.util.Map;

import io.smallrye.mutiny.Uni;

/**
 * Signing capability handed out by a {@link KeyMaterialProvider}.
 *
 * <p>A signer produces compact JWS serializations for one key. It never
 * exposes the key itself; for remote providers the key does not even exist
 * in this process.
 */
public interface JwsSigner {

    /**
     * The {@code kid} placed in every header this signer produces.
     */
    String keyId();

    /**
     * The JWS {@code alg} this signer produces.
     */
    String algorithm();

    /**
     * Sign a JSON payload.
     *
     * @param payloadJson the JWS payload, normally serialized JWT claims
     * @param headers     extra protected headers such as {@code typ}; {@code alg}
     *                    and {@code kid} are always set by the signer
     * @return the compact serialization
     */
    Uni<String> sign(String payloadJson, Map<String, Object> headers);
}
