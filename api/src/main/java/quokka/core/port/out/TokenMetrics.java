package quokka.core.port.out;

/**
 * Metrics recorded by the token engine.
 *
 * <p>Implementations must be cheap and must never throw; recording is a
 * no-op when metrics are disabled.
 */
public interface TokenMetrics {

    void recordTokensIssued(String grantType);

    void recordGrantFailure(String grantType, String error);

    void recordSignature(String providerName);

    void recordCibaRequest(String outcome);

    void recordStorageTimeout(String store, String operation);

    void recordStorageFailure(String store, String operation);
}
