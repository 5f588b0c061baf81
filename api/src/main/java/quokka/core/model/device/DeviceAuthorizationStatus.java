package quokka.core.model.device;

/**
 * Status of a device authorization.
 */
public enum DeviceAuthorizationStatus {
    PENDING,
    AUTHORIZED,
    DENIED
}
