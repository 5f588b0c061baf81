package quokka.core.service.ciba;

/**
 * Thrown when an approval decision names an unknown {@code auth_req_id}.
 */
public class CibaRequestNotFoundException extends RuntimeException {

    public CibaRequestNotFoundException(String message) {
        super(message);
    }
}
