package fun.fengwk.rsh.core.service.state;

/**
 * Raised when the state store cannot serve a request.
 *
 * @author fengwk
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}
