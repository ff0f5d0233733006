package in.elpyfi.infrastructure.persistence;

/**
 * Thrown when the database cannot be reached within the configured attempts.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
