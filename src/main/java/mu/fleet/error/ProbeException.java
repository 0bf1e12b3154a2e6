package mu.fleet.error;

/**
 * The system probe could not be initialized or refreshed. Fatal to a sampler run.
 */
public class ProbeException extends MuException {

    public ProbeException(String message) {
        super(message);
    }

    public ProbeException(String message, Throwable cause) {
        super(message, cause);
    }
}
