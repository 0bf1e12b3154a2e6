package mu.fleet.error;

/**
 * Sampler output could not be parsed as a snapshot.
 */
public class DeserializationException extends MuException {

    public DeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
