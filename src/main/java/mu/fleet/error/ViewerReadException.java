package mu.fleet.error;

/**
 * Failure to read or parse the persisted cluster snapshot.
 */
public class ViewerReadException extends MuException {

    public ViewerReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
