package mu.fleet.error;

/**
 * Remote execution could not be established, timed out, or the remote sampler failed.
 * Isolated to one machine.
 */
public class ConnectionException extends MuException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
