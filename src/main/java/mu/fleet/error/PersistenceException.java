package mu.fleet.error;

/**
 * Failure to serialize or write the cluster snapshot. Fatal to a hive run.
 */
public class PersistenceException extends MuException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
