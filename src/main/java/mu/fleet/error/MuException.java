package mu.fleet.error;

/**
 * Base class of all failures raised by the sampler, the hive and the viewers.
 */
public class MuException extends RuntimeException {

    public MuException(String message) {
        super(message);
    }

    public MuException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Innermost cause of this exception, or the exception itself. */
    public static Throwable rootCause(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root;
    }
}
