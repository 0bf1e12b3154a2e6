package mu.fleet.hive;

import java.time.Duration;

/**
 * Runs a command on a remote host and returns what it wrote to stdout.
 */
@FunctionalInterface
public interface RemoteExecutor extends AutoCloseable {

    /**
     * Execute {@code command} on {@code hostname}.
     *
     * @param timeout deadline for the whole execution
     * @return the command's standard output
     * @throws mu.fleet.error.ConnectionException if the host cannot be reached, the command exits
     *                                            with a non-zero status or the deadline expires
     */
    byte[] execute(String hostname, String command, Duration timeout);

    /** Release resources held across executions. */
    @Override
    default void close() {
    }
}
