package mu.fleet.hive;

import mu.fleet.error.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the command through an external ssh client: {@code <transport...> <host> <command>}.
 */
public class SshRemoteExecutor implements RemoteExecutor {

    private static final Logger log = LoggerFactory.getLogger(SshRemoteExecutor.class);
    private static final int STDERR_PREVIEW = 500;

    private final List<String> transport;
    private final ExecutorService drainers = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "mu-ssh-drain");
        t.setDaemon(true);
        return t;
    });

    public SshRemoteExecutor(List<String> transport) {
        if (transport.isEmpty()) {
            throw new IllegalArgumentException("transport command is empty");
        }
        this.transport = List.copyOf(transport);
    }

    @Override
    public byte[] execute(String hostname, String command, Duration timeout) {
        if (drainers.isShutdown()) {
            throw new ConnectionException("executor is closed, not connecting to " + hostname);
        }
        List<String> cmd = new ArrayList<>(transport);
        cmd.add(hostname);
        cmd.add(command);

        Process p;
        try {
            p = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            throw new ConnectionException("could not start " + transport.get(0) + " for " + hostname, e);
        }
        log.debug("({}) Connection started, running {}", hostname, command);

        // Drain both streams concurrently so a chatty remote cannot block on a full pipe.
        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(() -> readAll(p.getInputStream()), drainers);
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> readAll(p.getErrorStream()), drainers);
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new ConnectionException("timed out after " + timeout.toSeconds() + "s");
            }
            int exit = p.exitValue();
            if (exit != 0) {
                throw new ConnectionException("remote command exited with status " + exit + ": "
                        + preview(stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS)));
            }
            return stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ConnectionException("interrupted while waiting for " + hostname, e);
        } catch (ExecutionException e) {
            throw new ConnectionException("could not read output of " + hostname, e.getCause());
        } catch (TimeoutException e) {
            p.destroyForcibly();
            throw new ConnectionException("timed out reading output of " + hostname, e);
        }
    }

    @Override
    public void close() {
        drainers.shutdown();
        try {
            if (!drainers.awaitTermination(5, TimeUnit.SECONDS)) {
                drainers.shutdownNow();
                log.warn("Output drain pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            drainers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static byte[] readAll(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String preview(byte[] bytes) {
        String s = new String(bytes, StandardCharsets.UTF_8).strip();
        return s.length() > STDERR_PREVIEW ? s.substring(0, STDERR_PREVIEW) + "..." : s;
    }
}
