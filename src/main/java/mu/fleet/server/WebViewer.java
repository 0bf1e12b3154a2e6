package mu.fleet.server;

import mu.fleet.api.v1.FleetController;
import mu.fleet.api.v1.HealthController;
import mu.fleet.config.MuConfig;
import mu.fleet.model.HostInfo;
import mu.fleet.scheduler.Scheduler;
import mu.fleet.viewer.AccessLog;
import mu.fleet.viewer.SnapshotPoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * {@code mu web [snapshot-file]}: serves the fleet view as JSON.
 *
 * Wires the poller, its scheduler and the HTTP server together.
 */
public final class WebViewer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WebViewer.class);

    private final MuConfig config;
    private final SnapshotPoller poller;
    private final Scheduler scheduler;
    private final ViewerServer server;

    public WebViewer(MuConfig config, Path snapshotPath) {
        this.config = config;
        this.poller = new SnapshotPoller(snapshotPath, config.staleAfter());
        this.scheduler = new Scheduler("mu-web-poller")
                .every("snapshot-poller", Duration.ZERO, config.pollInterval(), poller::refresh);
        this.server = new ViewerServer(List.of(
                new FleetController(poller),
                new HealthController(poller)));
    }

    /**
     * Read the snapshot once, start polling and serving.
     *
     * @return the bound port
     */
    public int start() {
        boolean logged = AccessLog.record(config.accessLogPath(), HostInfo.current());
        log.debug("Access {}", logged ? "logged" : "not logged");
        poller.refresh();
        scheduler.start();
        return server.start(config.webHost(), config.webPort());
    }

    public SnapshotPoller poller() {
        return poller;
    }

    /**
     * @return process exit status
     */
    public static int run(String[] args, MuConfig config) {
        Path path = args.length > 0 ? Path.of(args[0]) : config.dataPath();
        try (WebViewer viewer = new WebViewer(config, path)) {
            viewer.start();
            viewer.server.awaitClose();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Web viewer failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    @Override
    public void close() {
        server.stop();
        scheduler.stop();
    }
}
