package mu.fleet.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import mu.fleet.api.Controller;
import mu.fleet.api.v1.dto.HealthResponse;
import mu.fleet.model.SnapshotJson;
import mu.fleet.viewer.SnapshotPoller;
import mu.fleet.viewer.ViewerStatus;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 *
 * 200 while the snapshot is fresh, 503 once it is stale or was never read.
 */
public class HealthController implements Controller {

    private static final String VERSION = "1.0.0";

    private final SnapshotPoller poller;

    public HealthController(SnapshotPoller poller) {
        this.poller = poller;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        ViewerStatus status = poller.status();
        HealthResponse response = HealthResponse.of(status, formatUptime(), VERSION);
        String body = SnapshotJson.mapper().writeValueAsString(response);
        return status.stale()
                ? ControllerResponse.json(HttpResponseStatus.SERVICE_UNAVAILABLE, body)
                : ControllerResponse.json(body);
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
