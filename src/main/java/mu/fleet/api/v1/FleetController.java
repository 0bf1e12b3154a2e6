package mu.fleet.api.v1;

import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import mu.fleet.api.Controller;
import mu.fleet.api.v1.dto.FleetResponse;
import mu.fleet.model.ClusterSnapshot;
import mu.fleet.model.SnapshotJson;
import mu.fleet.view.FleetView;
import mu.fleet.view.ViewModelBuilder;
import mu.fleet.viewer.SnapshotPoller;

import java.util.Optional;

/**
 * Fleet view endpoints.
 *
 * GET /api/v1/fleet    - rows, totals, user ranking and poll freshness
 * GET /api/v1/machines - rows only
 *
 * Both answer 503 until the first good read, then serve the last good snapshot.
 */
public class FleetController implements Controller {

    private final SnapshotPoller poller;

    public FleetController(SnapshotPoller poller) {
        this.poller = poller;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET)
                && ("/api/v1/fleet".equals(path) || "/api/v1/machines".equals(path));
    }

    @Override
    public ControllerResponse handle(FullHttpRequest req, String path) throws Exception {
        Optional<ClusterSnapshot> snapshot = poller.current();
        if (snapshot.isEmpty()) {
            return ControllerResponse.unavailable("no snapshot available yet");
        }

        FleetView fleet = ViewModelBuilder.fleetView(snapshot.get());
        Object body = "/api/v1/machines".equals(path)
                ? fleet.machines()
                : FleetResponse.of(fleet, poller.status());
        return ControllerResponse.json(SnapshotJson.mapper().writeValueAsString(body));
    }
}
