package mu.fleet.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mu.fleet.view.FleetView;
import mu.fleet.view.MachineView;
import mu.fleet.view.UserRank;
import mu.fleet.viewer.ViewerStatus;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the fleet view.
 * GET /api/v1/fleet
 *
 * The last good fleet view plus the freshness of the poll that produced it, so a client can
 * tell stale data from fresh without asking the health endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FleetResponse(
        @JsonProperty("updated") Instant updated,
        @JsonProperty("totalUsage") double totalUsage,
        @JsonProperty("cores") int cores,
        @JsonProperty("machines") List<MachineView> machines,
        @JsonProperty("ranking") List<UserRank> ranking,
        @JsonProperty("stale") boolean stale,
        @JsonProperty("ageSeconds") Long ageSeconds,
        @JsonProperty("lastPollOk") boolean lastPollOk) {

    public static FleetResponse of(FleetView fleet, ViewerStatus status) {
        return new FleetResponse(
                fleet.updated(),
                fleet.totalUsage(),
                fleet.cores(),
                fleet.machines(),
                fleet.ranking(),
                status.stale(),
                status.age() == null ? null : status.age().getSeconds(),
                status.success());
    }
}
