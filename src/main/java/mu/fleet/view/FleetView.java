package mu.fleet.view;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Everything a viewer renders for one cluster snapshot.
 */
public record FleetView(
        @JsonProperty("updated") Instant updated,
        @JsonProperty("totalUsage") double totalUsage,
        @JsonProperty("cores") int cores,
        @JsonProperty("machines") List<MachineView> machines,
        @JsonProperty("ranking") List<UserRank> ranking) {

    public FleetView {
        machines = List.copyOf(machines);
        ranking = List.copyOf(ranking);
    }
}
