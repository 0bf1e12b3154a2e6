package mu.fleet.hive;

import mu.fleet.model.ClusterSnapshot;

import java.util.List;

/**
 * Outcome of one gather: the aggregated snapshot plus the (successes, total) summary.
 */
public record GatherResult(
        ClusterSnapshot snapshot,
        int successes,
        int total,
        List<MachineFailure> failures) {

    public GatherResult {
        failures = List.copyOf(failures);
    }

    public String summary() {
        return successes + "/" + total;
    }
}
