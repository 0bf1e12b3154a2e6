package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A roster identity paired with the snapshot gathered from that machine.
 */
public record ClusterEntry(
        @JsonProperty("identity") MachineIdentity identity,
        @JsonProperty("snapshot") Snapshot snapshot) {

    public ClusterEntry {
        Objects.requireNonNull(identity, "identity is required");
        Objects.requireNonNull(snapshot, "snapshot is required");
    }
}
