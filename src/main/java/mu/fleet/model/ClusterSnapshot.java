package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Fleet-wide usage report written by the hive and read by viewers.
 * Machines whose gather failed are absent.
 */
public record ClusterSnapshot(
        @JsonProperty("timestamp") long timestamp,
        @JsonProperty("entries") List<ClusterEntry> entries) {

    public ClusterSnapshot {
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative");
        }
        entries = entries == null ? List.of() : List.copyOf(entries);
        Set<String> seen = new HashSet<>();
        for (ClusterEntry entry : entries) {
            if (!seen.add(entry.identity().hostname())) {
                throw new IllegalArgumentException("duplicate hostname: " + entry.identity().hostname());
            }
        }
    }

    /** Time of the gather that produced this snapshot. */
    @JsonIgnore
    public Instant time() {
        return Instant.ofEpochSecond(timestamp);
    }

    /** Total number of cores across all machines. */
    @JsonIgnore
    public int coreCount() {
        int cores = 0;
        for (ClusterEntry entry : entries) {
            cores += entry.snapshot().coreCount();
        }
        return cores;
    }
}
