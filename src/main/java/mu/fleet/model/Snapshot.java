package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Point-in-time usage report of a single machine, as produced by one sampler run.
 */
public record Snapshot(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("global_cpu_percent") double globalCpuPercent,
        @JsonProperty("per_core_percent") List<Double> perCorePercent,
        @JsonProperty("load_avg") LoadAverage loadAverage,
        @JsonProperty("memory") Memory memory,
        @JsonProperty("samples") List<Sample> samples) {

    public Snapshot {
        Objects.requireNonNull(hostname, "hostname is required");
        perCorePercent = perCorePercent == null ? List.of() : List.copyOf(perCorePercent);
        loadAverage = loadAverage == null ? LoadAverage.ZERO : loadAverage;
        memory = memory == null ? new Memory(0, 0) : memory;
        samples = samples == null ? List.of() : List.copyOf(samples);
    }

    @JsonIgnore
    public int coreCount() {
        return perCorePercent.size();
    }
}
