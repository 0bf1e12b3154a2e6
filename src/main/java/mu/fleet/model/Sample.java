package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One (process, user) observation that passed the sampler's filter policy.
 */
public record Sample(
        @JsonProperty("process_name") String processName,
        @JsonProperty("user") String user,
        @JsonProperty("cpu_percent") double cpuPercent) {

    public Sample {
        Objects.requireNonNull(processName, "processName is required");
        Objects.requireNonNull(user, "user is required");
    }
}
