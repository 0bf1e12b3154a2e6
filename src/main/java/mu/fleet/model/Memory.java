package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Memory figures in bytes.
 */
public record Memory(
        @JsonProperty("used") long used,
        @JsonProperty("total") long total) {

    public Memory {
        if (used < 0 || total < 0) {
            throw new IllegalArgumentException("memory figures must be non-negative");
        }
    }

    /** Used fraction in [0, 1]; 0 when total is unknown. */
    @JsonIgnore
    public double usedRatio() {
        if (total == 0) {
            return 0.0;
        }
        return Math.min(1.0, (double) used / total);
    }
}
