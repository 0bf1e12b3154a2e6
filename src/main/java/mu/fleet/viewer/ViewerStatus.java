package mu.fleet.viewer;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;

/**
 * Freshness of the snapshot a viewer is showing.
 *
 * @param lastUpdate time of the shown snapshot, {@code null} before the first good read
 * @param age        time since {@code lastUpdate}, {@code null} before the first good read
 * @param success    whether the latest poll read the file successfully
 * @param stale      true when nothing was read yet, the latest poll failed, or the data is too old
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViewerStatus(
        @JsonProperty("lastUpdate") Instant lastUpdate,
        @JsonProperty("age") Duration age,
        @JsonProperty("success") boolean success,
        @JsonProperty("stale") boolean stale) {
}
