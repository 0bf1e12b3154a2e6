package mu.fleet.view;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The user consuming the most CPU on one machine.
 *
 * @param coreCount number of that user's samples
 * @param task      process name of that user's highest-CPU sample
 */
public record ActiveUser(
        @JsonProperty("user") String user,
        @JsonProperty("coreCount") int coreCount,
        @JsonProperty("task") String task) {
}
