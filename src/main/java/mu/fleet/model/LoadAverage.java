package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 1, 5 and 15 minute load averages.
 */
public record LoadAverage(
        @JsonProperty("one") double one,
        @JsonProperty("five") double five,
        @JsonProperty("fifteen") double fifteen) {

    public static final LoadAverage ZERO = new LoadAverage(0, 0, 0);
}
