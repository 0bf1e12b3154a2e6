package mu.fleet.view;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * One row of the fleet user ranking.
 *
 * @param percent share of the fleet's cores, {@code null} when the fleet has no cores
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserRank(
        @JsonProperty("user") String user,
        @JsonProperty("samples") int samples,
        @JsonProperty("percent") Double percent) {

    public static final String UNDEFINED_PERCENT = "??";

    @JsonProperty("percentLabel")
    public String percentLabel() {
        return percent == null ? UNDEFINED_PERCENT : String.format(Locale.ROOT, "%.0f", percent);
    }
}
