package mu.fleet.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mu.fleet.viewer.ViewerStatus;

import java.time.Instant;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("lastUpdate") Instant lastUpdate,
        @JsonProperty("ageSeconds") Long ageSeconds,
        @JsonProperty("lastPollOk") boolean lastPollOk,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version) {

    public static HealthResponse of(ViewerStatus status, String uptime, String version) {
        return new HealthResponse(
                status.stale() ? "stale" : "healthy",
                status.lastUpdate(),
                status.age() == null ? null : status.age().getSeconds(),
                status.success(),
                uptime,
                version);
    }
}
