package mu.fleet.view;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mu.fleet.model.LoadAverage;
import mu.fleet.model.OwnerTag;

/**
 * Display-ready row for one machine.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MachineView(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("room") String room,
        @JsonProperty("ownerKind") OwnerTag.Kind ownerKind,
        @JsonProperty("owner") String owner,
        @JsonProperty("ownerMark") String ownerMark,
        @JsonProperty("hotness") int hotness,
        @JsonProperty("busyCores") int busyCores,
        @JsonProperty("loadCores") int loadCores,
        @JsonProperty("cores") int cores,
        @JsonProperty("loadAvg") LoadAverage loadAverage,
        @JsonProperty("memoryUsed") double memoryUsed,
        @JsonProperty("activeUser") ActiveUser activeUser,
        @JsonProperty("ownerActivity") OwnerActivity ownerActivity) {
}
