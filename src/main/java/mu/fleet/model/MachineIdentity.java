package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Identity of one roster machine.
 */
public record MachineIdentity(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("room") String room,
        @JsonProperty("owner") OwnerTag owner) {

    public MachineIdentity {
        Objects.requireNonNull(hostname, "hostname is required");
        Objects.requireNonNull(room, "room is required");
        owner = owner == null ? OwnerTag.unowned() : owner;
    }

    /** Build an identity from a roster line, parsing the optional owner note. */
    public static MachineIdentity of(String hostname, String room, String note) {
        return new MachineIdentity(hostname, room, OwnerTag.parse(note));
    }
}
