package mu.fleet.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Describes the machine a viewer is running on.
 */
public record HostInfo(
        @JsonProperty("hostname") String hostname,
        @JsonProperty("user") String user,
        @JsonProperty("os") String os,
        @JsonProperty("osVersion") String osVersion) {

    public static final String UNKNOWN = "?";

    /** Describe the current machine; fields that cannot be determined read "?". */
    public static HostInfo current() {
        return new HostInfo(
                localHostname(),
                orUnknown(System.getProperty("user.name")),
                orUnknown(System.getProperty("os.name")),
                orUnknown(System.getProperty("os.version")));
    }

    private static String localHostname() {
        try {
            return orUnknown(InetAddress.getLocalHost().getHostName());
        } catch (UnknownHostException e) {
            return UNKNOWN;
        }
    }

    private static String orUnknown(String value) {
        return value == null || value.isBlank() ? UNKNOWN : value;
    }
}
