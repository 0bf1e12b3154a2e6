package mu.fleet.hive;

/**
 * A machine that was left out of a gather, with the root cause.
 */
public record MachineFailure(String hostname, String cause) {
}
