package mu.fleet.sampler;

/**
 * Raw per-process reading taken by a {@link SystemProbe}.
 * Either uid may be null when the probe could not determine it.
 */
public record ProcessReading(
        long pid,
        String name,
        Integer effectiveUid,
        Integer realUid,
        double cpuPercent) {
}
