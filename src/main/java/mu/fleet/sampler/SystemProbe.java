package mu.fleet.sampler;

import mu.fleet.model.LoadAverage;
import mu.fleet.model.Memory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Operating system introspection used by the sampler.
 *
 * CPU percentages are deltas between the last two {@link #refresh()} calls, so they are only
 * meaningful after two refreshes at least {@link #minimumRefreshInterval()} apart.
 */
public interface SystemProbe {

    /**
     * Take a new reading of processes, cores and memory.
     *
     * @throws mu.fleet.error.ProbeException if the system cannot be read
     */
    void refresh();

    /** Shortest wait between two refreshes that yields usable CPU percentages. */
    Duration minimumRefreshInterval();

    List<ProcessReading> processes();

    /** Whole-machine CPU usage in percent. */
    double globalCpuPercent();

    /** One entry per core, in percent. */
    List<Double> perCorePercent();

    LoadAverage loadAverage();

    Memory memory();

    String hostname();

    /** Name of the account with the given uid, if it can be resolved. */
    Optional<String> userName(int uid);
}
