package mu.fleet.sampler;

import mu.fleet.error.ProbeException;
import mu.fleet.model.FilterPolicy;
import mu.fleet.model.LoadAverage;
import mu.fleet.model.Sample;
import mu.fleet.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Produces the snapshot of the machine it runs on.
 *
 * A run refreshes the probe twice, {@link SystemProbe#minimumRefreshInterval()} apart, before
 * reading any CPU figure; values read after a single refresh are all zero.
 */
public class LocalSampler {

    private static final Logger log = LoggerFactory.getLogger(LocalSampler.class);

    /** Processes below this CPU usage are not reported. */
    public static final double USAGE_THRESHOLD_PERCENT = 10.0;

    public static final String UNKNOWN_USER = "?";

    /** Blocking wait, replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final SystemProbe probe;
    private final long ownPid;
    private final Sleeper sleeper;

    public LocalSampler(SystemProbe probe) {
        this(probe, ProcessHandle.current().pid(), d -> Thread.sleep(d.toMillis()));
    }

    public LocalSampler(SystemProbe probe, long ownPid, Sleeper sleeper) {
        this.probe = probe;
        this.ownPid = ownPid;
        this.sleeper = sleeper;
    }

    /**
     * Sample the machine.
     *
     * @throws ProbeException if the probe fails; no partial snapshot is produced
     */
    public Snapshot sample(FilterPolicy policy) {
        probe.refresh();
        try {
            sleeper.sleep(probe.minimumRefreshInterval());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProbeException("interrupted while waiting between probe refreshes", e);
        }
        probe.refresh();

        // Read the load average before doing much processing ourselves.
        LoadAverage loadAverage = probe.loadAverage();

        List<Sample> samples = new ArrayList<>();
        int seen = 0;
        for (ProcessReading proc : probe.processes()) {
            if (proc.pid() == ownPid) continue;
            seen++;

            String name = proc.name() == null ? UNKNOWN_USER : proc.name();
            String user = resolveUser(proc);
            double cpu = proc.cpuPercent();

            boolean ignored = policy.isIgnoredUser(user) || policy.isIgnoredProcess(name);
            boolean lowUsage = cpu < USAGE_THRESHOLD_PERCENT;
            if (ignored || lowUsage) continue;

            String canonical = policy.canonicalName(name).orElse(name);
            samples.add(new Sample(canonical, user, cpu));
        }

        Snapshot snapshot = new Snapshot(
                probe.hostname(),
                probe.globalCpuPercent(),
                probe.perCorePercent(),
                loadAverage,
                probe.memory(),
                samples);
        log.debug("Sampled {}: {} processes seen, {} reported, {} cores",
                snapshot.hostname(), seen, samples.size(), snapshot.coreCount());
        return snapshot;
    }

    private String resolveUser(ProcessReading proc) {
        Integer uid = proc.effectiveUid() != null ? proc.effectiveUid() : proc.realUid();
        if (uid == null) {
            return UNKNOWN_USER;
        }
        Optional<String> name = probe.userName(uid);
        if (name.isEmpty() && proc.realUid() != null && !proc.realUid().equals(uid)) {
            name = probe.userName(proc.realUid());
        }
        return name.orElse(UNKNOWN_USER);
    }
}
