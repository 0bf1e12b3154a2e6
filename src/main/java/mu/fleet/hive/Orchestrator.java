package mu.fleet.hive;

import mu.fleet.config.MuConfig;
import mu.fleet.error.MuException;
import mu.fleet.model.ClusterEntry;
import mu.fleet.model.ClusterSnapshot;
import mu.fleet.model.MachineIdentity;
import mu.fleet.model.Snapshot;
import mu.fleet.model.SnapshotJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Gathers snapshots from every roster machine and aggregates them into one cluster snapshot.
 *
 * Each machine is an independent unit of work on a bounded pool:
 * connect, run the sampler, parse its output. A failing unit is logged and its machine is
 * left out; it never affects the other units. Aggregation starts only after every unit has
 * finished, and entries follow roster order regardless of completion order.
 */
public class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final String samplerCommand;
    private final Duration timeout;
    private final Clock clock;
    private final ExecutorService pool;

    private long lastTimestamp;

    public Orchestrator(String samplerCommand, MuConfig config) {
        this(samplerCommand, config, Clock.systemUTC());
    }

    public Orchestrator(String samplerCommand, MuConfig config, Clock clock) {
        this.samplerCommand = samplerCommand;
        this.timeout = config.gatherTimeout();
        this.clock = clock;
        AtomicInteger threads = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(config.gatherParallelism(), r -> {
            Thread t = new Thread(r, "mu-gather-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Gather from every machine once. Never throws because of a single machine.
     */
    public GatherResult gather(List<MachineIdentity> roster, RemoteExecutor exec) {
        List<MachineIdentity> machines = distinctByHostname(roster);

        List<CompletableFuture<Outcome>> units = new ArrayList<>(machines.size());
        for (MachineIdentity machine : machines) {
            log.debug("Setting up connection to {}", machine.hostname());
            units.add(CompletableFuture
                    .supplyAsync(() -> gatherOne(machine, exec), pool)
                    .handle((snapshot, error) -> error == null
                            ? Outcome.success(machine, snapshot)
                            : Outcome.failure(machine, unwrap(error))));
        }

        // Barrier: nothing is aggregated until every unit has succeeded or failed.
        CompletableFuture.allOf(units.toArray(new CompletableFuture[0])).join();

        List<ClusterEntry> entries = new ArrayList<>();
        List<MachineFailure> failures = new ArrayList<>();
        for (CompletableFuture<Outcome> unit : units) {
            Outcome outcome = unit.join();
            if (outcome.error() == null) {
                entries.add(new ClusterEntry(outcome.machine(), outcome.snapshot()));
            } else {
                Throwable root = MuException.rootCause(outcome.error());
                log.warn("Problem while gathering usage from {}: {} (root cause: {})",
                        outcome.machine().hostname(), outcome.error().getMessage(), root.toString());
                failures.add(new MachineFailure(outcome.machine().hostname(), root.toString()));
            }
        }

        ClusterSnapshot snapshot = new ClusterSnapshot(nextTimestamp(), entries);
        log.info("gathered {}/{} machines", entries.size(), machines.size());
        return new GatherResult(snapshot, entries.size(), machines.size(), failures);
    }

    /**
     * Write the snapshot to {@code path}.
     *
     * @throws mu.fleet.error.PersistenceException on any serialization or I/O failure
     */
    public void persist(ClusterSnapshot snapshot, Path path) {
        SnapshotStore.persist(snapshot, path);
    }

    private Snapshot gatherOne(MachineIdentity machine, RemoteExecutor exec) {
        String host = machine.hostname();
        byte[] output = exec.execute(host, samplerCommand, timeout);
        log.debug("({}) Executed sampler, deserializing {} bytes", host, output.length);
        Snapshot snapshot = SnapshotJson.readSnapshot(output);
        log.debug("({}) Done", host);
        return snapshot;
    }

    /** Current second, never earlier than the previous gather of this instance. */
    private synchronized long nextTimestamp() {
        long now = clock.instant().getEpochSecond();
        lastTimestamp = Math.max(now, lastTimestamp);
        return lastTimestamp;
    }

    private static List<MachineIdentity> distinctByHostname(List<MachineIdentity> roster) {
        Set<String> seen = new HashSet<>();
        List<MachineIdentity> distinct = new ArrayList<>(roster.size());
        for (MachineIdentity machine : roster) {
            if (seen.add(machine.hostname())) {
                distinct.add(machine);
            } else {
                log.warn("Duplicate roster entry for {} ignored", machine.hostname());
            }
        }
        return distinct;
    }

    private static Throwable unwrap(Throwable t) {
        if ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            return t.getCause();
        }
        return t;
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                log.warn("Gather pool forcefully stopped");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Outcome(MachineIdentity machine, Snapshot snapshot, Throwable error) {

        static Outcome success(MachineIdentity machine, Snapshot snapshot) {
            return new Outcome(machine, snapshot, null);
        }

        static Outcome failure(MachineIdentity machine, Throwable error) {
            return new Outcome(machine, null, error);
        }
    }
}
