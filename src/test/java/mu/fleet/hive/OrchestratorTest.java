package mu.fleet.hive;

import mu.fleet.config.MuConfig;
import mu.fleet.config.RosterParser;
import mu.fleet.error.ConnectionException;
import mu.fleet.model.ClusterEntry;
import mu.fleet.model.ClusterSnapshot;
import mu.fleet.model.LoadAverage;
import mu.fleet.model.MachineIdentity;
import mu.fleet.model.Memory;
import mu.fleet.model.OwnerTag;
import mu.fleet.model.Sample;
import mu.fleet.model.Snapshot;
import mu.fleet.model.SnapshotJson;
import mu.fleet.view.ActiveUser;
import mu.fleet.view.ViewModelBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorTest {

    private static final String BEE = "mu bee /etc/mu/policy";

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
    private Orchestrator orchestrator;

    private Orchestrator orchestrator(MuConfig config) {
        orchestrator = new Orchestrator(BEE, config, clock);
        return orchestrator;
    }

    private Orchestrator orchestrator() {
        return orchestrator(MuConfig.defaults().withGatherParallelism(4));
    }

    @AfterEach
    void tearDown() {
        if (orchestrator != null) {
            orchestrator.close();
        }
    }

    static byte[] json(String host, Sample... samples) {
        Snapshot snapshot = new Snapshot(host, 20.0, List.of(40.0, 0.0),
                new LoadAverage(0.5, 0.5, 0.5), new Memory(1, 2), List.of(samples));
        try {
            return SnapshotJson.writeSnapshot(snapshot);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static List<MachineIdentity> roster(String... hosts) {
        List<MachineIdentity> machines = new ArrayList<>();
        for (String host : hosts) {
            machines.add(MachineIdentity.of(host, "lab", ""));
        }
        return machines;
    }

    private static List<String> hostnames(ClusterSnapshot snapshot) {
        return snapshot.entries().stream().map(e -> e.identity().hostname()).toList();
    }

    @Test
    void allMachinesSucceed() {
        List<MachineIdentity> roster = roster("m1", "m2", "m3", "m4", "m5");

        GatherResult result = orchestrator().gather(roster, (host, cmd, timeout) -> json(host));

        assertEquals(5, result.snapshot().entries().size());
        assertEquals(5, result.successes());
        assertEquals(5, result.total());
        assertTrue(result.failures().isEmpty());
    }

    @Test
    @DisplayName("Entries follow roster order even when later machines answer first")
    void rosterOrderIndependentOfCompletionOrder() {
        List<MachineIdentity> roster = roster("a", "b", "c", "d");

        GatherResult result = orchestrator().gather(roster, (host, cmd, timeout) -> {
            try {
                Thread.sleep("a".equals(host) ? 200 : "b".equals(host) ? 100 : 0);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return json(host);
        });

        assertEquals(List.of("a", "b", "c", "d"), hostnames(result.snapshot()));
    }

    @Test
    void failingMachinesAreLeftOut() {
        List<MachineIdentity> roster = roster("ok1", "down", "garbage", "boom", "ok2");

        GatherResult result = orchestrator().gather(roster, (host, cmd, timeout) -> switch (host) {
            case "down" -> throw new ConnectionException("connection refused");
            case "garbage" -> "Welcome to m3!".getBytes(StandardCharsets.UTF_8);
            case "boom" -> throw new IllegalStateException("unexpected");
            default -> json(host);
        });

        assertEquals(List.of("ok1", "ok2"), hostnames(result.snapshot()));
        assertEquals(2, result.successes());
        assertEquals(5, result.total());
        assertEquals("2/5", result.summary());
        assertEquals(Set.of("down", "garbage", "boom"),
                Set.copyOf(result.failures().stream().map(MachineFailure::hostname).toList()));
    }

    @Test
    void allMachinesFailingStillProducesSnapshot() {
        GatherResult result = orchestrator().gather(roster("m1", "m2"), (host, cmd, timeout) -> {
            throw new ConnectionException("no route to host");
        });

        assertTrue(result.snapshot().entries().isEmpty());
        assertEquals(0, result.successes());
        assertEquals(2, result.total());
    }

    @Test
    @DisplayName("m1 answers, m2 is down: one Student-owned entry and summary (1, 2)")
    void endToEndScenario() {
        List<MachineIdentity> roster = RosterParser.parse(List.of(
                "[lab]",
                "m1: Ann (Student)",
                "m2:")).machines();

        GatherResult result = orchestrator().gather(roster, (host, cmd, timeout) -> {
            if ("m2".equals(host)) {
                throw new ConnectionException("ssh: connect to host m2 port 22: Connection refused");
            }
            return json(host, new Sample("python", "ann", 55.0));
        });

        assertEquals(1, result.successes());
        assertEquals(2, result.total());
        ClusterEntry entry = result.snapshot().entries().get(0);
        assertEquals("m1", entry.identity().hostname());
        assertEquals(OwnerTag.student("Ann"), entry.identity().owner());
        assertEquals(new ActiveUser("ann", 1, "python"),
                ViewModelBuilder.activeUser(entry.snapshot()).orElseThrow());
    }

    @Test
    void identityComesFromRoster() {
        GatherResult result = orchestrator().gather(List.of(MachineIdentity.of("m1", "lab", "Carl")),
                (host, cmd, timeout) -> json("localhost.localdomain"));

        ClusterEntry entry = result.snapshot().entries().get(0);
        assertEquals("m1", entry.identity().hostname());
        assertEquals("localhost.localdomain", entry.snapshot().hostname());
    }

    @Test
    void passesSamplerCommandAndTimeout() {
        MuConfig config = MuConfig.defaults().withGatherTimeout(Duration.ofSeconds(7));
        List<String> commands = new CopyOnWriteArrayList<>();
        List<Duration> timeouts = new CopyOnWriteArrayList<>();

        orchestrator(config).gather(roster("m1"), (host, cmd, timeout) -> {
            commands.add(cmd);
            timeouts.add(timeout);
            return json(host);
        });

        assertEquals(List.of(BEE), commands);
        assertEquals(List.of(Duration.ofSeconds(7)), timeouts);
    }

    @Test
    void concurrencyIsBounded() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<MachineIdentity> roster = roster("m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8");

        GatherResult result = orchestrator(MuConfig.defaults().withGatherParallelism(2))
                .gather(roster, (host, cmd, timeout) -> {
                    int now = active.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    try {
                        Thread.sleep(30);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        active.decrementAndGet();
                    }
                    return json(host);
                });

        assertEquals(8, result.successes());
        assertTrue(peak.get() <= 2, "peak concurrency was " + peak.get());
    }

    @Test
    void timestampsNeverGoBackwards() {
        Orchestrator o = orchestrator();
        long first = o.gather(roster("m1"), (host, cmd, timeout) -> json(host)).snapshot().timestamp();

        clock.set(Instant.ofEpochSecond(1_600_000_000L));
        long second = o.gather(roster("m1"), (host, cmd, timeout) -> json(host)).snapshot().timestamp();

        clock.set(Instant.ofEpochSecond(1_800_000_000L));
        long third = o.gather(roster("m1"), (host, cmd, timeout) -> json(host)).snapshot().timestamp();

        assertEquals(1_700_000_000L, first);
        assertEquals(first, second);
        assertEquals(1_800_000_000L, third);
    }

    @Test
    void duplicateRosterEntriesAreGatheredOnce() {
        AtomicInteger calls = new AtomicInteger();
        List<MachineIdentity> roster = List.of(
                MachineIdentity.of("m1", "lab", ""),
                MachineIdentity.of("m1", "other", ""));

        GatherResult result = orchestrator().gather(roster, (host, cmd, timeout) -> {
            calls.incrementAndGet();
            return json(host);
        });

        assertEquals(1, calls.get());
        assertEquals(1, result.snapshot().entries().size());
        assertEquals("lab", result.snapshot().entries().get(0).identity().room());
    }

    @Test
    void emptyRoster() {
        GatherResult result = orchestrator().gather(List.of(), (host, cmd, timeout) -> json(host));
        assertTrue(result.snapshot().entries().isEmpty());
        assertEquals("0/0", result.summary());
    }
}
