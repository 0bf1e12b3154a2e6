package mu.fleet.hive;

import mu.fleet.config.MuConfig;
import mu.fleet.error.ConnectionException;
import mu.fleet.model.ClusterSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class HiveCommandTest {

    @TempDir
    Path dir;

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));

    private HiveCommand command(RemoteExecutor executor) {
        return new HiveCommand(MuConfig.defaults().withGatherParallelism(2), executor, clock);
    }

    private Path roster(String content) throws Exception {
        Path file = dir.resolve("machines");
        Files.writeString(file, content);
        return file;
    }

    @Test
    void gathersAndPersists() throws Exception {
        Path machines = roster("[lab]\nm1: Ann (Student)\nm2:\n");
        Path output = dir.resolve("mu.dat");

        int status = command((host, cmd, timeout) -> {
            if ("m2".equals(host)) throw new ConnectionException("refused");
            return OrchestratorTest.json(host);
        }).run(new String[]{"-m", machines.toString(), "-o", output.toString(), "-b", "mu bee"});

        assertEquals(0, status);
        ClusterSnapshot written = SnapshotStore.load(output);
        assertEquals(1, written.entries().size());
        assertEquals(1_700_000_000L, written.timestamp());
    }

    @Test
    void longFlagsWork() throws Exception {
        Path machines = roster("m1:\n");
        Path output = dir.resolve("mu.dat");

        int status = command((host, cmd, timeout) -> OrchestratorTest.json(host))
                .run(new String[]{"--machines", machines.toString(), "--output", output.toString(), "--bee", "mu bee"});

        assertEquals(0, status);
        assertTrue(Files.exists(output));
    }

    @Test
    void missingFlagExitsWithTwo() throws Exception {
        Path machines = roster("m1:\n");
        int status = command((host, cmd, timeout) -> OrchestratorTest.json(host))
                .run(new String[]{"-m", machines.toString(), "-b", "mu bee"});
        assertEquals(2, status);
    }

    @Test
    void flagWithoutValueExitsWithTwo() {
        int status = command((host, cmd, timeout) -> OrchestratorTest.json(host)).run(new String[]{"-m"});
        assertEquals(2, status);
    }

    @Test
    void badRosterExitsWithTwo() throws Exception {
        Path machines = roster("[lab]\nm1 Ann\n");
        int status = command((host, cmd, timeout) -> OrchestratorTest.json(host))
                .run(new String[]{"-m", machines.toString(), "-o", dir.resolve("out").toString(), "-b", "mu bee"});
        assertEquals(2, status);
    }

    @Test
    void unwritableOutputExitsWithOne() throws Exception {
        Path machines = roster("m1:\n");
        Path output = dir.resolve("missing/dir/mu.dat");
        int status = command((host, cmd, timeout) -> OrchestratorTest.json(host))
                .run(new String[]{"-m", machines.toString(), "-o", output.toString(), "-b", "mu bee"});
        assertEquals(1, status);
    }

    @Test
    void closesExecutorWhenDone() throws Exception {
        Path machines = roster("m1:\n");
        AtomicBoolean closed = new AtomicBoolean();
        RemoteExecutor executor = new RemoteExecutor() {
            @Override
            public byte[] execute(String hostname, String command, Duration timeout) {
                return OrchestratorTest.json(hostname);
            }

            @Override
            public void close() {
                closed.set(true);
            }
        };

        int status = command(executor)
                .run(new String[]{"-m", machines.toString(), "-o", dir.resolve("mu.dat").toString(), "-b", "mu bee"});

        assertEquals(0, status);
        assertTrue(closed.get());
    }

    @Test
    void parsesInterval() {
        HiveCommand.Options options = HiveCommand.Options.parse(
                new String[]{"-m", "machines", "-o", "out", "-b", "mu bee", "--interval", "60"});
        assertEquals(60, options.interval().toSeconds());
    }
}
