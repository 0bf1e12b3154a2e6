package mu.fleet.sampler;

import mu.fleet.error.ConfigException;
import mu.fleet.model.FilterPolicy;
import mu.fleet.model.Snapshot;
import mu.fleet.model.SnapshotJson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class BeeCommandTest {

    @Test
    void printsSnapshotJson(@TempDir Path dir) throws Exception {
        Path policy = dir.resolve("policy");
        Files.writeString(policy, "ignore-user: root\n");
        FakeProbe probe = new FakeProbe().user(0, "root").user(1000, "ann")
                .process(1, "sshd", 0, 90.0)
                .process(2, "ffmpeg", 1000, 80.0);
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = new BeeCommand(probe).run(new String[]{policy.toString()}, new PrintStream(out, true));

        assertEquals(0, status);
        Snapshot snapshot = SnapshotJson.readSnapshot(out.toByteArray());
        assertEquals("m1", snapshot.hostname());
        assertEquals(1, snapshot.samples().size());
        assertEquals("ann", snapshot.samples().get(0).user());
    }

    @Test
    void malformedPolicyExitsWithTwo(@TempDir Path dir) throws Exception {
        Path policy = dir.resolve("policy");
        Files.writeString(policy, "ignore-everything\n");
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int status = new BeeCommand(new FakeProbe()).run(new String[]{policy.toString()}, new PrintStream(out));

        assertEquals(2, status);
        assertEquals("", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void probeFailureExitsWithOne() {
        FakeProbe probe = new FakeProbe();
        probe.failOnRefresh = true;

        int status = new BeeCommand(probe).run(new String[0], new PrintStream(new ByteArrayOutputStream()));

        assertEquals(1, status);
    }

    @Test
    void missingPolicyIsEmptyPolicy(@TempDir Path dir) {
        FilterPolicy policy = BeeCommand.loadPolicy(dir.resolve("does-not-exist"));
        assertTrue(policy.ignoredUsers().isEmpty());
        assertTrue(BeeCommand.loadPolicy(null).renames().isEmpty());
    }

    @Test
    void malformedPolicyIsConfigError(@TempDir Path dir) throws Exception {
        Path policy = dir.resolve("policy");
        Files.writeString(policy, "ignore-user:\n");
        assertThrows(ConfigException.class, () -> BeeCommand.loadPolicy(policy));
    }
}
