package mu.fleet.viewer;

import mu.fleet.hive.SnapshotStore;
import mu.fleet.model.ClusterSnapshot;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotPollerTest {

    private static final Instant NOW = Instant.ofEpochSecond(1_700_000_100L);

    @TempDir
    Path dir;

    private SnapshotPoller poller(Path file) {
        return new SnapshotPoller(file, Duration.ofSeconds(120), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void nothingReadYetIsStale() {
        SnapshotPoller poller = poller(dir.resolve("mu.dat"));

        assertFalse(poller.refresh());
        assertTrue(poller.current().isEmpty());
        ViewerStatus status = poller.status();
        assertTrue(status.stale());
        assertFalse(status.success());
        assertNull(status.lastUpdate());
    }

    @Test
    void freshSnapshot() {
        Path file = dir.resolve("mu.dat");
        SnapshotStore.persist(new ClusterSnapshot(1_700_000_090L, List.of()), file);
        SnapshotPoller poller = poller(file);

        assertTrue(poller.refresh());

        ViewerStatus status = poller.status();
        assertTrue(status.success());
        assertFalse(status.stale());
        assertEquals(Duration.ofSeconds(10), status.age());
    }

    @Test
    void oldSnapshotIsStale() {
        Path file = dir.resolve("mu.dat");
        SnapshotStore.persist(new ClusterSnapshot(1_700_000_100L - 121, List.of()), file);
        SnapshotPoller poller = poller(file);

        assertTrue(poller.refresh());
        assertTrue(poller.status().stale());
    }

    @Test
    void keepsLastGoodSnapshotOnReadFailure() throws Exception {
        Path file = dir.resolve("mu.dat");
        ClusterSnapshot good = new ClusterSnapshot(1_700_000_090L, List.of());
        SnapshotStore.persist(good, file);
        SnapshotPoller poller = poller(file);
        poller.refresh();

        Files.writeString(file, "{\"timestamp\":");
        assertFalse(poller.refresh());
        assertFalse(poller.refresh());

        assertEquals(good, poller.current().orElseThrow());
        ViewerStatus status = poller.status();
        assertFalse(status.success());
        assertTrue(status.stale());
        assertEquals(good.time(), status.lastUpdate());

        SnapshotStore.persist(good, file);
        assertTrue(poller.refresh());
        assertFalse(poller.status().stale());
    }
}
