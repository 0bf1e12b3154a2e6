package mu.fleet.viewer;

import mu.fleet.error.ViewerReadException;
import mu.fleet.hive.SnapshotStore;
import mu.fleet.model.ClusterSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Re-reads the persisted cluster snapshot on demand and keeps the last good one.
 * Read failures never propagate; they only mark the latest poll as failed.
 */
public class SnapshotPoller {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPoller.class);

    private final Path path;
    private final Duration staleAfter;
    private final Clock clock;

    private ClusterSnapshot current;
    private boolean success;
    private int failureStreak;

    public SnapshotPoller(Path path, Duration staleAfter) {
        this(path, staleAfter, Clock.systemUTC());
    }

    public SnapshotPoller(Path path, Duration staleAfter, Clock clock) {
        this.path = path;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    /**
     * Poll the file once.
     *
     * @return whether the read succeeded
     */
    public synchronized boolean refresh() {
        try {
            current = SnapshotStore.load(path);
            if (!success) {
                log.info("Read snapshot from {} (timestamp {})", path, current.timestamp());
            }
            success = true;
            failureStreak = 0;
        } catch (ViewerReadException e) {
            // Only the first failure of a streak is worth a warning.
            if (failureStreak++ == 0) {
                log.warn("Could not read snapshot, keeping the previous one: {}", e.getMessage());
            } else {
                log.debug("Still could not read snapshot: {}", e.getMessage());
            }
            success = false;
        }
        return success;
    }

    public synchronized Optional<ClusterSnapshot> current() {
        return Optional.ofNullable(current);
    }

    public Path path() {
        return path;
    }

    public synchronized ViewerStatus status() {
        if (current == null) {
            return new ViewerStatus(null, null, success, true);
        }
        Instant updated = current.time();
        Duration age = Duration.between(updated, clock.instant());
        if (age.isNegative()) {
            age = Duration.ZERO;
        }
        boolean stale = !success || age.compareTo(staleAfter) > 0;
        return new ViewerStatus(updated, age, success, stale);
    }
}
