package mu.fleet.hive;

import mu.fleet.error.DeserializationException;
import mu.fleet.error.PersistenceException;
import mu.fleet.error.ViewerReadException;
import mu.fleet.model.ClusterSnapshot;
import mu.fleet.model.SnapshotJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Reads and writes the persisted cluster snapshot file.
 * There is one writer (the hive) and any number of readers (the viewers).
 */
public final class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    /** Mode of a newly created snapshot file; viewers may run under other accounts. */
    static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private SnapshotStore() {
    }

    /**
     * Serialize in memory, write a temporary file next to {@code path} and rename it into place,
     * so readers see either the previous file or the complete new one.
     * On POSIX file systems an existing file keeps its mode, a new one gets {@code rw-r--r--}.
     *
     * @throws PersistenceException on any failure; the previous file is left untouched
     */
    public static void persist(ClusterSnapshot snapshot, Path path) {
        byte[] bytes;
        try {
            bytes = SnapshotJson.writeCluster(snapshot);
        } catch (IOException e) {
            throw new PersistenceException("could not serialize cluster snapshot", e);
        }

        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Path tmp = null;
        try {
            tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
            Files.write(tmp, bytes);
            copyPermissions(target, tmp);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported in {}, replacing {} non-atomically", dir, target);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("Output was written to {} with timestamp {}", target, snapshot.timestamp());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new PersistenceException("could not write cluster snapshot to " + target, e);
        }
    }

    /**
     * Read the whole file, then parse it.
     *
     * @throws ViewerReadException if the file cannot be read or parsed
     */
    public static ClusterSnapshot load(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new ViewerReadException("could not read " + path, e);
        }
        try {
            return SnapshotJson.readCluster(bytes);
        } catch (DeserializationException e) {
            throw new ViewerReadException("could not parse " + path, e);
        }
    }

    /** Temporary files are created owner-only; give the replacement the mode readers expect. */
    private static void copyPermissions(Path target, Path tmp) throws IOException {
        if (!tmp.getFileSystem().supportedFileAttributeViews().contains("posix")) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.isRegularFile(target)
                ? Files.getPosixFilePermissions(target)
                : DEFAULT_PERMISSIONS;
        Files.setPosixFilePermissions(tmp, permissions);
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", tmp, e.getMessage());
        }
    }
}
