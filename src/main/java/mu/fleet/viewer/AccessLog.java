package mu.fleet.viewer;

import mu.fleet.model.HostInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Appends one line per viewer start to a shared usage log.
 * The file is never created; a missing or unwritable log is not an error.
 */
public final class AccessLog {

    private static final Logger log = LoggerFactory.getLogger(AccessLog.class);

    private AccessLog() {
    }

    /**
     * @return whether the line was written
     */
    public static boolean record(Path logPath, HostInfo host, OffsetDateTime now) {
        String line = formatLine(host, now) + System.lineSeparator();
        try {
            Files.writeString(logPath, line, StandardCharsets.UTF_8,
                    StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            return true;
        } catch (IOException | SecurityException e) {
            log.debug("Access not logged to {}: {}", logPath, e.toString());
            return false;
        }
    }

    public static boolean record(Path logPath, HostInfo host) {
        return record(logPath, host, OffsetDateTime.now());
    }

    static String formatLine(HostInfo host, OffsetDateTime now) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(now)
                + "\tfrom " + host.user() + "@" + host.hostname()
                + "\t(" + host.os() + " " + host.osVersion() + ")";
    }
}
