package mu.fleet.config;

import mu.fleet.error.ConfigException;
import mu.fleet.model.MachineIdentity;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses the machines file.
 *
 * <pre>
 * # comment
 * [lab]
 * m1: Ann (Student)   # trailing comment
 * m2:
 * </pre>
 *
 * Machines listed before any header belong to the "orphan" room.
 */
public final class RosterParser {

    public static final String ORPHAN_ROOM = "orphan";

    private RosterParser() {
    }

    public static Roster parse(Path path) {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("could not read machines file " + path, e);
        }
        return parse(lines);
    }

    public static Roster parse(List<String> lines) {
        List<MachineIdentity> machines = new ArrayList<>();
        Set<String> hostnames = new HashSet<>();
        String room = ORPHAN_ROOM;

        int ln = 0;
        for (String raw : lines) {
            ln++;
            String line = stripComment(raw).trim();
            if (line.isEmpty()) continue;

            if (line.startsWith("[")) {
                if (!line.endsWith("]")) {
                    throw new ConfigException(ln, raw, "unterminated room header");
                }
                room = line.substring(1, line.length() - 1).trim();
                if (room.isEmpty()) {
                    throw new ConfigException(ln, raw, "empty room name");
                }
                continue;
            }

            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new ConfigException(ln, raw, "expected 'hostname: note'");
            }
            String hostname = line.substring(0, colon).trim();
            String note = line.substring(colon + 1).trim();
            if (hostname.isEmpty()) {
                throw new ConfigException(ln, raw, "missing hostname");
            }
            if (!hostnames.add(hostname)) {
                throw new ConfigException(ln, raw, "duplicate hostname " + hostname);
            }
            machines.add(MachineIdentity.of(hostname, room, note));
        }
        return new Roster(machines);
    }

    static String stripComment(String line) {
        int hash = line.indexOf('#');
        return hash < 0 ? line : line.substring(0, hash);
    }
}
