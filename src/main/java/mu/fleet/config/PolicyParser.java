package mu.fleet.config;

import mu.fleet.error.ConfigException;
import mu.fleet.model.FilterPolicy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the sampler's filter policy file.
 *
 * <pre>
 * ignore-user: root
 * ignore-proc: sshd
 * rename-proc: python3.11 -> python
 * </pre>
 */
public final class PolicyParser {

    private static final String ARROW = "->";

    private PolicyParser() {
    }

    public static FilterPolicy parse(Path path) throws IOException {
        return parse(Files.readAllLines(path, StandardCharsets.UTF_8));
    }

    public static FilterPolicy parse(List<String> lines) {
        Set<String> users = new HashSet<>();
        Set<String> processes = new HashSet<>();
        Map<String, String> renames = new HashMap<>();

        int ln = 0;
        for (String raw : lines) {
            ln++;
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int colon = line.indexOf(':');
            if (colon < 0) {
                throw new ConfigException(ln, raw, "expected colon after keyword");
            }
            String keyword = line.substring(0, colon).trim();
            String rest = RosterParser.stripComment(line.substring(colon + 1)).trim();
            if (rest.isEmpty() || rest.startsWith(ARROW) || rest.endsWith(ARROW)) {
                throw new ConfigException(ln, raw, "expected additional information");
            }

            switch (keyword) {
                case "ignore-user" -> users.add(rest);
                case "ignore-proc" -> processes.add(rest);
                case "rename-proc" -> {
                    int arrow = rest.indexOf(ARROW);
                    if (arrow < 0) {
                        throw new ConfigException(ln, raw, "expected rename arrow (->)");
                    }
                    String from = rest.substring(0, arrow).trim();
                    String to = rest.substring(arrow + ARROW.length()).trim();
                    renames.put(from, to);
                }
                default -> throw new ConfigException(ln, raw, "unknown keyword \"" + keyword + "\"");
            }
        }
        return new FilterPolicy(users, processes, renames);
    }
}
