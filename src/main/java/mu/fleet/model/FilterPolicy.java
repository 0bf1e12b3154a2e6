package mu.fleet.model;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which processes the sampler leaves out and which process names it canonicalizes.
 * Loaded once when the sampler starts.
 */
public final class FilterPolicy {

    private static final FilterPolicy EMPTY = new FilterPolicy(Set.of(), Set.of(), Map.of());

    private final Set<String> ignoredUsers;
    private final Set<String> ignoredProcesses;
    private final Map<String, String> renames;

    public FilterPolicy(Set<String> ignoredUsers, Set<String> ignoredProcesses, Map<String, String> renames) {
        this.ignoredUsers = Set.copyOf(ignoredUsers);
        this.ignoredProcesses = Set.copyOf(ignoredProcesses);
        this.renames = Map.copyOf(renames);
    }

    public static FilterPolicy empty() {
        return EMPTY;
    }

    public boolean isIgnoredUser(String user) {
        return ignoredUsers.contains(user);
    }

    public boolean isIgnoredProcess(String processName) {
        return ignoredProcesses.contains(processName);
    }

    /** Canonical name for a process, if one is configured. */
    public Optional<String> canonicalName(String processName) {
        return Optional.ofNullable(renames.get(processName));
    }

    public Set<String> ignoredUsers() {
        return ignoredUsers;
    }

    public Set<String> ignoredProcesses() {
        return ignoredProcesses;
    }

    public Map<String, String> renames() {
        return renames;
    }

    @Override
    public String toString() {
        return "FilterPolicy{ignoredUsers=" + ignoredUsers.size() +
                ", ignoredProcesses=" + ignoredProcesses.size() +
                ", renames=" + renames.size() + '}';
    }
}
