package mu.fleet.view;

import mu.fleet.model.ClusterEntry;
import mu.fleet.model.ClusterSnapshot;
import mu.fleet.model.MachineIdentity;
import mu.fleet.model.Sample;
import mu.fleet.model.Snapshot;
import mu.fleet.sampler.LocalSampler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Derives display-ready values from snapshots. Shared by every viewer; all functions are pure.
 *
 * Ties are broken by name so that the result never depends on map or entry order:
 * equal summed CPU goes to the smallest user name, equal sample CPU to the smallest process name.
 */
public final class ViewModelBuilder {

    /** Number of hotness color steps. */
    public static final int HOTNESS_STEPS = 10;

    /** Ranking rows below this share of the fleet's cores are not shown. */
    public static final double RANKING_THRESHOLD_PERCENT = 1.0;

    private static final Comparator<MachineView> BY_HOSTNAME = Comparator.comparing(MachineView::hostname);

    private ViewModelBuilder() {
    }

    public static Optional<ActiveUser> activeUser(Snapshot snapshot) {
        Map<String, UserUsage> byUser = new TreeMap<>();
        for (Sample sample : snapshot.samples()) {
            byUser.computeIfAbsent(sample.user(), u -> new UserUsage()).add(sample);
        }

        String bestUser = null;
        UserUsage best = null;
        // TreeMap iterates by name, strict comparison keeps the smallest name on a tie
        for (Map.Entry<String, UserUsage> e : byUser.entrySet()) {
            if (best == null || e.getValue().cpu > best.cpu) {
                bestUser = e.getKey();
                best = e.getValue();
            }
        }
        if (best == null) {
            return Optional.empty();
        }
        return Optional.of(new ActiveUser(bestUser, best.samples, best.top.processName()));
    }

    /**
     * Color step in {@code [0, HOTNESS_STEPS - 1]} for the five minute load relative to the core count.
     * A machine without cores is step 0.
     */
    public static int hotness(double loadFive, int coreCount) {
        double ratio = coreCount == 0 ? 0.0 : loadFive / coreCount;
        long step = Math.round(ratio * (HOTNESS_STEPS - 1));
        return (int) Math.max(0, Math.min(HOTNESS_STEPS - 1, step));
    }

    public static int hotness(Snapshot snapshot) {
        return hotness(snapshot.loadAverage().five(), snapshot.coreCount());
    }

    /** Cores whose usage is strictly above the sampling threshold. */
    public static int busyCores(Snapshot snapshot) {
        int busy = 0;
        for (double core : snapshot.perCorePercent()) {
            if (core > LocalSampler.USAGE_THRESHOLD_PERCENT) {
                busy++;
            }
        }
        return busy;
    }

    /** The one minute load average as a whole number of cores. */
    public static int loadCores(Snapshot snapshot) {
        return (int) Math.round(snapshot.loadAverage().one());
    }

    /** Fleet-wide CPU usage as a ratio in [0, 1]; 0 for a fleet without cores. */
    public static double totalUsage(ClusterSnapshot cluster) {
        double used = 0.0;
        int cores = 0;
        for (ClusterEntry entry : cluster.entries()) {
            for (double core : entry.snapshot().perCorePercent()) {
                used += core;
            }
            cores += entry.snapshot().coreCount();
        }
        if (cores == 0) {
            return 0.0;
        }
        return used / (cores * 100.0);
    }

    /**
     * Users by number of samples across the fleet, most first, then by name.
     * Users below {@link #RANKING_THRESHOLD_PERCENT} are left out; when the fleet has no cores
     * the percentage is undefined and every user is kept.
     */
    public static List<UserRank> userRanking(ClusterSnapshot cluster) {
        Map<String, Integer> counts = new TreeMap<>();
        for (ClusterEntry entry : cluster.entries()) {
            for (Sample sample : entry.snapshot().samples()) {
                counts.merge(sample.user(), 1, Integer::sum);
            }
        }

        int totalCores = cluster.coreCount();
        List<UserRank> ranking = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            Double percent = totalCores == 0 ? null : 100.0 * e.getValue() / totalCores;
            if (percent != null && percent < RANKING_THRESHOLD_PERCENT) {
                continue;
            }
            ranking.add(new UserRank(e.getKey(), e.getValue(), percent));
        }
        ranking.sort(Comparator.comparingInt(UserRank::samples).reversed()
                .thenComparing(UserRank::user));
        return ranking;
    }

    /**
     * Owner names and user names are compared ignoring case.
     *
     * @param activeUser may be {@code null}
     */
    public static OwnerActivity ownerActivity(MachineIdentity identity, ActiveUser activeUser) {
        Optional<String> owner = identity.owner().ownerName();
        if (activeUser == null || owner.isEmpty()) {
            return OwnerActivity.NONE;
        }
        return owner.get().equalsIgnoreCase(activeUser.user())
                ? OwnerActivity.OWNER_ACTIVE
                : OwnerActivity.OTHER_ACTIVE;
    }

    public static MachineView machineView(ClusterEntry entry) {
        MachineIdentity identity = entry.identity();
        Snapshot snapshot = entry.snapshot();
        ActiveUser active = activeUser(snapshot).orElse(null);
        return new MachineView(
                identity.hostname(),
                identity.room(),
                identity.owner().kind(),
                identity.owner().displayName(),
                identity.owner().mark(),
                hotness(snapshot),
                busyCores(snapshot),
                loadCores(snapshot),
                snapshot.coreCount(),
                snapshot.loadAverage(),
                snapshot.memory().usedRatio(),
                active,
                ownerActivity(identity, active));
    }

    /** Rows sorted by hostname, plus fleet totals and the user ranking. */
    public static FleetView fleetView(ClusterSnapshot cluster) {
        List<MachineView> machines = new ArrayList<>(cluster.entries().size());
        for (ClusterEntry entry : cluster.entries()) {
            machines.add(machineView(entry));
        }
        machines.sort(BY_HOSTNAME);
        return new FleetView(cluster.time(), totalUsage(cluster), cluster.coreCount(), machines,
                userRanking(cluster));
    }

    private static final class UserUsage {
        double cpu;
        int samples;
        Sample top;

        void add(Sample sample) {
            cpu += sample.cpuPercent();
            samples++;
            if (top == null
                    || sample.cpuPercent() > top.cpuPercent()
                    || (sample.cpuPercent() == top.cpuPercent()
                        && sample.processName().compareTo(top.processName()) < 0)) {
                top = sample;
            }
        }
    }
}
