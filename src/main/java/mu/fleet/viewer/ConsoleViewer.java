package mu.fleet.viewer;

import mu.fleet.config.MuConfig;
import mu.fleet.model.HostInfo;
import mu.fleet.view.ActiveUser;
import mu.fleet.view.FleetView;
import mu.fleet.view.MachineView;
import mu.fleet.view.UserRank;
import mu.fleet.view.ViewModelBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * {@code mu view [snapshot-file] [--once]}: prints the fleet as a plain text table,
 * re-reading the snapshot file every poll interval.
 */
public final class ConsoleViewer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleViewer.class);

    private final MuConfig config;
    private final HostInfo host;

    public ConsoleViewer(MuConfig config) {
        this(config, HostInfo.current());
    }

    ConsoleViewer(MuConfig config, HostInfo host) {
        this.config = config;
        this.host = host;
    }

    /**
     * @return process exit status
     */
    public int run(String[] args, PrintStream out) {
        Path path = config.dataPath();
        boolean once = false;
        for (String arg : args) {
            if ("--once".equals(arg)) {
                once = true;
            } else {
                path = Path.of(arg);
            }
        }

        boolean logged = AccessLog.record(config.accessLogPath(), host);
        SnapshotPoller poller = new SnapshotPoller(path, config.staleAfter());
        log.debug("Viewing {} every {}ms", path, config.pollInterval().toMillis());

        while (true) {
            poller.refresh();
            out.print(render(poller, logged));
            out.flush();
            if (once) {
                return poller.current().isPresent() ? 0 : 1;
            }
            try {
                Thread.sleep(config.pollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return 0;
            }
        }
    }

    String render(SnapshotPoller poller, boolean logged) {
        StringBuilder sb = new StringBuilder();
        ViewerStatus status = poller.status();
        FleetView fleet = poller.current().map(ViewModelBuilder::fleetView).orElse(null);

        sb.append(String.format(Locale.ROOT, "%s@%s  (%s %s)", host.user(), host.hostname(), host.os(),
                host.osVersion()));
        if (fleet != null) {
            sb.append(String.format(Locale.ROOT, "  fleet usage %3.0f%% of %d cores",
                    fleet.totalUsage() * 100, fleet.cores()));
        }
        sb.append('\n').append('\n');

        if (fleet == null) {
            sb.append("no data from ").append(poller.path()).append('\n');
        } else {
            appendMachines(sb, fleet);
            appendRanking(sb, fleet);
        }

        sb.append('\n').append(notes(status, logged)).append('\n');
        return sb.toString();
    }

    private static void appendMachines(StringBuilder sb, FleetView fleet) {
        sb.append(String.format(Locale.ROOT, "%-12s %-10s %-24s %7s %4s  %s%n",
                "host", "room", "owner", "cores", "heat", "active"));
        String previousRoom = null;
        for (MachineView m : fleet.machines()) {
            // A room is printed only where it changes.
            String room = m.room().equals(previousRoom) ? "" : m.room();
            previousRoom = m.room();
            String owner = m.ownerMark().isEmpty() ? m.owner() : m.ownerMark() + " " + m.owner();
            sb.append(String.format(Locale.ROOT, "%-12s %-10s %-24s %3d/%-3d %4d  %s%n",
                    m.hostname(), room, owner, m.busyCores(), m.cores(), m.hotness(),
                    describe(m.activeUser())));
        }
    }

    private static void appendRanking(StringBuilder sb, FleetView fleet) {
        if (fleet.ranking().isEmpty()) {
            return;
        }
        sb.append('\n');
        for (UserRank rank : fleet.ranking()) {
            sb.append(String.format(Locale.ROOT, "  %-16s %4d  %3s%%%n",
                    rank.user(), rank.samples(), rank.percentLabel()));
        }
    }

    private static String describe(ActiveUser user) {
        if (user == null) {
            return "";
        }
        return user.user() + " (" + user.coreCount() + ") " + user.task();
    }

    static String notes(ViewerStatus status, boolean logged) {
        String update = status.age() == null
                ? "never updated"
                : "updated " + status.age().getSeconds() + "s ago";
        return update + " " + (status.stale() ? ":(" : ":)") + "  " + (logged ? "logged" : "not logged");
    }
}
