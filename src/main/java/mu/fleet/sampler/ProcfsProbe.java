package mu.fleet.sampler;

import mu.fleet.error.ProbeException;
import mu.fleet.model.LoadAverage;
import mu.fleet.model.Memory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * {@link SystemProbe} backed by Linux procfs.
 *
 * Reads /proc/stat, /proc/[pid]/stat, /proc/[pid]/status, /proc/loadavg, /proc/meminfo and
 * /etc/passwd. Process CPU percentages are relative to one core, so a process keeping two cores
 * busy reads 200%.
 */
public class ProcfsProbe implements SystemProbe {

    private static final Logger log = LoggerFactory.getLogger(ProcfsProbe.class);

    /** USER_HZ; fixed at 100 on every mainstream Linux architecture. */
    static final int CLOCK_TICKS_PER_SECOND = 100;
    private static final Duration MINIMUM_REFRESH_INTERVAL = Duration.ofMillis(200);

    private final Path procRoot;
    private final Path passwdFile;
    private final LongSupplier nanoClock;

    private Map<Integer, String> users;

    // Previous refresh
    private CpuTimes previousTotal;
    private List<CpuTimes> previousCores = List.of();
    private Map<Long, Long> previousJiffies = Map.of();
    private long previousNanos;
    private boolean refreshed;

    // Current readings
    private double globalCpuPercent;
    private List<Double> perCorePercent = List.of();
    private List<ProcessReading> processes = List.of();
    private LoadAverage loadAverage = LoadAverage.ZERO;
    private Memory memory = new Memory(0, 0);

    public ProcfsProbe() {
        this(Path.of("/proc"), Path.of("/etc/passwd"), System::nanoTime);
    }

    ProcfsProbe(Path procRoot, Path passwdFile, LongSupplier nanoClock) {
        this.procRoot = procRoot;
        this.passwdFile = passwdFile;
        this.nanoClock = nanoClock;
    }

    @Override
    public synchronized void refresh() {
        long now = nanoClock.getAsLong();
        List<String> statLines = readLines(procRoot.resolve("stat"));

        CpuTimes total = null;
        List<CpuTimes> cores = new ArrayList<>();
        try {
            for (String line : statLines) {
                if (line.startsWith("cpu ")) {
                    total = CpuTimes.parse(line);
                } else if (line.startsWith("cpu")) {
                    cores.add(CpuTimes.parse(line));
                }
            }
        } catch (NumberFormatException e) {
            throw new ProbeException("malformed " + procRoot.resolve("stat"), e);
        }
        if (total == null) {
            throw new ProbeException("no aggregate cpu line in " + procRoot.resolve("stat"));
        }

        globalCpuPercent = refreshed && previousTotal != null ? total.percentSince(previousTotal) : 0.0;
        List<Double> corePercents = new ArrayList<>(cores.size());
        for (int i = 0; i < cores.size(); i++) {
            boolean comparable = refreshed && i < previousCores.size();
            corePercents.add(comparable ? cores.get(i).percentSince(previousCores.get(i)) : 0.0);
        }

        double elapsedSeconds = refreshed ? (now - previousNanos) / 1_000_000_000.0 : 0.0;
        Map<Long, Long> jiffies = new HashMap<>();
        List<ProcessReading> readings = new ArrayList<>();
        for (Path dir : processDirectories()) {
            long pid = Long.parseLong(dir.getFileName().toString());
            Optional<ProcessStat> stat = readProcess(dir, pid);
            if (stat.isEmpty()) continue;
            ProcessStat ps = stat.get();
            jiffies.put(pid, ps.jiffies());

            double cpu = 0.0;
            if (elapsedSeconds > 0) {
                long delta = ps.jiffies() - previousJiffies.getOrDefault(pid, 0L);
                cpu = 100.0 * Math.max(0, delta) / (elapsedSeconds * CLOCK_TICKS_PER_SECOND);
            }
            readings.add(new ProcessReading(pid, ps.name(), ps.effectiveUid(), ps.realUid(), cpu));
        }

        loadAverage = parseLoadAverage(readFirstLine(procRoot.resolve("loadavg")));
        memory = parseMemory(readLines(procRoot.resolve("meminfo")));

        perCorePercent = List.copyOf(corePercents);
        processes = List.copyOf(readings);
        previousTotal = total;
        previousCores = List.copyOf(cores);
        previousJiffies = jiffies;
        previousNanos = now;
        refreshed = true;
    }

    @Override
    public Duration minimumRefreshInterval() {
        return MINIMUM_REFRESH_INTERVAL;
    }

    @Override
    public synchronized List<ProcessReading> processes() {
        return processes;
    }

    @Override
    public synchronized double globalCpuPercent() {
        return globalCpuPercent;
    }

    @Override
    public synchronized List<Double> perCorePercent() {
        return perCorePercent;
    }

    @Override
    public synchronized LoadAverage loadAverage() {
        return loadAverage;
    }

    @Override
    public synchronized Memory memory() {
        return memory;
    }

    @Override
    public String hostname() {
        Path kernelHostname = procRoot.resolve("sys/kernel/hostname");
        if (Files.isReadable(kernelHostname)) {
            String name = readFirstLine(kernelHostname).trim();
            if (!name.isEmpty()) {
                return name;
            }
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            log.warn("Could not determine hostname: {}", e.getMessage());
            return "?";
        }
    }

    @Override
    public synchronized Optional<String> userName(int uid) {
        if (users == null) {
            users = loadUsers();
        }
        return Optional.ofNullable(users.get(uid));
    }

    private List<Path> processDirectories() {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(procRoot,
                p -> isNumeric(p.getFileName().toString()) && Files.isDirectory(p))) {
            stream.forEach(dirs::add);
        } catch (IOException e) {
            throw new ProbeException("could not list processes in " + procRoot, e);
        }
        return dirs;
    }

    /** Empty if the process exited while it was being read. */
    private Optional<ProcessStat> readProcess(Path dir, long pid) {
        try {
            String stat = Files.readString(dir.resolve("stat"), StandardCharsets.UTF_8);
            List<String> status = Files.readAllLines(dir.resolve("status"), StandardCharsets.UTF_8);
            return Optional.of(ProcessStat.parse(stat, status));
        } catch (IOException | NumberFormatException e) {
            log.trace("Process {} vanished while reading: {}", pid, e.getMessage());
            return Optional.empty();
        }
    }

    private Map<Integer, String> loadUsers() {
        try {
            return parsePasswd(Files.readAllLines(passwdFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Could not read {}, user names will show as '?': {}", passwdFile, e.getMessage());
            return Map.of();
        }
    }

    private static List<String> readLines(Path path) {
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ProbeException("could not read " + path, e);
        }
    }

    private static String readFirstLine(Path path) {
        List<String> lines = readLines(path);
        return lines.isEmpty() ? "" : lines.get(0);
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    // ---- parsing ----

    static LoadAverage parseLoadAverage(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length < 3) {
            throw new ProbeException("unexpected loadavg format: " + line);
        }
        try {
            return new LoadAverage(
                    Double.parseDouble(parts[0]),
                    Double.parseDouble(parts[1]),
                    Double.parseDouble(parts[2]));
        } catch (NumberFormatException e) {
            throw new ProbeException("unexpected loadavg format: " + line, e);
        }
    }

    static Memory parseMemory(List<String> meminfo) {
        long totalKb = -1;
        long availableKb = -1;
        long freeKb = 0;
        for (String line : meminfo) {
            if (line.startsWith("MemTotal:")) {
                totalKb = kilobytes(line);
            } else if (line.startsWith("MemAvailable:")) {
                availableKb = kilobytes(line);
            } else if (line.startsWith("MemFree:")) {
                freeKb = kilobytes(line);
            }
        }
        if (totalKb < 0) {
            throw new ProbeException("no MemTotal in meminfo");
        }
        long unusedKb = availableKb >= 0 ? availableKb : freeKb;
        long usedKb = Math.max(0, totalKb - unusedKb);
        return new Memory(usedKb * 1024, totalKb * 1024);
    }

    private static long kilobytes(String line) {
        String[] parts = line.trim().split("\\s+");
        return Long.parseLong(parts[1]);
    }

    static Map<Integer, String> parsePasswd(List<String> lines) {
        Map<Integer, String> users = new HashMap<>();
        for (String line : lines) {
            if (line.isBlank() || line.startsWith("#")) continue;
            String[] fields = line.split(":");
            if (fields.length < 3) continue;
            try {
                users.putIfAbsent(Integer.parseInt(fields[2]), fields[0]);
            } catch (NumberFormatException e) {
                log.debug("Skipping passwd line with bad uid: {}", line);
            }
        }
        return users;
    }

    /** Cumulative jiffies of one "cpu" line of /proc/stat. */
    record CpuTimes(long busy, long total) {

        static CpuTimes parse(String line) {
            String[] parts = line.trim().split("\\s+");
            long total = 0;
            long idle = 0;
            // user nice system idle iowait irq softirq steal; guest time is already in user
            for (int i = 1; i < parts.length && i <= 8; i++) {
                long value = Long.parseLong(parts[i]);
                total += value;
                if (i == 4 || i == 5) {
                    idle += value;
                }
            }
            return new CpuTimes(total - idle, total);
        }

        double percentSince(CpuTimes earlier) {
            long dTotal = total - earlier.total;
            if (dTotal <= 0) {
                return 0.0;
            }
            long dBusy = Math.max(0, busy - earlier.busy);
            return Math.min(100.0, 100.0 * dBusy / dTotal);
        }
    }

    /** The fields of /proc/[pid]/stat and /proc/[pid]/status the sampler needs. */
    record ProcessStat(String name, long jiffies, Integer realUid, Integer effectiveUid) {

        static ProcessStat parse(String stat, List<String> status) throws IOException {
            // The command name is in parentheses and may itself contain spaces and ')'.
            int close = stat.lastIndexOf(')');
            int open = stat.indexOf('(');
            if (open < 0 || close < open) {
                throw new IOException("malformed stat: " + stat);
            }
            String comm = stat.substring(open + 1, close);
            String[] rest = stat.substring(close + 1).trim().split("\\s+");
            // rest[0] is field 3 (state); utime and stime are fields 14 and 15
            if (rest.length < 13) {
                throw new IOException("short stat: " + stat);
            }
            long jiffies = Long.parseLong(rest[11]) + Long.parseLong(rest[12]);

            String name = comm;
            Integer realUid = null;
            Integer effectiveUid = null;
            for (String line : status) {
                if (line.startsWith("Name:")) {
                    name = line.substring("Name:".length()).trim();
                } else if (line.startsWith("Uid:")) {
                    String[] uids = line.substring("Uid:".length()).trim().split("\\s+");
                    if (uids.length >= 2) {
                        realUid = Integer.valueOf(uids[0]);
                        effectiveUid = Integer.valueOf(uids[1]);
                    }
                }
            }
            return new ProcessStat(name, jiffies, realUid, effectiveUid);
        }
    }
}
