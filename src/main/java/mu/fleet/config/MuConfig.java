package mu.fleet.config;

import mu.fleet.error.ConfigException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for the hive and the viewers.
 * All settings have sensible defaults.
 */
public final class MuConfig {

    // Gather settings
    private int gatherParallelism = 32;
    private Duration gatherTimeout = Duration.ofSeconds(30);
    private List<String> sshCommand = List.of("ssh", "-o", "BatchMode=yes", "-o", "StrictHostKeyChecking=yes");

    // Viewer settings
    private Path dataPath = Path.of("/var/lib/mu/mu.dat");
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration staleAfter = Duration.ofSeconds(120);
    private Path accessLogPath = Path.of("/var/log/mu/usage.log");

    // Web viewer settings
    private int webPort = 5172;
    private String webHost = "127.0.0.1";

    private MuConfig() {
    }

    public static MuConfig defaults() {
        return new MuConfig();
    }

    public static MuConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    static MuConfig fromEnv(Map<String, String> env) {
        MuConfig config = new MuConfig();

        String parallelism = env.get("MU_GATHER_PARALLELISM");
        if (parallelism != null && !parallelism.isBlank()) {
            config.gatherParallelism = positiveInt("MU_GATHER_PARALLELISM", parallelism);
        }

        String timeout = env.get("MU_GATHER_TIMEOUT_SECONDS");
        if (timeout != null && !timeout.isBlank()) {
            config.gatherTimeout = Duration.ofSeconds(positiveInt("MU_GATHER_TIMEOUT_SECONDS", timeout));
        }

        String ssh = env.get("MU_SSH_COMMAND");
        if (ssh != null && !ssh.isBlank()) {
            config.sshCommand = List.copyOf(Arrays.asList(ssh.trim().split("\\s+")));
        }

        String data = env.get("MU_DATA_PATH");
        if (data != null && !data.isBlank()) {
            config.dataPath = Path.of(data);
        }

        String stale = env.get("MU_STALE_AFTER_SECONDS");
        if (stale != null && !stale.isBlank()) {
            config.staleAfter = Duration.ofSeconds(positiveInt("MU_STALE_AFTER_SECONDS", stale));
        }

        String logPath = env.get("MU_LOG_PATH");
        if (logPath != null && !logPath.isBlank()) {
            config.accessLogPath = Path.of(logPath);
        }

        String port = env.get("MU_WEB_PORT");
        if (port != null && !port.isBlank()) {
            config.webPort = positiveInt("MU_WEB_PORT", port);
        }

        String host = env.get("MU_WEB_HOST");
        if (host != null && !host.isBlank()) {
            config.webHost = host.trim();
        }

        return config;
    }

    private static int positiveInt(String name, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new ConfigException(name + " must be positive, got " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigException(name + " is not a number: " + value, e);
        }
    }

    // Getters
    public int gatherParallelism() {
        return gatherParallelism;
    }

    public Duration gatherTimeout() {
        return gatherTimeout;
    }

    public List<String> sshCommand() {
        return sshCommand;
    }

    public Path dataPath() {
        return dataPath;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration staleAfter() {
        return staleAfter;
    }

    public Path accessLogPath() {
        return accessLogPath;
    }

    public int webPort() {
        return webPort;
    }

    public String webHost() {
        return webHost;
    }

    // Fluent setters for testing/customization
    public MuConfig withGatherParallelism(int parallelism) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive");
        }
        this.gatherParallelism = parallelism;
        return this;
    }

    public MuConfig withGatherTimeout(Duration timeout) {
        this.gatherTimeout = timeout;
        return this;
    }

    public MuConfig withSshCommand(List<String> command) {
        this.sshCommand = List.copyOf(command);
        return this;
    }

    public MuConfig withDataPath(Path path) {
        this.dataPath = path;
        return this;
    }

    public MuConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public MuConfig withStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
        return this;
    }

    public MuConfig withAccessLogPath(Path path) {
        this.accessLogPath = path;
        return this;
    }

    public MuConfig withWebPort(int port) {
        this.webPort = port;
        return this;
    }

    @Override
    public String toString() {
        return "MuConfig{" +
                "gatherParallelism=" + gatherParallelism +
                ", gatherTimeout=" + gatherTimeout +
                ", dataPath=" + dataPath +
                ", webPort=" + webPort +
                '}';
    }
}
