package mu.fleet.hive;

import mu.fleet.config.MuConfig;
import mu.fleet.config.Roster;
import mu.fleet.config.RosterParser;
import mu.fleet.error.ConfigException;
import mu.fleet.error.PersistenceException;
import mu.fleet.scheduler.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * {@code mu hive -m <roster> -o <output> -b <sampler-command> [--interval <seconds>]}.
 */
public final class HiveCommand {

    private static final Logger log = LoggerFactory.getLogger(HiveCommand.class);

    static final String USAGE =
            "usage: mu hive --machines|-m <roster> --output|-o <file> --bee|-b <command> [--interval <seconds>]";

    private final MuConfig config;
    private final RemoteExecutor executor;
    private final Clock clock;

    public HiveCommand(MuConfig config) {
        this(config, new SshRemoteExecutor(config.sshCommand()), Clock.systemUTC());
    }

    HiveCommand(MuConfig config, RemoteExecutor executor, Clock clock) {
        this.config = config;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * @return process exit status: 0 on success, 2 on bad arguments or roster, 1 if the
     *         snapshot could not be written
     */
    public int run(String[] args) {
        Options options;
        Roster roster;
        try {
            options = Options.parse(args);
            roster = RosterParser.parse(options.machines());
        } catch (ConfigException e) {
            System.err.println("mu hive: " + e.getMessage());
            System.err.println(USAGE);
            return 2;
        }
        log.info("Loaded {} machines from {}", roster.size(), options.machines());

        try (RemoteExecutor ignored = executor;
             Orchestrator orchestrator = new Orchestrator(options.bee(), config, clock)) {
            if (options.interval() == null) {
                return runOnce(orchestrator, roster, options.output());
            }
            runForever(orchestrator, roster, options);
            return 0;
        }
    }

    int runOnce(Orchestrator orchestrator, Roster roster, Path output) {
        long start = System.nanoTime();
        GatherResult result = orchestrator.gather(roster.machines(), executor);
        try {
            orchestrator.persist(result.snapshot(), output);
        } catch (PersistenceException e) {
            log.error("Could not persist cluster snapshot: {}", e.getMessage(), e);
            return 1;
        } finally {
            log.info("Took {}ms", Duration.ofNanos(System.nanoTime() - start).toMillis());
        }
        return 0;
    }

    private void runForever(Orchestrator orchestrator, Roster roster, Options options) {
        CountDownLatch stopped = new CountDownLatch(1);
        try (Scheduler scheduler = new Scheduler("mu-hive")) {
            scheduler.every("gather", Duration.ZERO, options.interval(),
                    () -> runOnce(orchestrator, roster, options.output()));
            Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "mu-hive-shutdown"));
            scheduler.start();
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    record Options(Path machines, Path output, String bee, Duration interval) {

        static Options parse(String[] args) {
            Path machines = null;
            Path output = null;
            String bee = null;
            Duration interval = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-m", "--machines" -> machines = Path.of(value(args, ++i, arg));
                    case "-o", "--output" -> output = Path.of(value(args, ++i, arg));
                    case "-b", "--bee" -> bee = value(args, ++i, arg);
                    case "--interval" -> interval = seconds(value(args, ++i, arg));
                    default -> throw new ConfigException("unknown argument: " + arg);
                }
            }

            if (machines == null) throw new ConfigException("missing --machines");
            if (output == null) throw new ConfigException("missing --output");
            if (bee == null || bee.isBlank()) throw new ConfigException("missing --bee");
            return new Options(machines, output, bee, interval);
        }

        private static String value(String[] args, int i, String flag) {
            if (i >= args.length) {
                throw new ConfigException(flag + " requires a value");
            }
            return args[i];
        }

        private static Duration seconds(String s) {
            try {
                long n = Long.parseLong(s.trim());
                if (n <= 0) {
                    throw new ConfigException("--interval must be positive, got " + s);
                }
                return Duration.ofSeconds(n);
            } catch (NumberFormatException e) {
                throw new ConfigException("--interval is not a number: " + s, e);
            }
        }
    }
}
