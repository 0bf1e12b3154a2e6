package mu.fleet;

import mu.fleet.config.MuConfig;
import mu.fleet.error.ConfigException;
import mu.fleet.hive.HiveCommand;
import mu.fleet.sampler.BeeCommand;
import mu.fleet.server.WebViewer;
import mu.fleet.viewer.ConsoleViewer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Command line entry point.
 *
 * <pre>
 * mu bee  [policy-file]
 * mu hive -m roster -o output -b sampler-command [--interval seconds]
 * mu view [snapshot-file] [--once]
 * mu web  [snapshot-file]
 * </pre>
 */
public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        if (args.length == 0) {
            printUsage();
            return 2;
        }
        String command = args[0];
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        if ("bee".equals(command)) {
            return new BeeCommand().run(rest, System.out);
        }

        MuConfig config;
        try {
            config = MuConfig.fromEnv();
        } catch (ConfigException e) {
            System.err.println("mu: " + e.getMessage());
            return 2;
        }
        log.debug("Using {}", config);

        return switch (command) {
            case "hive" -> new HiveCommand(config).run(rest);
            case "view" -> new ConsoleViewer(config).run(rest, System.out);
            case "web" -> WebViewer.run(rest, config);
            default -> {
                System.err.println("mu: unknown command '" + command + "'");
                printUsage();
                yield 2;
            }
        };
    }

    private static void printUsage() {
        System.err.println("usage: mu <bee|hive|view|web> [args...]");
    }
}
