package mu.fleet.sampler;

import mu.fleet.config.PolicyParser;
import mu.fleet.error.ConfigException;
import mu.fleet.error.ProbeException;
import mu.fleet.model.FilterPolicy;
import mu.fleet.model.Snapshot;
import mu.fleet.model.SnapshotJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code mu bee [policy-file]}: sample this machine and print the snapshot as JSON on stdout.
 */
public final class BeeCommand {

    private static final Logger log = LoggerFactory.getLogger(BeeCommand.class);

    private final SystemProbe probe;

    public BeeCommand() {
        this(new ProcfsProbe());
    }

    public BeeCommand(SystemProbe probe) {
        this.probe = probe;
    }

    /**
     * @return process exit status
     */
    public int run(String[] args, PrintStream out) {
        FilterPolicy policy;
        try {
            policy = loadPolicy(args.length > 0 ? Path.of(args[0]) : null);
        } catch (ConfigException e) {
            log.error("Invalid policy file: {}", e.getMessage());
            return 2;
        }

        try {
            Snapshot snapshot = new LocalSampler(probe).sample(policy);
            out.write(SnapshotJson.writeSnapshot(snapshot));
            out.println();
            out.flush();
            return 0;
        } catch (ProbeException e) {
            log.error("Sampling failed: {}", e.getMessage(), e);
            return 1;
        } catch (IOException e) {
            log.error("Could not write snapshot: {}", e.getMessage(), e);
            return 1;
        }
    }

    /**
     * Load the policy; an absent or unreadable file gives the empty policy.
     *
     * @throws ConfigException if the file is readable but malformed
     */
    static FilterPolicy loadPolicy(Path path) {
        if (path == null) {
            return FilterPolicy.empty();
        }
        if (!Files.isReadable(path)) {
            log.warn("Policy file {} not readable, using empty policy", path);
            return FilterPolicy.empty();
        }
        try {
            FilterPolicy policy = PolicyParser.parse(path);
            log.debug("Loaded {} from {}", policy, path);
            return policy;
        } catch (IOException e) {
            log.warn("Could not read policy file {}, using empty policy: {}", path, e.getMessage());
            return FilterPolicy.empty();
        }
    }
}
