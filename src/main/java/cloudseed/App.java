package cloudseed;

import cloudseed.cli.CommandLine;
import cloudseed.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        EngineConfig config;
        try {
            config = EngineConfig.fromEnv();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.err.println("cloudseed: invalid configuration: " + e.getMessage());
            System.exit(CommandLine.USAGE);
            return;
        }

        int exitCode = new CommandLine(config, System.out, System.err).run(args);
        System.exit(exitCode);
    }
}
