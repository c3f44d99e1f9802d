package cloudseed.cli;

import cloudseed.engine.config.Dependencies;
import cloudseed.engine.config.EngineConfig;
import cloudseed.engine.gateway.Credential;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.model.TaskState;
import cloudseed.engine.model.TransferTask;
import cloudseed.engine.repository.TaskNotFoundException;
import cloudseed.engine.repository.TaskStoreException;
import cloudseed.engine.scheduler.Scheduler;
import cloudseed.engine.scheduler.TickReport;
import cloudseed.engine.service.DuplicateTaskException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Operator commands. Output meant for the operator goes to {@code out},
 * diagnostics go to the log.
 *
 * Exit codes: 0 success, 1 operation failed, 2 usage error.
 */
public final class CommandLine {

    private static final Logger log = LoggerFactory.getLogger(CommandLine.class);

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int USAGE = 2;

    static final String USAGE_TEXT = """
            Usage: cloudseed <command> [options]

            Commands:
              auth                         sign in to OneDrive (device code)
              add <source>...              track magnet links, torrent URLs or .torrent files
              list                         show all tasks grouped by state
              show <task-id>               show one task in detail
              start [--interval SECONDS]   run the polling loop until interrupted
                    [--max-runtime SECONDS]  stop after this long
                    [--once]                 run a single pass and exit
              remove <task-id> [--purge]   stop tracking a task, --purge also deletes its files
              help                         show this text

            Configuration: cloudseed.ini (or $CLOUDSEED_CONFIG) and environment variables.
            """;

    private final EngineConfig config;
    private final Function<EngineConfig, Dependencies> factory;
    private final PrintStream out;
    private final PrintStream err;

    public CommandLine(EngineConfig config, PrintStream out, PrintStream err) {
        this(config, Dependencies::create, out, err);
    }

    CommandLine(EngineConfig config, Function<EngineConfig, Dependencies> factory, PrintStream out, PrintStream err) {
        this.config = config;
        this.factory = factory;
        this.out = out;
        this.err = err;
    }

    public int run(String... args) {
        if (args.length == 0) {
            err.print(USAGE_TEXT);
            return USAGE;
        }

        String command = args[0];
        List<String> rest = Arrays.asList(args).subList(1, args.length);

        try {
            return switch (command) {
                case "auth" -> auth();
                case "add" -> add(rest);
                case "list" -> list();
                case "show" -> show(rest);
                case "start" -> start(rest);
                case "remove" -> remove(rest);
                case "help", "--help", "-h" -> {
                    out.print(USAGE_TEXT);
                    yield OK;
                }
                default -> usage("unknown command: " + command);
            };
        } catch (IllegalArgumentException e) {
            return usage(e.getMessage());
        } catch (TaskStoreException e) {
            log.error("Task store failure", e);
            err.println("Task store failure: " + e.getMessage());
            return FAILED;
        }
    }

    private int auth() {
        // The operator is at the console, so the device-code flow is always allowed here
        try (Dependencies deps = factory.apply(config.withInteractiveAuth(true))) {
            Credential credential = deps.taskService().authenticate();
            out.println("Signed in. Token valid until " + credential.expiresAt());
            return OK;
        } catch (GatewayException e) {
            err.println(e.kind().describe(e.getMessage()));
            return FAILED;
        }
    }

    private int add(List<String> sources) {
        if (sources.isEmpty()) {
            throw new IllegalArgumentException("add needs at least one source");
        }
        int status = OK;
        try (Dependencies deps = factory.apply(config)) {
            for (String source : sources) {
                try {
                    TransferTask task = deps.taskService().addTask(source);
                    out.println("Added " + task.id() + "  " + abbreviate(task.source(), 70));
                } catch (DuplicateTaskException e) {
                    TransferTask existing = e.existing();
                    out.println("Already tracked by " + existing.id() + " (" + existing.state() + ")");
                } catch (IllegalArgumentException e) {
                    err.println("Rejected '" + source + "': " + e.getMessage());
                    status = FAILED;
                }
            }
        }
        return status;
    }

    private int list() {
        try (Dependencies deps = factory.apply(config)) {
            List<TransferTask> tasks = deps.taskService().listTasks();
            if (tasks.isEmpty()) {
                out.println("No tasks.");
                return OK;
            }

            Map<TaskState, List<TransferTask>> byState = new LinkedHashMap<>();
            for (TaskState state : TaskState.values()) {
                byState.put(state, new ArrayList<>());
            }
            for (TransferTask task : tasks) {
                byState.get(task.state()).add(task);
            }

            for (Map.Entry<TaskState, List<TransferTask>> group : byState.entrySet()) {
                if (group.getValue().isEmpty()) {
                    continue;
                }
                out.println(group.getKey() + " (" + group.getValue().size() + ")");
                for (TransferTask task : group.getValue()) {
                    out.println("  " + summaryLine(task));
                    if (task.hasError()) {
                        out.println("      error: " + task.error());
                    }
                }
            }
            return OK;
        }
    }

    private int show(List<String> args) {
        if (args.size() != 1) {
            throw new IllegalArgumentException("show needs exactly one task id");
        }
        try (Dependencies deps = factory.apply(config)) {
            TransferTask task = deps.taskService().getTask(args.get(0));
            out.println("id:        " + task.id());
            out.println("state:     " + task.state());
            out.println("source:    " + task.source());
            out.println("name:      " + orDash(task.name()));
            out.println("progress:  " + percent(task.progress()));
            out.println("handle:    " + orDash(task.downloadHandle()));
            out.println("local:     " + orDash(task.localPath()));
            out.println("remote:    " + orDash(task.remotePath()));
            out.println("error:     " + orDash(task.error()));
            out.println("failures:  " + task.failureCount());
            out.println("created:   " + task.createdAt());
            out.println("updated:   " + task.updatedAt());
            return OK;
        } catch (TaskNotFoundException e) {
            err.println(e.getMessage());
            return FAILED;
        }
    }

    private int start(List<String> args) {
        Duration interval = config.pollInterval();
        Duration maxRuntime = null;
        boolean once = false;

        for (int i = 0; i < args.size(); i++) {
            switch (args.get(i)) {
                case "--once" -> once = true;
                case "--interval" -> interval = Duration.ofSeconds(positiveSeconds(args, ++i, "--interval"));
                case "--max-runtime" -> maxRuntime = Duration.ofSeconds(positiveSeconds(args, ++i, "--max-runtime"));
                default -> throw new IllegalArgumentException("unknown option for start: " + args.get(i));
            }
        }

        try (Dependencies deps = factory.apply(config)) {
            Scheduler scheduler = deps.scheduler();

            if (once) {
                TickReport report = scheduler.runOnce();
                out.println("Examined " + report.examined() + ", advanced " + report.advanced()
                        + ", failed " + report.failed());
                return OK;
            }

            if (config.httpEnabled()) {
                int port = deps.startControlServer();
                out.println("Control API on http://" + config.httpHost() + ":" + port + "/api/v1");
            }

            Thread hook = new Thread(scheduler::stop, "cloudseed-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);

            ScheduledExecutorService deadline = null;
            if (maxRuntime != null) {
                deadline = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "cloudseed-deadline");
                    t.setDaemon(true);
                    return t;
                });
                deadline.schedule(() -> {
                    log.info("Maximum runtime reached, stopping after the current pass");
                    scheduler.stop();
                }, maxRuntime.toMillis(), TimeUnit.MILLISECONDS);
            }

            out.println("Polling every " + interval.toSeconds() + "s, Ctrl-C to stop");
            try {
                scheduler.run(interval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.stop();
            } finally {
                if (deadline != null) {
                    deadline.shutdownNow();
                }
                removeHook(hook);
            }
            return OK;
        }
    }

    private int remove(List<String> args) {
        List<String> ids = new ArrayList<>();
        boolean purge = false;
        for (String arg : args) {
            if ("--purge".equals(arg)) {
                purge = true;
            } else {
                ids.add(arg);
            }
        }
        if (ids.size() != 1) {
            throw new IllegalArgumentException("remove needs exactly one task id");
        }

        try (Dependencies deps = factory.apply(config)) {
            TransferTask removed = deps.taskService().removeTask(ids.get(0), purge);
            out.println("Removed " + removed.id() + (purge ? " and deleted its local files" : ""));
            return OK;
        } catch (TaskNotFoundException e) {
            err.println(e.getMessage());
            return FAILED;
        }
    }

    private int usage(String message) {
        err.println("cloudseed: " + message);
        err.print(USAGE_TEXT);
        return USAGE;
    }

    static String summaryLine(TransferTask task) {
        StringBuilder line = new StringBuilder(task.id()).append("  ").append(abbreviate(task.displayName(), 60));
        if (task.state() == TaskState.DOWNLOADING) {
            line.append("  ").append(percent(task.progress()));
        }
        if (task.remotePath() != null) {
            line.append("  -> ").append(task.remotePath());
        }
        return line.toString();
    }

    private static long positiveSeconds(List<String> args, int index, String option) {
        if (index >= args.size()) {
            throw new IllegalArgumentException(option + " needs a value in seconds");
        }
        long seconds = EngineConfig.parseInt(option, args.get(index));
        if (seconds <= 0) {
            throw new IllegalArgumentException(option + " must be positive");
        }
        return seconds;
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            log.debug("JVM already shutting down");
        }
    }

    private static String percent(double progress) {
        return String.format(Locale.ROOT, "%.1f%%", progress * 100);
    }

    private static String orDash(String value) {
        return value != null ? value : "-";
    }

    private static String abbreviate(String text, int max) {
        return text.length() > max ? text.substring(0, max - 3) + "..." : text;
    }
}
