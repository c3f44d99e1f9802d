package cloudseed.cli;

import cloudseed.engine.config.Dependencies;
import cloudseed.engine.config.EngineConfig;
import cloudseed.engine.model.TaskState;
import cloudseed.engine.simulation.SimulatedDownloadGateway;
import cloudseed.engine.simulation.SimulatedUploadGateway;
import cloudseed.engine.store.JsonFileTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the operator commands against a JSON store and the simulated gateways.
 * Gateways are shared between invocations the way a long-lived daemon would be.
 */
class CommandLineTest {

    private static final String MAGNET = "magnet:?xt=urn:btih:0011223344&dn=ubuntu.iso";
    private static final Pattern ADDED = Pattern.compile("Added (task-[0-9a-f]{8})");

    @TempDir
    Path dir;

    private EngineConfig config;
    private SimulatedDownloadGateway download;
    private SimulatedUploadGateway upload;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        config = EngineConfig.defaults().withStoreDir(dir.resolve("tasks"));
        download = new SimulatedDownloadGateway(dir.resolve("downloads"), 1.0);
        upload = new SimulatedUploadGateway(true);
    }

    private int run(String... args) {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        CommandLine cli = new CommandLine(config, cfg -> Dependencies.create(cfg, download, upload),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        return cli.run(args);
    }

    private String out() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private String addAndGetId(String source) {
        assertEquals(CommandLine.OK, run("add", source));
        Matcher m = ADDED.matcher(out());
        assertTrue(m.find(), out());
        return m.group(1);
    }

    private TaskState stateOf(String id) {
        JsonFileTaskStore store = new JsonFileTaskStore(dir.resolve("tasks"));
        store.load();
        return store.get(id).state();
    }

    @Test
    void noArgumentsIsUsageError() {
        assertEquals(CommandLine.USAGE, run());
        assertTrue(err().contains("Usage: cloudseed"));
    }

    @Test
    void unknownCommandIsUsageError() {
        assertEquals(CommandLine.USAGE, run("frobnicate"));
        assertTrue(err().contains("unknown command: frobnicate"));
    }

    @Test
    void helpPrintsUsage() {
        assertEquals(CommandLine.OK, run("help"));
        assertTrue(out().contains("Commands:"));
    }

    @Test
    void addThenListGroupsByState() {
        String id = addAndGetId(MAGNET);

        assertEquals(CommandLine.OK, run("list"));
        assertTrue(out().contains("PENDING (1)"), out());
        assertTrue(out().contains("  " + id + "  " + MAGNET), out());
    }

    @Test
    void addingTwiceReportsExistingTask() {
        String id = addAndGetId(MAGNET);

        assertEquals(CommandLine.OK, run("add", MAGNET));
        assertTrue(out().contains("Already tracked by " + id + " (PENDING)"), out());
    }

    @Test
    void blankSourceIsRejected() {
        assertEquals(CommandLine.FAILED, run("add", "  "));
        assertTrue(err().contains("Rejected"));
    }

    @Test
    void addWithoutSourceIsUsageError() {
        assertEquals(CommandLine.USAGE, run("add"));
    }

    @Test
    void emptyListSaysSo() {
        assertEquals(CommandLine.OK, run("list"));
        assertEquals("No tasks.", out().strip());
    }

    @Test
    void startOnceRunsOnePass() {
        String id = addAndGetId(MAGNET);

        assertEquals(CommandLine.OK, run("start", "--once"));
        assertTrue(out().contains("Examined 1, advanced 1, failed 0"), out());
        assertEquals(TaskState.SUBMITTED, stateOf(id));
    }

    @Test
    void repeatedPassesCompleteTheTask() {
        String id = addAndGetId(MAGNET);
        for (int i = 0; i < 4; i++) {
            assertEquals(CommandLine.OK, run("start", "--once"));
        }

        assertEquals(TaskState.COMPLETED, stateOf(id));
        assertEquals(CommandLine.OK, run("show", id));
        assertTrue(out().contains("remote:    /BTDownloads/ubuntu.iso"), out());
        assertTrue(out().contains("progress:  100.0%"), out());
    }

    @Test
    void failedTaskShowsErrorInList() {
        String id = addAndGetId("definitely not a torrent");
        run("start", "--once");

        assertEquals(CommandLine.OK, run("list"));
        assertTrue(out().contains("FAILED (1)"), out());
        assertTrue(out().contains("error: InputError"), out());
        assertEquals(TaskState.FAILED, stateOf(id));
    }

    @Test
    void startWithMaxRuntimeStopsByItself() {
        addAndGetId(MAGNET);

        assertEquals(CommandLine.OK, run("start", "--interval", "1", "--max-runtime", "1"));
        assertTrue(out().contains("Polling every 1s"), out());
    }

    @Test
    void startRejectsBadOptions() {
        assertEquals(CommandLine.USAGE, run("start", "--interval", "0"));
        assertEquals(CommandLine.USAGE, run("start", "--interval"));
        assertEquals(CommandLine.USAGE, run("start", "--interval", "soon"));
        assertEquals(CommandLine.USAGE, run("start", "--verbose"));
    }

    @Test
    void removeMarksTaskRemoved() {
        String id = addAndGetId(MAGNET);

        assertEquals(CommandLine.OK, run("remove", id, "--purge"));
        assertTrue(out().contains("Removed " + id + " and deleted its local files"));
        assertEquals(TaskState.REMOVED, stateOf(id));
    }

    @Test
    void unknownTaskFails() {
        assertEquals(CommandLine.FAILED, run("show", "task-00000000"));
        assertEquals(CommandLine.FAILED, run("remove", "task-00000000"));
        assertEquals(CommandLine.USAGE, run("remove"));
    }

    @Test
    void authSignsIn() {
        upload.signOut();

        assertEquals(CommandLine.OK, run("auth"));
        assertTrue(out().startsWith("Signed in. Token valid until"));
    }
}
