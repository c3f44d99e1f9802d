package cloudseed.engine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import cloudseed.engine.model.TransferTask;
import cloudseed.engine.repository.IllegalTransitionException;
import cloudseed.engine.repository.TaskStore;
import cloudseed.engine.repository.TaskStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * File-backed task store: one pretty-printed JSON document per task in a
 * single directory, so an operator can inspect or repair records by hand.
 *
 * Writes go to a uniquely named temp file, are fsynced, then renamed over
 * the record file. A reader therefore sees either the old or the new record,
 * never a partial one. Separate processes (a CLI {@code add} next to a running
 * loop) only ever write different files or whole-file replacements.
 */
public class JsonFileTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFileTaskStore.class);

    static final String RECORD_SUFFIX = ".json";
    static final String TEMP_SUFFIX = ".tmp";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Duration STALE_TEMP_AGE = Duration.ofHours(1);

    private final Path dir;
    private final ObjectMapper mapper;
    private volatile Map<String, TransferTask> tasks = Map.of();

    public JsonFileTaskStore(Path dir) {
        this.dir = dir;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public synchronized int load() {
        Map<String, TransferTask> loaded = new HashMap<>();

        if (!Files.isDirectory(dir)) {
            log.debug("Task directory {} does not exist yet, starting empty", dir);
            tasks = Map.of();
            return 0;
        }

        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                if (fileName.endsWith(TEMP_SUFFIX)) {
                    removeIfStale(file);
                } else if (fileName.endsWith(RECORD_SUFFIX)) {
                    readRecord(file).ifPresent(task -> loaded.put(task.id(), task));
                }
            }
        } catch (IOException e) {
            throw new TaskStoreException("Failed to list task directory " + dir, e);
        }

        tasks = Map.copyOf(loaded);
        log.debug("Loaded {} tasks from {}", loaded.size(), dir);
        return loaded.size();
    }

    @Override
    public synchronized void save(TransferTask task) {
        Path target = recordFile(task.id());

        if (Files.exists(target)) {
            readRecord(target).ifPresent(current ->
                    IllegalTransitionException.check(task.id(), current.state(), task.state()));
        }

        Path temp = dir.resolve(task.id() + "." + UUID.randomUUID().toString().substring(0, 8) + TEMP_SUFFIX);
        try {
            Files.createDirectories(dir);
            byte[] bytes = mapper.writeValueAsBytes(TaskDocument.from(task));

            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }

            moveIntoPlace(temp, target);
            syncDirectory();
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new TaskStoreException("Failed to save task: " + task.id(), e);
        }

        Map<String, TransferTask> updated = new HashMap<>(tasks);
        updated.put(task.id(), task);
        tasks = Map.copyOf(updated);
    }

    @Override
    public Optional<TransferTask> findById(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public List<TransferTask> list() {
        List<TransferTask> all = new ArrayList<>(tasks.values());
        all.sort(Comparator.comparing(TransferTask::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(TransferTask::id));
        return all;
    }

    @Override
    public boolean isHealthy() {
        return !Files.exists(dir) || (Files.isDirectory(dir) && Files.isWritable(dir));
    }

    private Path recordFile(String taskId) {
        if (taskId == null || !SAFE_ID.matcher(taskId).matches()) {
            throw new IllegalArgumentException("invalid task id: " + taskId);
        }
        return dir.resolve(taskId + RECORD_SUFFIX);
    }

    /**
     * Read one record file. Files that do not parse, lack a required field or
     * predate the current format are reported and skipped; records written in a
     * newer format stop the load.
     */
    private Optional<TransferTask> readRecord(Path file) {
        try {
            TaskDocument doc = mapper.readValue(file.toFile(), TaskDocument.class);
            if (doc.version() > TaskDocument.CURRENT_VERSION) {
                throw new TaskStoreException("Unsupported task format version " + doc.version() + " in " + file);
            }
            String problem = problemWith(doc);
            if (problem != null) {
                log.error("Skipping unreadable task file {}: {}", file, problem);
                return Optional.empty();
            }
            return Optional.of(doc.toTask());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Skipping unreadable task file {}: {}", file, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new TaskStoreException("Failed to read task file " + file, e);
        }
    }

    private static String problemWith(TaskDocument doc) {
        if (doc.version() < TaskDocument.CURRENT_VERSION) {
            return doc.version() == 0 ? "no format version" : "outdated format version " + doc.version();
        }
        if (doc.id() == null) {
            return "missing id";
        }
        if (doc.source() == null) {
            return "missing source";
        }
        if (doc.state() == null) {
            return "missing state";
        }
        return null;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("Atomic move not supported for {}, falling back to replace", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void syncDirectory() {
        // Not supported on every platform; the rename itself is what matters for atomicity
        try (FileChannel channel = FileChannel.open(dir, StandardOpenOption.READ)) {
            channel.force(true);
        } catch (IOException e) {
            log.debug("Directory sync not supported for {}: {}", dir, e.getMessage());
        }
    }

    private void removeIfStale(Path temp) {
        try {
            Instant modified = Files.getLastModifiedTime(temp).toInstant();
            if (modified.isBefore(Instant.now().minus(STALE_TEMP_AGE))) {
                Files.deleteIfExists(temp);
                log.info("Removed stale temp file {}", temp);
            }
        } catch (IOException e) {
            log.warn("Could not inspect temp file {}: {}", temp, e.getMessage());
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
