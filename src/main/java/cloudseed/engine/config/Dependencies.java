package cloudseed.engine.config;

import cloudseed.engine.api.v1.HealthController;
import cloudseed.engine.api.v1.TaskController;
import cloudseed.engine.gateway.DownloadGateway;
import cloudseed.engine.gateway.UploadGateway;
import cloudseed.engine.repository.TaskStore;
import cloudseed.engine.scheduler.Scheduler;
import cloudseed.engine.scheduler.TaskOrchestrator;
import cloudseed.engine.server.ControlServer;
import cloudseed.engine.server.RouterHandler;
import cloudseed.engine.service.TaskService;
import cloudseed.engine.simulation.SimulatedDownloadGateway;
import cloudseed.engine.simulation.SimulatedUploadGateway;
import cloudseed.engine.store.Database;
import cloudseed.engine.store.JdbcTaskStore;
import cloudseed.engine.store.JsonFileTaskStore;
import cloudseed.onedrive.OneDriveUploadGateway;
import cloudseed.torrent.TransmissionDownloadGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Manual dependency injection container.
 * Creates and wires the store, gateways and services.
 *
 * Usage:
 *
 * <pre>
 * try (Dependencies deps = Dependencies.create(EngineConfig.fromEnv())) {
 *     deps.taskService().addTask(magnet);
 *     deps.scheduler().run(deps.config().pollInterval());
 * }
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final EngineConfig config;
    private final Database database;
    private final TaskStore taskStore;
    private final DownloadGateway downloadGateway;
    private final UploadGateway uploadGateway;
    private final TaskOrchestrator orchestrator;
    private final TaskService taskService;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;

    // Lazy-initialized
    private RouterHandler routerHandler;
    private Scheduler scheduler;
    private ControlServer controlServer;

    private Dependencies(EngineConfig config, DownloadGateway downloadGateway, UploadGateway uploadGateway) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Store
        if (config.storeType() == EngineConfig.StoreType.JDBC) {
            this.database = new Database(config);
            this.taskStore = new JdbcTaskStore(database);
        } else {
            this.database = null;
            this.taskStore = new JsonFileTaskStore(config.storeDir());
        }
        int loaded = taskStore.load();
        log.info("Task store ready ({} tasks)", loaded);

        // Gateways
        this.downloadGateway = downloadGateway != null ? downloadGateway : createDownloadGateway(config);
        this.uploadGateway = uploadGateway != null ? uploadGateway : createUploadGateway(config);

        // Services
        this.orchestrator = new TaskOrchestrator(taskStore, this.downloadGateway, this.uploadGateway, config);
        this.taskService = new TaskService(taskStore, orchestrator, this.uploadGateway);

        // Controllers
        this.healthController = new HealthController(taskStore, taskService);
        this.taskController = new TaskController(taskService);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config, gateways chosen by its gateway mode.
     */
    public static Dependencies create(EngineConfig config) {
        return new Dependencies(config, null, null);
    }

    /**
     * Create dependencies with explicit gateways.
     */
    public static Dependencies create(EngineConfig config, DownloadGateway downloadGateway,
            UploadGateway uploadGateway) {
        return new Dependencies(config, downloadGateway, uploadGateway);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(EngineConfig.fromEnv());
    }

    private static DownloadGateway createDownloadGateway(EngineConfig config) {
        if (config.gatewayMode() == EngineConfig.GatewayMode.SIMULATED) {
            log.info("Using simulated download gateway");
            return new SimulatedDownloadGateway(Path.of(config.downloadDir()));
        }
        return new TransmissionDownloadGateway(config);
    }

    private static UploadGateway createUploadGateway(EngineConfig config) {
        if (config.gatewayMode() == EngineConfig.GatewayMode.SIMULATED) {
            log.info("Using simulated upload gateway");
            return new SimulatedUploadGateway(true);
        }
        return new OneDriveUploadGateway(config);
    }

    // Getters
    public EngineConfig config() {
        return config;
    }

    public TaskStore taskStore() {
        return taskStore;
    }

    public DownloadGateway downloadGateway() {
        return downloadGateway;
    }

    public UploadGateway uploadGateway() {
        return uploadGateway;
    }

    public TaskOrchestrator orchestrator() {
        return orchestrator;
    }

    public TaskService taskService() {
        return taskService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    .registerController(healthController)
                    .registerController(taskController);
        }
        return routerHandler;
    }

    /**
     * Get the scheduler (creates it if not yet created).
     */
    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = new Scheduler(orchestrator);
        }
        return scheduler;
    }

    /**
     * Start the control API on the configured port.
     *
     * @return the bound port
     */
    public int startControlServer() {
        if (controlServer == null) {
            controlServer = new ControlServer(config, routerHandler());
        }
        return controlServer.start(config.httpPort());
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (controlServer != null) {
            try {
                controlServer.stop();
            } catch (Exception e) {
                log.warn("Error stopping control server: {}", e.getMessage());
            }
        }

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        if (database != null) {
            try {
                database.close();
            } catch (Exception e) {
                log.warn("Error closing database: {}", e.getMessage());
            }
        }

        log.info("Dependencies closed");
    }
}
