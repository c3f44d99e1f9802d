package cloudseed.engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration holder for the transfer engine.
 * All settings have sensible defaults.
 *
 * Precedence: defaults, then the INI file ({@code CLOUDSEED_CONFIG} or
 * {@code ./cloudseed.ini}), then environment variables.
 */
public final class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    public static final String CONFIG_FILE_ENV = "CLOUDSEED_CONFIG";
    public static final String DEFAULT_CONFIG_FILE = "cloudseed.ini";

    public enum StoreType {
        JSON,
        JDBC
    }

    public enum GatewayMode {
        LIVE,
        SIMULATED
    }

    // Store settings
    private StoreType storeType = StoreType.JSON;
    private Path storeDir = Path.of("data", "tasks");
    private String databaseUrl = "jdbc:h2:file:./data/cloudseed;AUTO_SERVER=TRUE";
    private int databasePoolSize = 4;

    // Engine settings
    private Duration pollInterval = Duration.ofSeconds(300);
    private int maxTransientFailures = 5;
    private boolean purgeOnComplete = false;
    private GatewayMode gatewayMode = GatewayMode.LIVE;

    // Transmission settings
    private String downloadDir = "./downloads";
    private String transmissionHost = "localhost";
    private int transmissionPort = 9091;
    private String transmissionUser = "";
    private String transmissionPassword = "";
    private int maxDownloadRate = 0; // KB/s, 0 = unlimited
    private int maxUploadRate = 50; // KB/s

    // OneDrive settings
    private String onedriveClientId = null;
    private String onedriveTenantId = "common";
    private List<String> onedriveScopes = List.of("Files.ReadWrite", "Files.ReadWrite.All", "offline_access");
    private String uploadFolder = "/BTDownloads";
    private Path tokenPath = Path.of("onedrive_token.json");
    private String tokenSeed = null; // serialized token cache supplied by a headless runner
    private boolean interactiveAuth = false;

    // HTTP control API (optional)
    private int httpPort = 0; // 0 = disabled
    private String httpHost = "127.0.0.1";
    private String apiKey = null; // If set, mutating requests must provide X-Cloudseed-Key

    private EngineConfig() {
    }

    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    public static EngineConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build the configuration from the optional INI file and the given
     * environment.
     */
    public static EngineConfig fromEnv(Map<String, String> env) {
        EngineConfig config = new EngineConfig();

        String configFile = env.getOrDefault(CONFIG_FILE_ENV, DEFAULT_CONFIG_FILE);
        File file = new File(configFile);
        if (file.isFile()) {
            try {
                IniLoader.apply(file, config);
                log.info("Loaded configuration from {}", file.getAbsolutePath());
            } catch (IOException e) {
                throw new IllegalArgumentException("Cannot read config file " + file + ": " + e.getMessage(), e);
            }
        } else if (env.containsKey(CONFIG_FILE_ENV)) {
            throw new IllegalArgumentException("Config file not found: " + file.getAbsolutePath());
        }

        config.applyEnv(env);
        return config;
    }

    private void applyEnv(Map<String, String> env) {
        String storeTypeValue = env.get("CLOUDSEED_STORE");
        if (notBlank(storeTypeValue)) {
            storeType = parseEnum(StoreType.class, "CLOUDSEED_STORE", storeTypeValue);
        }

        String dir = env.get("CLOUDSEED_STORE_DIR");
        if (notBlank(dir)) {
            storeDir = Path.of(dir);
        }

        String dbUrl = env.get("CLOUDSEED_DB_URL");
        if (notBlank(dbUrl)) {
            databaseUrl = dbUrl;
        }

        String interval = env.get("CHECK_INTERVAL");
        if (notBlank(interval)) {
            pollInterval = Duration.ofSeconds(parseInt("CHECK_INTERVAL", interval));
        }

        String maxFailures = env.get("MAX_TRANSIENT_FAILURES");
        if (notBlank(maxFailures)) {
            maxTransientFailures = parseInt("MAX_TRANSIENT_FAILURES", maxFailures);
        }

        String purge = env.get("PURGE_ON_COMPLETE");
        if (notBlank(purge)) {
            purgeOnComplete = Boolean.parseBoolean(purge.trim());
        }

        String mode = env.get("CLOUDSEED_GATEWAY_MODE");
        if (notBlank(mode)) {
            gatewayMode = parseEnum(GatewayMode.class, "CLOUDSEED_GATEWAY_MODE", mode);
        }

        String downloads = env.get("DOWNLOAD_DIR");
        if (notBlank(downloads)) {
            downloadDir = downloads;
        }

        String host = env.get("TRANSMISSION_HOST");
        if (notBlank(host)) {
            transmissionHost = host;
        }

        String port = env.get("TRANSMISSION_PORT");
        if (notBlank(port)) {
            transmissionPort = parseInt("TRANSMISSION_PORT", port);
        }

        String user = env.get("TRANSMISSION_USERNAME");
        if (user != null) {
            transmissionUser = user;
        }

        String password = env.get("TRANSMISSION_PASSWORD");
        if (password != null) {
            transmissionPassword = password;
        }

        String downRate = env.get("MAX_DOWNLOAD_RATE");
        if (notBlank(downRate)) {
            maxDownloadRate = parseInt("MAX_DOWNLOAD_RATE", downRate);
        }

        String upRate = env.get("MAX_UPLOAD_RATE");
        if (notBlank(upRate)) {
            maxUploadRate = parseInt("MAX_UPLOAD_RATE", upRate);
        }

        String clientId = env.get("ONEDRIVE_CLIENT_ID");
        if (notBlank(clientId)) {
            onedriveClientId = clientId;
        }

        String tenant = env.get("ONEDRIVE_TENANT_ID");
        if (notBlank(tenant)) {
            onedriveTenantId = tenant;
        }

        String folder = env.get("ONEDRIVE_UPLOAD_FOLDER");
        if (notBlank(folder)) {
            uploadFolder = folder;
        }

        String token = env.get("ONEDRIVE_TOKEN");
        if (notBlank(token)) {
            tokenSeed = token;
        }

        String tokenFile = env.get("ONEDRIVE_TOKEN_PATH");
        if (notBlank(tokenFile)) {
            tokenPath = Path.of(tokenFile);
        }

        String interactive = env.get("ONEDRIVE_INTERACTIVE_AUTH");
        if (notBlank(interactive)) {
            interactiveAuth = Boolean.parseBoolean(interactive.trim());
        }

        String httpPortValue = env.get("CLOUDSEED_HTTP_PORT");
        if (notBlank(httpPortValue)) {
            httpPort = parseInt("CLOUDSEED_HTTP_PORT", httpPortValue);
        }

        String key = env.get("CLOUDSEED_API_KEY");
        if (notBlank(key)) {
            apiKey = key;
        }
    }

    static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    public static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer, got '" + value + "'");
        }
    }

    static <E extends Enum<E>> E parseEnum(Class<E> type, String key, String value) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(key + ": unknown value '" + value + "'");
        }
    }

    // Getters
    public StoreType storeType() {
        return storeType;
    }

    public Path storeDir() {
        return storeDir;
    }

    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public int maxTransientFailures() {
        return maxTransientFailures;
    }

    public boolean purgeOnComplete() {
        return purgeOnComplete;
    }

    public GatewayMode gatewayMode() {
        return gatewayMode;
    }

    public String downloadDir() {
        return downloadDir;
    }

    public String transmissionHost() {
        return transmissionHost;
    }

    public int transmissionPort() {
        return transmissionPort;
    }

    public String transmissionUser() {
        return transmissionUser;
    }

    public String transmissionPassword() {
        return transmissionPassword;
    }

    public int maxDownloadRate() {
        return maxDownloadRate;
    }

    public int maxUploadRate() {
        return maxUploadRate;
    }

    public String onedriveClientId() {
        return onedriveClientId;
    }

    public String onedriveTenantId() {
        return onedriveTenantId;
    }

    public List<String> onedriveScopes() {
        return onedriveScopes;
    }

    public String uploadFolder() {
        return uploadFolder;
    }

    public Path tokenPath() {
        return tokenPath;
    }

    public String tokenSeed() {
        return tokenSeed;
    }

    public boolean interactiveAuth() {
        return interactiveAuth;
    }

    public int httpPort() {
        return httpPort;
    }

    public String httpHost() {
        return httpHost;
    }

    public String apiKey() {
        return apiKey;
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public boolean httpEnabled() {
        return httpPort > 0;
    }

    // Fluent setters for testing/customization
    public EngineConfig withStoreType(StoreType type) {
        this.storeType = type;
        return this;
    }

    public EngineConfig withStoreDir(Path dir) {
        this.storeDir = dir;
        return this;
    }

    public EngineConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public EngineConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public EngineConfig withMaxTransientFailures(int max) {
        this.maxTransientFailures = max;
        return this;
    }

    public EngineConfig withPurgeOnComplete(boolean purge) {
        this.purgeOnComplete = purge;
        return this;
    }

    public EngineConfig withGatewayMode(GatewayMode mode) {
        this.gatewayMode = mode;
        return this;
    }

    public EngineConfig withDownloadDir(String dir) {
        this.downloadDir = dir;
        return this;
    }

    public EngineConfig withTransmission(String host, int port) {
        this.transmissionHost = host;
        this.transmissionPort = port;
        return this;
    }

    public EngineConfig withTransmissionCredentials(String user, String password) {
        this.transmissionUser = user;
        this.transmissionPassword = password;
        return this;
    }

    public EngineConfig withRateLimits(int downloadKbps, int uploadKbps) {
        this.maxDownloadRate = downloadKbps;
        this.maxUploadRate = uploadKbps;
        return this;
    }

    public EngineConfig withOnedriveClient(String clientId, String tenantId) {
        this.onedriveClientId = clientId;
        this.onedriveTenantId = tenantId;
        return this;
    }

    public EngineConfig withUploadFolder(String folder) {
        this.uploadFolder = folder;
        return this;
    }

    public EngineConfig withTokenPath(Path path) {
        this.tokenPath = path;
        return this;
    }

    public EngineConfig withTokenSeed(String tokenJson) {
        this.tokenSeed = tokenJson;
        return this;
    }

    public EngineConfig withInteractiveAuth(boolean interactive) {
        this.interactiveAuth = interactive;
        return this;
    }

    public EngineConfig withHttpPort(int port) {
        this.httpPort = port;
        return this;
    }

    public EngineConfig withHttpHost(String host) {
        this.httpHost = host;
        return this;
    }

    public EngineConfig withApiKey(String key) {
        this.apiKey = key;
        return this;
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "storeType=" + storeType +
                ", storeDir=" + storeDir +
                ", pollInterval=" + pollInterval +
                ", maxTransientFailures=" + maxTransientFailures +
                ", purgeOnComplete=" + purgeOnComplete +
                ", gatewayMode=" + gatewayMode +
                ", transmission=" + transmissionHost + ":" + transmissionPort +
                ", uploadFolder='" + uploadFolder + '\'' +
                ", httpPort=" + httpPort +
                ", apiKeySet=" + hasApiKey() +
                '}';
    }
}
