package cloudseed.engine.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Applies settings from an INI file onto an {@link EngineConfig}.
 * Sections: [store], [engine], [transmission], [onedrive], [http]. All optional.
 */
public final class IniLoader {

    private IniLoader() {
    }

    public static void apply(File file, EngineConfig cfg) throws IOException {
        Ini ini = new Ini(file);

        Profile.Section store = ini.get("store");
        Profile.Section engine = ini.get("engine");
        Profile.Section bt = ini.get("transmission");
        Profile.Section drive = ini.get("onedrive");
        Profile.Section http = ini.get("http");

        // STORE
        String type = opt(store, "type");
        if (type != null) cfg.withStoreType(EngineConfig.parseEnum(EngineConfig.StoreType.class, "store.type", type));
        String dir = opt(store, "dir");
        if (dir != null) cfg.withStoreDir(Path.of(dir));
        String dbUrl = opt(store, "database_url");
        if (dbUrl != null) cfg.withDatabaseUrl(dbUrl);

        // ENGINE
        String interval = opt(engine, "poll_interval_seconds");
        if (interval != null) cfg.withPollInterval(
                Duration.ofSeconds(EngineConfig.parseInt("engine.poll_interval_seconds", interval)));
        String maxFailures = opt(engine, "max_transient_failures");
        if (maxFailures != null) cfg.withMaxTransientFailures(
                EngineConfig.parseInt("engine.max_transient_failures", maxFailures));
        String purge = opt(engine, "purge_on_complete");
        if (purge != null) cfg.withPurgeOnComplete(Boolean.parseBoolean(purge));
        String mode = opt(engine, "gateway_mode");
        if (mode != null) cfg.withGatewayMode(
                EngineConfig.parseEnum(EngineConfig.GatewayMode.class, "engine.gateway_mode", mode));

        // TRANSMISSION
        String host = opt(bt, "host", cfg.transmissionHost());
        String port = opt(bt, "port");
        cfg.withTransmission(host, port != null
                ? EngineConfig.parseInt("transmission.port", port)
                : cfg.transmissionPort());
        cfg.withTransmissionCredentials(
                opt(bt, "username", cfg.transmissionUser()),
                opt(bt, "password", cfg.transmissionPassword()));
        String downloadDir = opt(bt, "download_dir");
        if (downloadDir != null) cfg.withDownloadDir(downloadDir);
        String downRate = opt(bt, "max_download_rate");
        String upRate = opt(bt, "max_upload_rate");
        cfg.withRateLimits(
                downRate != null ? EngineConfig.parseInt("transmission.max_download_rate", downRate) : cfg.maxDownloadRate(),
                upRate != null ? EngineConfig.parseInt("transmission.max_upload_rate", upRate) : cfg.maxUploadRate());

        // ONEDRIVE
        cfg.withOnedriveClient(
                opt(drive, "client_id", cfg.onedriveClientId()),
                opt(drive, "tenant_id", cfg.onedriveTenantId()));
        String folder = opt(drive, "upload_folder");
        if (folder != null) cfg.withUploadFolder(folder);
        String tokenPath = opt(drive, "token_path");
        if (tokenPath != null) cfg.withTokenPath(Path.of(tokenPath));
        String interactive = opt(drive, "interactive_auth");
        if (interactive != null) cfg.withInteractiveAuth(Boolean.parseBoolean(interactive));

        // HTTP
        String httpPort = opt(http, "port");
        if (httpPort != null) cfg.withHttpPort(EngineConfig.parseInt("http.port", httpPort));
        String httpHost = opt(http, "host");
        if (httpHost != null) cfg.withHttpHost(httpHost);
        String apiKey = opt(http, "api_key");
        if (apiKey != null) cfg.withApiKey(apiKey);
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        if (s == null) return null;
        String v = s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }
}
