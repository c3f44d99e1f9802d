package cloudseed.engine.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir
    Path dir;

    @Test
    void defaults() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(EngineConfig.StoreType.JSON, config.storeType());
        assertEquals(Duration.ofSeconds(300), config.pollInterval());
        assertEquals(5, config.maxTransientFailures());
        assertFalse(config.purgeOnComplete());
        assertEquals(EngineConfig.GatewayMode.LIVE, config.gatewayMode());
        assertEquals("localhost", config.transmissionHost());
        assertEquals(9091, config.transmissionPort());
        assertEquals(0, config.maxDownloadRate());
        assertEquals(50, config.maxUploadRate());
        assertEquals("/BTDownloads", config.uploadFolder());
        assertFalse(config.interactiveAuth());
        assertFalse(config.httpEnabled());
        assertFalse(config.hasApiKey());
    }

    @Test
    void environmentOverridesDefaults() {
        EngineConfig config = EngineConfig.fromEnv(Map.of(
                EngineConfig.CONFIG_FILE_ENV, writeIni(""),
                "CHECK_INTERVAL", "60",
                "TRANSMISSION_HOST", "seedbox",
                "TRANSMISSION_PORT", " 9092 ",
                "MAX_UPLOAD_RATE", "0",
                "ONEDRIVE_CLIENT_ID", "client-123",
                "ONEDRIVE_TOKEN", "{\"access_token\":\"a\"}",
                "CLOUDSEED_GATEWAY_MODE", "simulated",
                "PURGE_ON_COMPLETE", "true"));

        assertEquals(Duration.ofSeconds(60), config.pollInterval());
        assertEquals("seedbox", config.transmissionHost());
        assertEquals(9092, config.transmissionPort());
        assertEquals(0, config.maxUploadRate());
        assertEquals("client-123", config.onedriveClientId());
        assertEquals("{\"access_token\":\"a\"}", config.tokenSeed());
        assertEquals(EngineConfig.GatewayMode.SIMULATED, config.gatewayMode());
        assertTrue(config.purgeOnComplete());
    }

    @Test
    void iniFileIsApplied() {
        String ini = String.join("\n",
                "[store]",
                "type = jdbc",
                "database_url = jdbc:h2:mem:ini",
                "[engine]",
                "poll_interval_seconds = 30",
                "max_transient_failures = 2",
                "[transmission]",
                "host = nas",
                "username = admin",
                "download_dir = /srv/downloads",
                "[onedrive]",
                "upload_folder = /Torrents",
                "[http]",
                "port = 8080",
                "api_key = secret",
                "");

        EngineConfig config = EngineConfig.fromEnv(Map.of(EngineConfig.CONFIG_FILE_ENV, writeIni(ini)));

        assertEquals(EngineConfig.StoreType.JDBC, config.storeType());
        assertEquals("jdbc:h2:mem:ini", config.databaseUrl());
        assertEquals(Duration.ofSeconds(30), config.pollInterval());
        assertEquals(2, config.maxTransientFailures());
        assertEquals("nas", config.transmissionHost());
        assertEquals(9091, config.transmissionPort());
        assertEquals("admin", config.transmissionUser());
        assertEquals("/srv/downloads", config.downloadDir());
        assertEquals("/Torrents", config.uploadFolder());
        assertTrue(config.httpEnabled());
        assertEquals(8080, config.httpPort());
        assertTrue(config.hasApiKey());
    }

    @Test
    void environmentWinsOverIniFile() {
        String ini = "[transmission]\nhost = nas\nport = 9000\n";

        EngineConfig config = EngineConfig.fromEnv(Map.of(
                EngineConfig.CONFIG_FILE_ENV, writeIni(ini),
                "TRANSMISSION_HOST", "override"));

        assertEquals("override", config.transmissionHost());
        assertEquals(9000, config.transmissionPort());
    }

    @Test
    void missingExplicitConfigFileFails() {
        String missing = dir.resolve("nope.ini").toString();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of(EngineConfig.CONFIG_FILE_ENV, missing)));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void badNumbersAndEnumsFail() {
        String empty = writeIni("");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of(EngineConfig.CONFIG_FILE_ENV, empty, "CHECK_INTERVAL", "soon")));
        assertTrue(e.getMessage().contains("CHECK_INTERVAL"));

        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromEnv(Map.of(EngineConfig.CONFIG_FILE_ENV, empty, "CLOUDSEED_STORE", "mongo")));
    }

    @Test
    void fluentSettersChain() {
        EngineConfig config = EngineConfig.defaults()
                .withHttpPort(0)
                .withApiKey("k")
                .withUploadFolder("/X");

        assertTrue(config.hasApiKey());
        assertEquals("/X", config.uploadFolder());
    }

    private String writeIni(String content) {
        try {
            Path file = dir.resolve("cloudseed-" + content.hashCode() + ".ini");
            Files.writeString(file, content);
            return file.toString();
        } catch (java.io.IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
