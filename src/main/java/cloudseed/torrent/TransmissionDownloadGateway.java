package cloudseed.torrent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import cloudseed.engine.config.EngineConfig;
import cloudseed.engine.gateway.DownloadGateway;
import cloudseed.engine.gateway.DownloadStatus;
import cloudseed.engine.gateway.FatalGatewayException;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.InvalidSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.List;
import java.util.Locale;

/**
 * Download gateway backed by a Transmission daemon.
 * The handle of a transfer is the torrent's info hash, which Transmission
 * keeps across its own restarts.
 */
public class TransmissionDownloadGateway implements DownloadGateway {

    private static final Logger log = LoggerFactory.getLogger(TransmissionDownloadGateway.class);

    static final List<String> STATUS_FIELDS = List.of(
            "hashString", "name", "percentDone", "leftUntilDone", "status", "error", "errorString", "downloadDir");

    /** Transmission reports a local I/O problem with error code 3; 1 and 2 are tracker warnings/errors. */
    static final int LOCAL_ERROR = 3;

    static final double COMPLETE_THRESHOLD = 0.999;

    private final TransmissionClient client;
    private final String downloadDir;
    private final int maxDownloadRate;
    private final int maxUploadRate;

    private volatile boolean sessionConfigured = false;

    public TransmissionDownloadGateway(EngineConfig config) {
        this(new TransmissionClient(config.transmissionHost(), config.transmissionPort(),
                config.transmissionUser(), config.transmissionPassword()),
                config.downloadDir(), config.maxDownloadRate(), config.maxUploadRate());
    }

    public TransmissionDownloadGateway(TransmissionClient client, String downloadDir, int maxDownloadRate,
            int maxUploadRate) {
        this.client = client;
        this.downloadDir = downloadDir;
        this.maxDownloadRate = maxDownloadRate;
        this.maxUploadRate = maxUploadRate;
    }

    @Override
    public String submit(String source) throws GatewayException {
        ObjectNode args = client.mapper().createObjectNode();
        describeSource(source, args);
        if (downloadDir != null) {
            args.put("download-dir", Path.of(downloadDir).toAbsolutePath().toString());
        }

        configureSession();

        JsonNode response = client.call("torrent-add", args);
        String result = response.path("result").asText();
        if (!"success".equals(result)) {
            String lower = result.toLowerCase(Locale.ROOT);
            if (lower.contains("invalid") || lower.contains("corrupt") || lower.contains("unrecognized")) {
                throw new InvalidSourceException("Transmission rejected the source: " + result);
            }
            throw new FatalGatewayException("torrent-add failed: " + result);
        }

        JsonNode arguments = response.path("arguments");
        JsonNode torrent = arguments.has("torrent-added")
                ? arguments.get("torrent-added")
                : arguments.path("torrent-duplicate");
        String hash = torrent.path("hashString").asText("");
        if (hash.isEmpty()) {
            throw new FatalGatewayException("torrent-add returned no info hash");
        }

        if (arguments.has("torrent-duplicate")) {
            log.info("Transmission already had torrent {}, reusing it", hash);
        } else {
            log.info("Torrent added with info hash {}", hash);
        }
        return hash;
    }

    @Override
    public DownloadStatus status(String handle) throws GatewayException {
        ObjectNode args = client.mapper().createObjectNode();
        args.putArray("ids").add(handle);
        ArrayNode fields = args.putArray("fields");
        STATUS_FIELDS.forEach(fields::add);

        JsonNode response = client.call("torrent-get", args);
        requireSuccess("torrent-get", response);

        JsonNode torrents = response.path("arguments").path("torrents");
        if (!torrents.isArray() || torrents.isEmpty()) {
            throw new FatalGatewayException("Transmission no longer knows torrent " + handle);
        }
        return toStatus(torrents.get(0));
    }

    @Override
    public void cancel(String handle, boolean purgeFiles) throws GatewayException {
        ObjectNode args = client.mapper().createObjectNode();
        args.putArray("ids").add(handle);
        args.put("delete-local-data", purgeFiles);

        requireSuccess("torrent-remove", client.call("torrent-remove", args));
        log.info("Removed torrent {} from Transmission (deleteLocalData={})", handle, purgeFiles);
    }

    /**
     * Map one {@code torrent-get} entry onto the engine's coarse status.
     */
    static DownloadStatus toStatus(JsonNode torrent) {
        String name = torrent.hasNonNull("name") ? torrent.get("name").asText() : null;

        if (torrent.path("error").asInt(0) == LOCAL_ERROR) {
            return DownloadStatus.error(name, torrent.path("errorString").asText("local error"));
        }

        double percentDone = torrent.path("percentDone").asDouble(0.0);
        boolean nothingLeft = !torrent.has("leftUntilDone") || torrent.get("leftUntilDone").asLong() == 0;
        if (percentDone >= COMPLETE_THRESHOLD && nothingLeft && name != null) {
            String dir = torrent.path("downloadDir").asText("");
            String localPath = dir.isEmpty() ? name : Path.of(dir).resolve(name).toString();
            return DownloadStatus.complete(name, localPath);
        }

        // 0 stopped, 1/2 verifying, 3 queued to download, 4 downloading, 5/6 seeding
        int state = torrent.path("status").asInt(0);
        if (state == 4) {
            return DownloadStatus.active(name, percentDone);
        }
        return new DownloadStatus(DownloadStatus.State.QUEUED, percentDone, name, null, null);
    }

    /**
     * Fill in {@code filename} or {@code metainfo}. Only the source's shape is
     * checked here; Transmission validates the content.
     */
    static void describeSource(String source, ObjectNode args) throws InvalidSourceException {
        if (source == null || source.isBlank()) {
            throw new InvalidSourceException("empty source");
        }
        String trimmed = source.strip();

        if (trimmed.startsWith("magnet:")) {
            if (!trimmed.startsWith("magnet:?") || !trimmed.contains("xt=urn:btih:")) {
                throw new InvalidSourceException("magnet link has no BitTorrent info hash: " + abbreviate(trimmed));
            }
            args.put("filename", trimmed);
            return;
        }
        if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
            args.put("filename", trimmed);
            return;
        }

        Path file;
        try {
            file = Path.of(trimmed);
        } catch (InvalidPathException e) {
            throw new InvalidSourceException("not a magnet link, URL or file path: " + abbreviate(trimmed));
        }
        if (!Files.isRegularFile(file)) {
            throw new InvalidSourceException("torrent file not found: " + trimmed);
        }
        try {
            args.put("metainfo", Base64.getEncoder().encodeToString(Files.readAllBytes(file)));
        } catch (IOException e) {
            throw new InvalidSourceException("cannot read torrent file " + trimmed + ": " + e.getMessage(), e);
        }
    }

    /**
     * Apply download directory and speed limits once per process. A failure is
     * retried on the next submit.
     */
    private void configureSession() throws GatewayException {
        if (sessionConfigured) {
            return;
        }
        ObjectNode args = client.mapper().createObjectNode();
        args.put("speed-limit-down-enabled", maxDownloadRate > 0);
        if (maxDownloadRate > 0) {
            args.put("speed-limit-down", maxDownloadRate);
        }
        args.put("speed-limit-up-enabled", maxUploadRate > 0);
        if (maxUploadRate > 0) {
            args.put("speed-limit-up", maxUploadRate);
        }

        requireSuccess("session-set", client.call("session-set", args));
        sessionConfigured = true;
        log.info("Transmission session configured: download limit {} KB/s, upload limit {} KB/s",
                maxDownloadRate, maxUploadRate);
    }

    private static void requireSuccess(String method, JsonNode response) throws FatalGatewayException {
        String result = response.path("result").asText();
        if (!"success".equals(result)) {
            throw new FatalGatewayException(method + " failed: " + result);
        }
    }

    private static String abbreviate(String source) {
        return source.length() > 60 ? source.substring(0, 57) + "..." : source;
    }
}
