package cloudseed.engine.simulation;

import cloudseed.engine.gateway.DownloadGateway;
import cloudseed.engine.gateway.DownloadStatus;
import cloudseed.engine.gateway.FatalGatewayException;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.InvalidSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process stand-in for a torrent client.
 * Every status poll advances a transfer by a fixed step; on completion a small
 * file is written to the download directory so the upload side has real content.
 *
 * Transfers live in memory. An unknown handle of the simulated form is adopted
 * as a fresh transfer, so a restarted process picks up where records say it was.
 */
public class SimulatedDownloadGateway implements DownloadGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedDownloadGateway.class);

    static final String HANDLE_PREFIX = "sim-";

    private final Path downloadDir;
    private final double stepPerPoll;
    private final Map<String, Transfer> transfers = new ConcurrentHashMap<>();

    public SimulatedDownloadGateway(Path downloadDir) {
        this(downloadDir, 0.25);
    }

    /**
     * @param downloadDir where completed content is written
     * @param stepPerPoll progress added per status call, in (0,1]
     */
    public SimulatedDownloadGateway(Path downloadDir, double stepPerPoll) {
        if (stepPerPoll <= 0 || stepPerPoll > 1) {
            throw new IllegalArgumentException("stepPerPoll must be in (0,1]: " + stepPerPoll);
        }
        this.downloadDir = downloadDir;
        this.stepPerPoll = stepPerPoll;
    }

    @Override
    public String submit(String source) throws GatewayException {
        String name = nameOf(source);
        String handle = HANDLE_PREFIX + digest(source);
        transfers.putIfAbsent(handle, new Transfer(name));
        log.info("Simulated transfer {} started for {}", handle, name);
        return handle;
    }

    @Override
    public DownloadStatus status(String handle) throws GatewayException {
        Transfer transfer = transfers.get(handle);
        if (transfer == null) {
            if (handle == null || !handle.startsWith(HANDLE_PREFIX)) {
                throw new FatalGatewayException("unknown transfer: " + handle);
            }
            transfer = transfers.computeIfAbsent(handle, h -> new Transfer(h));
            log.info("Adopted simulated transfer {} after restart", handle);
        }

        synchronized (transfer) {
            if (transfer.progress < 1.0) {
                transfer.progress = Math.min(1.0, transfer.progress + stepPerPoll);
            }
            if (transfer.progress < 1.0) {
                return DownloadStatus.active(transfer.name, transfer.progress);
            }
            if (transfer.content == null) {
                transfer.content = writeContent(transfer.name);
            }
            return DownloadStatus.complete(transfer.name, transfer.content.toString());
        }
    }

    @Override
    public void cancel(String handle, boolean purgeFiles) throws GatewayException {
        Transfer transfer = transfers.remove(handle);
        if (transfer == null) {
            log.debug("Cancel of unknown simulated transfer {}", handle);
            return;
        }
        if (purgeFiles && transfer.content != null) {
            try {
                Files.deleteIfExists(transfer.content);
            } catch (IOException e) {
                throw new FatalGatewayException("could not delete " + transfer.content, e);
            }
        }
        log.info("Simulated transfer {} cancelled (purgeFiles={})", handle, purgeFiles);
    }

    public int activeTransfers() {
        return transfers.size();
    }

    private Path writeContent(String name) throws GatewayException {
        Path file = downloadDir.resolve(name);
        try {
            Files.createDirectories(downloadDir);
            Files.writeString(file, "simulated content of " + name + "\n");
            return file;
        } catch (IOException e) {
            throw new FatalGatewayException("could not write simulated content to " + file, e);
        }
    }

    /**
     * Display name from a magnet {@code dn} parameter, a torrent file name or a URL.
     */
    static String nameOf(String source) throws InvalidSourceException {
        if (source == null || source.isBlank()) {
            throw new InvalidSourceException("empty source");
        }
        if (source.startsWith("magnet:?")) {
            if (!source.contains("xt=urn:btih:")) {
                throw new InvalidSourceException("magnet link has no info hash: " + source);
            }
            for (String param : source.substring("magnet:?".length()).split("&")) {
                if (param.startsWith("dn=")) {
                    return sanitize(URLDecoder.decode(param.substring(3), StandardCharsets.UTF_8));
                }
            }
            return "magnet-" + digest(source);
        }
        if (source.endsWith(".torrent")) {
            String fileName = source.substring(source.lastIndexOf('/') + 1);
            return sanitize(fileName.substring(0, fileName.length() - ".torrent".length()));
        }
        throw new InvalidSourceException("not a magnet link or .torrent source: " + source);
    }

    private static String sanitize(String name) {
        String cleaned = name.replaceAll("[^A-Za-z0-9._ -]", "_").strip();
        return cleaned.isEmpty() ? "download" : cleaned;
    }

    private static String digest(String source) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-1").digest(source.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 6);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }

    private static final class Transfer {
        private final String name;
        private double progress;
        private Path content;

        private Transfer(String name) {
            this.name = name;
        }
    }
}
