package cloudseed.onedrive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import cloudseed.engine.config.EngineConfig;
import cloudseed.engine.gateway.AuthExpiredException;
import cloudseed.engine.gateway.AuthRequiredException;
import cloudseed.engine.gateway.Credential;
import cloudseed.engine.gateway.FatalGatewayException;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.QuotaExceededException;
import cloudseed.engine.gateway.TransientNetworkException;
import cloudseed.engine.gateway.UploadGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Upload gateway for OneDrive through Microsoft Graph.
 *
 * Small files go up in one PUT, larger ones through an upload session in
 * fixed-size chunks. Remote items are replaced, so re-uploading after a crash
 * gives the same result.
 */
public class OneDriveUploadGateway implements UploadGateway {

    private static final Logger log = LoggerFactory.getLogger(OneDriveUploadGateway.class);

    static final long SIMPLE_UPLOAD_LIMIT = 4L * 1024 * 1024;
    static final int CHUNK_SIZE = 10 * 1024 * 1024;
    static final URI GRAPH_BASE = URI.create("https://graph.microsoft.com/v1.0");
    static final Duration EXPIRY_SKEW = Duration.ofMinutes(5);

    private final URI graphBase;
    private final TokenProvider tokens;
    private final boolean interactive;
    private final HttpClient http;
    private final Clock clock;
    private final ObjectMapper mapper = new ObjectMapper();
    private final long simpleUploadLimit;
    private final int chunkSize;

    private Consumer<String> prompt = System.out::println;
    private Credential credential;
    private boolean rejected;

    public OneDriveUploadGateway(EngineConfig config) {
        this(GRAPH_BASE,
                new MsalTokenProvider(config.onedriveClientId(), config.onedriveTenantId(), config.onedriveScopes(),
                        new TokenStore(config.tokenPath(), config.tokenSeed())),
                config.interactiveAuth(),
                HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(15))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                Clock.systemUTC(), SIMPLE_UPLOAD_LIMIT, CHUNK_SIZE);
    }

    OneDriveUploadGateway(URI graphBase, TokenProvider tokens, boolean interactive, HttpClient http, Clock clock,
            long simpleUploadLimit, int chunkSize) {
        this.graphBase = graphBase;
        this.tokens = tokens;
        this.interactive = interactive;
        this.http = http;
        this.clock = clock;
        this.simpleUploadLimit = simpleUploadLimit;
        this.chunkSize = chunkSize;
    }

    /**
     * Where device-code instructions are shown. Defaults to standard output.
     */
    public OneDriveUploadGateway withPrompt(Consumer<String> prompt) {
        this.prompt = prompt;
        return this;
    }

    @Override
    public synchronized Credential ensureAuthenticated() throws GatewayException {
        if (credential != null && !credential.isExpired(clock.instant().plus(EXPIRY_SKEW))) {
            return credential;
        }

        Optional<Credential> silent = tokens.acquireSilently(rejected);
        if (silent.isPresent()) {
            credential = silent.get();
            rejected = false;
            return credential;
        }
        credential = null;

        if (interactive) {
            return authenticate();
        }
        throw new AuthRequiredException("no valid OneDrive sign-in in " + tokens.cachePath()
                + "; run 'cloudseed auth' or provide ONEDRIVE_TOKEN");
    }

    @Override
    public synchronized Credential authenticate() throws GatewayException {
        credential = tokens.acquireByDeviceCode(prompt);
        rejected = false;
        log.info("OneDrive sign-in stored in {}", tokens.cachePath());
        return credential;
    }

    @Override
    public boolean supportsInteractiveAuth() {
        return interactive;
    }

    @Override
    public String upload(Path localPath, String remoteFolder) throws GatewayException {
        if (!Files.exists(localPath)) {
            throw new FatalGatewayException("local content missing: " + localPath);
        }
        String folder = normalizeFolder(remoteFolder);
        String rootName = localPath.getFileName().toString();

        if (Files.isDirectory(localPath)) {
            List<Path> files = listFiles(localPath);
            log.info("Uploading directory {} ({} files) to {}/{}", localPath, files.size(), folder, rootName);
            for (Path file : files) {
                String relative = localPath.relativize(file).toString().replace('\\', '/');
                uploadFile(file, folder + "/" + rootName + "/" + relative);
            }
        } else {
            uploadFile(localPath, folder + "/" + rootName);
        }
        return folder + "/" + rootName;
    }

    private void uploadFile(Path file, String remotePath) throws GatewayException {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new FatalGatewayException("cannot read " + file + ": " + e.getMessage(), e);
        }

        if (size <= simpleUploadLimit) {
            simpleUpload(file, remotePath);
        } else {
            chunkedUpload(file, remotePath, size);
        }
        log.debug("Uploaded {} ({} bytes) to {}", file, size, remotePath);
    }

    private void simpleUpload(Path file, String remotePath) throws GatewayException {
        HttpRequest.BodyPublisher body;
        try {
            body = HttpRequest.BodyPublishers.ofFile(file);
        } catch (IOException e) {
            throw new FatalGatewayException("cannot read " + file + ": " + e.getMessage(), e);
        }

        HttpRequest request = authorized(itemUri(remotePath, "content?@microsoft.graph.conflictBehavior=replace"))
                .header("Content-Type", "application/octet-stream")
                .PUT(body)
                .build();
        HttpResponse<String> response = send(request);
        if (response.statusCode() != 200 && response.statusCode() != 201) {
            throw failure(response.statusCode(), response.body());
        }
    }

    private void chunkedUpload(Path file, String remotePath, long size) throws GatewayException {
        String sessionBody = "{\"item\":{\"@microsoft.graph.conflictBehavior\":\"replace\"}}";
        HttpRequest create = authorized(itemUri(remotePath, "createUploadSession"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(sessionBody))
                .build();
        HttpResponse<String> created = send(create);
        if (created.statusCode() != 200) {
            throw failure(created.statusCode(), created.body());
        }

        URI uploadUrl;
        try {
            JsonNode session = mapper.readTree(created.body());
            uploadUrl = URI.create(session.path("uploadUrl").asText());
        } catch (IOException | IllegalArgumentException e) {
            throw new FatalGatewayException("upload session reply has no usable uploadUrl", e);
        }

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long offset = 0;
            while (offset < size) {
                int length = (int) Math.min(chunkSize, size - offset);
                ByteBuffer buffer = ByteBuffer.allocate(length);
                while (buffer.hasRemaining()) {
                    if (channel.read(buffer, offset + buffer.position()) < 0) {
                        throw new FatalGatewayException(file + " shrank during upload");
                    }
                }
                long end = offset + length - 1;

                // The upload URL is pre-authenticated; sending the bearer token is rejected
                HttpRequest chunk = HttpRequest.newBuilder(uploadUrl)
                        .timeout(Duration.ofMinutes(5))
                        .header("Content-Range", "bytes " + offset + "-" + end + "/" + size)
                        .PUT(HttpRequest.BodyPublishers.ofByteArray(buffer.array()))
                        .build();
                HttpResponse<String> response = send(chunk);
                int status = response.statusCode();
                if (status != 200 && status != 201 && status != 202) {
                    throw failure(status, response.body());
                }
                offset = end + 1;
                log.debug("Uploaded {}/{} bytes of {}", offset, size, file.getFileName());
            }
        } catch (IOException e) {
            throw new FatalGatewayException("cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Classify a failed response. A rejected token is dropped from memory and the
     * next attempt forces a refresh instead of reusing it.
     */
    private GatewayException failure(int status, String body) {
        GatewayException e = classify(status, body);
        if (e instanceof AuthExpiredException) {
            synchronized (this) {
                credential = null;
                rejected = true;
            }
        }
        return e;
    }

    /**
     * Map a Graph error response onto the gateway taxonomy.
     */
    static GatewayException classify(int status, String body) {
        String text = body != null ? body : "";
        String detail = "HTTP " + status + (text.isBlank() ? "" : ": " + abbreviate(text));

        if (status == 401) {
            return new AuthExpiredException("OneDrive rejected the access token (" + detail + ")");
        }
        if (status == 507 || text.contains("quotaLimitReached") || text.contains("insufficientStorage")) {
            return new QuotaExceededException("OneDrive storage quota exceeded (" + detail + ")");
        }
        if (status == 429 || status == 408 || status >= 500) {
            return new TransientNetworkException("OneDrive temporarily unavailable (" + detail + ")");
        }
        return new FatalGatewayException("OneDrive request failed (" + detail + ")");
    }

    private HttpRequest.Builder authorized(URI uri) throws GatewayException {
        Credential credential = ensureAuthenticated();
        return HttpRequest.newBuilder(uri)
                .timeout(Duration.ofMinutes(5))
                .header("Authorization", "Bearer " + credential.accessToken());
    }

    private URI itemUri(String remotePath, String action) {
        String encoded = Stream.of(remotePath.split("/"))
                .filter(segment -> !segment.isEmpty())
                .map(segment -> URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"))
                .collect(Collectors.joining("/"));
        return URI.create(graphBase + "/me/drive/root:/" + encoded + ":/" + action);
    }

    private HttpResponse<String> send(HttpRequest request) throws GatewayException {
        try {
            return http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientNetworkException("cannot reach OneDrive: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("interrupted while uploading to OneDrive", e);
        }
    }

    private static List<Path> listFiles(Path dir) throws GatewayException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            throw new FatalGatewayException("cannot list " + dir + ": " + e.getMessage(), e);
        }
    }

    static String normalizeFolder(String folder) {
        if (folder == null || folder.isBlank()) {
            return "";
        }
        String trimmed = folder.strip().replaceAll("/+$", "");
        return trimmed.startsWith("/") ? trimmed : "/" + trimmed;
    }

    private static String abbreviate(String text) {
        String oneLine = text.replaceAll("\\s+", " ");
        return oneLine.length() > 200 ? oneLine.substring(0, 197) + "..." : oneLine;
    }
}
