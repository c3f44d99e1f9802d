package cloudseed.onedrive;

import cloudseed.engine.gateway.AuthExpiredException;
import cloudseed.engine.gateway.AuthRequiredException;
import cloudseed.engine.gateway.Credential;
import cloudseed.engine.gateway.FatalGatewayException;
import cloudseed.engine.gateway.QuotaExceededException;
import cloudseed.engine.gateway.TransientNetworkException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests the OneDrive gateway against a stub serving Graph, with sign-in
 * behind a mocked token provider.
 */
@ExtendWith(MockitoExtension.class)
class OneDriveUploadGatewayTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    /** One request as seen by the stub. */
    record Recorded(String method, String path, String query, String authorization, String contentRange,
            byte[] body) {

        String bodyText() {
            return new String(body, StandardCharsets.UTF_8);
        }
    }

    /** Canned reply. */
    record Reply(int status, String body) {
    }

    @TempDir
    Path dir;

    private HttpServer server;
    private String base;
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final Map<String, Deque<Reply>> replies = new ConcurrentHashMap<>();

    @Mock
    private TokenProvider tokens;

    @BeforeEach
    void startStub() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopStub() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        byte[] body = exchange.getRequestBody().readAllBytes();
        String path = exchange.getRequestURI().getRawPath();
        requests.add(new Recorded(exchange.getRequestMethod(), path, exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders().getFirst("Authorization"),
                exchange.getRequestHeaders().getFirst("Content-Range"), body));

        Reply reply = replyFor(path);
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(reply.status(), bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    /** The first queued reply whose key is a prefix of the path; the last one repeats. */
    private Reply replyFor(String path) {
        for (Map.Entry<String, Deque<Reply>> entry : replies.entrySet()) {
            if (path.startsWith(entry.getKey())) {
                Deque<Reply> queue = entry.getValue();
                return queue.size() > 1 ? queue.poll() : queue.peek();
            }
        }
        return new Reply(404, "{\"error\":{\"code\":\"itemNotFound\"}}");
    }

    private void reply(String pathPrefix, Reply... sequence) {
        replies.put(pathPrefix, new ConcurrentLinkedDeque<>(List.of(sequence)));
    }

    private OneDriveUploadGateway gateway(boolean interactive, long simpleLimit, int chunkSize) {
        HttpClient http = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
        return new OneDriveUploadGateway(URI.create(base + "/graph"), tokens, interactive, http, CLOCK,
                simpleLimit, chunkSize);
    }

    private void signedIn(String access, long expiresInSeconds) throws Exception {
        when(tokens.acquireSilently(false)).thenReturn(Optional.of(credential(access, expiresInSeconds)));
    }

    private static Credential credential(String access, long expiresInSeconds) {
        return new Credential(access, NOW.plusSeconds(expiresInSeconds));
    }

    private List<Recorded> requestsTo(String prefix) {
        List<Recorded> matching = new ArrayList<>();
        for (Recorded r : requests) {
            if (r.path().startsWith(prefix)) {
                matching.add(r);
            }
        }
        return matching;
    }

    @Test
    @DisplayName("Small file goes up in one PUT that replaces the remote item")
    void simpleUpload() throws Exception {
        signedIn("tok", 3600);
        reply("/graph/", new Reply(201, "{\"id\":\"item-1\"}"));
        Path file = Files.writeString(dir.resolve("my file.txt"), "hello world");

        String remote = gateway(false, 64, 10).upload(file, "BTDownloads/");

        assertEquals("/BTDownloads/my file.txt", remote);
        Recorded put = requestsTo("/graph/").get(0);
        assertEquals("PUT", put.method());
        assertEquals("/graph/me/drive/root:/BTDownloads/my%20file.txt:/content", put.path());
        assertEquals("@microsoft.graph.conflictBehavior=replace", put.query());
        assertEquals("Bearer tok", put.authorization());
        assertEquals("hello world", put.bodyText());
    }

    @Test
    @DisplayName("Large file goes through an upload session in fixed-size chunks")
    void chunkedUpload() throws Exception {
        signedIn("tok", 3600);
        reply("/graph/", new Reply(200, "{\"uploadUrl\":\"" + base + "/upload/session-1\"}"));
        reply("/upload/", new Reply(202, "{}"), new Reply(202, "{}"), new Reply(201, "{\"id\":\"item-2\"}"));
        byte[] content = "0123456789abcdefghijKLMNO".getBytes(StandardCharsets.UTF_8);
        Path file = Files.write(dir.resolve("big.bin"), content);

        gateway(false, 16, 10).upload(file, "/BTDownloads");

        Recorded create = requestsTo("/graph/").get(0);
        assertEquals("POST", create.method());
        assertEquals("/graph/me/drive/root:/BTDownloads/big.bin:/createUploadSession", create.path());
        assertTrue(create.bodyText().contains("replace"));

        List<Recorded> chunks = requestsTo("/upload/");
        assertEquals(3, chunks.size());
        assertEquals("bytes 0-9/25", chunks.get(0).contentRange());
        assertEquals("bytes 10-19/25", chunks.get(1).contentRange());
        assertEquals("bytes 20-24/25", chunks.get(2).contentRange());
        assertNull(chunks.get(0).authorization());

        ByteArrayOutputStream joined = new ByteArrayOutputStream();
        for (Recorded chunk : chunks) {
            joined.write(chunk.body());
        }
        assertArrayEquals(content, joined.toByteArray());
    }

    @Test
    void directoryIsUploadedFileByFile() throws Exception {
        signedIn("tok", 3600);
        reply("/graph/", new Reply(201, "{}"));
        Path album = Files.createDirectories(dir.resolve("album"));
        Files.writeString(album.resolve("a.txt"), "a");
        Files.createDirectories(album.resolve("sub"));
        Files.writeString(album.resolve("sub").resolve("b.txt"), "b");

        String remote = gateway(false, 64, 10).upload(album, "/BTDownloads");

        assertEquals("/BTDownloads/album", remote);
        List<String> paths = requestsTo("/graph/").stream().map(Recorded::path).toList();
        assertEquals(List.of(
                "/graph/me/drive/root:/BTDownloads/album/a.txt:/content",
                "/graph/me/drive/root:/BTDownloads/album/sub/b.txt:/content"), paths);
    }

    @Test
    void freshTokenIsReusedWithoutAskingAgain() throws Exception {
        signedIn("tok", 3600);
        OneDriveUploadGateway gateway = gateway(false, 64, 10);

        assertEquals("tok", gateway.ensureAuthenticated().accessToken());
        assertEquals("tok", gateway.ensureAuthenticated().accessToken());

        verify(tokens, times(1)).acquireSilently(false);
    }

    @Test
    void tokenCloseToExpiryIsAcquiredAgain() throws Exception {
        when(tokens.acquireSilently(false)).thenReturn(
                Optional.of(credential("old", 60)),
                Optional.of(credential("new", 3600)));
        OneDriveUploadGateway gateway = gateway(false, 64, 10);

        assertEquals("old", gateway.ensureAuthenticated().accessToken());
        assertEquals("new", gateway.ensureAuthenticated().accessToken());
    }

    @Test
    void noSignInAndHeadlessNeedsAuth() throws Exception {
        when(tokens.acquireSilently(false)).thenReturn(Optional.empty());
        when(tokens.cachePath()).thenReturn(dir.resolve("token.json"));

        AuthRequiredException e = assertThrows(AuthRequiredException.class,
                () -> gateway(false, 64, 10).ensureAuthenticated());

        assertTrue(e.getMessage().contains("cloudseed auth"));
        verify(tokens, never()).acquireByDeviceCode(any());
        assertTrue(requests.isEmpty());
    }

    @Test
    void failedSilentAcquisitionPropagates() throws Exception {
        when(tokens.acquireSilently(false)).thenThrow(new TransientNetworkException("login unreachable"));

        assertThrows(TransientNetworkException.class, () -> gateway(true, 64, 10).ensureAuthenticated());
        verify(tokens, never()).acquireByDeviceCode(any());
    }

    @Test
    @DisplayName("Interactive gateway falls back to the device code flow and shows its prompt")
    void deviceCodeFlow() throws Exception {
        when(tokens.acquireSilently(false)).thenReturn(Optional.empty());
        when(tokens.cachePath()).thenReturn(dir.resolve("token.json"));
        when(tokens.acquireByDeviceCode(any())).thenAnswer(invocation -> {
            Consumer<String> prompt = invocation.getArgument(0);
            prompt.accept("Enter ABCD at https://microsoft.com/devicelogin");
            return credential("fresh", 3600);
        });
        List<String> prompts = new ArrayList<>();

        OneDriveUploadGateway gateway = gateway(true, 64, 10).withPrompt(prompts::add);
        Credential credential = gateway.ensureAuthenticated();

        assertEquals("fresh", credential.accessToken());
        assertEquals(List.of("Enter ABCD at https://microsoft.com/devicelogin"), prompts);
        assertTrue(gateway.supportsInteractiveAuth());
    }

    @Test
    void deniedDeviceCodeNeedsAuth() throws Exception {
        when(tokens.acquireByDeviceCode(any())).thenThrow(new AuthRequiredException("authorization_declined"));

        assertThrows(AuthRequiredException.class, () -> gateway(true, 64, 10).withPrompt(s -> { }).authenticate());
    }

    @Test
    void rejectedAccessTokenForcesRefreshNextTime() throws Exception {
        signedIn("revoked", 3600);
        when(tokens.acquireSilently(true)).thenReturn(Optional.of(credential("renewed", 3600)));
        reply("/graph/", new Reply(401, "{\"error\":{\"code\":\"InvalidAuthenticationToken\"}}"));
        Path file = Files.writeString(dir.resolve("a.txt"), "a");
        OneDriveUploadGateway gateway = gateway(false, 64, 10);

        assertThrows(AuthExpiredException.class, () -> gateway.upload(file, "/BTDownloads"));

        assertEquals("renewed", gateway.ensureAuthenticated().accessToken());
        verify(tokens).acquireSilently(true);
    }

    @Test
    void quotaExceededOnUpload() throws Exception {
        signedIn("tok", 3600);
        reply("/graph/", new Reply(507, "{\"error\":{\"code\":\"quotaLimitReached\"}}"));
        Path file = Files.writeString(dir.resolve("a.txt"), "a");

        assertThrows(QuotaExceededException.class, () -> gateway(false, 64, 10).upload(file, "/BTDownloads"));
    }

    @Test
    void missingLocalContentIsFatal() {
        assertThrows(FatalGatewayException.class,
                () -> gateway(false, 64, 10).upload(dir.resolve("gone"), "/BTDownloads"));
    }

    @Test
    void errorClassification() {
        assertInstanceOf(AuthExpiredException.class, OneDriveUploadGateway.classify(401, ""));
        assertInstanceOf(QuotaExceededException.class, OneDriveUploadGateway.classify(507, null));
        assertInstanceOf(QuotaExceededException.class,
                OneDriveUploadGateway.classify(403, "{\"error\":{\"code\":\"quotaLimitReached\"}}"));
        assertInstanceOf(TransientNetworkException.class, OneDriveUploadGateway.classify(429, "slow down"));
        assertInstanceOf(TransientNetworkException.class, OneDriveUploadGateway.classify(503, ""));
        assertInstanceOf(TransientNetworkException.class, OneDriveUploadGateway.classify(408, ""));
        assertInstanceOf(FatalGatewayException.class, OneDriveUploadGateway.classify(400, "bad request"));
        assertInstanceOf(FatalGatewayException.class, OneDriveUploadGateway.classify(403, "accessDenied"));
    }

    @Test
    void folderNormalization() {
        assertEquals("/BTDownloads", OneDriveUploadGateway.normalizeFolder("BTDownloads//"));
        assertEquals("/a/b", OneDriveUploadGateway.normalizeFolder(" /a/b "));
        assertEquals("", OneDriveUploadGateway.normalizeFolder(""));
    }
}
