package cloudseed.torrent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import cloudseed.engine.gateway.FatalGatewayException;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

/**
 * Minimal Transmission JSON-RPC client.
 *
 * Transmission answers the first request of a session with HTTP 409 and an
 * {@code X-Transmission-Session-Id} header; the request is repeated once with
 * that id. The id is cached for later calls and refreshed whenever the daemon
 * rotates it.
 */
public class TransmissionClient {

    private static final Logger log = LoggerFactory.getLogger(TransmissionClient.class);

    static final String SESSION_HEADER = "X-Transmission-Session-Id";
    static final String RPC_PATH = "/transmission/rpc";

    private final URI endpoint;
    private final String authorization;
    private final HttpClient http;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Duration requestTimeout = Duration.ofSeconds(30);

    private volatile String sessionId;

    public TransmissionClient(String host, int port, String username, String password) {
        this(URI.create("http://" + host + ":" + port + RPC_PATH), username, password,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    TransmissionClient(URI endpoint, String username, String password, HttpClient http) {
        this.endpoint = endpoint;
        this.http = http;
        if (username != null && !username.isBlank()) {
            String pair = username + ":" + (password != null ? password : "");
            this.authorization = "Basic " + Base64.getEncoder().encodeToString(pair.getBytes(StandardCharsets.UTF_8));
        } else {
            this.authorization = null;
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Invoke an RPC method.
     *
     * @return the whole response document; callers check {@code result}
     * @throws TransientNetworkException on connection failure, timeout or 5xx
     * @throws FatalGatewayException     on rejected credentials or an unexpected reply
     */
    public JsonNode call(String method, ObjectNode arguments) throws GatewayException {
        ObjectNode body = mapper.createObjectNode();
        body.put("method", method);
        body.set("arguments", arguments != null ? arguments : mapper.createObjectNode());
        String json = body.toString();

        HttpResponse<String> response = send(json);
        if (response.statusCode() == 409) {
            sessionId = response.headers().firstValue(SESSION_HEADER).orElse(null);
            log.debug("Transmission session id renewed");
            response = send(json);
        }

        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new FatalGatewayException("Transmission rejected the configured credentials (HTTP " + status + ")");
        }
        if (status == 409) {
            throw new TransientNetworkException("Transmission session handshake failed");
        }
        if (status >= 500) {
            throw new TransientNetworkException("Transmission returned HTTP " + status);
        }
        if (status != 200) {
            throw new FatalGatewayException("Transmission returned HTTP " + status + " for " + method);
        }

        try {
            JsonNode root = mapper.readTree(response.body());
            if (!root.has("result")) {
                throw new FatalGatewayException("Transmission reply to " + method + " has no result");
            }
            return root;
        } catch (IOException e) {
            throw new FatalGatewayException("Transmission reply to " + method + " is not JSON", e);
        }
    }

    private HttpResponse<String> send(String json) throws GatewayException {
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json));
        if (sessionId != null) {
            request.header(SESSION_HEADER, sessionId);
        }
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        try {
            return http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientNetworkException("cannot reach Transmission at " + endpoint + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("interrupted while calling Transmission", e);
        }
    }
}
