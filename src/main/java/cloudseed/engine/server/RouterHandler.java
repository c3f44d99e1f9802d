package cloudseed.engine.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import cloudseed.engine.api.Controller;
import cloudseed.engine.api.Controller.ControllerResponse;
import cloudseed.engine.config.EngineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only /api/v1/* is served; everything else is 404. When an API key is
 * configured, every request other than GET must carry it in
 * {@value #API_KEY_HEADER}.
 *
 * This handler is @Sharable because it has no per-channel state.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .findAndRegisterModules();

    public static final String API_KEY_HEADER = "X-Cloudseed-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final EngineConfig config;

    public RouterHandler(EngineConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req)) {
                log.warn("Auth failed for {} {}", method, path);
                write(ctx, ControllerResponse.forbidden("forbidden"));
                return;
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    write(ctx, controller.handle(req, path));
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            write(ctx, ControllerResponse.notFound("not found"));

        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            write(ctx, ControllerResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            log.error("Handler error: {} {}", method, path, e);
            write(ctx, ControllerResponse.error(e.toString()));
        }
    }

    /**
     * Reads are open; mutations need the key when one is configured.
     */
    private boolean checkAuth(FullHttpRequest req) {
        if (!config.hasApiKey()) {
            return true;
        }
        if (req.method().equals(HttpMethod.GET)) {
            return true;
        }
        return config.apiKey().equals(req.headers().get(API_KEY_HEADER));
    }

    private void write(ChannelHandlerContext ctx, ControllerResponse response) {
        String body = response.body() != null ? response.body() : "";
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        FullHttpResponse httpResponse = new DefaultFullHttpResponse(HTTP_1_1, response.status(),
                Unpooled.wrappedBuffer(bytes));
        httpResponse.headers().set(CONTENT_TYPE, response.contentType() + "; charset=utf-8");
        httpResponse.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        ctx.writeAndFlush(httpResponse);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        ctx.close();
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
