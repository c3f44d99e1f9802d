package cloudseed.onedrive;

import com.microsoft.aad.msal4j.ITokenCacheAccessAspect;
import com.microsoft.aad.msal4j.ITokenCacheAccessContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * MSAL token cache persisted to a file. The file is replaced atomically so a
 * concurrent reader never sees a half-written cache.
 *
 * When the file does not exist, a seed (a serialized cache, typically
 * injected through an environment variable on a headless runner) is written
 * to it and used instead.
 */
public class TokenStore implements ITokenCacheAccessAspect {

    private static final Logger log = LoggerFactory.getLogger(TokenStore.class);

    private final Path path;
    private final String seed;

    public TokenStore(Path path, String seed) {
        this.path = path;
        this.seed = seed;
    }

    public Path path() {
        return path;
    }

    @Override
    public void beforeCacheAccess(ITokenCacheAccessContext context) {
        read().ifPresent(json -> context.tokenCache().deserialize(json));
    }

    @Override
    public void afterCacheAccess(ITokenCacheAccessContext context) {
        if (!context.hasCacheChanged()) {
            return;
        }
        try {
            write(context.tokenCache().serialize());
        } catch (IOException e) {
            // The signed-in session still works from memory; only the next process loses it
            log.error("Cannot write token cache {}: {}", path, e.getMessage());
        }
    }

    /**
     * @return the serialized cache, or empty if there is none or it cannot be read
     */
    Optional<String> read() {
        if (Files.exists(path)) {
            try {
                return Optional.of(Files.readString(path, StandardCharsets.UTF_8)).filter(s -> !s.isBlank());
            } catch (IOException e) {
                log.error("Cannot read token cache {}: {}", path, e.getMessage());
                return Optional.empty();
            }
        }

        if (seed != null && !seed.isBlank()) {
            try {
                write(seed);
                log.info("Token cache {} seeded from environment", path);
            } catch (IOException e) {
                log.error("Cannot write seeded token cache {}: {}", path, e.getMessage());
            }
            return Optional.of(seed);
        }
        return Optional.empty();
    }

    void write(String json) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(temp, json, StandardCharsets.UTF_8);
        try {
            Files.move(temp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Token cache saved to {}", path);
    }
}
