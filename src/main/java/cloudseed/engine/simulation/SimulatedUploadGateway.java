package cloudseed.engine.simulation;

import cloudseed.engine.gateway.AuthRequiredException;
import cloudseed.engine.gateway.Credential;
import cloudseed.engine.gateway.FatalGatewayException;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.UploadGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * In-process stand-in for cloud storage. Records uploads instead of sending them.
 */
public class SimulatedUploadGateway implements UploadGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatedUploadGateway.class);

    private final Clock clock;
    private final List<String> uploads = new ArrayList<>();
    private volatile Credential credential;

    /**
     * @param authenticated start with a valid credential
     */
    public SimulatedUploadGateway(boolean authenticated) {
        this(authenticated, Clock.systemUTC());
    }

    public SimulatedUploadGateway(boolean authenticated, Clock clock) {
        this.clock = clock;
        this.credential = authenticated ? issue() : null;
    }

    @Override
    public Credential ensureAuthenticated() throws GatewayException {
        Credential current = credential;
        if (current == null) {
            throw new AuthRequiredException("not signed in to simulated storage, run 'cloudseed auth'");
        }
        if (current.isExpired(clock.instant())) {
            current = issue();
            credential = current;
            log.debug("Simulated credential refreshed");
        }
        return current;
    }

    @Override
    public Credential authenticate() {
        credential = issue();
        log.info("Signed in to simulated storage");
        return credential;
    }

    @Override
    public boolean supportsInteractiveAuth() {
        return true;
    }

    @Override
    public String upload(Path localPath, String remoteFolder) throws GatewayException {
        ensureAuthenticated();
        if (!Files.exists(localPath)) {
            throw new FatalGatewayException("local content missing: " + localPath);
        }
        String remotePath = remoteFolder.replaceAll("/+$", "") + "/" + localPath.getFileName();
        synchronized (uploads) {
            uploads.add(remotePath);
        }
        log.info("Simulated upload of {} to {}", localPath, remotePath);
        return remotePath;
    }

    /** Remote paths uploaded so far, in order. */
    public List<String> uploads() {
        synchronized (uploads) {
            return List.copyOf(uploads);
        }
    }

    public void signOut() {
        credential = null;
    }

    private Credential issue() {
        return new Credential("sim-" + UUID.randomUUID(), clock.instant().plus(Duration.ofHours(1)));
    }
}
