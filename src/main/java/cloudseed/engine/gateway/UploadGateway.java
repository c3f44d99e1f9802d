package cloudseed.engine.gateway;

import java.nio.file.Path;

/**
 * Cloud-storage client that needs an authenticated credential.
 *
 * Whether an interactive (device-code) flow may be started is a capability of
 * the gateway instance, not something sniffed from the environment. A
 * headless gateway only works with a credential supplied up front.
 */
public interface UploadGateway {

    /**
     * Return a usable credential, refreshing it silently if possible.
     * Starts the interactive flow only when {@link #supportsInteractiveAuth()}.
     *
     * @throws AuthRequiredException if no credential can be obtained
     */
    Credential ensureAuthenticated() throws GatewayException;

    /**
     * Run the operator-facing authentication flow regardless of cached state.
     *
     * @throws AuthRequiredException if the gateway cannot run an interactive flow
     */
    Credential authenticate() throws GatewayException;

    /** True if this gateway may block on an operator completing a device-code flow. */
    boolean supportsInteractiveAuth();

    /**
     * Upload a file or a directory tree.
     *
     * @param localPath    completed content
     * @param remoteFolder destination folder in cloud storage
     * @return remote path of the uploaded item
     */
    String upload(Path localPath, String remoteFolder) throws GatewayException;
}
