package cloudseed.onedrive;

import cloudseed.engine.gateway.Credential;
import cloudseed.engine.gateway.GatewayException;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Source of Microsoft Graph access tokens.
 */
interface TokenProvider {

    /**
     * A token from the cache, refreshed when needed.
     *
     * @param forceRefresh skip the cached access token, e.g. after Graph rejected it
     * @return empty when there is no signed-in account or it needs a new interactive sign-in
     */
    Optional<Credential> acquireSilently(boolean forceRefresh) throws GatewayException;

    /**
     * Device-code sign-in. Blocks until the operator completes it or the code expires.
     *
     * @param prompt receives the instructions to show the operator
     */
    Credential acquireByDeviceCode(Consumer<String> prompt) throws GatewayException;

    /** Where the token cache is kept, for operator messages. */
    Path cachePath();
}
