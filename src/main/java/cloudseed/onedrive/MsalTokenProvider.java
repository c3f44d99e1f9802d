package cloudseed.onedrive;

import cloudseed.engine.gateway.AuthRequiredException;
import cloudseed.engine.gateway.Credential;
import cloudseed.engine.gateway.FatalGatewayException;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.TransientNetworkException;
import com.microsoft.aad.msal4j.DeviceCodeFlowParameters;
import com.microsoft.aad.msal4j.IAccount;
import com.microsoft.aad.msal4j.IAuthenticationResult;
import com.microsoft.aad.msal4j.MsalInteractionRequiredException;
import com.microsoft.aad.msal4j.MsalServiceException;
import com.microsoft.aad.msal4j.PublicClientApplication;
import com.microsoft.aad.msal4j.SilentParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.MalformedURLException;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Token provider backed by MSAL as a public client. The token cache lives in
 * a {@link TokenStore} file.
 */
class MsalTokenProvider implements TokenProvider {

    private static final Logger log = LoggerFactory.getLogger(MsalTokenProvider.class);

    static final String LOGIN_BASE = "https://login.microsoftonline.com/";

    // MSAL requests these itself
    private static final Set<String> RESERVED_SCOPES = Set.of("openid", "profile", "offline_access");

    private final String clientId;
    private final String authority;
    private final Set<String> scopes;
    private final TokenStore tokenStore;

    private PublicClientApplication app;

    MsalTokenProvider(String clientId, String tenantId, List<String> scopes, TokenStore tokenStore) {
        this.clientId = clientId;
        this.authority = LOGIN_BASE + tenantId + "/";
        this.scopes = requestScopes(scopes);
        this.tokenStore = tokenStore;
    }

    @Override
    public Optional<Credential> acquireSilently(boolean forceRefresh) throws GatewayException {
        PublicClientApplication client = app();
        try {
            Set<IAccount> accounts = client.getAccounts().get();
            if (accounts.isEmpty()) {
                return Optional.empty();
            }
            SilentParameters parameters = SilentParameters.builder(scopes, accounts.iterator().next())
                    .forceRefresh(forceRefresh)
                    .build();
            return Optional.of(toCredential(client.acquireTokenSilently(parameters).get()));
        } catch (MalformedURLException e) {
            throw new FatalGatewayException("invalid OneDrive authority " + authority, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("interrupted while refreshing the OneDrive token", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MsalInteractionRequiredException) {
                log.warn("Cached OneDrive sign-in can no longer be refreshed: {}", e.getCause().getMessage());
                return Optional.empty();
            }
            throw classify("OneDrive token refresh failed", e);
        }
    }

    @Override
    public Credential acquireByDeviceCode(Consumer<String> prompt) throws GatewayException {
        DeviceCodeFlowParameters parameters = DeviceCodeFlowParameters
                .builder(scopes, deviceCode -> prompt.accept(deviceCode.message()))
                .build();
        try {
            return toCredential(app().acquireToken(parameters).get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthRequiredException("OneDrive sign-in interrupted", e);
        } catch (ExecutionException e) {
            throw classify("OneDrive sign-in failed", e);
        }
    }

    @Override
    public Path cachePath() {
        return tokenStore.path();
    }

    private synchronized PublicClientApplication app() throws GatewayException {
        if (app == null) {
            if (clientId == null || clientId.isBlank()) {
                throw new AuthRequiredException("ONEDRIVE_CLIENT_ID is not configured");
            }
            try {
                app = PublicClientApplication.builder(clientId)
                        .authority(authority)
                        .setTokenCacheAccessAspect(tokenStore)
                        .build();
            } catch (MalformedURLException e) {
                throw new FatalGatewayException("invalid OneDrive authority " + authority, e);
            }
        }
        return app;
    }

    /**
     * Map an MSAL failure onto the gateway taxonomy: the network, throttling and
     * server errors are worth retrying, anything else needs a new sign-in.
     */
    static GatewayException classify(String context, Throwable failure) {
        Throwable cause = failure;
        if ((cause instanceof ExecutionException || cause instanceof CompletionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String detail = context + ": " + cause.getMessage();

        if (cause instanceof MsalServiceException && !(cause instanceof MsalInteractionRequiredException)) {
            Integer status = ((MsalServiceException) cause).statusCode();
            if (status != null && (status == 429 || status >= 500)) {
                return new TransientNetworkException(detail + " (HTTP " + status + ")", cause);
            }
        }
        if (hasNetworkCause(cause)) {
            return new TransientNetworkException(detail, cause);
        }
        return new AuthRequiredException(detail, cause);
    }

    private static boolean hasNetworkCause(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof IOException || t instanceof TimeoutException) {
                return true;
            }
        }
        return false;
    }

    static Set<String> requestScopes(List<String> configured) {
        Set<String> result = new LinkedHashSet<>();
        for (String scope : configured) {
            if (!RESERVED_SCOPES.contains(scope.toLowerCase(Locale.ROOT))) {
                result.add(scope);
            }
        }
        return result;
    }

    private static Credential toCredential(IAuthenticationResult result) {
        return new Credential(result.accessToken(), result.expiresOnDate().toInstant());
    }
}
