package cloudseed.onedrive;

import cloudseed.engine.gateway.AuthRequiredException;
import cloudseed.engine.gateway.GatewayException;
import cloudseed.engine.gateway.TransientNetworkException;
import com.microsoft.aad.msal4j.MsalClientException;
import com.microsoft.aad.msal4j.MsalServiceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.SocketTimeoutException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MsalTokenProviderTest {

    @TempDir
    Path dir;

    @Test
    void reservedScopesAreLeftToMsal() {
        assertEquals(Set.of("Files.ReadWrite", "Files.ReadWrite.All"), MsalTokenProvider.requestScopes(
                List.of("Files.ReadWrite", "Files.ReadWrite.All", "offline_access", "OpenId")));
    }

    @Test
    void missingClientIdNeedsAuthWithoutContactingLogin() {
        MsalTokenProvider provider = new MsalTokenProvider(null, "common", List.of("Files.ReadWrite"),
                new TokenStore(dir.resolve("token.json"), null));

        AuthRequiredException e = assertThrows(AuthRequiredException.class, () -> provider.acquireSilently(false));
        assertTrue(e.getMessage().contains("ONEDRIVE_CLIENT_ID"));
        assertThrows(AuthRequiredException.class, () -> provider.acquireByDeviceCode(s -> { }));
    }

    @Test
    void rejectedGrantNeedsAuth() {
        MsalServiceException rejected = new MsalServiceException("AADSTS70000: grant is expired", "invalid_grant");

        GatewayException e = MsalTokenProvider.classify("refresh", new ExecutionException(rejected));

        assertInstanceOf(AuthRequiredException.class, e);
        assertSame(rejected, e.getCause());
    }

    @Test
    void throttledOrFailingLoginIsTransient() {
        MsalServiceException throttled = mock(MsalServiceException.class);
        when(throttled.statusCode()).thenReturn(429);
        MsalServiceException unavailable = mock(MsalServiceException.class);
        when(unavailable.statusCode()).thenReturn(503);
        MsalServiceException badRequest = mock(MsalServiceException.class);
        when(badRequest.statusCode()).thenReturn(400);

        assertInstanceOf(TransientNetworkException.class, MsalTokenProvider.classify("refresh", throttled));
        assertInstanceOf(TransientNetworkException.class, MsalTokenProvider.classify("refresh", unavailable));
        assertInstanceOf(AuthRequiredException.class, MsalTokenProvider.classify("refresh", badRequest));
    }

    @Test
    void networkFailureIsTransient() {
        MsalClientException timeout = new MsalClientException(new SocketTimeoutException("connect timed out"));

        assertInstanceOf(TransientNetworkException.class,
                MsalTokenProvider.classify("sign-in", new ExecutionException(timeout)));
    }

    @Test
    void clientSideFailureNeedsAuth() {
        MsalClientException expired = new MsalClientException("device code expired", "code_expired");

        assertInstanceOf(AuthRequiredException.class, MsalTokenProvider.classify("sign-in", expired));
    }
}
