package cloudseed.engine.gateway;

import java.time.Instant;

/**
 * Access credential held by an upload gateway.
 *
 * @param accessToken bearer token
 * @param expiresAt   instant after which the token must be refreshed
 */
public record Credential(String accessToken, Instant expiresAt) {

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "Credential{expiresAt=" + expiresAt + "}";
    }
}
