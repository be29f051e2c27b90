package slidewriter.core.model.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * A pending authorization attempt, keyed by its state token.
 *
 * <p>Created when the user starts signing in and consumed exactly once when the
 * provider redirects back.
 *
 * @param stateToken   random anti-forgery token sent to the provider as {@code state}
 * @param codeVerifier PKCE verifier matching the challenge sent to the provider
 * @param createdAt    when the attempt was started
 */
public record AuthorizationState(String stateToken, String codeVerifier, Instant createdAt) {

    public AuthorizationState {
        if (stateToken == null || stateToken.isBlank()) {
            throw new IllegalArgumentException("State token cannot be null or blank");
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new IllegalArgumentException("Code verifier cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("Created-at timestamp cannot be null");
        }
    }

    /**
     * Whether this attempt is older than {@code ttl} at {@code now}.
     */
    public boolean isExpired(Instant now, Duration ttl) {
        return !now.isBefore(createdAt.plus(ttl));
    }

    @Override
    public String toString() {
        return "AuthorizationState[stateToken=" + stateToken + ", createdAt=" + createdAt + "]";
    }
}
