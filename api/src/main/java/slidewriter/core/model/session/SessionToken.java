package slidewriter.core.model.session;

import java.time.Instant;

/**
 * Server-side record behind a session cookie.
 *
 * <p>Never mutated after creation. The access token is omitted from
 * {@link #toString()} so the record can be logged.
 *
 * @param sessionId   opaque identifier stored in the session cookie
 * @param accessToken provider access token used for Slides API calls
 * @param expiresAt   instant after which the session is unusable
 */
public record SessionToken(String sessionId, String accessToken, Instant expiresAt) {

    public SessionToken {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token cannot be null or blank");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("Expiry cannot be null");
        }
    }

    /**
     * A session is valid strictly before its expiry instant.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "SessionToken[sessionId=" + sessionId + ", expiresAt=" + expiresAt + "]";
    }
}
