package slidewriter.core.service.session;

import java.time.Duration;
import java.time.Instant;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.config.SessionConfig;
import slidewriter.core.model.session.SessionLookup;
import slidewriter.core.model.session.SessionToken;
import slidewriter.core.port.out.SessionTokenRepository;

/**
 * Stores and resolves session tokens.
 *
 * <p>Tokens are written once and never updated. A lookup that finds an expired
 * token reports it as {@link SessionLookup.Expired} and removes it in the
 * background.
 */
@ApplicationScoped
public class SessionStore {

    private static final Logger LOG = Logger.getLogger(SessionStore.class);

    private final SessionStorageProviderRegistry storageRegistry;
    private final SessionIdGenerator idGenerator;
    private final SessionConfig config;

    public SessionStore(
            SessionStorageProviderRegistry storageRegistry, SessionIdGenerator idGenerator, SessionConfig config) {
        this.storageRegistry = storageRegistry;
        this.idGenerator = idGenerator;
        this.config = config;
    }

    /**
     * Create a session for an access token under a freshly generated ID.
     *
     * @param accessToken provider access token
     * @param ttl         session lifetime
     * @return the stored token
     */
    public Uni<SessionToken> create(String accessToken, Duration ttl) {
        return createWithRetry(accessToken, ttl, 0);
    }

    private Uni<SessionToken> createWithRetry(String accessToken, Duration ttl, int attempt) {
        int maxRetries = config.idGeneration().maxRetries();

        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new IllegalStateException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        final var token = new SessionToken(idGenerator.generate(), accessToken, Instant.now().plus(ttl));

        return put(token, ttl).flatMap(saved -> {
            if (saved) {
                LOG.debugf("Session created: %s (expires %s)", token.sessionId(), token.expiresAt());
                return Uni.createFrom().item(token);
            }

            LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return createWithRetry(accessToken, ttl, attempt + 1);
        });
    }

    /**
     * Store a token unless its session ID is taken.
     *
     * @param token token to store
     * @param ttl   backend retention
     * @return true if stored
     */
    public Uni<Boolean> put(SessionToken token, Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            return Uni.createFrom().failure(new IllegalArgumentException("Session TTL must be positive"));
        }
        return getRepository().saveIfAbsent(token, ttl);
    }

    /**
     * Resolve a session ID.
     *
     * @param sessionId session identifier, may be null
     * @return lookup outcome
     */
    public Uni<SessionLookup> get(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().item(new SessionLookup.NotFound(sessionId));
        }

        return getRepository().findById(sessionId).map(tokenOpt -> {
            if (tokenOpt.isEmpty()) {
                return new SessionLookup.NotFound(sessionId);
            }

            final var token = tokenOpt.get();
            if (token.isExpired(Instant.now())) {
                LOG.debugf("Session %s has expired", sessionId);
                getRepository()
                        .delete(sessionId)
                        .subscribe()
                        .with(
                                v -> LOG.debugf("Cleaned up expired session: %s", sessionId),
                                e -> LOG.warnf("Failed to clean up session: %s", e.getMessage()));
                return new SessionLookup.Expired(token);
            }

            return new SessionLookup.Found(token);
        });
    }

    /**
     * Delete a session.
     *
     * @param sessionId session identifier
     * @return Uni completing when deleted
     */
    public Uni<Void> invalidate(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            return Uni.createFrom().voidItem();
        }
        LOG.debugf("Invalidating session: %s", sessionId);
        return getRepository().delete(sessionId);
    }

    private SessionTokenRepository getRepository() {
        return storageRegistry.getRepository();
    }
}
