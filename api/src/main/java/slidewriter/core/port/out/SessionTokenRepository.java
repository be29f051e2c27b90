package slidewriter.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import slidewriter.core.model.session.SessionToken;

/**
 * Outbound port for session token storage.
 *
 * <p>Implementations may store sessions in Redis, in-memory, or custom backends
 * via {@link slidewriter.spi.SessionStorageProvider}. Tokens are never updated.
 */
public interface SessionTokenRepository {

    /**
     * Store a token only if its session ID does not already exist.
     *
     * <ul>
     *   <li>Redis: SET key value NX EX ttl</li>
     *   <li>In-Memory: ConcurrentHashMap.putIfAbsent()</li>
     * </ul>
     *
     * @param token token to store
     * @param ttl   how long the backend keeps the entry
     * @return true if saved, false if the ID already exists
     */
    Uni<Boolean> saveIfAbsent(SessionToken token, Duration ttl);

    /**
     * Retrieve a token by session ID.
     *
     * <p>Backends may return a token whose expiry has passed; callers check
     * {@link SessionToken#isExpired(java.time.Instant)}.
     *
     * @param sessionId session identifier
     * @return the token, or empty if not found
     */
    Uni<Optional<SessionToken>> findById(String sessionId);

    /**
     * Delete a token.
     *
     * @param sessionId session identifier
     * @return Uni completing when deleted
     */
    Uni<Void> delete(String sessionId);
}
