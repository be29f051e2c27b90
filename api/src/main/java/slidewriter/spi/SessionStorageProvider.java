package slidewriter.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import slidewriter.core.port.out.SessionTokenRepository;

/**
 * SPI for session token storage implementations.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>Selected by {@code slidewriter.session.storage.provider}, falling back to
 * the highest priority available provider.
 *
 * @see SessionTokenRepository
 */
public interface SessionStorageProvider {

    /**
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * @return Priority value (higher = more preferred)
     */
    int priority();

    /**
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the repository implementation. Entries must expire automatically
     * and inserts must be insert-if-absent.
     *
     * @return Session token repository instance
     */
    SessionTokenRepository createRepository();

    /**
     * @return Health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
