package slidewriter.spi;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;

import slidewriter.core.port.out.AuthorizationStateRepository;

/**
 * SPI for authorization state storage implementations.
 *
 * <p>Built-in providers:
 * <ul>
 *   <li>redis (priority: 100) - Redis-based storage</li>
 *   <li>memory (priority: 0) - In-memory storage (development only)</li>
 * </ul>
 *
 * <p>Provider selection order:
 * <ol>
 *   <li>Configured provider (slidewriter.oauth.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class DynamoAuthorizationStateStorageProvider implements AuthorizationStateStorageProvider {
 *
 *     @Override
 *     public String name() {
 *         return "dynamodb";
 *     }
 *
 *     @Override
 *     public int priority() {
 *         return 150;
 *     }
 *
 *     @Override
 *     public boolean isAvailable() {
 *         return dynamoClient != null;
 *     }
 *
 *     @Override
 *     public AuthorizationStateRepository createRepository() {
 *         return new DynamoAuthorizationStateRepository(dynamoClient);
 *     }
 * }
 * }</pre>
 *
 * @see AuthorizationStateRepository
 */
public interface AuthorizationStateStorageProvider {

    /**
     * Return the provider name used in {@code slidewriter.oauth.storage.provider}.
     *
     * @return Provider name (e.g., "redis", "memory")
     */
    String name();

    /**
     * Return the provider priority for automatic selection. Higher wins.
     *
     * @return Priority value
     */
    int priority();

    /**
     * Check if this provider is available and ready to use.
     *
     * <p>May be called multiple times and should return quickly.
     *
     * @return true if the provider can be used
     */
    boolean isAvailable();

    /**
     * Create the repository implementation.
     *
     * <p>The returned repository must expire entries automatically and consume
     * them atomically.
     *
     * @return Authorization state repository instance
     */
    AuthorizationStateRepository createRepository();

    /**
     * Report the health of this storage backend.
     *
     * @return Health check response, or empty if not supported
     */
    default Optional<HealthCheckResponse> healthCheck() {
        return Optional.empty();
    }
}
