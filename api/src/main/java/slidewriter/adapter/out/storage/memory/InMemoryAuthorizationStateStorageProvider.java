package slidewriter.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import slidewriter.core.port.out.AuthorizationStateRepository;
import slidewriter.spi.AuthorizationStateStorageProvider;

/**
 * In-memory authorization state storage provider.
 *
 * <p>Always available; used when Redis is not. Requires sticky sessions when
 * running multiple instances, since the callback must reach the instance that
 * served {@code /oauth/start}.
 */
@ApplicationScoped
public class InMemoryAuthorizationStateStorageProvider implements AuthorizationStateStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthorizationStateStorageProvider.class);
    private static final int PRIORITY = 0;

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemoryAuthorizationStateRepository repository;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized AuthorizationStateRepository createRepository() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: OAuth authorization state storage is in-memory only!");
            LOG.warn("  Sticky sessions are REQUIRED when running multiple instances.");
            LOG.warn("  Configure Redis or a custom storage provider for production.");
            LOG.warn("========================================================================");
        }

        if (repository == null) {
            repository = new InMemoryAuthorizationStateRepository();
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("oauth-state-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("pending", repository != null ? repository.getStateCount() : 0)
                .build());
    }

    @PreDestroy
    void shutdown() {
        if (repository != null) {
            repository.shutdown();
        }
    }
}
