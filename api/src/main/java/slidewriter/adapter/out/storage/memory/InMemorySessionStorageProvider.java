package slidewriter.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import slidewriter.core.port.out.SessionTokenRepository;
import slidewriter.spi.SessionStorageProvider;

/**
 * In-memory session storage provider. Development and testing only.
 */
@ApplicationScoped
public class InMemorySessionStorageProvider implements SessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(InMemorySessionStorageProvider.class);

    private final AtomicBoolean warningLogged = new AtomicBoolean(false);
    private volatile InMemorySessionTokenRepository repository;

    @Override
    public String name() {
        return "memory";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public synchronized SessionTokenRepository createRepository() {
        if (warningLogged.compareAndSet(false, true)) {
            LOG.warn("========================================================================");
            LOG.warn("  WARNING: Session storage is in-memory only!");
            LOG.warn("  Sessions are lost on restart and not shared across instances.");
            LOG.warn("========================================================================");
        }
        if (repository == null) {
            repository = new InMemorySessionTokenRepository();
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        return Optional.of(HealthCheckResponse.named("session-storage-memory")
                .up()
                .withData("type", "in-memory")
                .withData("sessions", repository != null ? repository.getSessionCount() : 0)
                .build());
    }

    @PreDestroy
    void shutdown() {
        if (repository != null) {
            repository.shutdown();
        }
    }
}
