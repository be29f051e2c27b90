package slidewriter.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.model.auth.AuthorizationState;
import slidewriter.core.port.out.AuthorizationStateRepository;

/**
 * In-memory implementation of authorization state storage.
 *
 * <p>This implementation is intended for development and testing only.
 * Pending attempts are lost on restart and not shared across instances.
 *
 * <p><strong>Warning:</strong> Do not use in production with multiple instances.
 */
public class InMemoryAuthorizationStateRepository implements AuthorizationStateRepository {

    private static final Logger LOG = Logger.getLogger(InMemoryAuthorizationStateRepository.class);

    private final ConcurrentMap<String, StateEntry> states = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemoryAuthorizationStateRepository() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "authorization-state-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpired, 1, 1, TimeUnit.MINUTES);
        LOG.info("Initialized in-memory authorization state repository");
    }

    @Override
    public Uni<Boolean> store(AuthorizationState state, Duration retention) {
        return Uni.createFrom().item(() -> {
            final var now = Instant.now();
            final var entry = new StateEntry(state, now.plus(retention));
            final var existing = states.compute(
                    state.stateToken(), (key, current) -> current == null || current.isGone(now) ? entry : current);
            final var stored = existing == entry;
            if (stored) {
                LOG.debugf("Stored authorization state: %s with retention: %s", state.stateToken(), retention);
            }
            return stored;
        });
    }

    @Override
    public Uni<Optional<AuthorizationState>> consume(String stateToken) {
        return Uni.createFrom().item(() -> {
            if (stateToken == null) {
                return Optional.<AuthorizationState>empty();
            }
            final var entry = states.remove(stateToken);
            if (entry == null || entry.isGone(Instant.now())) {
                LOG.debugf("No authorization state found for: %s", stateToken);
                return Optional.<AuthorizationState>empty();
            }

            LOG.debugf("Consumed authorization state: %s", stateToken);
            return Optional.of(entry.state());
        });
    }

    private void cleanupExpired() {
        final var now = Instant.now();
        final var before = states.size();

        states.entrySet().removeIf(entry -> entry.getValue().isGone(now));

        final var removed = before - states.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired authorization state entries", removed);
        }
    }

    /**
     * Shuts down the cleanup executor.
     */
    public void shutdown() {
        cleanupExecutor.shutdown();
        try {
            if (!cleanupExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                cleanupExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cleanupExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Get the current count of stored attempts (for testing and health).
     */
    public int getStateCount() {
        return states.size();
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        states.clear();
    }

    private record StateEntry(AuthorizationState state, Instant retainUntil) {
        boolean isGone(Instant now) {
            return !now.isBefore(retainUntil);
        }
    }
}
