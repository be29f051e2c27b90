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

import slidewriter.core.model.session.SessionToken;
import slidewriter.core.port.out.SessionTokenRepository;

/**
 * In-memory implementation of SessionTokenRepository.
 *
 * <p>This implementation is intended for development and testing only.
 * Sessions are lost on restart and not shared across instances.
 */
public class InMemorySessionTokenRepository implements SessionTokenRepository {

    private static final Logger LOG = Logger.getLogger(InMemorySessionTokenRepository.class);

    private final ConcurrentMap<String, SessionEntry> sessions = new ConcurrentHashMap<>();
    private final ScheduledExecutorService cleanupExecutor;

    public InMemorySessionTokenRepository() {
        this.cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-cleanup");
            t.setDaemon(true);
            return t;
        });

        cleanupExecutor.scheduleAtFixedRate(this::cleanupExpiredSessions, 1, 1, TimeUnit.MINUTES);
    }

    @Override
    public Uni<Boolean> saveIfAbsent(SessionToken token, Duration ttl) {
        return Uni.createFrom().item(() -> {
            final var now = Instant.now();
            final var entry = new SessionEntry(token, now.plus(ttl));
            final var existing = sessions.compute(
                    token.sessionId(), (key, current) -> current == null || current.isGone(now) ? entry : current);
            if (existing == entry) {
                return true;
            }
            LOG.debugf("Session ID collision detected: %s", token.sessionId());
            return false;
        });
    }

    @Override
    public Uni<Optional<SessionToken>> findById(String sessionId) {
        return Uni.createFrom().item(() -> {
            final var entry = sessions.get(sessionId);
            if (entry == null || entry.isGone(Instant.now())) {
                return Optional.<SessionToken>empty();
            }
            return Optional.of(entry.token());
        });
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        return Uni.createFrom().item(() -> {
            sessions.remove(sessionId);
            return null;
        });
    }

    private void cleanupExpiredSessions() {
        final var now = Instant.now();
        int before = sessions.size();
        sessions.entrySet().removeIf(e -> e.getValue().isGone(now));
        int removed = before - sessions.size();
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired sessions", removed);
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
     * Get the current count of stored sessions (for testing and health).
     */
    public int getSessionCount() {
        return sessions.size();
    }

    /**
     * Clear all entries (for testing).
     */
    public void clear() {
        sessions.clear();
    }

    private record SessionEntry(SessionToken token, Instant retainUntil) {
        boolean isGone(Instant now) {
            return !now.isBefore(retainUntil);
        }
    }
}
