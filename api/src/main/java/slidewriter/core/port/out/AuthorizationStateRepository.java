package slidewriter.core.port.out;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import slidewriter.core.model.auth.AuthorizationState;

/**
 * Outbound port for pending authorization attempts.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Entries MUST expire automatically after the given retention</li>
 *   <li>{@link #consume(String)} MUST be atomic: a state is returned at most once</li>
 *   <li>All operations MUST be non-blocking (return Uni)</li>
 * </ul>
 */
public interface AuthorizationStateRepository {

    /**
     * Store an authorization attempt unless its state token is already in use.
     *
     * @param state     the attempt to store
     * @param retention how long the backend keeps the entry
     * @return true if stored, false if the state token already exists
     */
    Uni<Boolean> store(AuthorizationState state, Duration retention);

    /**
     * Retrieve and delete an attempt in one step.
     *
     * @param stateToken the state token received on the callback
     * @return the attempt, or empty if unknown or already consumed
     */
    Uni<Optional<AuthorizationState>> consume(String stateToken);
}
