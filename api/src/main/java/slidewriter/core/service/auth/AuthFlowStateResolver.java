package slidewriter.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.session.SessionLookup;
import slidewriter.core.service.session.SessionStore;

/**
 * Works out where a browser stands in the sign-in flow from the values it presents.
 *
 * <p>A live session wins over an attempt in flight. An expired session is taken
 * through {@link AuthFlowState.Authenticated#expire()} before the attempt is
 * considered, so it never counts as signed in.
 */
@ApplicationScoped
public class AuthFlowStateResolver {

    private static final Logger LOG = Logger.getLogger(AuthFlowStateResolver.class);

    private final SessionStore sessionStore;

    public AuthFlowStateResolver(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /**
     * Resolve the full state of a browser.
     *
     * @param sessionId  session cookie value, may be null
     * @param stateToken authorization state cookie value, may be null
     * @return {@code Authenticated}, {@code Pending} or {@code NoSession}
     */
    public Uni<AuthFlowState> resolve(String sessionId, String stateToken) {
        return sessionStore.get(sessionId).map(lookup -> {
            if (lookup instanceof SessionLookup.Found found) {
                return new AuthFlowState.Authenticated(found.token());
            }
            var current = AuthFlowState.initial();
            if (lookup instanceof SessionLookup.Expired expired) {
                current = new AuthFlowState.Authenticated(expired.token()).expire();
                LOG.debugf("Session %s has expired", expired.token().sessionId());
            }
            return withAttempt(current, stateToken);
        });
    }

    /**
     * State of a sign-in attempt, ignoring any session the browser holds.
     *
     * @param stateToken authorization state cookie value, may be null
     * @return {@code Pending} when the browser carries a state token, else {@code NoSession}
     */
    public AuthFlowState attempt(String stateToken) {
        return withAttempt(AuthFlowState.initial(), stateToken);
    }

    private static AuthFlowState withAttempt(AuthFlowState current, String stateToken) {
        if (stateToken == null || stateToken.isBlank()) {
            return current;
        }
        return current.start(stateToken);
    }
}
