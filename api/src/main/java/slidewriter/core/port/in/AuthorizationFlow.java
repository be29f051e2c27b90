package slidewriter.core.port.in;

import io.smallrye.mutiny.Uni;

import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.auth.AuthorizationStart;
import slidewriter.core.model.session.SessionToken;

/**
 * Inbound port for the OAuth 2.0 authorization code flow with PKCE.
 */
public interface AuthorizationFlow {

    /**
     * Begin an authorization attempt.
     *
     * @return provider URL and the state token to bind to the browser
     * @throws slidewriter.core.model.common.ConfigurationException if client settings are missing
     */
    Uni<AuthorizationStart> startAuthorization();

    /**
     * Complete an authorization attempt.
     *
     * <p>The attempt identified by {@code stateToken} is consumed whether or not
     * the code exchange succeeds.
     *
     * @param stateToken        state received on the callback
     * @param authorizationCode code received on the callback
     * @return the new session
     */
    Uni<SessionToken> handleCallback(String stateToken, String authorizationCode);

    /**
     * Complete the attempt a browser has in flight.
     *
     * <p>Only a {@link AuthFlowState.Pending} browser whose state token equals the
     * one received on the callback may complete; anything else is a CSRF mismatch
     * and consumes nothing.
     *
     * @param current           state resolved from the browser
     * @param receivedState     state received on the callback
     * @param authorizationCode code received on the callback
     * @return the browser's new state
     */
    Uni<AuthFlowState.Authenticated> completeAuthorization(
            AuthFlowState current, String receivedState, String authorizationCode);
}
