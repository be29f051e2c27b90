package slidewriter.core.model.auth;

import java.time.Duration;

/**
 * Result of starting an authorization attempt.
 *
 * @param authorizationUrl provider URL the browser is redirected to
 * @param stateToken       state token to bind to the browser
 * @param stateTtl         how long the attempt stays valid
 */
public record AuthorizationStart(String authorizationUrl, String stateToken, Duration stateTtl) {}
