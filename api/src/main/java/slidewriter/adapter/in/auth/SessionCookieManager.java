package slidewriter.adapter.in.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;

import slidewriter.core.config.OAuthConfig;
import slidewriter.core.config.SessionConfig;
import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.session.SessionToken;

/**
 * Creates, reads and clears the session and authorization-state cookies.
 *
 * <p>Both cookies share path, domain, Secure and HttpOnly settings. The state
 * cookie is always SameSite=Lax: it has to come back on the provider's cross-site
 * redirect to the callback, which a Strict cookie never does.
 */
@ApplicationScoped
public class SessionCookieManager {

    private final SessionConfig sessionConfig;
    private final OAuthConfig oauthConfig;

    @Inject
    public SessionCookieManager(SessionConfig sessionConfig, OAuthConfig oauthConfig) {
        this.sessionConfig = sessionConfig;
        this.oauthConfig = oauthConfig;
    }

    /**
     * Creates a session cookie living as long as the session.
     *
     * @param session The session to create a cookie for
     * @return The session cookie
     */
    public NewCookie createSessionCookie(SessionToken session) {
        long maxAge = session.expiresAt().getEpochSecond() - Instant.now().getEpochSecond();
        return builder(sessionConfig.cookie().name())
                .value(session.sessionId())
                .maxAge((int) Math.max(0, Math.min(Integer.MAX_VALUE, maxAge)))
                .build();
    }

    /**
     * Creates a cookie that expires the session cookie immediately.
     */
    public NewCookie createLogoutCookie() {
        return builder(sessionConfig.cookie().name()).value("").maxAge(0).build();
    }

    /**
     * Creates the cookie binding an authorization attempt to this browser.
     */
    public NewCookie createStateCookie(AuthFlowState.Pending pending, Duration ttl) {
        return stateBuilder()
                .value(pending.stateToken())
                .maxAge((int) ttl.toSeconds())
                .build();
    }

    /**
     * Creates a cookie that clears the authorization-state cookie.
     */
    public NewCookie clearStateCookie() {
        return stateBuilder().value("").maxAge(0).build();
    }

    /**
     * Extracts the session ID from request cookies.
     *
     * @return The session ID, or empty if not present
     */
    public Optional<String> extractSessionId(HttpHeaders headers) {
        return value(headers, sessionConfig.cookie().name());
    }

    /**
     * Extracts the authorization state token from request cookies.
     */
    public Optional<String> extractStateToken(HttpHeaders headers) {
        return value(headers, oauthConfig.stateCookieName());
    }

    private static Optional<String> value(HttpHeaders headers, String name) {
        if (headers == null) {
            return Optional.empty();
        }
        Cookie cookie = headers.getCookies().get(name);
        if (cookie == null || cookie.getValue() == null || cookie.getValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(cookie.getValue());
    }

    private NewCookie.Builder stateBuilder() {
        return builder(oauthConfig.stateCookieName()).sameSite(NewCookie.SameSite.LAX);
    }

    private NewCookie.Builder builder(String name) {
        final var cookie = sessionConfig.cookie();
        var builder = new NewCookie.Builder(name)
                .path(cookie.path())
                .secure(cookie.secure())
                .httpOnly(cookie.httpOnly())
                .sameSite(parseSameSite(cookie.sameSite()));
        if (cookie.domain().isPresent()) {
            builder = (NewCookie.Builder) builder.domain(cookie.domain().get());
        }
        return builder;
    }

    private static NewCookie.SameSite parseSameSite(String sameSite) {
        return switch (sameSite.toUpperCase(Locale.ROOT)) {
            case "STRICT" -> NewCookie.SameSite.STRICT;
            case "NONE" -> NewCookie.SameSite.NONE;
            default -> NewCookie.SameSite.LAX;
        };
    }
}
