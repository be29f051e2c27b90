package slidewriter.adapter.in.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import jakarta.ws.rs.core.Cookie;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.NewCookie;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import slidewriter.core.config.OAuthConfig;
import slidewriter.core.config.SessionConfig;
import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.session.SessionToken;

@DisplayName("SessionCookieManager")
class SessionCookieManagerTest {

    private SessionConfig.CookieConfig cookieConfig;
    private SessionCookieManager manager;

    @BeforeEach
    void setUp() {
        SessionConfig sessionConfig = mock(SessionConfig.class);
        cookieConfig = mock(SessionConfig.CookieConfig.class);
        when(sessionConfig.cookie()).thenReturn(cookieConfig);
        when(cookieConfig.name()).thenReturn("sid");
        when(cookieConfig.path()).thenReturn("/");
        when(cookieConfig.domain()).thenReturn(Optional.empty());
        when(cookieConfig.secure()).thenReturn(true);
        when(cookieConfig.httpOnly()).thenReturn(true);
        when(cookieConfig.sameSite()).thenReturn("Lax");

        OAuthConfig oauthConfig = mock(OAuthConfig.class);
        when(oauthConfig.stateCookieName()).thenReturn("oauth_state");

        manager = new SessionCookieManager(sessionConfig, oauthConfig);
    }

    private static HttpHeaders headersWith(Map<String, Cookie> cookies) {
        HttpHeaders headers = mock(HttpHeaders.class);
        when(headers.getCookies()).thenReturn(cookies);
        return headers;
    }

    @Nested
    @DisplayName("Creating cookies")
    class CreateTests {

        @Test
        @DisplayName("should create a secure HttpOnly session cookie living as long as the session")
        void shouldCreateSessionCookie() {
            var session = new SessionToken("sid-1", "token", Instant.now().plus(Duration.ofHours(1)));

            NewCookie cookie = manager.createSessionCookie(session);

            assertEquals("sid", cookie.getName());
            assertEquals("sid-1", cookie.getValue());
            assertEquals("/", cookie.getPath());
            assertTrue(cookie.isSecure());
            assertTrue(cookie.isHttpOnly());
            assertEquals(NewCookie.SameSite.LAX, cookie.getSameSite());
            assertTrue(cookie.getMaxAge() > 3590 && cookie.getMaxAge() <= 3600);
            assertNull(cookie.getDomain());
        }

        @Test
        @DisplayName("should expire the session cookie on logout")
        void shouldCreateLogoutCookie() {
            NewCookie cookie = manager.createLogoutCookie();

            assertEquals("sid", cookie.getName());
            assertEquals(0, cookie.getMaxAge());
        }

        @Test
        @DisplayName("should bind the state cookie to the attempt lifetime")
        void shouldCreateStateCookie() {
            NewCookie cookie = manager.createStateCookie(new AuthFlowState.Pending("state-1"), Duration.ofMinutes(10));

            assertEquals("oauth_state", cookie.getName());
            assertEquals("state-1", cookie.getValue());
            assertEquals(600, cookie.getMaxAge());
            assertEquals(0, manager.clearStateCookie().getMaxAge());
        }

        @Test
        @DisplayName("should apply the configured domain and SameSite")
        void shouldApplyDomain() {
            when(cookieConfig.domain()).thenReturn(Optional.of("example.com"));
            when(cookieConfig.sameSite()).thenReturn("strict");

            NewCookie cookie = manager.createLogoutCookie();

            assertEquals("example.com", cookie.getDomain());
            assertEquals(NewCookie.SameSite.STRICT, cookie.getSameSite());
        }

        @Test
        @DisplayName("should keep the state cookie Lax when the session cookie is Strict")
        void shouldKeepStateCookieLax() {
            when(cookieConfig.sameSite()).thenReturn("Strict");

            NewCookie state = manager.createStateCookie(new AuthFlowState.Pending("state-1"), Duration.ofMinutes(10));
            NewCookie cleared = manager.clearStateCookie();
            NewCookie session = manager.createSessionCookie(
                    new SessionToken("sid-1", "token", Instant.now().plus(Duration.ofHours(1))));

            assertEquals(NewCookie.SameSite.LAX, state.getSameSite());
            assertEquals(NewCookie.SameSite.LAX, cleared.getSameSite());
            assertEquals(NewCookie.SameSite.STRICT, session.getSameSite());
            assertTrue(state.isSecure());
            assertTrue(state.isHttpOnly());
        }
    }

    @Nested
    @DisplayName("Reading cookies")
    class ExtractTests {

        @Test
        @DisplayName("should read the session ID")
        void shouldExtractSessionId() {
            var headers = headersWith(Map.of("sid", new Cookie.Builder("sid").value("abc").build()));

            assertEquals(Optional.of("abc"), manager.extractSessionId(headers));
        }

        @Test
        @DisplayName("should read the state token")
        void shouldExtractStateToken() {
            var headers =
                    headersWith(Map.of("oauth_state", new Cookie.Builder("oauth_state").value("s1").build()));

            assertEquals(Optional.of("s1"), manager.extractStateToken(headers));
        }

        @Test
        @DisplayName("should treat a missing or empty cookie as absent")
        void shouldHandleMissing() {
            assertTrue(manager.extractSessionId(headersWith(Map.of())).isEmpty());
            assertTrue(manager.extractSessionId(
                            headersWith(Map.of("sid", new Cookie.Builder("sid").value("").build())))
                    .isEmpty());
            assertTrue(manager.extractSessionId(null).isEmpty());
        }
    }
}
