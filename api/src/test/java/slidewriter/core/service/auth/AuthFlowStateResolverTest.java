package slidewriter.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.session.SessionLookup;
import slidewriter.core.model.session.SessionToken;
import slidewriter.core.service.session.SessionStore;

@DisplayName("AuthFlowStateResolver")
class AuthFlowStateResolverTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SessionStore sessionStore;
    private AuthFlowStateResolver resolver;

    @BeforeEach
    void setUp() {
        sessionStore = mock(SessionStore.class);
        resolver = new AuthFlowStateResolver(sessionStore);
    }

    private AuthFlowState resolve(String sessionId, String stateToken) {
        return resolver.resolve(sessionId, stateToken).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("resolve()")
    class ResolveTests {

        @Test
        @DisplayName("should resolve a live session to authenticated")
        void shouldResolveLiveSession() {
            var token = new SessionToken("sid-1", "access", Instant.now().plus(Duration.ofHours(1)));
            when(sessionStore.get("sid-1")).thenReturn(Uni.createFrom().item(new SessionLookup.Found(token)));

            var state = assertInstanceOf(AuthFlowState.Authenticated.class, resolve("sid-1", "state-1"));

            assertEquals(token, state.session());
        }

        @Test
        @DisplayName("should expire a stale session to no session")
        void shouldExpireStaleSession() {
            var token = new SessionToken("old", "access", Instant.now().minusSeconds(1));
            when(sessionStore.get("old")).thenReturn(Uni.createFrom().item(new SessionLookup.Expired(token)));

            assertInstanceOf(AuthFlowState.NoSession.class, resolve("old", null));
        }

        @Test
        @DisplayName("should resolve a stale session with an attempt in flight to pending")
        void shouldResolveAttemptAfterExpiry() {
            var token = new SessionToken("old", "access", Instant.now().minusSeconds(1));
            when(sessionStore.get("old")).thenReturn(Uni.createFrom().item(new SessionLookup.Expired(token)));

            var state = assertInstanceOf(AuthFlowState.Pending.class, resolve("old", "state-1"));

            assertEquals("state-1", state.stateToken());
        }

        @Test
        @DisplayName("should resolve an unknown browser to no session")
        void shouldResolveUnknownBrowser() {
            when(sessionStore.get(null)).thenReturn(Uni.createFrom().item(new SessionLookup.NotFound(null)));

            assertEquals("NO_SESSION", resolve(null, null).name());
        }
    }

    @Nested
    @DisplayName("attempt()")
    class AttemptTests {

        @Test
        @DisplayName("should be pending when a state token is present")
        void shouldBePending() {
            var state = assertInstanceOf(AuthFlowState.Pending.class, resolver.attempt("state-1"));

            assertEquals("state-1", state.stateToken());
        }

        @Test
        @DisplayName("should be no session without a state token")
        void shouldBeNoSession() {
            assertInstanceOf(AuthFlowState.NoSession.class, resolver.attempt(null));
            assertInstanceOf(AuthFlowState.NoSession.class, resolver.attempt(" "));
        }
    }
}
