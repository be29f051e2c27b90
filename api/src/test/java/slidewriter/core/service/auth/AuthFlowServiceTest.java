package slidewriter.core.service.auth;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import slidewriter.adapter.out.storage.memory.InMemoryAuthorizationStateRepository;
import slidewriter.core.config.OAuthConfig;
import slidewriter.core.config.SessionConfig;
import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.auth.AuthorizationState;
import slidewriter.core.model.auth.OAuthTokenExchangeRequest;
import slidewriter.core.model.auth.OAuthTokenExchangeResponse;
import slidewriter.core.model.common.AuthException;
import slidewriter.core.model.common.ConfigurationException;
import slidewriter.core.model.common.ErrorCode;
import slidewriter.core.model.session.SessionToken;
import slidewriter.core.port.out.Metrics;
import slidewriter.core.service.session.SessionStore;
import slidewriter.spi.TokenExchangeProvider;

@DisplayName("AuthFlowService")
class AuthFlowServiceTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final String REDIRECT_URI = "http://localhost:3000/oauth/callback";

    private InMemoryAuthorizationStateRepository stateRepository;
    private TokenExchangeProvider exchangeProvider;
    private SessionStore sessionStore;
    private OAuthConfig oauthConfig;
    private SessionConfig sessionConfig;
    private Metrics metrics;
    private AuthFlowService service;

    @BeforeEach
    void setUp() {
        stateRepository = new InMemoryAuthorizationStateRepository();
        exchangeProvider = mock(TokenExchangeProvider.class);
        sessionStore = mock(SessionStore.class);
        metrics = mock(Metrics.class);

        oauthConfig = mock(OAuthConfig.class);
        when(oauthConfig.clientId()).thenReturn(Optional.of("client-123"));
        when(oauthConfig.clientSecret()).thenReturn(Optional.of("secret-456"));
        when(oauthConfig.redirectUri()).thenReturn(Optional.of(REDIRECT_URI));
        when(oauthConfig.authorizationEndpoint()).thenReturn("https://accounts.google.com/o/oauth2/v2/auth");
        when(oauthConfig.tokenEndpoint()).thenReturn("https://oauth2.googleapis.com/token");
        when(oauthConfig.scopes())
                .thenReturn(List.of(
                        "https://www.googleapis.com/auth/presentations",
                        "https://www.googleapis.com/auth/drive.file"));
        when(oauthConfig.accessType()).thenReturn("offline");
        when(oauthConfig.prompt()).thenReturn("consent");
        when(oauthConfig.clientAuthMethod()).thenReturn("client_secret_post");
        when(oauthConfig.stateTtl()).thenReturn(Duration.ofMinutes(10));
        when(oauthConfig.expiredStateRetention()).thenReturn(Duration.ofMinutes(5));

        sessionConfig = mock(SessionConfig.class);
        when(sessionConfig.ttl()).thenReturn(Duration.ofDays(14));
        when(sessionConfig.capAtTokenExpiry()).thenReturn(true);

        TokenExchangeProviderRegistry registry = mock(TokenExchangeProviderRegistry.class);
        when(registry.getProvider()).thenReturn(exchangeProvider);

        service = new AuthFlowService(
                stateRepository, new PkceService(), registry, sessionStore, oauthConfig, sessionConfig, metrics);
    }

    @AfterEach
    void tearDown() {
        stateRepository.shutdown();
    }

    private static Map<String, String> queryParams(String url) {
        Map<String, String> params = new LinkedHashMap<>();
        for (String pair : URI.create(url).getRawQuery().split("&")) {
            String[] kv = pair.split("=", 2);
            params.put(kv[0], URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
        }
        return params;
    }

    private void givenSuccessfulExchange(long expiresIn) {
        when(exchangeProvider.exchange(any()))
                .thenReturn(Uni.createFrom()
                        .item(new OAuthTokenExchangeResponse(
                                "access-abc", Optional.empty(), "Bearer", expiresIn, Optional.empty())));
        when(sessionStore.create(anyString(), any())).thenAnswer(inv -> Uni.createFrom()
                .item(new SessionToken(
                        "sid-1", inv.getArgument(0), Instant.now().plus(inv.getArgument(1, Duration.class)))));
    }

    @Nested
    @DisplayName("startAuthorization()")
    class StartTests {

        @Test
        @DisplayName("should build the provider URL with PKCE and offline access")
        void shouldBuildAuthorizationUrl() {
            var start = service.startAuthorization().await().atMost(TIMEOUT);

            assertTrue(start.authorizationUrl().startsWith("https://accounts.google.com/o/oauth2/v2/auth?"));
            var params = queryParams(start.authorizationUrl());
            assertEquals(
                    List.of(
                            "client_id",
                            "redirect_uri",
                            "response_type",
                            "scope",
                            "state",
                            "code_challenge",
                            "code_challenge_method",
                            "access_type",
                            "prompt"),
                    List.copyOf(params.keySet()));
            assertEquals("client-123", params.get("client_id"));
            assertEquals(REDIRECT_URI, params.get("redirect_uri"));
            assertEquals("code", params.get("response_type"));
            assertEquals(
                    "https://www.googleapis.com/auth/presentations https://www.googleapis.com/auth/drive.file",
                    params.get("scope"));
            assertEquals(start.stateToken(), params.get("state"));
            assertEquals("S256", params.get("code_challenge_method"));
            assertEquals("offline", params.get("access_type"));
            assertEquals("consent", params.get("prompt"));
            assertEquals(Duration.ofMinutes(10), start.stateTtl());
        }

        @Test
        @DisplayName("should store a state whose verifier matches the challenge")
        void shouldStoreVerifier() {
            var start = service.startAuthorization().await().atMost(TIMEOUT);
            var challenge = queryParams(start.authorizationUrl()).get("code_challenge");

            var stored = stateRepository.consume(start.stateToken()).await().atMost(TIMEOUT);

            assertTrue(stored.isPresent());
            assertEquals(challenge, new PkceService().generateChallenge(stored.get().codeVerifier()));
            verify(metrics).recordAuthorizationStarted();
        }

        @Test
        @DisplayName("should issue a distinct state for every attempt")
        void shouldUseFreshState() {
            var first = service.startAuthorization().await().atMost(TIMEOUT);
            var second = service.startAuthorization().await().atMost(TIMEOUT);

            assertTrue(!first.stateToken().equals(second.stateToken()));
            assertEquals(2, stateRepository.getStateCount());
        }

        @Test
        @DisplayName("should fail when the client is not configured")
        void shouldFailWithoutClientId() {
            when(oauthConfig.clientId()).thenReturn(Optional.empty());

            assertThrows(
                    ConfigurationException.class,
                    () -> service.startAuthorization().await().atMost(TIMEOUT));
            assertEquals(0, stateRepository.getStateCount());
        }
    }

    @Nested
    @DisplayName("handleCallback()")
    class CallbackTests {

        @Test
        @DisplayName("should exchange the code with the stored verifier and create a session")
        void shouldCompleteFlow() {
            givenSuccessfulExchange(3600);
            var start = service.startAuthorization().await().atMost(TIMEOUT);

            SessionToken session =
                    service.handleCallback(start.stateToken(), "auth-code").await().atMost(TIMEOUT);

            assertEquals("sid-1", session.sessionId());
            assertEquals("access-abc", session.accessToken());

            ArgumentCaptor<OAuthTokenExchangeRequest> captor = ArgumentCaptor.forClass(OAuthTokenExchangeRequest.class);
            verify(exchangeProvider).exchange(captor.capture());
            var request = captor.getValue();
            assertEquals("auth-code", request.authorizationCode());
            assertEquals(REDIRECT_URI, request.redirectUri());
            assertEquals("client-123", request.clientId());
            verify(metrics).recordAuthorizationCompleted("success");
        }

        @Test
        @DisplayName("should cap the session at the access token lifetime")
        void shouldCapSessionTtl() {
            givenSuccessfulExchange(1800);
            var start = service.startAuthorization().await().atMost(TIMEOUT);

            service.handleCallback(start.stateToken(), "code").await().atMost(TIMEOUT);

            verify(sessionStore).create("access-abc", Duration.ofSeconds(1800));
        }

        @Test
        @DisplayName("should use the configured TTL when capping is disabled")
        void shouldNotCapWhenDisabled() {
            when(sessionConfig.capAtTokenExpiry()).thenReturn(false);
            givenSuccessfulExchange(1800);
            var start = service.startAuthorization().await().atMost(TIMEOUT);

            service.handleCallback(start.stateToken(), "code").await().atMost(TIMEOUT);

            verify(sessionStore).create("access-abc", Duration.ofDays(14));
        }

        @Test
        @DisplayName("should accept a state only once")
        void shouldRejectReplay() {
            givenSuccessfulExchange(3600);
            var start = service.startAuthorization().await().atMost(TIMEOUT);
            service.handleCallback(start.stateToken(), "code").await().atMost(TIMEOUT);

            var ex = assertThrows(
                    AuthException.class,
                    () -> service.handleCallback(start.stateToken(), "code").await().atMost(TIMEOUT));

            assertEquals(ErrorCode.CSRF_MISMATCH, ex.errorCode());
            verify(exchangeProvider, times(1)).exchange(any());
        }

        @Test
        @DisplayName("should reject an unknown state without exchanging")
        void shouldRejectUnknownState() {
            var ex = assertThrows(
                    AuthException.class,
                    () -> service.handleCallback("forged", "code").await().atMost(TIMEOUT));

            assertEquals(ErrorCode.CSRF_MISMATCH, ex.errorCode());
            verify(exchangeProvider, never()).exchange(any());
            verify(metrics).recordAuthorizationCompleted("csrf_mismatch");
        }

        @Test
        @DisplayName("should report an expired state as expired")
        void shouldRejectExpiredState() {
            var old = new AuthorizationState("old-state", "verifier", Instant.now().minus(Duration.ofMinutes(11)));
            stateRepository.store(old, Duration.ofMinutes(15)).await().atMost(TIMEOUT);

            var ex = assertThrows(
                    AuthException.class,
                    () -> service.handleCallback("old-state", "code").await().atMost(TIMEOUT));

            assertEquals(ErrorCode.STATE_EXPIRED, ex.errorCode());
            verify(exchangeProvider, never()).exchange(any());
        }

        @Test
        @DisplayName("should map exchange errors and burn the state")
        void shouldMapExchangeFailure() {
            when(exchangeProvider.exchange(any()))
                    .thenReturn(Uni.createFrom().failure(new RuntimeException("connection reset")));
            var start = service.startAuthorization().await().atMost(TIMEOUT);

            var ex = assertThrows(
                    AuthException.class,
                    () -> service.handleCallback(start.stateToken(), "code").await().atMost(TIMEOUT));

            assertEquals(ErrorCode.TOKEN_EXCHANGE_FAILED, ex.errorCode());
            assertInstanceOf(RuntimeException.class, ex.getCause());
            assertEquals(0, stateRepository.getStateCount());
            verify(sessionStore, never()).create(anyString(), any());
            verify(metrics).recordAuthorizationCompleted(eq("token_exchange_failed"));
        }
    }

    @Nested
    @DisplayName("completeAuthorization()")
    class CompleteTests {

        @Test
        @DisplayName("should take a pending browser to authenticated")
        void shouldAuthenticatePendingBrowser() {
            givenSuccessfulExchange(3600);
            var start = service.startAuthorization().await().atMost(TIMEOUT);
            var pending = AuthFlowState.initial().start(start.stateToken());

            var authenticated = service.completeAuthorization(pending, start.stateToken(), "code")
                    .await()
                    .atMost(TIMEOUT);

            assertEquals("AUTHENTICATED", authenticated.name());
            assertEquals("sid-1", authenticated.sessionId());
            assertEquals("access-abc", authenticated.session().accessToken());
        }

        @Test
        @DisplayName("should refuse a browser that has not started signing in and keep the state")
        void shouldRefuseWithoutPendingAttempt() {
            var start = service.startAuthorization().await().atMost(TIMEOUT);

            var ex = assertThrows(
                    AuthException.class,
                    () -> service.completeAuthorization(AuthFlowState.initial(), start.stateToken(), "code")
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(ErrorCode.CSRF_MISMATCH, ex.errorCode());
            assertEquals(1, stateRepository.getStateCount());
            verify(exchangeProvider, never()).exchange(any());
        }

        @Test
        @DisplayName("should refuse a pending browser bound to a different state")
        void shouldRefuseOtherAttempt() {
            var start = service.startAuthorization().await().atMost(TIMEOUT);
            var otherBrowser = AuthFlowState.initial().start("someone-elses-state");

            var ex = assertThrows(
                    AuthException.class,
                    () -> service.completeAuthorization(otherBrowser, start.stateToken(), "code")
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(ErrorCode.CSRF_MISMATCH, ex.errorCode());
            assertEquals(1, stateRepository.getStateCount());
        }

        @Test
        @DisplayName("should refuse an already authenticated browser")
        void shouldRefuseAuthenticatedBrowser() {
            var start = service.startAuthorization().await().atMost(TIMEOUT);
            var signedIn = new AuthFlowState.Authenticated(
                    new SessionToken("sid-0", "old-token", Instant.now().plus(Duration.ofHours(1))));

            var ex = assertThrows(
                    AuthException.class,
                    () -> service.completeAuthorization(signedIn, start.stateToken(), "code")
                            .await()
                            .atMost(TIMEOUT));

            assertEquals(ErrorCode.CSRF_MISMATCH, ex.errorCode());
            verify(exchangeProvider, never()).exchange(any());
        }
    }
}
