package slidewriter.core.service.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.config.OAuthConfig;
import slidewriter.core.config.SessionConfig;
import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.auth.AuthorizationStart;
import slidewriter.core.model.auth.AuthorizationState;
import slidewriter.core.model.auth.OAuthTokenExchangeRequest;
import slidewriter.core.model.auth.OAuthTokenExchangeRequest.ClientAuthMethod;
import slidewriter.core.model.auth.OAuthTokenExchangeResponse;
import slidewriter.core.model.common.AuthException;
import slidewriter.core.model.common.ConfigurationException;
import slidewriter.core.model.common.SlideWriterException;
import slidewriter.core.model.session.SessionToken;
import slidewriter.core.port.in.AuthorizationFlow;
import slidewriter.core.port.out.AuthorizationStateRepository;
import slidewriter.core.port.out.Metrics;
import slidewriter.core.service.session.SessionStore;

/**
 * Drives the OAuth 2.0 authorization code flow with PKCE.
 *
 * <p>Each attempt is stored under its state token and consumed atomically when
 * the provider redirects back, before the code is exchanged. A failed exchange
 * therefore also burns the attempt and the user has to start over.
 */
@ApplicationScoped
public class AuthFlowService implements AuthorizationFlow {

    private static final Logger LOG = Logger.getLogger(AuthFlowService.class);
    private static final int MAX_STATE_ATTEMPTS = 3;

    private final AuthorizationStateRepository stateRepository;
    private final PkceService pkceService;
    private final TokenExchangeProviderRegistry exchangeRegistry;
    private final SessionStore sessionStore;
    private final OAuthConfig oauthConfig;
    private final SessionConfig sessionConfig;
    private final Metrics metrics;

    @Inject
    public AuthFlowService(
            AuthorizationStateRepository stateRepository,
            PkceService pkceService,
            TokenExchangeProviderRegistry exchangeRegistry,
            SessionStore sessionStore,
            OAuthConfig oauthConfig,
            SessionConfig sessionConfig,
            Metrics metrics) {
        this.stateRepository = stateRepository;
        this.pkceService = pkceService;
        this.exchangeRegistry = exchangeRegistry;
        this.sessionStore = sessionStore;
        this.oauthConfig = oauthConfig;
        this.sessionConfig = sessionConfig;
        this.metrics = metrics;
    }

    @Override
    public Uni<AuthorizationStart> startAuthorization() {
        final ClientSettings client;
        try {
            client = clientSettings();
        } catch (ConfigurationException e) {
            return Uni.createFrom().failure(e);
        }
        return storeNewState(client, 0);
    }

    private Uni<AuthorizationStart> storeNewState(ClientSettings client, int attempt) {
        if (attempt >= MAX_STATE_ATTEMPTS) {
            return Uni.createFrom()
                    .failure(new IllegalStateException(
                            "Failed to generate unique state token after " + MAX_STATE_ATTEMPTS + " attempts"));
        }

        final var verifier = pkceService.generateCodeVerifier();
        final var state = new AuthorizationState(pkceService.generateState(), verifier, Instant.now());
        final var retention = oauthConfig.stateTtl().plus(oauthConfig.expiredStateRetention());

        return stateRepository.store(state, retention).flatMap(stored -> {
            if (!stored) {
                LOG.warnf("State token collision detected (attempt %d/%d), retrying", attempt + 1, MAX_STATE_ATTEMPTS);
                return storeNewState(client, attempt + 1);
            }
            LOG.debugf("Authorization started with state: %s", state.stateToken());
            metrics.recordAuthorizationStarted();
            final var url = buildAuthorizationUrl(client, state.stateToken(), pkceService.generateChallenge(verifier));
            return Uni.createFrom().item(new AuthorizationStart(url, state.stateToken(), oauthConfig.stateTtl()));
        });
    }

    @Override
    public Uni<SessionToken> handleCallback(String stateToken, String authorizationCode) {
        final ClientSettings client;
        try {
            client = clientSettings();
        } catch (ConfigurationException e) {
            return Uni.createFrom().failure(e);
        }

        return stateRepository
                .consume(stateToken)
                .flatMap(stateOpt -> {
                    if (stateOpt.isEmpty()) {
                        LOG.debugf("No pending authorization for state: %s", stateToken);
                        return Uni.createFrom()
                                .<AuthorizationState>failure(
                                        AuthException.csrfMismatch("Unknown or already used authorization state"));
                    }
                    final var state = stateOpt.get();
                    if (state.isExpired(Instant.now(), oauthConfig.stateTtl())) {
                        LOG.debugf("Authorization state expired: %s", stateToken);
                        return Uni.createFrom().<AuthorizationState>failure(AuthException.stateExpired());
                    }
                    return Uni.createFrom().item(state);
                })
                .flatMap(state -> exchange(client, state, authorizationCode))
                .flatMap(response -> sessionStore.create(response.accessToken(), sessionTtl(response)))
                .invoke(token -> {
                    LOG.infof("Authorization completed, session expires at %s", token.expiresAt());
                    metrics.recordAuthorizationCompleted("success");
                })
                .onFailure()
                .invoke(e -> metrics.recordAuthorizationCompleted(outcomeOf(e)));
    }

    @Override
    public Uni<AuthFlowState.Authenticated> completeAuthorization(
            AuthFlowState current, String receivedState, String authorizationCode) {
        if (!(current instanceof AuthFlowState.Pending pending) || !pending.stateToken().equals(receivedState)) {
            LOG.debugf("Callback state %s does not match browser state %s", receivedState, current.name());
            return Uni.createFrom()
                    .failure(AuthException.csrfMismatch("Authorization state does not belong to this browser"));
        }

        return handleCallback(receivedState, authorizationCode)
                .map(pending::complete)
                .onFailure()
                .invoke(e -> LOG.debugf("Authorization attempt rejected, browser is %s", pending.reject().name()));
    }

    private Uni<OAuthTokenExchangeResponse> exchange(
            ClientSettings client, AuthorizationState state, String authorizationCode) {
        final var request = new OAuthTokenExchangeRequest(
                authorizationCode,
                state.codeVerifier(),
                client.redirectUri(),
                oauthConfig.tokenEndpoint(),
                client.clientId(),
                client.clientSecret(),
                ClientAuthMethod.fromConfig(oauthConfig.clientAuthMethod()));

        return exchangeRegistry
                .getProvider()
                .exchange(request)
                .onFailure(e -> !(e instanceof AuthException))
                .transform(e -> {
                    LOG.warnf("Token exchange failed: %s", e.getMessage());
                    return AuthException.tokenExchangeFailed("Token exchange failed", e);
                });
    }

    private Duration sessionTtl(OAuthTokenExchangeResponse response) {
        final var ttl = sessionConfig.ttl();
        if (!sessionConfig.capAtTokenExpiry()) {
            return ttl;
        }
        final var tokenLifetime = Duration.ofSeconds(response.expiresIn());
        return tokenLifetime.compareTo(ttl) < 0 ? tokenLifetime : ttl;
    }

    String buildAuthorizationUrl(ClientSettings client, String stateToken, String challenge) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("client_id", client.clientId());
        params.put("redirect_uri", client.redirectUri());
        params.put("response_type", "code");
        params.put("scope", String.join(" ", oauthConfig.scopes()));
        params.put("state", stateToken);
        params.put("code_challenge", challenge);
        params.put("code_challenge_method", pkceService.challengeMethod());
        params.put("access_type", oauthConfig.accessType());
        params.put("prompt", oauthConfig.prompt());

        final var query = params.entrySet().stream()
                .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
                .collect(Collectors.joining("&"));
        final var endpoint = oauthConfig.authorizationEndpoint();
        return endpoint + (endpoint.contains("?") ? "&" : "?") + query;
    }

    private ClientSettings clientSettings() {
        return new ClientSettings(
                required(oauthConfig.clientId(), "slidewriter.oauth.client-id"),
                required(oauthConfig.clientSecret(), "slidewriter.oauth.client-secret"),
                required(oauthConfig.redirectUri(), "slidewriter.oauth.redirect-uri"));
    }

    private static String required(Optional<String> value, String property) {
        return value.filter(v -> !v.isBlank())
                .orElseThrow(() -> new ConfigurationException("OAuth client is not configured: " + property));
    }

    private static String outcomeOf(Throwable e) {
        if (e instanceof SlideWriterException swe) {
            return swe.errorCode().code();
        }
        return "error";
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    record ClientSettings(String clientId, String clientSecret, String redirectUri) {}
}
