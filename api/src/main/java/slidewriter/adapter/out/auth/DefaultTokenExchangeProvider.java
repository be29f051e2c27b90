package slidewriter.adapter.out.auth;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import slidewriter.core.config.OAuthConfig;
import slidewriter.core.model.auth.OAuthTokenExchangeRequest;
import slidewriter.core.model.auth.OAuthTokenExchangeRequest.ClientAuthMethod;
import slidewriter.core.model.auth.OAuthTokenExchangeResponse;
import slidewriter.core.model.common.AuthException;
import slidewriter.spi.TokenExchangeProvider;

/**
 * Default token exchange provider using the standard OAuth 2.0 flow (RFC 6749).
 *
 * <p>Supports:
 * <ul>
 *   <li>Authorization code exchange</li>
 *   <li>PKCE code verifier (RFC 7636)</li>
 *   <li>client_secret_basic authentication</li>
 *   <li>client_secret_post authentication</li>
 * </ul>
 */
@ApplicationScoped
public class DefaultTokenExchangeProvider implements TokenExchangeProvider {

    private static final Logger LOG = Logger.getLogger(DefaultTokenExchangeProvider.class);
    private static final String NAME = "default";
    private static final int PRIORITY = 100;
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    private final WebClient webClient;
    private final OAuthConfig config;

    @Inject
    public DefaultTokenExchangeProvider(Vertx vertx, OAuthConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public Uni<OAuthTokenExchangeResponse> exchange(OAuthTokenExchangeRequest request) {
        LOG.debugf("Exchanging authorization code at: %s", request.tokenEndpoint());

        final var timeout = config.timeout().toMillis();
        final var formBody = buildFormBody(request);

        var httpRequest = webClient
                .postAbs(request.tokenEndpoint())
                .timeout(timeout)
                .putHeader("Content-Type", "application/x-www-form-urlencoded")
                .putHeader("Accept", "application/json");

        if (request.clientAuthMethod() == ClientAuthMethod.CLIENT_SECRET_BASIC && request.clientSecret() != null) {
            final var credentials = urlEncode(request.clientId()) + ":" + urlEncode(request.clientSecret());
            final var encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
            httpRequest = httpRequest.putHeader("Authorization", "Basic " + encoded);
        }

        return httpRequest
                .sendBuffer(Buffer.buffer(formBody))
                .onFailure()
                .transform(error -> {
                    LOG.warnf("Token endpoint unreachable: %s", error.getMessage());
                    return AuthException.tokenExchangeFailed("Token endpoint unreachable", error);
                })
                .flatMap(this::parseTokenResponse);
    }

    String buildFormBody(OAuthTokenExchangeRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("grant_type", "authorization_code");
        params.put("code", request.authorizationCode());
        params.put("code_verifier", request.codeVerifier());

        if (request.redirectUri() != null && !request.redirectUri().isBlank()) {
            params.put("redirect_uri", request.redirectUri());
        }

        // client_id goes in the body for both methods; some providers require it
        params.put("client_id", request.clientId());
        if (request.clientAuthMethod() == ClientAuthMethod.CLIENT_SECRET_POST && request.clientSecret() != null) {
            params.put("client_secret", request.clientSecret());
        }

        return params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
    }

    private Uni<OAuthTokenExchangeResponse> parseTokenResponse(HttpResponse<Buffer> response) {
        if (response.statusCode() != 200) {
            LOG.warnf("Token exchange failed with status %d", response.statusCode());
            return Uni.createFrom()
                    .failure(AuthException.tokenExchangeFailed(
                            "Token endpoint returned status " + response.statusCode()));
        }

        try {
            final var json = response.bodyAsJsonObject();
            if (json == null) {
                return Uni.createFrom().failure(AuthException.tokenExchangeFailed("Token endpoint returned no body"));
            }

            final var accessToken = json.getString("access_token");
            if (accessToken == null || accessToken.isBlank()) {
                return Uni.createFrom()
                        .failure(AuthException.tokenExchangeFailed("Token response missing access_token"));
            }

            final var expiresIn = json.getLong("expires_in", DEFAULT_EXPIRES_IN_SECONDS);
            final var tokenResponse = new OAuthTokenExchangeResponse(
                    accessToken,
                    Optional.ofNullable(json.getString("refresh_token")),
                    json.getString("token_type", "Bearer"),
                    expiresIn,
                    Optional.ofNullable(json.getString("scope")));

            LOG.debugf("Token exchange successful, expires_in: %d", expiresIn);
            return Uni.createFrom().item(tokenResponse);

        } catch (RuntimeException e) {
            LOG.warnf("Failed to parse token response: %s", e.getMessage());
            return Uni.createFrom().failure(AuthException.tokenExchangeFailed("Malformed token response", e));
        }
    }

    private static String urlEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
