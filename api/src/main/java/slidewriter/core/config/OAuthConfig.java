package slidewriter.core.config;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the OAuth 2.0 authorization code flow with PKCE.
 *
 * <p>Configuration prefix: {@code slidewriter.oauth}
 *
 * <p>Client credentials and the redirect URI have no defaults. Starting an
 * authorization without them fails with a configuration error rather than
 * redirecting the user to a provider that would reject the request.
 */
@ConfigMapping(prefix = "slidewriter.oauth")
public interface OAuthConfig {

    /**
     * OAuth client ID registered with the provider.
     */
    Optional<String> clientId();

    /**
     * OAuth client secret registered with the provider.
     */
    Optional<String> clientSecret();

    /**
     * Callback URI registered with the provider, pointing at {@code /oauth/callback}.
     */
    Optional<String> redirectUri();

    /**
     * Provider authorization endpoint.
     *
     * @return Authorization URL (default: Google)
     */
    @WithDefault("https://accounts.google.com/o/oauth2/v2/auth")
    String authorizationEndpoint();

    /**
     * Provider token endpoint.
     *
     * @return Token URL (default: Google)
     */
    @WithDefault("https://oauth2.googleapis.com/token")
    String tokenEndpoint();

    /**
     * Scopes requested during authorization.
     *
     * @return Scopes (default: Slides and per-file Drive access)
     */
    @WithDefault("https://www.googleapis.com/auth/presentations,https://www.googleapis.com/auth/drive.file")
    List<String> scopes();

    /**
     * Value of the {@code access_type} authorization parameter.
     */
    @WithDefault("offline")
    String accessType();

    /**
     * Value of the {@code prompt} authorization parameter.
     */
    @WithDefault("consent")
    String prompt();

    /**
     * How the client authenticates at the token endpoint: {@code client_secret_post}
     * or {@code client_secret_basic}.
     */
    @WithDefault("client_secret_post")
    String clientAuthMethod();

    /**
     * How long an authorization attempt stays valid after {@code /oauth/start}.
     *
     * @return State TTL (default: 10 minutes)
     */
    @WithDefault("PT10M")
    Duration stateTtl();

    /**
     * How long an expired authorization attempt is retained so a late callback
     * can be reported as expired instead of unknown.
     *
     * @return Retention after expiry (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration expiredStateRetention();

    /**
     * Timeout for the token exchange request.
     *
     * @return Timeout (default: 10 seconds)
     */
    @WithDefault("PT10S")
    Duration timeout();

    /**
     * Where the browser is sent after a successful callback.
     */
    @WithDefault("/app")
    String postLoginRedirect();

    /**
     * Name of the cookie binding an authorization attempt to the browser.
     */
    @WithDefault("oauth_state")
    String stateCookieName();

    /**
     * Name of the token exchange provider to use.
     *
     * @return Provider name (default: default)
     */
    @WithDefault("default")
    String tokenExchangeProvider();

    /**
     * Storage configuration for authorization state.
     */
    StorageConfig storage();

    /**
     * Storage configuration options.
     */
    interface StorageConfig {

        /**
         * Storage provider name: redis, memory, or a custom SPI name.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        /**
         * Redis-specific configuration.
         */
        RedisConfig redis();

        interface RedisConfig {

            /**
             * @return Key prefix (default: slidewriter:oauth-state:)
             */
            @WithDefault("slidewriter:oauth-state:")
            String keyPrefix();
        }
    }
}
