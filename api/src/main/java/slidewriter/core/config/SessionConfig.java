package slidewriter.core.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for session tokens.
 *
 * <p>Configuration prefix: {@code slidewriter.session}
 */
@ConfigMapping(prefix = "slidewriter.session")
public interface SessionConfig {

    /**
     * Session TTL (time-to-live).
     *
     * @return Session duration (default: 14 days)
     */
    @WithDefault("P14D")
    Duration ttl();

    /**
     * Cap the session lifetime at the provider's access token lifetime.
     *
     * <p>Access tokens are never refreshed, so a session that outlives its token
     * can only produce remote failures.
     *
     * @return true if capped (default: true)
     */
    @WithDefault("true")
    boolean capAtTokenExpiry();

    /**
     * Cookie configuration.
     */
    CookieConfig cookie();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Storage configuration.
     */
    StorageConfig storage();

    interface CookieConfig {

        /**
         * @return Cookie name (default: sid)
         */
        @WithDefault("sid")
        String name();

        /**
         * @return Cookie path (default: /)
         */
        @WithDefault("/")
        String path();

        /**
         * Cookie domain. If not set, defaults to the request domain.
         */
        Optional<String> domain();

        /**
         * @return true if secure (default: true)
         */
        @WithDefault("true")
        boolean secure();

        /**
         * @return true if HttpOnly (default: true)
         */
        @WithDefault("true")
        boolean httpOnly();

        /**
         * SameSite attribute. Strict would drop the cookie on the redirect back
         * from the provider.
         *
         * @return SameSite value: Strict, Lax, or None (default: Lax)
         */
        @WithDefault("Lax")
        String sameSite();
    }

    interface IdGenerationConfig {

        /**
         * Maximum attempts when a generated session ID already exists in storage.
         *
         * @return Max attempts (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    interface StorageConfig {

        /**
         * Storage provider name: redis, memory, or a custom SPI name.
         *
         * @return Provider name (default: redis)
         */
        @WithDefault("redis")
        String provider();

        RedisConfig redis();

        interface RedisConfig {

            /**
             * @return Key prefix (default: slidewriter:session:)
             */
            @WithDefault("slidewriter:session:")
            String keyPrefix();
        }
    }
}
