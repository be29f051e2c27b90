package slidewriter.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration shared by the storage backends.
 *
 * <p>Configuration prefix: {@code slidewriter.storage}
 */
@ConfigMapping(prefix = "slidewriter.storage")
public interface StorageConfig {

    RedisConfig redis();

    interface RedisConfig {

        /**
         * Upper bound for a single Redis operation. Exceeding it is reported as
         * an unavailable backend.
         *
         * @return Timeout (default: 2 seconds)
         */
        @WithDefault("PT2S")
        Duration timeout();
    }
}
