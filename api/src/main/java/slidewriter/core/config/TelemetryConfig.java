package slidewriter.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration prefix: {@code slidewriter.telemetry}
 */
@ConfigMapping(prefix = "slidewriter.telemetry")
public interface TelemetryConfig {

    /**
     * @return true if metrics are recorded (default: true)
     */
    @WithDefault("true")
    boolean metricsEnabled();
}
