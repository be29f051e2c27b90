package slidewriter.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the remote presentation API.
 *
 * <p>Configuration prefix: {@code slidewriter.slides}
 */
@ConfigMapping(prefix = "slidewriter.slides")
public interface SlidesConfig {

    /**
     * Base URL of the Slides REST API.
     *
     * @return API base URL (default: Google Slides)
     */
    @WithDefault("https://slides.googleapis.com")
    String apiBaseUrl();

    /**
     * Template for the user-facing presentation URL. {@code %s} is replaced by
     * the presentation ID.
     */
    @WithDefault("https://docs.google.com/presentation/d/%s/edit")
    String presentationUrlTemplate();

    /**
     * Predefined layout used for every generated slide.
     */
    @WithDefault("TITLE_AND_BODY")
    String layout();

    /**
     * Timeout for each call to the Slides API.
     *
     * @return Timeout (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration timeout();

    /**
     * Default limits used when a request omits {@code splitter_config} values.
     */
    SplitterDefaults splitterDefaults();

    interface SplitterDefaults {

        @WithDefault("50")
        int maxWords();

        @WithDefault("500")
        int maxChars();
    }
}
