package slidewriter.adapter.in.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import slidewriter.core.model.slides.CreateSlidesCommand;

/**
 * DTO for slide creation requests.
 *
 * @param title          presentation title (required)
 * @param content        text to split into slides (required)
 * @param splitterType   newline, empty_line, max_words or max_chars
 * @param splitterConfig optional limits for the size-based splitters
 */
public record CreateSlidesRequest(
        String title,
        String content,
        @JsonProperty("splitter_type") String splitterType,
        @JsonProperty("splitter_config") SplitterConfigDto splitterConfig) {

    /**
     * @param maxWords word limit for max_words
     * @param maxChars character limit for max_chars
     */
    public record SplitterConfigDto(
            @JsonProperty("max_words") Integer maxWords, @JsonProperty("max_chars") Integer maxChars) {}

    public CreateSlidesCommand toCommand() {
        return new CreateSlidesCommand(
                title,
                content,
                splitterType,
                splitterConfig != null ? splitterConfig.maxWords() : null,
                splitterConfig != null ? splitterConfig.maxChars() : null);
    }
}
