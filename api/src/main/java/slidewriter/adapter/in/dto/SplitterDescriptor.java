package slidewriter.adapter.in.dto;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import slidewriter.core.config.SlidesConfig;
import slidewriter.core.model.slides.SplitterType;

/**
 * DTO describing one segmentation strategy to the client.
 *
 * @param type        wire name, used as {@code splitter_type}
 * @param name        display name
 * @param description what the strategy does
 * @param config      default limits, absent for strategies without any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SplitterDescriptor(String type, String name, String description, Map<String, Integer> config) {

    public static SplitterDescriptor of(SplitterType type, SlidesConfig.SplitterDefaults defaults) {
        Map<String, Integer> config = null;
        if (type.usesMaxWords()) {
            config = new LinkedHashMap<>();
            config.put("max_words", defaults.maxWords());
        } else if (type.usesMaxChars()) {
            config = new LinkedHashMap<>();
            config.put("max_chars", defaults.maxChars());
        }
        return new SplitterDescriptor(type.wireName(), type.displayName(), type.description(), config);
    }

    public static List<SplitterDescriptor> all(SlidesConfig.SplitterDefaults defaults) {
        return Arrays.stream(SplitterType.values()).map(t -> of(t, defaults)).toList();
    }
}
