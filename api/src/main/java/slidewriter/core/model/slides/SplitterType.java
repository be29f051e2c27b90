package slidewriter.core.model.slides;

import java.util.Arrays;
import java.util.Optional;

/**
 * Segmentation strategies as named on the wire.
 */
public enum SplitterType {
    NEWLINE("newline", "New Line Splitter", "Splits text by individual lines", false, false),
    EMPTY_LINE("empty_line", "Empty Line Splitter", "Splits text by empty lines (paragraphs)", false, false),
    MAX_WORDS("max_words", "Max Words Splitter", "Splits text by maximum word count per slide", true, false),
    MAX_CHARS("max_chars", "Max Characters Splitter", "Splits text by maximum character count per slide", false, true);

    private final String wireName;
    private final String displayName;
    private final String description;
    private final boolean usesMaxWords;
    private final boolean usesMaxChars;

    SplitterType(
            String wireName, String displayName, String description, boolean usesMaxWords, boolean usesMaxChars) {
        this.wireName = wireName;
        this.displayName = displayName;
        this.description = description;
        this.usesMaxWords = usesMaxWords;
        this.usesMaxChars = usesMaxChars;
    }

    public String wireName() {
        return wireName;
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    public boolean usesMaxWords() {
        return usesMaxWords;
    }

    public boolean usesMaxChars() {
        return usesMaxChars;
    }

    public static Optional<SplitterType> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values()).filter(t -> t.wireName.equals(value)).findFirst();
    }

    /**
     * Build the configuration for this strategy, falling back to the given defaults
     * for limits the request leaves out.
     */
    public SplitterConfig toConfig(Integer maxWords, Integer maxChars, int defaultMaxWords, int defaultMaxChars) {
        return switch (this) {
            case NEWLINE -> new SplitterConfig.Newline();
            case EMPTY_LINE -> new SplitterConfig.EmptyLine();
            case MAX_WORDS -> new SplitterConfig.MaxWords(maxWords != null ? maxWords : defaultMaxWords);
            case MAX_CHARS -> new SplitterConfig.MaxChars(maxChars != null ? maxChars : defaultMaxChars);
        };
    }
}
