package slidewriter.core.model.slides;

/**
 * Per-request segmentation strategy and its parameters.
 *
 * <p>Limits are validated when the text is split, not on construction, so an
 * out-of-range value reaches the client as an invalid configuration.
 */
public sealed interface SplitterConfig {

    SplitterType type();

    /**
     * One segment per non-empty line.
     */
    record Newline() implements SplitterConfig {
        @Override
        public SplitterType type() {
            return SplitterType.NEWLINE;
        }
    }

    /**
     * One segment per paragraph, paragraphs being separated by blank lines.
     */
    record EmptyLine() implements SplitterConfig {
        @Override
        public SplitterType type() {
            return SplitterType.EMPTY_LINE;
        }
    }

    /**
     * Segments of at most {@code maxWords} words.
     */
    record MaxWords(int maxWords) implements SplitterConfig {
        @Override
        public SplitterType type() {
            return SplitterType.MAX_WORDS;
        }
    }

    /**
     * Segments of at most {@code maxChars} characters.
     */
    record MaxChars(int maxChars) implements SplitterConfig {
        @Override
        public SplitterType type() {
            return SplitterType.MAX_CHARS;
        }
    }
}
