package slidewriter.core.service.slides;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;

import slidewriter.core.model.common.ValidationException;
import slidewriter.core.model.slides.SplitterConfig;
import slidewriter.core.model.slides.TextSegment;

/**
 * Splits raw text into one segment per slide.
 *
 * <p>Pure and deterministic. Segments keep the order of the source text and are
 * never blank; null or blank input yields no segments.
 */
@ApplicationScoped
public class TextSplitter {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n|\\r|\\n");

    public List<TextSegment> split(String text, SplitterConfig config) {
        if (config == null) {
            throw ValidationException.invalidConfig("Splitter configuration is required");
        }
        validate(config);
        if (text == null || text.isBlank()) {
            return List.of();
        }

        final List<String> parts;
        if (config instanceof SplitterConfig.Newline) {
            parts = byLine(text);
        } else if (config instanceof SplitterConfig.EmptyLine) {
            parts = byParagraph(text);
        } else if (config instanceof SplitterConfig.MaxWords maxWords) {
            parts = byWordCount(text, maxWords.maxWords());
        } else if (config instanceof SplitterConfig.MaxChars maxChars) {
            parts = byCharCount(text, maxChars.maxChars());
        } else {
            throw new IllegalStateException("Unhandled splitter configuration: " + config);
        }

        return parts.stream().map(TextSegment::new).toList();
    }

    private static void validate(SplitterConfig config) {
        if (config instanceof SplitterConfig.MaxWords maxWords && maxWords.maxWords() < 1) {
            throw ValidationException.invalidConfig("max_words must be at least 1, got " + maxWords.maxWords());
        }
        if (config instanceof SplitterConfig.MaxChars maxChars && maxChars.maxChars() < 1) {
            throw ValidationException.invalidConfig("max_chars must be at least 1, got " + maxChars.maxChars());
        }
    }

    private static List<String> byLine(String text) {
        List<String> segments = new ArrayList<>();
        for (String line : LINE_BREAK.split(text)) {
            final var stripped = line.strip();
            if (!stripped.isEmpty()) {
                segments.add(stripped);
            }
        }
        return segments;
    }

    private static List<String> byParagraph(String text) {
        List<String> segments = new ArrayList<>();
        List<String> block = new ArrayList<>();
        for (String line : LINE_BREAK.split(text)) {
            if (line.isBlank()) {
                flushBlock(block, segments);
            } else {
                block.add(line);
            }
        }
        flushBlock(block, segments);
        return segments;
    }

    private static void flushBlock(List<String> block, List<String> segments) {
        if (block.isEmpty()) {
            return;
        }
        segments.add(String.join("\n", block).strip());
        block.clear();
    }

    private static List<String> byWordCount(String text, int maxWords) {
        final var words = words(text);
        List<String> segments = new ArrayList<>();
        for (int start = 0; start < words.size(); start += maxWords) {
            int end = Math.min(start + maxWords, words.size());
            segments.add(String.join(" ", words.subList(start, end)));
        }
        return segments;
    }

    /**
     * Lengths are counted in code points, so a surrogate pair always stays in one piece.
     */
    private static List<String> byCharCount(String text, int maxChars) {
        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentLength = 0;

        for (String word : words(text)) {
            int wordLength = word.codePointCount(0, word.length());

            if (currentLength > 0 && currentLength + 1 + wordLength <= maxChars) {
                current.append(' ').append(word);
                currentLength += 1 + wordLength;
                continue;
            }

            if (currentLength > 0) {
                segments.add(current.toString());
                current.setLength(0);
                currentLength = 0;
            }

            if (wordLength <= maxChars) {
                current.append(word);
                currentLength = wordLength;
                continue;
            }

            // hard break; the last piece stays open for the following words
            int offset = 0;
            while (wordLength - offset > maxChars) {
                int begin = word.offsetByCodePoints(0, offset);
                int end = word.offsetByCodePoints(begin, maxChars);
                segments.add(word.substring(begin, end));
                offset += maxChars;
            }
            current.append(word.substring(word.offsetByCodePoints(0, offset)));
            currentLength = wordLength - offset;
        }

        if (currentLength > 0) {
            segments.add(current.toString());
        }
        return segments;
    }

    /**
     * Words are delimited by {@link Character#isWhitespace(int)}, the same test
     * {@link String#isBlank()} uses, so no word is ever blank.
     */
    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        int start = -1;
        int i = 0;
        while (i < text.length()) {
            int codePoint = text.codePointAt(i);
            if (Character.isWhitespace(codePoint)) {
                if (start >= 0) {
                    words.add(text.substring(start, i));
                    start = -1;
                }
            } else if (start < 0) {
                start = i;
            }
            i += Character.charCount(codePoint);
        }
        if (start >= 0) {
            words.add(text.substring(start));
        }
        return words;
    }
}
