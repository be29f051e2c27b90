package slidewriter.core.model.slides;

/**
 * Text destined for exactly one slide.
 */
public record TextSegment(String text) {

    public TextSegment {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Segment text cannot be null or blank");
        }
    }
}
