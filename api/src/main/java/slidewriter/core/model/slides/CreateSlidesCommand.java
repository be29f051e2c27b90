package slidewriter.core.model.slides;

/**
 * Slide creation request as received from the client, before validation.
 *
 * @param title        presentation title
 * @param content      raw text to split
 * @param splitterType wire name of the segmentation strategy
 * @param maxWords     optional word limit
 * @param maxChars     optional character limit
 */
public record CreateSlidesCommand(
        String title, String content, String splitterType, Integer maxWords, Integer maxChars) {}
