package slidewriter.core.model.slides;

/**
 * A created presentation.
 *
 * @param presentationId  remote presentation ID
 * @param presentationUrl URL where the user can open the presentation
 */
public record PresentationResult(String presentationId, String presentationUrl) {}
