package slidewriter.core.model.slides;

/**
 * One entry of the ordered batch applied to a new presentation.
 *
 * <p>{@code index} is the position of the operation in the batch.
 */
public sealed interface SlideOperation {

    int index();

    String slideId();

    /**
     * Append a slide with the given layout, mapping its BODY placeholder to {@code bodyId}.
     */
    record CreateSlide(int index, String slideId, String bodyId, String layout) implements SlideOperation {}

    /**
     * Insert text into a slide's body placeholder.
     */
    record InsertText(int index, String slideId, String bodyId, String text) implements SlideOperation {}
}
