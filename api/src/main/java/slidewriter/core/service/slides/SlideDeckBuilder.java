package slidewriter.core.service.slides;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.config.SlidesConfig;
import slidewriter.core.model.common.RemoteException;
import slidewriter.core.model.slides.PresentationResult;
import slidewriter.core.model.slides.SlideOperation;
import slidewriter.core.model.slides.TextSegment;
import slidewriter.core.port.out.PresentationClient;

/**
 * Turns text segments into a remote presentation.
 *
 * <p>The presentation is created first; every slide is then added in one batch
 * so that slide order always matches segment order. Slide and placeholder IDs
 * are assigned here, which lets each insert refer to a slide created earlier
 * in the same batch.
 */
@ApplicationScoped
public class SlideDeckBuilder {

    private static final Logger LOG = Logger.getLogger(SlideDeckBuilder.class);

    private final PresentationClient client;
    private final SlidesConfig config;

    @Inject
    public SlideDeckBuilder(PresentationClient client, SlidesConfig config) {
        this.client = client;
        this.config = config;
    }

    /**
     * Plan the batch for a deck: for each segment, a create-slide followed by
     * an insert-text into that slide's body.
     *
     * @param segments slide contents in order
     * @return operations in application order
     */
    public List<SlideOperation> plan(List<TextSegment> segments) {
        List<SlideOperation> operations = new ArrayList<>(segments.size() * 2);
        for (int n = 0; n < segments.size(); n++) {
            final var slideId = "slide_" + n;
            final var bodyId = slideId + "_body";
            operations.add(new SlideOperation.CreateSlide(operations.size(), slideId, bodyId, config.layout()));
            operations.add(new SlideOperation.InsertText(
                    operations.size(), slideId, bodyId, segments.get(n).text()));
        }
        return operations;
    }

    /**
     * Create a presentation titled {@code title} with one slide per segment.
     *
     * @param accessToken user's access token
     * @param title       presentation title
     * @param segments    slide contents in order, at least one
     * @return the created presentation
     */
    public Uni<PresentationResult> build(String accessToken, String title, List<TextSegment> segments) {
        if (segments == null || segments.isEmpty()) {
            return Uni.createFrom().failure(RemoteException.rejected("A presentation needs at least one slide"));
        }
        final var operations = plan(segments);

        return client.createPresentation(accessToken, title)
                .invoke(id -> LOG.debugf("Created presentation %s, adding %d slides", id, segments.size()))
                .flatMap(presentationId -> client.batchUpdate(accessToken, presentationId, operations)
                        .replaceWith(() -> new PresentationResult(presentationId, presentationUrl(presentationId))));
    }

    String presentationUrl(String presentationId) {
        return String.format(config.presentationUrlTemplate(), presentationId);
    }
}
