package slidewriter.core.port.out;

import java.util.List;

import io.smallrye.mutiny.Uni;

import slidewriter.core.model.slides.SlideOperation;

/**
 * Outbound port for the remote presentation API.
 *
 * <p>Failures are reported as {@link slidewriter.core.model.common.RemoteException}.
 */
public interface PresentationClient {

    /**
     * Create an empty presentation.
     *
     * @param accessToken user's access token
     * @param title       presentation title
     * @return the new presentation's ID
     */
    Uni<String> createPresentation(String accessToken, String title);

    /**
     * Apply all operations to a presentation in a single ordered batch.
     *
     * @param accessToken    user's access token
     * @param presentationId target presentation
     * @param operations     operations in application order
     * @return Uni completing when the batch has been applied
     */
    Uni<Void> batchUpdate(String accessToken, String presentationId, List<SlideOperation> operations);
}
