package slidewriter.core.port.in;

import io.smallrye.mutiny.Uni;

import slidewriter.core.model.session.SessionToken;
import slidewriter.core.model.slides.CreateSlidesCommand;
import slidewriter.core.model.slides.PresentationResult;

/**
 * Inbound port for turning text into a presentation on behalf of a session.
 *
 * <p>Callers authenticate first and only then hand over the payload, so an
 * unauthenticated request never reaches splitting or the remote API.
 */
public interface SlideCreationUseCase {

    /**
     * Resolve the session behind a cookie value.
     *
     * @param sessionId cookie value, may be null
     * @return the live session
     * @throws slidewriter.core.model.common.AuthException unauthenticated if missing, unknown or expired
     */
    Uni<SessionToken> authenticate(String sessionId);

    /**
     * Validate the command, split its content and build the presentation.
     *
     * @param session authenticated session
     * @param command request payload, may be null
     * @return the created presentation
     */
    Uni<PresentationResult> createSlides(SessionToken session, CreateSlidesCommand command);
}
