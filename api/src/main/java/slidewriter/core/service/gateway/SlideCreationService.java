package slidewriter.core.service.gateway;

import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.config.SlidesConfig;
import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.common.AuthException;
import slidewriter.core.model.common.SlideWriterException;
import slidewriter.core.model.common.ValidationException;
import slidewriter.core.model.session.SessionToken;
import slidewriter.core.model.slides.CreateSlidesCommand;
import slidewriter.core.model.slides.PresentationResult;
import slidewriter.core.model.slides.SplitterConfig;
import slidewriter.core.model.slides.SplitterType;
import slidewriter.core.model.slides.TextSegment;
import slidewriter.core.port.in.SlideCreationUseCase;
import slidewriter.core.port.out.Metrics;
import slidewriter.core.service.auth.AuthFlowStateResolver;
import slidewriter.core.service.slides.SlideDeckBuilder;
import slidewriter.core.service.slides.TextSplitter;

/**
 * Authenticates slide creation requests and runs them through splitting and
 * deck building.
 */
@ApplicationScoped
public class SlideCreationService implements SlideCreationUseCase {

    private static final Logger LOG = Logger.getLogger(SlideCreationService.class);

    private final AuthFlowStateResolver stateResolver;
    private final TextSplitter splitter;
    private final SlideDeckBuilder deckBuilder;
    private final SlidesConfig config;
    private final Metrics metrics;

    @Inject
    public SlideCreationService(
            AuthFlowStateResolver stateResolver,
            TextSplitter splitter,
            SlideDeckBuilder deckBuilder,
            SlidesConfig config,
            Metrics metrics) {
        this.stateResolver = stateResolver;
        this.splitter = splitter;
        this.deckBuilder = deckBuilder;
        this.config = config;
        this.metrics = metrics;
    }

    @Override
    public Uni<SessionToken> authenticate(String sessionId) {
        return stateResolver.resolve(sessionId, null).flatMap(state -> {
            if (state instanceof AuthFlowState.Authenticated authenticated) {
                return Uni.createFrom().item(authenticated.session());
            }
            LOG.debugf("Rejecting request from a browser in state %s", state.name());
            return Uni.createFrom().<SessionToken>failure(AuthException.unauthenticated());
        });
    }

    @Override
    public Uni<PresentationResult> createSlides(SessionToken session, CreateSlidesCommand command) {
        final SplitterConfig splitterConfig;
        final List<TextSegment> segments;
        try {
            splitterConfig = toSplitterConfig(command);
            segments = splitter.split(command.content(), splitterConfig);
        } catch (ValidationException e) {
            metrics.recordDeckCreation(splitterName(command), e.errorCode().code(), 0);
            return Uni.createFrom().failure(e);
        }

        if (segments.isEmpty()) {
            metrics.recordDeckCreation(splitterConfig.type().wireName(), "malformed_request", 0);
            return Uni.createFrom().failure(ValidationException.malformedRequest("Content produced no slides"));
        }

        final var splitterName = splitterConfig.type().wireName();
        LOG.debugf("Creating deck with %d slides using %s", segments.size(), splitterName);

        return deckBuilder
                .build(session.accessToken(), command.title(), segments)
                .invoke(result -> metrics.recordDeckCreation(splitterName, "success", segments.size()))
                .onFailure()
                .invoke(e -> {
                    final var outcome =
                            e instanceof SlideWriterException swe ? swe.errorCode().code() : "error";
                    metrics.recordDeckCreation(splitterName, outcome, segments.size());
                });
    }

    private SplitterConfig toSplitterConfig(CreateSlidesCommand command) {
        if (command == null) {
            throw ValidationException.malformedRequest("Request body is required");
        }
        if (command.title() == null || command.title().isBlank()) {
            throw ValidationException.malformedRequest("title is required");
        }
        if (command.content() == null) {
            throw ValidationException.malformedRequest("content is required");
        }
        final var type = SplitterType.fromWireName(command.splitterType())
                .orElseThrow(() -> ValidationException.malformedRequest(
                        "Unknown splitter_type: " + command.splitterType()));
        final var defaults = config.splitterDefaults();
        return type.toConfig(command.maxWords(), command.maxChars(), defaults.maxWords(), defaults.maxChars());
    }

    private static String splitterName(CreateSlidesCommand command) {
        if (command == null || command.splitterType() == null) {
            return "unknown";
        }
        return SplitterType.fromWireName(command.splitterType())
                .map(SplitterType::wireName)
                .orElse("unknown");
    }
}
