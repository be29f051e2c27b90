package slidewriter.adapter.in.rest;

import java.util.List;
import java.util.Map;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.smallrye.mutiny.Uni;

import slidewriter.adapter.in.auth.SessionCookieManager;
import slidewriter.adapter.in.dto.CreateSlidesRequest;
import slidewriter.adapter.in.dto.CreateSlidesResponse;
import slidewriter.adapter.in.dto.SessionStatusResponse;
import slidewriter.adapter.in.dto.SplitterDescriptor;
import slidewriter.core.config.SlidesConfig;
import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.common.ValidationException;
import slidewriter.core.model.slides.CreateSlidesCommand;
import slidewriter.core.port.in.SlideCreationUseCase;
import slidewriter.core.service.auth.AuthFlowStateResolver;

/**
 * Application API used by the web client.
 */
@Path("/api")
@Produces(MediaType.APPLICATION_JSON)
public class SlidesResource {

    private final SlideCreationUseCase slideCreation;
    private final AuthFlowStateResolver stateResolver;
    private final SessionCookieManager cookieManager;
    private final ObjectMapper objectMapper;
    private final SlidesConfig config;

    @Inject
    public SlidesResource(
            SlideCreationUseCase slideCreation,
            AuthFlowStateResolver stateResolver,
            SessionCookieManager cookieManager,
            ObjectMapper objectMapper,
            SlidesConfig config) {
        this.slideCreation = slideCreation;
        this.stateResolver = stateResolver;
        this.cookieManager = cookieManager;
        this.objectMapper = objectMapper;
        this.config = config;
    }

    /**
     * Create a presentation from text.
     *
     * <p>No media type is declared: the body is read as text and parsed only after
     * the session is resolved, so an unauthenticated caller always gets 401
     * whatever it sends.
     */
    @POST
    @Path("/create-slides")
    public Uni<CreateSlidesResponse> createSlides(String body, @Context HttpHeaders headers) {
        final var sessionId = cookieManager.extractSessionId(headers).orElse(null);
        return slideCreation
                .authenticate(sessionId)
                .flatMap(session -> slideCreation.createSlides(session, parse(body)))
                .map(CreateSlidesResponse::from);
    }

    /**
     * List the available segmentation strategies.
     */
    @GET
    @Path("/splitters")
    public Map<String, List<SplitterDescriptor>> splitters() {
        return Map.of("splitters", SplitterDescriptor.all(config.splitterDefaults()));
    }

    /**
     * Report whether the caller is signed in.
     */
    @GET
    @Path("/session")
    public Uni<SessionStatusResponse> session(@Context HttpHeaders headers) {
        final var sessionId = cookieManager.extractSessionId(headers).orElse(null);
        final var stateToken = cookieManager.extractStateToken(headers).orElse(null);
        return stateResolver.resolve(sessionId, stateToken).map(state -> {
            if (state instanceof AuthFlowState.Authenticated authenticated) {
                return new SessionStatusResponse(state.name(), authenticated.session().expiresAt());
            }
            return new SessionStatusResponse(state.name(), null);
        });
    }

    private CreateSlidesCommand parse(String body) {
        if (body == null || body.isBlank()) {
            throw ValidationException.malformedRequest("Request body is required");
        }
        try {
            final var request = objectMapper.readValue(body, CreateSlidesRequest.class);
            return request != null ? request.toCommand() : null;
        } catch (JsonProcessingException e) {
            throw ValidationException.malformedRequest("Request body is not valid JSON");
        }
    }
}
