package slidewriter.adapter.in.rest;

import java.net.URI;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.adapter.in.auth.SessionCookieManager;
import slidewriter.core.config.OAuthConfig;
import slidewriter.core.model.auth.AuthFlowState;
import slidewriter.core.model.common.ValidationException;
import slidewriter.core.port.in.AuthorizationFlow;
import slidewriter.core.service.auth.AuthFlowStateResolver;
import slidewriter.core.service.session.SessionStore;

/**
 * Sign-in endpoints for the OAuth 2.0 authorization code flow with PKCE.
 *
 * <p>The state token travels twice: as the {@code state} parameter through the
 * provider and as a cookie on this browser. A callback is only accepted when
 * both match, which ties the attempt to the browser that started it.
 *
 * @see <a href="https://tools.ietf.org/html/rfc7636">RFC 7636 - PKCE</a>
 */
@Path("/oauth")
@Produces(MediaType.APPLICATION_JSON)
public class OAuthResource {

    private static final Logger LOG = Logger.getLogger(OAuthResource.class);

    private final AuthorizationFlow authorizationFlow;
    private final SessionStore sessionStore;
    private final SessionCookieManager cookieManager;
    private final AuthFlowStateResolver stateResolver;
    private final OAuthConfig config;

    @Inject
    public OAuthResource(
            AuthorizationFlow authorizationFlow,
            SessionStore sessionStore,
            SessionCookieManager cookieManager,
            AuthFlowStateResolver stateResolver,
            OAuthConfig config) {
        this.authorizationFlow = authorizationFlow;
        this.sessionStore = sessionStore;
        this.cookieManager = cookieManager;
        this.stateResolver = stateResolver;
        this.config = config;
    }

    /**
     * Start signing in: redirect to the provider with a fresh state and PKCE challenge.
     */
    @GET
    @Path("/start")
    public Uni<Response> start() {
        return authorizationFlow.startAuthorization().map(start -> {
            final var pending = AuthFlowState.initial().start(start.stateToken());
            LOG.debugf("Redirecting to provider, browser is %s", pending.name());
            return Response.status(Response.Status.FOUND)
                    .location(URI.create(start.authorizationUrl()))
                    .cookie(cookieManager.createStateCookie(pending, start.stateTtl()))
                    .build();
        });
    }

    /**
     * Provider redirect target: validate state, exchange the code and establish a session.
     */
    @GET
    @Path("/callback")
    public Uni<Response> callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("error") String error,
            @Context HttpHeaders headers) {

        if (error != null && !error.isBlank()) {
            LOG.debugf("Provider returned error: %s", error);
            throw ValidationException.malformedRequest("Authorization was not granted: " + error);
        }
        if (code == null || code.isBlank() || state == null || state.isBlank()) {
            throw ValidationException.malformedRequest("code and state are required");
        }

        final var current = stateResolver.attempt(cookieManager.extractStateToken(headers).orElse(null));
        return authorizationFlow
                .completeAuthorization(current, state, code)
                .map(authenticated -> Response.status(Response.Status.FOUND)
                        .location(URI.create(config.postLoginRedirect()))
                        .cookie(
                                cookieManager.createSessionCookie(authenticated.session()),
                                cookieManager.clearStateCookie())
                        .build());
    }

    /**
     * Sign out: delete the session and clear its cookie.
     */
    @POST
    @Path("/logout")
    public Uni<Response> logout(@Context HttpHeaders headers) {
        final var sessionId = cookieManager.extractSessionId(headers);
        return sessionStore
                .invalidate(sessionId.orElse(null))
                .map(v -> Response.ok()
                        .cookie(cookieManager.createLogoutCookie())
                        .build());
    }
}
