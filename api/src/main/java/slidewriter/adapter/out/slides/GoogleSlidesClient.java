package slidewriter.adapter.out.slides;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.UnknownHostException;
import java.util.List;
import java.util.concurrent.TimeoutException;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.core.buffer.Buffer;
import io.vertx.mutiny.ext.web.client.HttpResponse;
import io.vertx.mutiny.ext.web.client.WebClient;
import org.jboss.logging.Logger;

import slidewriter.core.config.SlidesConfig;
import slidewriter.core.model.common.RemoteException;
import slidewriter.core.model.slides.SlideOperation;
import slidewriter.core.port.out.PresentationClient;

/**
 * {@link PresentationClient} backed by the Google Slides REST API.
 *
 * <p>Failures map to remote error kinds:
 * <ul>
 *   <li>no connection (refused, unreachable, DNS, or the timeout running out while
 *       still getting a connection) on any call, or any transport failure while
 *       creating the presentation: {@code remote_unavailable}</li>
 *   <li>a non-2xx status or an unreadable body: {@code remote_rejected}</li>
 *   <li>a batch update that was sent but never answered: {@code partial_apply_unknown}</li>
 * </ul>
 */
@ApplicationScoped
public class GoogleSlidesClient implements PresentationClient {

    private static final Logger LOG = Logger.getLogger(GoogleSlidesClient.class);
    private static final String CONNECTION_ACQUISITION_TIMEOUT = "when getting a connection";

    private final WebClient webClient;
    private final SlidesConfig config;

    @Inject
    public GoogleSlidesClient(Vertx vertx, SlidesConfig config) {
        this.webClient = WebClient.create(vertx);
        this.config = config;
    }

    @Override
    public Uni<String> createPresentation(String accessToken, String title) {
        final var url = baseUrl() + "/v1/presentations";
        final var body = new JsonObject().put("title", title);

        return webClient
                .postAbs(url)
                .timeout(config.timeout().toMillis())
                .bearerTokenAuthentication(accessToken)
                .putHeader("Accept", "application/json")
                .sendJsonObject(body)
                .onFailure()
                .transform(error -> {
                    LOG.warnf("Create presentation failed: %s", error.getMessage());
                    return RemoteException.unavailable("Slides API unavailable", error);
                })
                .flatMap(this::parsePresentationId);
    }

    @Override
    public Uni<Void> batchUpdate(String accessToken, String presentationId, List<SlideOperation> operations) {
        final var url = baseUrl() + "/v1/presentations/" + presentationId + ":batchUpdate";
        final var body = new JsonObject().put("requests", toRequests(operations));

        return webClient
                .postAbs(url)
                .timeout(config.timeout().toMillis())
                .bearerTokenAuthentication(accessToken)
                .putHeader("Accept", "application/json")
                .sendJsonObject(body)
                .onFailure()
                .transform(error -> {
                    if (failedBeforeDispatch(error)) {
                        LOG.warnf("Batch update could not connect: %s", error.getMessage());
                        return RemoteException.unavailable("Slides API unavailable", error);
                    }
                    LOG.warnf(
                            "Batch update for %s sent without response, outcome unknown: %s",
                            presentationId, error.getMessage());
                    return RemoteException.partialApplyUnknown(presentationId, error);
                })
                .flatMap(response -> {
                    if (!isSuccess(response)) {
                        LOG.warnf("Batch update for %s rejected with status %d", presentationId, response.statusCode());
                        return Uni.createFrom()
                                .failure(RemoteException.rejected(
                                        "Slides API rejected the update with status " + response.statusCode(),
                                        presentationId));
                    }
                    LOG.debugf("Applied %d operations to %s", operations.size(), presentationId);
                    return Uni.createFrom().voidItem();
                });
    }

    private Uni<String> parsePresentationId(HttpResponse<Buffer> response) {
        if (!isSuccess(response)) {
            LOG.warnf("Create presentation rejected with status %d", response.statusCode());
            return Uni.createFrom()
                    .failure(RemoteException.rejected(
                            "Slides API rejected the presentation with status " + response.statusCode()));
        }
        try {
            final var json = response.bodyAsJsonObject();
            final var presentationId = json != null ? json.getString("presentationId") : null;
            if (presentationId == null || presentationId.isBlank()) {
                return Uni.createFrom().failure(RemoteException.rejected("Slides API response missing presentationId"));
            }
            return Uni.createFrom().item(presentationId);
        } catch (RuntimeException e) {
            LOG.warnf("Unreadable create presentation response: %s", e.getMessage());
            return Uni.createFrom().failure(RemoteException.rejected("Unreadable Slides API response"));
        }
    }

    /**
     * Translate operations into Slides API requests, keeping their order.
     */
    static JsonArray toRequests(List<SlideOperation> operations) {
        final var requests = new JsonArray();
        for (SlideOperation operation : operations) {
            if (operation instanceof SlideOperation.CreateSlide create) {
                requests.add(new JsonObject()
                        .put(
                                "createSlide",
                                new JsonObject()
                                        .put("objectId", create.slideId())
                                        .put(
                                                "slideLayoutReference",
                                                new JsonObject().put("predefinedLayout", create.layout()))
                                        .put(
                                                "placeholderIdMappings",
                                                new JsonArray()
                                                        .add(new JsonObject()
                                                                .put(
                                                                        "layoutPlaceholder",
                                                                        new JsonObject()
                                                                                .put("type", "BODY")
                                                                                .put("index", 0))
                                                                .put("objectId", create.bodyId())))));
            } else if (operation instanceof SlideOperation.InsertText insert) {
                requests.add(new JsonObject()
                        .put(
                                "insertText",
                                new JsonObject()
                                        .put("objectId", insert.bodyId())
                                        .put("insertionIndex", 0)
                                        .put("text", insert.text())));
            } else {
                throw new IllegalArgumentException("Unsupported operation: " + operation);
            }
        }
        return requests;
    }

    private String baseUrl() {
        final var base = config.apiBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static boolean isSuccess(HttpResponse<Buffer> response) {
        return response.statusCode() >= 200 && response.statusCode() < 300;
    }

    /**
     * True when the request never left this process. Vert.x reports a request
     * timeout that fires during connection acquisition with its own message; any
     * other timeout may have fired after the body was written.
     */
    static boolean failedBeforeDispatch(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof ConnectException
                    || t instanceof NoRouteToHostException
                    || t instanceof UnknownHostException) {
                return true;
            }
            if (t instanceof TimeoutException
                    && t.getMessage() != null
                    && t.getMessage().contains(CONNECTION_ACQUISITION_TIMEOUT)) {
                return true;
            }
        }
        return false;
    }
}
