package slidewriter.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import slidewriter.core.model.common.SlideWriterException;

/**
 * Converts service exceptions to RFC 7807 Problem Details.
 *
 * <p>Client errors are logged at DEBUG, server-side and upstream failures at WARN.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    static final String PROBLEM_JSON = "application/problem+json";

    private final ObjectMapper objectMapper;

    public GlobalExceptionMappers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @ServerExceptionMapper
    public Response mapSlideWriterException(SlideWriterException e) {
        final var status = e.errorCode().httpStatus();
        if (status >= 500) {
            LOG.warnv(e.getCause(), "{0}: {1}", e.errorCode().code(), e.getMessage());
        } else {
            LOG.debugv("{0}: {1}", e.errorCode().code(), e.getMessage());
        }
        return toResponse(ApiProblem.from(e));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.errorv(e, "Unexpected state: {0}", e.getMessage());
        return toResponse(ApiProblem.internalError());
    }

    Response toResponse(ProblemDetail problem) {
        try {
            return Response.status(problem.getStatus())
                    .type(PROBLEM_JSON)
                    .entity(objectMapper.writeValueAsString(problem))
                    .build();
        } catch (JsonProcessingException e) {
            LOG.errorv(e, "Failed to serialize problem for status {0}", problem.getStatus());
            return Response.status(problem.getStatus()).build();
        }
    }
}
