package slidewriter.adapter.in.problem;

import slidewriter.core.model.common.AuthException;
import slidewriter.core.model.common.ConfigurationException;
import slidewriter.core.model.common.ErrorCode;
import slidewriter.core.model.common.RemoteException;
import slidewriter.core.model.common.SlideWriterException;
import slidewriter.core.model.common.StorageException;
import slidewriter.core.model.common.ValidationException;

/**
 * RFC 7807 Problem Details factory for service errors.
 *
 * <p>Every problem carries an {@code error} member holding the stable
 * {@link ErrorCode} so clients never have to parse the title or detail.
 */
public final class ApiProblem {

    public static final String ERROR = "error";
    public static final String PRESENTATION_ID = "presentation_id";
    public static final String RETRY_MAY_DUPLICATE = "retry_may_duplicate";

    private ApiProblem() {}

    public static ProblemDetail from(SlideWriterException e) {
        final var code = e.errorCode();
        final var problem = new ProblemDetail(titleFor(e), code.httpStatus(), e.getMessage()).with(ERROR, code.code());

        if (e instanceof RemoteException remote) {
            remote.presentationId().ifPresent(id -> problem.with(PRESENTATION_ID, id));
            if (remote.retryMayDuplicate()) {
                problem.with(RETRY_MAY_DUPLICATE, true);
            }
        }
        return problem;
    }

    /**
     * Problem for an unexpected failure. The detail never echoes the cause.
     */
    public static ProblemDetail internalError() {
        return new ProblemDetail("Internal Server Error", 500, "An unexpected error occurred")
                .with(ERROR, "internal_error");
    }

    private static String titleFor(SlideWriterException e) {
        if (e instanceof AuthException) {
            return e.errorCode() == ErrorCode.UNAUTHENTICATED ? "Unauthorized" : "Authentication Failed";
        }
        if (e instanceof ValidationException) {
            return "Validation Error";
        }
        if (e instanceof RemoteException) {
            return "Bad Gateway";
        }
        if (e instanceof StorageException) {
            return "Service Unavailable";
        }
        if (e instanceof ConfigurationException) {
            return "Configuration Error";
        }
        return "Error";
    }
}
