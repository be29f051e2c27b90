package slidewriter.core.model.common;

/**
 * Stable error identifiers exposed to clients in the {@code error} field of
 * problem responses.
 */
public enum ErrorCode {
    CSRF_MISMATCH("csrf_mismatch", 400),
    STATE_EXPIRED("state_expired", 400),
    TOKEN_EXCHANGE_FAILED("token_exchange_failed", 502),
    UNAUTHENTICATED("unauthenticated", 401),
    INVALID_CONFIG("invalid_config", 400),
    MALFORMED_REQUEST("malformed_request", 400),
    REMOTE_UNAVAILABLE("remote_unavailable", 502),
    REMOTE_REJECTED("remote_rejected", 502),
    PARTIAL_APPLY_UNKNOWN("partial_apply_unknown", 502),
    BACKEND_UNAVAILABLE("backend_unavailable", 503),
    CONFIGURATION_ERROR("configuration_error", 500);

    private final String code;
    private final int httpStatus;

    ErrorCode(String code, int httpStatus) {
        this.code = code;
        this.httpStatus = httpStatus;
    }

    public String code() {
        return code;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
