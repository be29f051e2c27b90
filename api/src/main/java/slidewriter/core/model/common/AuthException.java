package slidewriter.core.model.common;

/**
 * Failures of the authorization flow and of session resolution.
 */
public final class AuthException extends SlideWriterException {

    private AuthException(ErrorCode errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }

    public static AuthException csrfMismatch(String detail) {
        return new AuthException(ErrorCode.CSRF_MISMATCH, detail, null);
    }

    public static AuthException stateExpired() {
        return new AuthException(
                ErrorCode.STATE_EXPIRED, "Authorization attempt has expired, please sign in again", null);
    }

    public static AuthException tokenExchangeFailed(String detail) {
        return new AuthException(ErrorCode.TOKEN_EXCHANGE_FAILED, detail, null);
    }

    public static AuthException tokenExchangeFailed(String detail, Throwable cause) {
        return new AuthException(ErrorCode.TOKEN_EXCHANGE_FAILED, detail, cause);
    }

    public static AuthException unauthenticated() {
        return new AuthException(ErrorCode.UNAUTHENTICATED, "Not authenticated", null);
    }
}
